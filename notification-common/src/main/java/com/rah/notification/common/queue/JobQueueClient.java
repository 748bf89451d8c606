package com.rah.notification.common.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rah.notification.common.job.JobKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Producer side of the job queue.
 *
 * <p>Immediate jobs go straight to the topic of their {@link JobKind}. Jobs with a
 * future {@code startAfter} are parked in {@code scheduled_jobs} and published by the
 * worker's dispatcher once they are due. The returned job id is the Kafka record key
 * in both cases.
 *
 * <p>Example usage:
 * <pre>
 * jobQueueClient.sendAfter(JobKind.APPOINTMENT_REMINDER,
 *     new ReminderJobPayload(appointment.getId()),
 *     appointment.getStartAt().minus(Duration.ofHours(24)));
 * </pre>
 */
@Slf4j
@RequiredArgsConstructor
public class JobQueueClient {

    private static final Duration PUBLISH_TIMEOUT = Duration.ofSeconds(30);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ScheduledJobStore scheduledJobStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Publish a job for immediate processing.
     *
     * @return the job id
     * @throws JobPublishException if the broker does not acknowledge the record
     */
    public String send(JobKind kind, Object payload) {
        String jobId = newJobId();
        publish(kind, jobId, serialize(payload));
        log.info("Queued {} job {}", kind.getTopic(), jobId);
        return jobId;
    }

    /**
     * Publish a job that must not be processed before {@code startAfter}.
     * A start time that is not in the future publishes immediately.
     *
     * @return the job id
     */
    public String sendAfter(JobKind kind, Object payload, Instant startAfter) {
        Instant now = clock.instant();
        if (startAfter == null || !startAfter.isAfter(now)) {
            return send(kind, payload);
        }

        String jobId = newJobId();
        scheduledJobStore.insert(new ScheduledJob(jobId, kind, serialize(payload), startAfter, now));
        log.info("Scheduled {} job {} for {}", kind.getTopic(), jobId, startAfter);
        return jobId;
    }

    /**
     * Drop a scheduled job that has not been published yet.
     *
     * @return true if the job was still pending
     */
    public boolean cancelScheduled(String jobId) {
        boolean removed = scheduledJobStore.delete(jobId);
        if (removed) {
            log.info("Cancelled scheduled job {}", jobId);
        }
        return removed;
    }

    /**
     * Publish an already serialized job and wait for the broker acknowledgment.
     */
    public void publish(JobKind kind, String jobId, String payloadJson) {
        try {
            kafkaTemplate.send(kind.getTopic(), jobId, payloadJson)
                .get(PUBLISH_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobPublishException("Interrupted while publishing job " + jobId, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new JobPublishException(
                "Failed to publish job " + jobId + " to " + kind.getTopic(), e);
        }
    }

    private String serialize(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job payload is not serializable: " + e.getMessage(), e);
        }
    }

    private String newJobId() {
        return UUID.randomUUID().toString();
    }
}
