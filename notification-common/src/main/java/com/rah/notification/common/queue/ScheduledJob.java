package com.rah.notification.common.queue;

import com.rah.notification.common.job.JobKind;

import java.time.Instant;

/**
 * A deferred job waiting in {@code scheduled_jobs} until {@code startAfter}.
 *
 * @param id job id, reused as the Kafka record key when the job is published
 * @param kind job kind (decides the topic)
 * @param payload serialized JSON payload
 * @param startAfter earliest publish time
 * @param createdAt when the job was scheduled
 */
public record ScheduledJob(
    String id,
    JobKind kind,
    String payload,
    Instant startAfter,
    Instant createdAt
) {
}
