package com.rah.notification.whatsapp.service;

import com.rah.notification.common.queue.JobPublishException;
import com.rah.notification.common.queue.JobQueueClient;
import com.rah.notification.common.queue.ScheduledJob;
import com.rah.notification.common.queue.ScheduledJobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Publishes deferred jobs once their start time has passed.
 *
 * <p>Due rows are locked with {@code FOR UPDATE SKIP LOCKED}, so several workers can run
 * the dispatcher at once without publishing a row twice. A row is deleted only after the
 * broker acknowledged it; failed publishes stay for the next run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduledJobDispatcher {

    private final ScheduledJobStore scheduledJobStore;
    private final JobQueueClient jobQueueClient;
    private final Clock clock;

    @Value("${worker.scheduler.batch-size:50}")
    private int batchSize;

    @Scheduled(
        fixedDelayString = "${worker.scheduler.dispatch-interval-ms:15000}",
        initialDelayString = "${worker.scheduler.initial-delay-ms:5000}"
    )
    @Transactional
    public void dispatchDueJobs() {
        List<ScheduledJob> due = scheduledJobStore.claimDue(clock.instant(), batchSize);
        if (due.isEmpty()) {
            return;
        }

        int published = 0;
        for (ScheduledJob job : due) {
            try {
                jobQueueClient.publish(job.kind(), job.id(), job.payload());
                scheduledJobStore.delete(job.id());
                published++;
            } catch (JobPublishException e) {
                log.warn("Failed to publish scheduled job {} ({}), will retry: {}",
                    job.id(), job.kind().getTopic(), e.getMessage());
            }
        }
        log.info("Dispatched {}/{} due scheduled jobs", published, due.size());
    }
}
