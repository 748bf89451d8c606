package com.rah.notification.whatsapp.service;

import com.rah.notification.common.job.JobKind;
import com.rah.notification.common.queue.JobPublishException;
import com.rah.notification.common.queue.JobQueueClient;
import com.rah.notification.common.queue.ScheduledJob;
import com.rah.notification.common.queue.ScheduledJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScheduledJobDispatcherTest {

    private static final Instant NOW = Instant.parse("2026-02-09T12:00:00Z");

    @Mock
    private ScheduledJobStore scheduledJobStore;

    @Mock
    private JobQueueClient jobQueueClient;

    private ScheduledJobDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new ScheduledJobDispatcher(scheduledJobStore, jobQueueClient, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(dispatcher, "batchSize", 10);
    }

    private static ScheduledJob job(String id) {
        return new ScheduledJob(id, JobKind.APPOINTMENT_REMINDER, "{\"appointmentId\":\"A1\"}",
            NOW.minusSeconds(60), NOW.minusSeconds(3600));
    }

    @Test
    void testDispatch_PublishesAndDeletesDueJobs() {
        when(scheduledJobStore.claimDue(NOW, 10)).thenReturn(List.of(job("J1"), job("J2")));

        dispatcher.dispatchDueJobs();

        verify(jobQueueClient).publish(JobKind.APPOINTMENT_REMINDER, "J1", "{\"appointmentId\":\"A1\"}");
        verify(jobQueueClient).publish(JobKind.APPOINTMENT_REMINDER, "J2", "{\"appointmentId\":\"A1\"}");
        verify(scheduledJobStore).delete("J1");
        verify(scheduledJobStore).delete("J2");
    }

    @Test
    void testDispatch_PublishFailure_KeepsRowAndContinues() {
        when(scheduledJobStore.claimDue(NOW, 10)).thenReturn(List.of(job("J1"), job("J2")));
        doThrow(new JobPublishException("broker down", null))
            .when(jobQueueClient).publish(JobKind.APPOINTMENT_REMINDER, "J1", "{\"appointmentId\":\"A1\"}");

        dispatcher.dispatchDueJobs();

        verify(scheduledJobStore, never()).delete("J1");
        verify(scheduledJobStore).delete("J2");
    }

    @Test
    void testDispatch_NothingDue_NoPublish() {
        when(scheduledJobStore.claimDue(NOW, 10)).thenReturn(List.of());

        dispatcher.dispatchDueJobs();

        verifyNoInteractions(jobQueueClient);
    }
}
