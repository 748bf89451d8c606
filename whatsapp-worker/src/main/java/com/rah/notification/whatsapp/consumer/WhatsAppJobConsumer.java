package com.rah.notification.whatsapp.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rah.notification.common.job.JobKind;
import com.rah.notification.common.job.ReminderJobPayload;
import com.rah.notification.common.job.SendWhatsAppJobPayload;
import com.rah.notification.whatsapp.handler.AppointmentReminderHandler;
import com.rah.notification.whatsapp.handler.JobOutcome;
import com.rah.notification.whatsapp.handler.SendWhatsAppHandler;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Binds job topics to their handlers.
 *
 * <p>A job is acknowledged once its handler returns, whatever the outcome. Exceptions
 * are left to the container's error handler, which retries the uncommitted record.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WhatsAppJobConsumer {

    public static final String REMINDER_LISTENER_ID = "appointment-reminder-listener";
    public static final String SEND_WHATSAPP_LISTENER_ID = "send-whatsapp-listener";

    static final String JOBS_PROCESSED_METRIC = "whatsapp.jobs.processed";

    private final AppointmentReminderHandler appointmentReminderHandler;
    private final SendWhatsAppHandler sendWhatsAppHandler;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @KafkaListener(id = REMINDER_LISTENER_ID, topics = "appointment-reminder", autoStartup = "false")
    public void onAppointmentReminder(
            @Payload String payload,
            @Header(name = KafkaHeaders.RECEIVED_KEY, required = false) String jobId,
            Acknowledgment acknowledgment) {
        process(JobKind.APPOINTMENT_REMINDER, jobId, payload, acknowledgment,
            json -> appointmentReminderHandler.handle(objectMapper.readValue(json, ReminderJobPayload.class)));
    }

    @KafkaListener(id = SEND_WHATSAPP_LISTENER_ID, topics = "send-whatsapp", autoStartup = "false")
    public void onSendWhatsApp(
            @Payload String payload,
            @Header(name = KafkaHeaders.RECEIVED_KEY, required = false) String jobId,
            Acknowledgment acknowledgment) {
        process(JobKind.SEND_WHATSAPP, jobId, payload, acknowledgment,
            json -> sendWhatsAppHandler.handle(objectMapper.readValue(json, SendWhatsAppJobPayload.class)));
    }

    private void process(JobKind kind, String jobId, String payload, Acknowledgment acknowledgment,
                         JobHandler handler) {
        log.debug("Processing {} job {}", kind.getTopic(), jobId);
        JobOutcome outcome;
        try {
            outcome = handler.handle(payload);
        } catch (JsonProcessingException e) {
            log.info("Malformed {} job {}: {}", kind.getTopic(), jobId, e.getOriginalMessage());
            outcome = JobOutcome.SKIPPED_MALFORMED;
        }

        meterRegistry.counter(JOBS_PROCESSED_METRIC, "kind", kind.getTopic(), "outcome", outcome.metricTag())
            .increment();
        log.info("{} job {} finished: {}", kind.getTopic(), jobId, outcome);
        acknowledgment.acknowledge();
    }

    /**
     * Parses the payload and runs the handler.
     */
    @FunctionalInterface
    interface JobHandler {
        JobOutcome handle(String payload) throws JsonProcessingException;
    }
}
