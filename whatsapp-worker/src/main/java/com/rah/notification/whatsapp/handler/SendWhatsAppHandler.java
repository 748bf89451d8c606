package com.rah.notification.whatsapp.handler;

import com.rah.notification.common.job.SendWhatsAppJobPayload;
import com.rah.notification.whatsapp.enums.AppointmentEventType;
import com.rah.notification.whatsapp.service.AppointmentEventService;
import com.rah.notification.whatsapp.session.SendResult;
import com.rah.notification.whatsapp.session.WhatsAppSessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Handles {@code send-whatsapp} jobs: a ready-made message for one phone number,
 * optionally recorded as an appointment event once delivered.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SendWhatsAppHandler {

    private final WhatsAppSessionManager sessionManager;
    private final AppointmentEventService appointmentEventService;

    public JobOutcome handle(SendWhatsAppJobPayload payload) {
        if (payload == null || isBlank(payload.getPhone()) || isBlank(payload.getMessage())) {
            log.info("send-whatsapp job without phone or message, skipping");
            return JobOutcome.SKIPPED_MALFORMED;
        }

        SendResult result = sessionManager.send(payload.getPhone(), payload.getMessage());
        if (result instanceof SendResult.Failure failure) {
            log.warn("Failed to send WhatsApp message{}: {}",
                payload.getAppointmentId() != null ? " for appointment " + payload.getAppointmentId() : "",
                failure.reason());
            return JobOutcome.DELIVERY_FAILED;
        }

        log.info("WhatsApp message sent (message id: {})", ((SendResult.Success) result).messageId());
        if (!isBlank(payload.getAppointmentId()) && !isBlank(payload.getEventType())) {
            recordEvent(payload.getAppointmentId(), payload.getEventType());
        }
        return JobOutcome.DELIVERED;
    }

    // Unknown types are logged and dropped; the job is still acked.
    private void recordEvent(String appointmentId, String eventType) {
        Optional<AppointmentEventType> type = AppointmentEventType.fromString(eventType);
        if (type.isEmpty()) {
            log.warn("Unknown eventType '{}' for appointment {}, event not recorded", eventType, appointmentId);
            return;
        }
        appointmentEventService.record(appointmentId, type.get());
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
