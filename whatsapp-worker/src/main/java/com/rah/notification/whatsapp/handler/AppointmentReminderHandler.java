package com.rah.notification.whatsapp.handler;

import com.rah.notification.common.job.ReminderJobPayload;
import com.rah.notification.whatsapp.entity.Appointment;
import com.rah.notification.whatsapp.enums.AppointmentEventType;
import com.rah.notification.whatsapp.model.ComposeFields;
import com.rah.notification.whatsapp.model.NotificationSettings;
import com.rah.notification.whatsapp.repository.AppointmentRepository;
import com.rah.notification.whatsapp.service.AppointmentEventService;
import com.rah.notification.whatsapp.service.AppointmentTimeFormatter;
import com.rah.notification.whatsapp.service.MessageComposer;
import com.rah.notification.whatsapp.service.NotificationSettingsCache;
import com.rah.notification.whatsapp.session.SendResult;
import com.rah.notification.whatsapp.session.WhatsAppSessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Handles {@code appointment-reminder} jobs.
 *
 * <p>The appointment is re-read when the job runs: it may have been cancelled since the
 * reminder was scheduled. A reminder is sent at most once per appointment; redelivered
 * jobs find the REMINDER_SENT event and stop.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AppointmentReminderHandler {

    private final AppointmentRepository appointmentRepository;
    private final AppointmentEventService appointmentEventService;
    private final NotificationSettingsCache notificationSettingsCache;
    private final AppointmentTimeFormatter timeFormatter;
    private final MessageComposer messageComposer;
    private final WhatsAppSessionManager sessionManager;

    public JobOutcome handle(ReminderJobPayload payload) {
        String appointmentId = payload != null ? payload.getAppointmentId() : null;
        if (appointmentId == null || appointmentId.isBlank()) {
            log.info("Reminder job without appointmentId, skipping");
            return JobOutcome.SKIPPED_MALFORMED;
        }

        Optional<Appointment> found = appointmentRepository.findWithUserById(appointmentId);
        if (found.isEmpty()) {
            log.info("Appointment {} not found, skipping reminder", appointmentId);
            return JobOutcome.SKIPPED_NOT_FOUND;
        }
        Appointment appointment = found.get();
        if (appointment.isCancelled()) {
            log.info("Appointment {} is cancelled, skipping reminder", appointmentId);
            return JobOutcome.SKIPPED_CANCELLED;
        }

        if (appointmentEventService.hasEvent(appointmentId, AppointmentEventType.REMINDER_SENT)) {
            log.info("Reminder for appointment {} already sent, skipping", appointmentId);
            return JobOutcome.SKIPPED_ALREADY_SENT;
        }

        Optional<NotificationSettings> settings = notificationSettingsCache.getNotificationSettings();
        if (settings.isEmpty() || !settings.get().hasReminderTemplate()) {
            log.info("Reminder template not configured, skipping reminder for appointment {}", appointmentId);
            return JobOutcome.SKIPPED_DISABLED;
        }

        String message = messageComposer.compose(settings.get().reminderMessageTemplate(), new ComposeFields(
            appointment.getUser().getName(),
            appointment.getServiceName(),
            timeFormatter.formatDate(appointment.getStartAt()),
            timeFormatter.formatTime(appointment.getStartAt())
        ));

        SendResult result = sessionManager.send(appointment.getUser().getPhone(), message);
        if (result instanceof SendResult.Failure failure) {
            log.warn("Failed to send reminder for appointment {}: {}", appointmentId, failure.reason());
            return JobOutcome.DELIVERY_FAILED;
        }

        appointmentEventService.record(appointmentId, AppointmentEventType.REMINDER_SENT);
        log.info("Reminder sent for appointment {} (message id: {})",
            appointmentId, ((SendResult.Success) result).messageId());
        return JobOutcome.DELIVERED;
    }
}
