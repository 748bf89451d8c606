package com.rah.notification.whatsapp.service;

import com.rah.notification.whatsapp.entity.AppointmentEvent;
import com.rah.notification.whatsapp.enums.AppointmentEventType;
import com.rah.notification.whatsapp.repository.AppointmentEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Appends delivery outcomes to the appointment event log.
 *
 * Store failures are not caught here: the job must be retried rather than acknowledged
 * without its audit record.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AppointmentEventService {

    private final AppointmentEventRepository appointmentEventRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public boolean hasEvent(String appointmentId, AppointmentEventType type) {
        return appointmentEventRepository.existsByAppointmentIdAndType(appointmentId, type);
    }

    @Transactional
    public AppointmentEvent record(String appointmentId, AppointmentEventType type) {
        AppointmentEvent event = AppointmentEvent.builder()
            .appointmentId(appointmentId)
            .type(type)
            .createdAt(clock.instant())
            .build();
        AppointmentEvent saved = appointmentEventRepository.save(event);
        log.info("Recorded {} event for appointment {}", type, appointmentId);
        return saved;
    }
}
