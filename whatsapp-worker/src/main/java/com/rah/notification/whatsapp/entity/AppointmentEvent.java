package com.rah.notification.whatsapp.entity;

import com.rah.notification.whatsapp.enums.AppointmentEventType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Append-only audit record of something that happened to an appointment.
 *
 * One row per successful delivery. Rows are never updated or deleted by the worker.
 */
@Entity
@Immutable
@Table(name = "appointment_events", indexes = {
    @Index(name = "idx_appointment_events_appointment_type", columnList = "appointment_id, type")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "appointment_id", nullable = false, length = 64)
    private String appointmentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 32)
    private AppointmentEventType type;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
