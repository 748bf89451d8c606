package com.rah.notification.whatsapp.entity;

import com.rah.notification.whatsapp.enums.AppointmentStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Appointment as seen by the worker.
 *
 * ⚠️ READ-ONLY PROJECTION: schema and writes belong to the booking API. Cancellation can
 * happen after a reminder was queued, so handlers check {@link #isCancelled()} when the
 * job runs, never when it is scheduled.
 */
@Entity
@Immutable
@Table(name = "appointments", indexes = {
    @Index(name = "idx_appointments_user_id", columnList = "user_id"),
    @Index(name = "idx_appointments_start_at", columnList = "start_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Appointment {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "start_at", nullable = false)
    private Instant startAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private AppointmentStatus status;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private AppointmentUser user;

    @Column(name = "service_name", nullable = false)
    private String serviceName;

    public boolean isCancelled() {
        return status == AppointmentStatus.CANCELLED;
    }
}
