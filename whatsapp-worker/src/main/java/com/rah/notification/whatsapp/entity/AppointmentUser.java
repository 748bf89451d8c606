package com.rah.notification.whatsapp.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

/**
 * Customer behind an appointment.
 *
 * ⚠️ READ-ONLY PROJECTION: the booking API owns the {@code users} table. The worker
 * only needs the name (template substitution) and the phone number (recipient).
 */
@Entity
@Immutable
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentUser {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "name", nullable = false)
    private String name;

    /** Digits only, with country code (e.g. 5527999999999). */
    @Column(name = "phone", nullable = false, length = 32)
    private String phone;
}
