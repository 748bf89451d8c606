package com.rah.notification.whatsapp.repository;

import com.rah.notification.whatsapp.entity.Appointment;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * ⚠️ READ-ONLY: the worker never saves or deletes appointments.
 */
@Repository
public interface AppointmentRepository extends JpaRepository<Appointment, String> {

    /**
     * Load an appointment together with its user in one query.
     */
    @EntityGraph(attributePaths = "user")
    Optional<Appointment> findWithUserById(String id);
}
