package com.rah.notification.whatsapp.repository;

import com.rah.notification.whatsapp.entity.AppointmentEvent;
import com.rah.notification.whatsapp.enums.AppointmentEventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AppointmentEventRepository extends JpaRepository<AppointmentEvent, String> {

    boolean existsByAppointmentIdAndType(String appointmentId, AppointmentEventType type);

    long countByAppointmentIdAndType(String appointmentId, AppointmentEventType type);
}
