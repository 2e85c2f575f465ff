package com.byootify.booking_ledger.booking;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BookingAuditRepository extends JpaRepository<BookingAuditEntity, UUID> {

    List<BookingAuditEntity> findByAppointmentId(UUID appointmentId);
}
