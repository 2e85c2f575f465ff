package com.byootify.booking_ledger.booking;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AppointmentTransitionRepository extends JpaRepository<AppointmentTransitionEntity, UUID> {

    Optional<AppointmentTransitionEntity> findByAppointmentIdAndTriggerEventId(UUID appointmentId, String triggerEventId);

    List<AppointmentTransitionEntity> findByAppointmentIdOrderByOccurredAtAsc(UUID appointmentId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM AppointmentTransitionEntity t WHERE t.id = :id")
    Optional<AppointmentTransitionEntity> findForUpdate(@Param("id") UUID id);

    /**
     * Postings to retry: DEGRADED ones, and PENDING ones older than the grace period
     * (the request thread crashed before posting).
     */
    @Query("""
        SELECT t.id FROM AppointmentTransitionEntity t
        WHERE t.ledgerStatus = com.byootify.booking_ledger.booking.LedgerStatus.DEGRADED
           OR (t.ledgerStatus = com.byootify.booking_ledger.booking.LedgerStatus.PENDING AND t.occurredAt < :pendingBefore)
        ORDER BY t.occurredAt ASC
        """)
    List<UUID> findPostingsToRetry(@Param("pendingBefore") Instant pendingBefore, Pageable pageable);

    long countByLedgerStatus(LedgerStatus ledgerStatus);
}
