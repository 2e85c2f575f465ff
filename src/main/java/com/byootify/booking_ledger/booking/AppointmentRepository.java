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
public interface AppointmentRepository extends JpaRepository<AppointmentEntity, UUID> {

    Optional<AppointmentEntity> findByRequestKey(String requestKey);

    /**
     * Per-appointment row lock taken by every state transition.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AppointmentEntity a WHERE a.id = :id")
    Optional<AppointmentEntity> findForUpdate(@Param("id") UUID id);

    /**
     * Confirmed appointments whose window ended before {@code endedBefore}.
     */
    @Query("""
        SELECT a.id FROM AppointmentEntity a
        WHERE a.status = com.byootify.booking_ledger.booking.AppointmentStatus.CONFIRMED
          AND a.endAt < :endedBefore
        ORDER BY a.endAt ASC
        """)
    List<UUID> findConfirmedEndedBefore(@Param("endedBefore") Instant endedBefore, Pageable pageable);

    List<AppointmentEntity> findByProviderIdOrderByStartAtAsc(UUID providerId);
}
