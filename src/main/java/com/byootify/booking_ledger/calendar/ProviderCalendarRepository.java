package com.byootify.booking_ledger.calendar;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProviderCalendarRepository extends JpaRepository<ProviderCalendarEntity, UUID> {

    /**
     * Creates the lock row on first use. Concurrent first bookings race harmlessly.
     */
    @Modifying
    @Query(value = """
        INSERT INTO provider_calendars (provider_id, mutation_count, created_at, updated_at)
        VALUES (:providerId, 0, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
        ON CONFLICT (provider_id) DO NOTHING
        """, nativeQuery = true)
    int ensureExists(@Param("providerId") UUID providerId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM ProviderCalendarEntity c WHERE c.providerId = :providerId")
    Optional<ProviderCalendarEntity> findForUpdate(@Param("providerId") UUID providerId);
}
