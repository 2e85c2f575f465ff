package com.byootify.booking_ledger.calendar;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for calendar intervals.
 *
 * Deletes are bulk statements so they reach the database before any pending insert is
 * flushed; the exclusion constraint would otherwise see the lapsed row and the new one together.
 */
@Repository
public interface BookedIntervalRepository extends JpaRepository<BookedIntervalEntity, UUID> {

    Optional<BookedIntervalEntity> findByProviderIdAndAppointmentId(UUID providerId, UUID appointmentId);

    Optional<BookedIntervalEntity> findByAppointmentId(UUID appointmentId);

    /**
     * Rows of one provider overlapping {@code [start, end)}, ordered by start.
     */
    @Query("""
        SELECT b FROM BookedIntervalEntity b
        WHERE b.providerId = :providerId AND b.startAt < :end AND b.endAt > :start
        ORDER BY b.startAt ASC
        """)
    List<BookedIntervalEntity> findOverlapping(@Param("providerId") UUID providerId,
                                               @Param("start") Instant start,
                                               @Param("end") Instant end);

    @Query("""
        SELECT DISTINCT b.providerId FROM BookedIntervalEntity b
        WHERE b.status = com.byootify.booking_ledger.calendar.IntervalStatus.TENTATIVE
          AND b.expiresAt <= :now
        """)
    List<UUID> findProvidersWithLapsedHolds(@Param("now") Instant now);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM BookedIntervalEntity b WHERE b.id IN :ids")
    int deleteByIds(@Param("ids") Collection<UUID> ids);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM BookedIntervalEntity b WHERE b.providerId = :providerId AND b.appointmentId = :appointmentId")
    int deleteByProviderAndAppointment(@Param("providerId") UUID providerId,
                                       @Param("appointmentId") UUID appointmentId);

    @Modifying(flushAutomatically = true)
    @Query("""
        DELETE FROM BookedIntervalEntity b
        WHERE b.providerId = :providerId
          AND b.status = com.byootify.booking_ledger.calendar.IntervalStatus.TENTATIVE
          AND b.expiresAt <= :now
        """)
    int deleteLapsedHolds(@Param("providerId") UUID providerId, @Param("now") Instant now);
}
