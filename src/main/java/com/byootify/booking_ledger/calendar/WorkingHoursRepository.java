package com.byootify.booking_ledger.calendar;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface WorkingHoursRepository extends JpaRepository<WorkingHoursEntity, UUID> {

    List<WorkingHoursEntity> findByProviderIdOrderByDayOfWeekAscStartTimeAsc(UUID providerId);

    @Modifying
    @Query("DELETE FROM WorkingHoursEntity w WHERE w.providerId = :providerId")
    int deleteByProvider(@Param("providerId") UUID providerId);
}
