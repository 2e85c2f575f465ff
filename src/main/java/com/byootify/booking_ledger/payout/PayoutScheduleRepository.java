package com.byootify.booking_ledger.payout;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface PayoutScheduleRepository extends JpaRepository<PayoutScheduleEntity, UUID> {
}
