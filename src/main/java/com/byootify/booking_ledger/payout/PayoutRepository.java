package com.byootify.booking_ledger.payout;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PayoutRepository extends JpaRepository<PayoutEntity, UUID> {

    boolean existsByIdempotencyKey(String idempotencyKey);

    Optional<PayoutEntity> findByTransferId(String transferId);

    List<PayoutEntity> findByProviderIdOrderByCutoffDesc(UUID providerId);

    List<PayoutEntity> findByStatusOrderByCreatedAtAsc(PayoutStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PayoutEntity p WHERE p.id = :id")
    Optional<PayoutEntity> findForUpdate(@Param("id") UUID id);
}
