package com.byootify.booking_ledger.settlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ClientSettlementRepository extends JpaRepository<ClientSettlementEntity, UUID> {

    boolean existsByInstructionKey(String instructionKey);

    List<ClientSettlementEntity> findByAppointmentIdOrderByCreatedAtAsc(UUID appointmentId);

    @Query(value = """
        SELECT * FROM client_settlements
        WHERE status = 'PENDING'
        ORDER BY created_at ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<ClientSettlementEntity> findPendingForUpdate(@Param("limit") int limit);

    long countByStatus(SettlementStatus status);
}
