package com.byootify.booking_ledger.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    /**
     * Unpublished events below the retry limit, oldest first. SKIP LOCKED lets several
     * publishers share the table.
     */
    @Query(value = """
        SELECT * FROM outbox_events
        WHERE published_at IS NULL AND retry_count < :maxRetries
        ORDER BY sequence_number ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEventEntity> findUnpublishedEventsForUpdate(@Param("limit") int limit,
                                                           @Param("maxRetries") int maxRetries);

    List<OutboxEventEntity> findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
        String aggregateType, UUID aggregateId);

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    long countUnpublished();

    /**
     * Dead-lettered events: unpublished and out of retries.
     */
    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL AND e.retryCount >= :maxRetries")
    long countDeadLettered(@Param("maxRetries") int maxRetries);

    @Query("""
        SELECT MIN(e.createdAt) FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL
        """)
    Optional<Instant> findOldestUnpublishedCreatedAt();
}
