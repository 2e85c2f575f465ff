package com.byootify.booking_ledger.booking;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps a client's Idempotency-Key to the appointment it created.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the appointments table (request_key column)
 * 3. Back-fill Redis after a database hit
 *
 * The appointment id itself is derived from the request key, so a retry that races the
 * original request converges on the same appointment even before either has committed.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "booking:idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final AppointmentRepository appointmentRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(AppointmentRepository appointmentRepository,
                              Optional<StringRedisTemplate> redisTemplate,
                              @Value("${booking.idempotency.redis-enabled:true}") boolean redisEnabled) {
        this.appointmentRepository = appointmentRepository;
        this.redisTemplate = redisEnabled ? redisTemplate : Optional.empty();
    }

    /**
     * Idempotency keys are scoped to the client that sent them.
     */
    public static String requestKey(UUID clientId, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        return clientId + ":" + idempotencyKey.trim();
    }

    public static UUID appointmentIdFor(String requestKey) {
        return UUID.nameUUIDFromBytes(requestKey.getBytes(StandardCharsets.UTF_8));
    }

    public Optional<UUID> findAppointment(String requestKey) {
        if (redisTemplate.isPresent()) {
            try {
                String appointmentId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + requestKey);
                if (appointmentId != null) {
                    log.debug("Idempotency key found in Redis: {}", requestKey);
                    return Optional.of(UUID.fromString(appointmentId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        requestKey, e.getMessage());
            }
        }

        Optional<UUID> stored = appointmentRepository.findByRequestKey(requestKey).map(AppointmentEntity::getId);
        stored.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", requestKey);
            cache(requestKey, id);
        });
        return stored;
    }

    /**
     * Caches the mapping in Redis. The appointments table stays the source of truth.
     */
    public void store(String requestKey, UUID appointmentId) {
        if (appointmentId == null) {
            throw new IllegalArgumentException("Appointment ID cannot be null");
        }
        cache(requestKey, appointmentId);
    }

    private void cache(String requestKey, UUID appointmentId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + requestKey, appointmentId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", requestKey, e.getMessage());
        }
    }
}
