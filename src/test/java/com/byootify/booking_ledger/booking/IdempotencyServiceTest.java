package com.byootify.booking_ledger.booking;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Redis fast path and database fallback of the Idempotency-Key lookup.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class IdempotencyServiceTest {

    private static final String PREFIX = "booking:idempotency:";

    @Mock
    private AppointmentRepository appointmentRepository;

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private AppointmentEntity appointmentEntity;

    private IdempotencyService idempotencyService;
    private String requestKey;
    private UUID appointmentId;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        idempotencyService = new IdempotencyService(appointmentRepository, Optional.of(redisTemplate), true);
        requestKey = IdempotencyService.requestKey(UUID.randomUUID(), "key-1");
        appointmentId = IdempotencyService.appointmentIdFor(requestKey);
        when(appointmentEntity.getId()).thenReturn(appointmentId);
    }

    @Test
    @DisplayName("A Redis hit answers without touching the database")
    void redisHit() {
        when(valueOperations.get(PREFIX + requestKey)).thenReturn(appointmentId.toString());

        assertEquals(Optional.of(appointmentId), idempotencyService.findAppointment(requestKey));
        verifyNoInteractions(appointmentRepository);
    }

    @Test
    @DisplayName("A Redis outage falls back to the database and back-fills the cache")
    void redisOutageFallsBack() {
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));
        when(appointmentRepository.findByRequestKey(requestKey)).thenReturn(Optional.of(appointmentEntity));

        assertEquals(Optional.of(appointmentId), idempotencyService.findAppointment(requestKey));
        verify(valueOperations).set(PREFIX + requestKey, appointmentId.toString(), Duration.ofDays(7));
    }

    @Test
    @DisplayName("An unknown key is a miss in both stores")
    void unknownKey() {
        when(appointmentRepository.findByRequestKey(requestKey)).thenReturn(Optional.empty());

        assertTrue(idempotencyService.findAppointment(requestKey).isEmpty());
        verify(valueOperations, never()).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("With Redis disabled only the database is consulted")
    void redisDisabled() {
        IdempotencyService databaseOnly = new IdempotencyService(appointmentRepository, Optional.of(redisTemplate), false);
        when(appointmentRepository.findByRequestKey(requestKey)).thenReturn(Optional.of(appointmentEntity));

        assertEquals(Optional.of(appointmentId), databaseOnly.findAppointment(requestKey));
        databaseOnly.store(requestKey, appointmentId);
        verifyNoInteractions(redisTemplate);
    }

    @Test
    @DisplayName("A failed cache write does not fail the booking")
    void cacheWriteFailureIsTolerated() {
        doThrow(new RedisConnectionFailureException("connection refused"))
                .when(valueOperations).set(anyString(), anyString(), any(Duration.class));

        assertDoesNotThrow(() -> idempotencyService.store(requestKey, appointmentId));
    }

    @Test
    @DisplayName("Keys are scoped per client and map to a stable appointment id")
    void keysAreScopedPerClient() {
        UUID clientA = UUID.randomUUID();
        UUID clientB = UUID.randomUUID();

        String keyA = IdempotencyService.requestKey(clientA, "same");
        String keyB = IdempotencyService.requestKey(clientB, "same");

        assertNotEquals(IdempotencyService.appointmentIdFor(keyA), IdempotencyService.appointmentIdFor(keyB));
        assertEquals(IdempotencyService.appointmentIdFor(keyA),
                IdempotencyService.appointmentIdFor(IdempotencyService.requestKey(clientA, " same ")));
        assertThrows(IllegalArgumentException.class, () -> IdempotencyService.requestKey(clientA, " "));
    }
}
