package com.flagship.altyn_ledger.idempotency;

import com.flagship.altyn_ledger.ledger.AssetType;
import com.flagship.altyn_ledger.observability.LedgerMetrics;
import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import com.flagship.altyn_ledger.transaction.TransactionLog;
import com.flagship.altyn_ledger.transaction.TransactionType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdempotencyServiceTest {

    @Mock
    private TransactionLog transactionLog;
    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOperations;

    private IdempotencyService service;

    @BeforeEach
    void setUp() {
        service = new IdempotencyService(transactionLog, Optional.of(redisTemplate),
                new LedgerMetrics(new SimpleMeterRegistry()));
    }

    @Test
    @DisplayName("Keys are trimmed before the length check and bound to the caller")
    void scopeTrimsBeforeValidating() {
        String maxLength = "k".repeat(128);

        assertEquals("alice:" + maxLength, IdempotencyService.scope("alice", "  " + maxLength + "  "));
        assertEquals("alice:k1", IdempotencyService.scope("alice", " k1\t"));
        assertThrows(IllegalArgumentException.class, () -> IdempotencyService.scope("alice", maxLength + "k"));
        assertThrows(IllegalArgumentException.class, () -> IdempotencyService.scope("alice", "   "));
        assertThrows(IllegalArgumentException.class, () -> IdempotencyService.scope("alice", null));
    }

    @Test
    @DisplayName("Lookup falls through to the ledger when Redis fails and re-caches the hit")
    void fallsBackToLedgerWhenRedisFails() {
        LedgerTransaction settled = LedgerTransaction.movement(TransactionType.TRANSFER, AssetType.COIN,
                "alice", "bob", new BigDecimal("10.00"), new BigDecimal("0.01"), null, "alice:k1");
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("altyn:idempotency:alice:k1")).thenThrow(new IllegalStateException("redis down"));
        when(transactionLog.findByIdempotencyKey("alice:k1")).thenReturn(Optional.of(settled));

        Optional<LedgerTransaction> found = service.findSettled("alice:k1");

        assertTrue(found.isPresent());
        assertEquals(settled.getId(), found.get().getId());
        verify(valueOperations).set(eq("altyn:idempotency:alice:k1"), eq(settled.getId().toString()), any(Duration.class));
    }

    @Test
    @DisplayName("Unknown key is a miss")
    void unknownKeyIsMiss() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenReturn(null);
        when(transactionLog.findByIdempotencyKey("alice:k9")).thenReturn(Optional.empty());

        assertTrue(service.findSettled("alice:k9").isEmpty());
        verify(valueOperations, never()).set(anyString(), anyString(), any(Duration.class));
    }
}
