package com.flagship.altyn_ledger.observability;

import com.flagship.altyn_ledger.error.ErrorCode;
import com.flagship.altyn_ledger.ledger.AssetType;
import com.flagship.altyn_ledger.transaction.TransactionType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.function.Supplier;

/**
 * Micrometer meters for ledger operations.
 *
 * Meters:
 * - ledger.transactions: settled transactions by type and asset
 * - ledger.volume: gross amount moved, by type and asset
 * - ledger.fees.collected: fees credited to the treasury
 * - ledger.dividends.runs / ledger.dividends.distributed: dividend runs and paid amount
 * - ledger.rejections: business rejections by operation and error code
 * - ledger.idempotency: replayed vs fresh keyed requests
 * - ledger.operation.duration: timer per operation
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransaction(TransactionType type, AssetType assetType, BigDecimal amount, BigDecimal fee) {
        registry.counter("ledger.transactions",
                "type", type.name(),
                "asset", assetType.name()
        ).increment();
        registry.counter("ledger.volume",
                "type", type.name(),
                "asset", assetType.name()
        ).increment(amount.doubleValue());
        if (fee.signum() > 0) {
            registry.counter("ledger.fees.collected").increment(fee.doubleValue());
        }
    }

    public void recordDividendRun(BigDecimal totalDistributed, int holders) {
        registry.counter("ledger.dividends.runs").increment();
        registry.counter("ledger.dividends.distributed").increment(totalDistributed.doubleValue());
        registry.summary("ledger.dividends.holders").record(holders);
    }

    public void recordRejection(String operation, ErrorCode code) {
        registry.counter("ledger.rejections",
                "operation", operation,
                "code", code.name()
        ).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("ledger.idempotency", "result", "replay").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("ledger.idempotency", "result", "fresh").increment();
    }

    public <T> T time(String operation, Supplier<T> work) {
        return Timer.builder("ledger.operation.duration")
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(work);
    }
}
