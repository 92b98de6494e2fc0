package com.flagship.altyn_ledger.observability;

import com.flagship.altyn_ledger.outbox.OutboxEventRepository;
import com.flagship.altyn_ledger.treasury.ReconciliationReport;
import com.flagship.altyn_ledger.treasury.TreasuryReportService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicators for the ledger service.
 */
public class HealthIndicators {

    /**
     * DOWN when the conservation equations do not hold. This means money was
     * created or lost outside emission, and needs a human.
     */
    @Component("ledgerConservation")
    public static class LedgerConservationHealthIndicator implements HealthIndicator {

        private final TreasuryReportService treasuryReportService;

        public LedgerConservationHealthIndicator(TreasuryReportService treasuryReportService) {
            this.treasuryReportService = treasuryReportService;
        }

        @Override
        public Health health() {
            try {
                ReconciliationReport report = treasuryReportService.reconcile();
                Health.Builder builder = report.isBalanced() ? Health.up() : Health.down();
                return builder
                        .withDetail("coinDiscrepancy", report.getCoinDiscrepancy().toPlainString())
                        .withDetail("tokenDiscrepancy", report.getTokenDiscrepancy().toPlainString())
                        .withDetail("totalCoinsInCirculation", report.getTotalCoinsInCirculation().toPlainString())
                        .withDetail("collectedFees", report.getCollectedFees().toPlainString())
                        .build();
            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * WARNING above 1000 pending ledger events, DOWN above 10000.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlog = outboxRepository.countUnpublished();
                Health.Builder builder = backlog < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlog < BACKLOG_CRITICAL_THRESHOLD ? Health.status("WARNING") : Health.down();
                return builder.withDetail("backlogSize", backlog).build();
            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Redis only caches idempotency keys, so an outage degrades rather than fails the service.
     */
    @Component("idempotencyCache")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return Health.status("DEGRADED").withDetail("error", "No connection factory").build();
                }
                try (var connection = connectionFactory.getConnection()) {
                    String reply = connection.ping();
                    return "PONG".equals(reply)
                            ? Health.up().build()
                            : Health.status("DEGRADED").withDetail("reply", String.valueOf(reply)).build();
                }
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("fallback", "database")
                        .build();
            }
        }
    }
}
