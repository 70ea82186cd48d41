package com.flagship.member_ledger.observability;

import com.flagship.member_ledger.ledger.FinanceStatistics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for the finance domain.
 *
 * - finance.log.entries: appended log entries, tagged by code
 * - finance.balance.credited / finance.balance.debited: money moved through the ledger (EUR)
 * - lastschrift.transactions: issued and finalized direct debits, tagged by status
 * - lastschrift.batch.rejected: batch items reported instead of processed
 * - fee.recalculation.*: registrations touched by fee recalculation, and its duration
 * - billing.personas: semester billing outcomes
 * - idempotency.cache: Idempotency-Key hits and misses
 * - finance.members*: gauges of the finance overview, refreshed by {@link MetricsScheduler}
 */
@Component
public class FinanceMetrics {

    private final MeterRegistry registry;

    private final Counter feeRecalculatedRegistrations;
    private final Timer feeRecalculationTimer;
    private final Timer lastschriftBatchTimer;

    private final AtomicLong members = new AtomicLong(0);
    private final AtomicLong trialMembers = new AtomicLong(0);
    private final AtomicLong lowBalanceMembers = new AtomicLong(0);
    private final AtomicLong lowBalanceMembersWithMandate = new AtomicLong(0);

    public FinanceMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.feeRecalculatedRegistrations = Counter.builder("fee.recalculation.changed")
                .description("Registrations whose amount owed changed on recalculation")
                .register(registry);

        this.feeRecalculationTimer = Timer.builder("fee.recalculation.duration")
                .description("Time taken to recalculate the fees of an event")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.lastschriftBatchTimer = Timer.builder("lastschrift.batch.duration")
                .description("Time taken by direct debit batch operations")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        Gauge.builder("finance.members", members, AtomicLong::get)
                .tag("kind", "all")
                .register(registry);
        Gauge.builder("finance.members", trialMembers, AtomicLong::get)
                .tag("kind", "trial")
                .register(registry);
        Gauge.builder("finance.members.low_balance", lowBalanceMembers, AtomicLong::get)
                .description("Members whose balance does not cover the next fee")
                .tag("mandate", "any")
                .register(registry);
        Gauge.builder("finance.members.low_balance", lowBalanceMembersWithMandate, AtomicLong::get)
                .tag("mandate", "active")
                .register(registry);
    }

    public void updateMembershipGauges(FinanceStatistics statistics) {
        members.set(statistics.getMembers());
        trialMembers.set(statistics.getTrialMembers());
        lowBalanceMembers.set(statistics.getLowBalanceMembers());
        lowBalanceMembersWithMandate.set(statistics.getLowBalanceMembersWithMandate());
    }

    public void recordFinanceLogEntry(String code) {
        registry.counter("finance.log.entries", "code", sanitizeTag(code)).increment();
    }

    /**
     * Records money moved by a balance mutation. Negative deltas count as debits.
     */
    public void recordBalanceChange(String code, BigDecimal delta) {
        if (delta == null || delta.signum() == 0) {
            return;
        }
        String name = delta.signum() > 0 ? "finance.balance.credited" : "finance.balance.debited";
        registry.counter(name, "code", sanitizeTag(code)).increment(delta.abs().doubleValue());
    }

    public void recordFeeRecalculation(int changedRegistrations, long durationMs) {
        feeRecalculatedRegistrations.increment(changedRegistrations);
        feeRecalculationTimer.record(Duration.ofMillis(durationMs));
    }

    public void recordLastschriftTransaction(String status) {
        registry.counter("lastschrift.transactions", "status", sanitizeTag(status)).increment();
    }

    public void recordBatchItemRejected(String operation, String reason) {
        registry.counter("lastschrift.batch.rejected",
                "operation", sanitizeTag(operation),
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordLastschriftBatch(String operation, long durationMs) {
        lastschriftBatchTimer.record(Duration.ofMillis(durationMs));
        registry.timer("lastschrift.batch.latency", "operation", sanitizeTag(operation))
                .record(Duration.ofMillis(durationMs));
    }

    public void recordBillingOutcome(String outcome) {
        registry.counter("billing.personas", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    // keeps tag cardinality bounded
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
