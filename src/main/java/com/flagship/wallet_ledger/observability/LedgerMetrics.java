package com.flagship.wallet_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger transfers.
 *
 * Metrics exposed:
 * - ledger.transfers: counter tagged by type and result
 *   (success, replay, insufficient_funds, validation_error, not_found, conflict, error)
 * - ledger.transfer.latency: timer tagged by type
 * - idempotency.cache: counter tagged by result (hit, miss) and source (redis, database)
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransfer(String type, String result) {
        registry.counter("ledger.transfers",
                "type", sanitizeTag(type),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordTransferLatency(String type, long durationMs) {
        Timer.builder("ledger.transfer.latency")
                .description("Time taken to execute a ledger transfer")
                .tag("type", sanitizeTag(type))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit(String source) {
        registry.counter("idempotency.cache", "result", "hit", "source", sanitizeTag(source)).increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss", "source", "none").increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
