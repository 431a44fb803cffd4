package io.flashvault.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.math.BigInteger;

public final class VaultMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter sessionsOpened = registry.counter("vault.sessions.opened");
    private static final Counter sessionsCommitted = registry.counter("vault.sessions.committed");
    private static final Counter sessionsRolledBack = registry.counter("vault.sessions.rolledback");
    private static final Counter appsRegistered = registry.counter("vault.apps.registered");
    private static final Timer sessionTime = registry.timer("vault.session.time");
    private static final DistributionSummary settlePaid = DistributionSummary.builder("vault.settle.paid")
            .baseUnit("units")
            .description("Amounts credited by settle")
            .register(registry);
    private static final DistributionSummary takeAmount = DistributionSummary.builder("vault.take.amount")
            .baseUnit("units")
            .description("Amounts withdrawn by take")
            .register(registry);

    private VaultMetrics() {}

    public static Timer.Sample sessionOpened() {
        sessionsOpened.increment();
        return Timer.start(registry);
    }

    public static void sessionCommitted(Timer.Sample sample) {
        sessionsCommitted.increment();
        sample.stop(sessionTime);
    }

    public static void sessionRolledBack(Timer.Sample sample) {
        sessionsRolledBack.increment();
        sample.stop(sessionTime);
    }

    public static void appRegistered() {
        appsRegistered.increment();
    }

    // summaries are doubles; precision loss above 2^53 is acceptable for metrics
    public static void recordSettle(BigInteger paid) {
        settlePaid.record(paid.doubleValue());
    }

    public static void recordTake(BigInteger amount) {
        takeAmount.record(amount.doubleValue());
    }

    public static Timer.Sample requestStarted() {
        return Timer.start(registry);
    }

    /** Times a read-API request under {@code vault.api.requests}, tagged by endpoint and status. */
    public static void requestCompleted(Timer.Sample sample, String endpoint, int status) {
        Timer timer = Timer.builder("vault.api.requests")
                .description("Read API request duration")
                .tag("endpoint", endpoint)
                .tag("status", Integer.toString(status))
                .register(registry);
        sample.stop(timer);
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
