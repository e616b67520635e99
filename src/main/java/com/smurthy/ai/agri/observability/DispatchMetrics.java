package com.smurthy.ai.agri.observability;

import com.smurthy.ai.agri.model.Category;
import com.smurthy.ai.agri.model.SpecialistResult;
import com.smurthy.ai.agri.model.SynthesizedResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Dispatch Observability Metrics
 *
 * Tracks, per query and per specialist category:
 * - how many queries were answered fully, partially or not at all
 * - specialist successes, failures and timeouts
 * - end-to-end and per-specialist latency
 *
 * Exposed via {@code GET /monitoring/dispatch}; {@code POST /monitoring/dispatch/reset} clears it.
 */
@Component
public class DispatchMetrics {

    private static final Logger log = LoggerFactory.getLogger(DispatchMetrics.class);

    private static final long SLOW_QUERY_MS = 3000;

    // Query counters
    private final LongAdder totalQueries = new LongAdder();
    private final LongAdder fullAnswers = new LongAdder();
    private final LongAdder partialAnswers = new LongAdder();
    private final LongAdder totalFailures = new LongAdder();

    // Timing metrics (in milliseconds)
    private final LongAdder totalLatencyMs = new LongAdder();
    private final AtomicLong maxLatencyMs = new AtomicLong(0);

    private final Map<Category, CategoryCounters> byCategory = new ConcurrentHashMap<>();

    private static final class CategoryCounters {
        final LongAdder invocations = new LongAdder();
        final LongAdder successes = new LongAdder();
        final LongAdder failures = new LongAdder();
        final LongAdder timeouts = new LongAdder();
        final LongAdder latencyMs = new LongAdder();
        final AtomicLong maxLatencyMs = new AtomicLong(0);
    }

    /**
     * Record one dispatched query
     */
    public void recordDispatch(List<SpecialistResult> results, SynthesizedResponse response, long latencyMs) {
        totalQueries.increment();
        if (!response.success()) {
            totalFailures.increment();
        } else if (response.isPartial()) {
            partialAnswers.increment();
        } else {
            fullAnswers.increment();
        }

        totalLatencyMs.add(latencyMs);
        maxLatencyMs.updateAndGet(current -> Math.max(current, latencyMs));

        for (SpecialistResult result : results) {
            CategoryCounters counters = byCategory.computeIfAbsent(result.category(), c -> new CategoryCounters());
            long elapsed = result.elapsed().toMillis();
            counters.invocations.increment();
            counters.latencyMs.add(elapsed);
            counters.maxLatencyMs.updateAndGet(current -> Math.max(current, elapsed));
            switch (result.outcome()) {
                case SUCCESS -> counters.successes.increment();
                case FAILURE -> counters.failures.increment();
                case TIMEOUT -> counters.timeouts.increment();
            }
        }

        if (latencyMs > SLOW_QUERY_MS) {
            log.warn("Slow dispatch detected: {}ms across {} specialist(s)", latencyMs, results.size());
        }
    }

    /**
     * Get current metrics summary
     */
    public MetricsSummary getMetricsSummary() {
        long queries = totalQueries.sum();

        Map<String, CategorySummary> categories = new TreeMap<>();
        byCategory.forEach((category, counters) -> {
            long invocations = counters.invocations.sum();
            categories.put(category.key(), new CategorySummary(
                    invocations,
                    counters.successes.sum(),
                    counters.failures.sum(),
                    counters.timeouts.sum(),
                    invocations > 0 ? counters.latencyMs.sum() / invocations : 0,
                    counters.maxLatencyMs.get()));
        });

        return new MetricsSummary(
                queries,
                fullAnswers.sum(),
                partialAnswers.sum(),
                totalFailures.sum(),
                queries > 0 ? totalLatencyMs.sum() / queries : 0,
                maxLatencyMs.get(),
                categories);
    }

    /**
     * Reset all metrics
     */
    public void resetMetrics() {
        totalQueries.reset();
        fullAnswers.reset();
        partialAnswers.reset();
        totalFailures.reset();
        totalLatencyMs.reset();
        maxLatencyMs.set(0);
        byCategory.clear();
        log.info("Dispatch metrics reset");
    }

    // Data classes

    public record CategorySummary(
            long invocations,
            long successes,
            long failures,
            long timeouts,
            long averageLatencyMs,
            long maxLatencyMs
    ) {}

    public record MetricsSummary(
            long totalQueries,
            long fullAnswers,
            long partialAnswers,
            long totalFailures,
            long averageLatencyMs,
            long maxLatencyMs,
            Map<String, CategorySummary> categories
    ) {}
}
