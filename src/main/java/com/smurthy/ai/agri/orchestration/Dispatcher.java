package com.smurthy.ai.agri.orchestration;

import com.smurthy.ai.agri.agents.Specialist;
import com.smurthy.ai.agri.config.DispatchConfig;
import com.smurthy.ai.agri.logging.MdcContext;
import com.smurthy.ai.agri.model.Category;
import com.smurthy.ai.agri.model.Classification;
import com.smurthy.ai.agri.model.Query;
import com.smurthy.ai.agri.model.SpecialistResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Fans a classified query out to the specialists of its target categories and joins their
 * results under a hard deadline.
 *
 * Guarantees:
 * - every target yields exactly one result, in target order (never completion order)
 * - exceptions, null or malformed results become FAILURE results
 * - a specialist that overruns its budget becomes TIMEOUT and is cancelled with interruption
 * - budgets are measured from the common start, so the whole call is bounded by the largest one
 */
@Component
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final SpecialistRegistry registry;
    private final ExecutorService executor;
    private final DispatchConfig config;

    /**
     * A specialist scheduled for one of the query's target categories.
     */
    public record Target(Category category, Specialist specialist, Duration budget) {}

    private record Pending(Target target, Future<SpecialistResult> future, SpecialistResult rejected) {}

    public Dispatcher(SpecialistRegistry registry,
                      @Qualifier("specialistExecutor") ExecutorService executor,
                      DispatchConfig config) {
        this.registry = registry;
        this.executor = executor;
        this.config = config;
    }

    public List<SpecialistResult> dispatch(Classification classification, Query query) {
        return run(targetsFor(classification, query), classification, query);
    }

    /**
     * Sends the query to one category regardless of what the classifier picked.
     */
    public List<SpecialistResult> dispatchTo(Category forced, Classification classification, Query query) {
        return run(targetsFor(List.of(forced)), classification, query);
    }

    /**
     * Primary first, then secondaries when comprehensive; GENERAL means every specialist.
     */
    public List<Target> targetsFor(Classification classification, Query query) {
        List<Category> categories = new ArrayList<>();
        categories.add(classification.primary());
        if (query.comprehensive()) {
            categories.addAll(classification.secondaries());
        }
        return targetsFor(categories);
    }

    private List<Target> targetsFor(List<Category> categories) {
        Set<Category> distinct = new LinkedHashSet<>(categories);
        distinct.remove(null);
        if (distinct.isEmpty() || distinct.contains(Category.GENERAL)) {
            // GENERAL fans out to the whole registry, each specialist under its own category
            List<Target> everyone = new ArrayList<>();
            for (Specialist specialist : registry.all()) {
                everyone.add(new Target(specialist.category(), specialist, config.timeoutFor(specialist.category())));
            }
            return everyone;
        }

        List<Target> targets = new ArrayList<>();
        for (Category category : distinct) {
            for (Specialist specialist : registry.resolve(category)) {
                targets.add(new Target(category, specialist, config.timeoutFor(category)));
            }
        }
        return targets;
    }

    private List<SpecialistResult> run(List<Target> targets, Classification classification, Query query) {
        String queryId = MDC.get(MdcContext.QUERY_ID);
        Map<String, String> callerMdc = MdcContext.capture();
        Map<String, Object> context = classification.entities();

        log.info("[Dispatcher] Dispatching to {} specialist(s): {}", targets.size(),
                targets.stream().map(t -> t.specialist().name()).collect(Collectors.toList()));

        long start = System.nanoTime();
        List<Pending> pending = new ArrayList<>(targets.size());
        for (Target target : targets) {
            try {
                Future<SpecialistResult> future = executor.submit(
                        () -> invokeSafely(target, query, context, callerMdc, queryId));
                pending.add(new Pending(target, future, null));
            } catch (RejectedExecutionException e) {
                log.error("[Dispatcher] Executor rejected {}: {}", target.specialist().name(), e.getMessage());
                pending.add(new Pending(target, null, SpecialistResult.failure(target.category(),
                        target.specialist().name(), "Dispatch rejected: executor saturated", Duration.ZERO)));
            }
        }

        List<SpecialistResult> results = new ArrayList<>(pending.size());
        boolean interrupted = false;
        for (Pending entry : pending) {
            if (entry.future() == null) {
                results.add(entry.rejected());
            } else if (interrupted) {
                entry.future().cancel(true);
                results.add(SpecialistResult.failure(entry.target().category(), entry.target().specialist().name(),
                        "Dispatch interrupted", elapsedSince(start)));
            } else {
                try {
                    results.add(await(entry, start));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    interrupted = true;
                    entry.future().cancel(true);
                    results.add(SpecialistResult.failure(entry.target().category(),
                            entry.target().specialist().name(), "Dispatch interrupted", elapsedSince(start)));
                }
            }
        }

        log.info("[Dispatcher] Joined {} result(s) in {}ms", results.size(), elapsedSince(start).toMillis());
        return results;
    }

    private SpecialistResult await(Pending entry, long start) throws InterruptedException {
        Target target = entry.target();
        String name = target.specialist().name();
        long deadline = start + target.budget().toNanos();

        try {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            return entry.future().get(remaining, TimeUnit.NANOSECONDS);

        } catch (TimeoutException e) {
            entry.future().cancel(true);
            log.warn("[Dispatcher] {} timed out after {}ms, abandoning", name, target.budget().toMillis());
            return SpecialistResult.timeout(target.category(), name, target.budget());

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Dispatcher] {} failed: {}", name, cause.toString());
            return SpecialistResult.failure(target.category(), name, describe(cause), elapsedSince(start));

        } catch (CancellationException e) {
            return SpecialistResult.failure(target.category(), name, "Cancelled", elapsedSince(start));
        }
    }

    /**
     * Runs on a specialist thread. Never throws: every problem is turned into a FAILURE result.
     */
    SpecialistResult invokeSafely(Target target, Query query, Map<String, Object> context,
                                  Map<String, String> callerMdc, String queryId) {
        MdcContext.restore(callerMdc);
        MdcContext.setSpecialist(queryId != null ? queryId : "-", target.category().key(),
                target.specialist().name());
        String name = target.specialist().name();
        long startTime = System.nanoTime();

        try {
            SpecialistResult result = target.specialist().invoke(query, context);
            Duration elapsed = elapsedSince(startTime);

            String problem = validate(result);
            if (problem != null) {
                log.warn("[Dispatcher] {} returned an invalid result: {}", name, problem);
                return SpecialistResult.failure(target.category(), name, "Invalid result: " + problem, elapsed);
            }

            log.debug("[Dispatcher] {} finished with {} in {}ms", name, result.outcome(), elapsed.toMillis());
            return result.attributedTo(target.category(), elapsed);

        } catch (Exception e) {
            log.error("[Dispatcher] {} threw {}", name, e.toString());
            return SpecialistResult.failure(target.category(), name, describe(e), elapsedSince(startTime));
        } finally {
            MDC.clear();
        }
    }

    /**
     * @return what is wrong with the result, or null when it can be used
     */
    static String validate(SpecialistResult result) {
        if (result == null) {
            return "no result";
        }
        if (!result.isSuccess()) {
            return null;
        }
        if (result.payload() == null) {
            return "null payload";
        }
        if (result.source() == null || result.source().isBlank()) {
            return "blank source";
        }
        double confidence = result.confidence();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            return "confidence " + confidence + " outside [0,1]";
        }
        return null;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getClass().getSimpleName() + ": " + t.getMessage()
                : t.getClass().getSimpleName();
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
