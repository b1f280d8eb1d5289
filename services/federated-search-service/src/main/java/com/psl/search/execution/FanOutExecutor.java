package com.psl.search.execution;

import com.psl.search.provider.ProviderAdapter;
import com.psl.search.provider.ProviderOutcome;
import com.psl.search.provider.ProviderRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Issues provider calls under one overall deadline. Two modes:
 * <ul>
 *   <li>{@link #cascade}: providers strictly in order, stopping at the first non-empty answer.</li>
 *   <li>{@link #fanOut}: every (query, provider) assignment concurrently, with a per-query retry
 *   against the third assigned provider for assignments that failed.</li>
 * </ul>
 * Provider failures, timeouts and cancellations are recorded as outcomes and never thrown.
 */
@Component
public class FanOutExecutor {
    private static final Logger logger = LoggerFactory.getLogger(FanOutExecutor.class);

    private final ExecutorService executor;
    private final ProviderRegistry providerRegistry;
    private final ExecutionProperties properties;
    private final MeterRegistry meterRegistry;

    public FanOutExecutor(
        @Qualifier("fanOutExecutorService") ExecutorService executor,
        ProviderRegistry providerRegistry,
        ExecutionProperties properties,
        MeterRegistry meterRegistry
    ) {
        this.executor = executor;
        this.providerRegistry = providerRegistry;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    public FanOutResult cascade(String query, List<String> providerIds, int limit) {
        long deadline = deadlineNanos();
        FanOutResult result = new FanOutResult();
        Set<String> tried = new LinkedHashSet<>();
        for (String providerId : providerIds) {
            if (!tried.add(providerId)) {
                continue;
            }
            if (tried.size() > 1) {
                result.markFallback();
            }
            ProviderOutcome outcome = await(submit(query, providerId, limit), providerId, deadline);
            result.record(query, outcome, tried.size() > 1);
            countOutcome(outcome);
            if (outcome.hasCandidates()) {
                return result;
            }
            if (!outcome.isOk()) {
                logger.warn("cascade_provider_failed provider={} reason={}", providerId, outcome.getErrorReason());
            }
            if (System.nanoTime() >= deadline) {
                logger.warn("cascade_deadline_exceeded tried={}", tried);
                break;
            }
        }
        logger.info("cascade_exhausted providers={} query_len={}", tried, query.length());
        return result;
    }

    public FanOutResult broadcast(String query, List<String> providerIds, int totalLimit) {
        List<QueryAssignment> assignments = new ArrayList<>();
        for (String providerId : new LinkedHashSet<>(providerIds)) {
            assignments.add(new QueryAssignment(query, providerId));
        }
        return fanOut(assignments, totalLimit);
    }

    public FanOutResult fanOut(List<QueryAssignment> assignments, int totalLimit) {
        FanOutResult result = new FanOutResult();
        if (assignments.isEmpty()) {
            return result;
        }
        long deadline = deadlineNanos();
        List<String> assignedProviders = distinctProviders(assignments);
        int perProviderLimit = Math.max(properties.getMinPerProviderLimit(), totalLimit / assignedProviders.size());

        Map<QueryAssignment, Future<ProviderOutcome>> primary = new LinkedHashMap<>();
        for (QueryAssignment assignment : assignments) {
            primary.putIfAbsent(
                assignment,
                submit(assignment.getQuery(), assignment.getProviderId(), perProviderLimit)
            );
        }

        Map<String, String> retryTargets = new LinkedHashMap<>();
        String backup = assignedProviders.size() >= properties.getFallbackMinProviders()
            ? assignedProviders.get(2)
            : null;
        for (Map.Entry<QueryAssignment, Future<ProviderOutcome>> entry : primary.entrySet()) {
            QueryAssignment assignment = entry.getKey();
            ProviderOutcome outcome = await(entry.getValue(), assignment.getProviderId(), deadline);
            result.record(assignment.getQuery(), outcome, false);
            countOutcome(outcome);
            if (outcome.isOk()) {
                continue;
            }
            logger.warn(
                "fanout_provider_failed provider={} reason={}",
                assignment.getProviderId(),
                outcome.getErrorReason()
            );
            if (backup != null
                && !backup.equals(assignment.getProviderId())
                && !primary.containsKey(new QueryAssignment(assignment.getQuery(), backup))) {
                retryTargets.putIfAbsent(assignment.getQuery(), backup);
            }
        }

        if (retryTargets.isEmpty()) {
            return result;
        }
        logger.info("fanout_fallback_activated queries={} backup={}", retryTargets.size(), backup);
        Map<QueryAssignment, Future<ProviderOutcome>> retries = new LinkedHashMap<>();
        for (Map.Entry<String, String> retry : retryTargets.entrySet()) {
            result.markFallback();
            retries.put(
                new QueryAssignment(retry.getKey(), retry.getValue()),
                submit(retry.getKey(), retry.getValue(), perProviderLimit)
            );
        }
        for (Map.Entry<QueryAssignment, Future<ProviderOutcome>> entry : retries.entrySet()) {
            QueryAssignment assignment = entry.getKey();
            ProviderOutcome outcome = await(entry.getValue(), assignment.getProviderId(), deadline);
            result.record(assignment.getQuery(), outcome, true);
            countOutcome(outcome);
        }
        return result;
    }

    private Future<ProviderOutcome> submit(String query, String providerId, int limit) {
        Optional<ProviderAdapter> adapter = providerRegistry.find(providerId);
        if (adapter.isEmpty()) {
            return null;
        }
        try {
            return executor.submit(() -> adapter.get().search(query, limit));
        } catch (RejectedExecutionException e) {
            logger.warn("fanout_submit_rejected provider={}", providerId);
            return null;
        }
    }

    private ProviderOutcome await(Future<ProviderOutcome> future, String providerId, long deadlineNanos) {
        if (future == null) {
            return ProviderOutcome.err(providerId, "unavailable", 0L);
        }
        long started = System.nanoTime();
        long remaining = deadlineNanos - started;
        try {
            if (remaining <= 0) {
                if (future.isDone()) {
                    return future.get();
                }
                future.cancel(true);
                return ProviderOutcome.err(providerId, "timeout", 0L);
            }
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return ProviderOutcome.err(providerId, "timeout", elapsedMs(started));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            logger.warn("fanout_provider_exception provider={} error={}", providerId, cause.toString());
            return ProviderOutcome.err(providerId, "exception", elapsedMs(started));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ProviderOutcome.err(providerId, "interrupted", elapsedMs(started));
        }
    }

    private void countOutcome(ProviderOutcome outcome) {
        String result = outcome.isOk() ? (outcome.hasCandidates() ? "ok" : "empty") : "error";
        meterRegistry.counter(
            "search.fanout.provider.calls.total",
            "provider", outcome.getProvider(),
            "outcome", result
        ).increment();
    }

    private long deadlineNanos() {
        return System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(1L, properties.getDeadlineMs()));
    }

    private static List<String> distinctProviders(List<QueryAssignment> assignments) {
        Set<String> providers = new LinkedHashSet<>();
        for (QueryAssignment assignment : assignments) {
            providers.add(assignment.getProviderId());
        }
        return new ArrayList<>(providers);
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }
}
