package com.songbook.ensemble.service;

import com.songbook.ensemble.exception.SourceException;
import com.songbook.ensemble.exception.SourceHttpException;
import com.songbook.ensemble.exception.SourceTimeoutException;
import com.songbook.ensemble.infra.SourceClient;
import com.songbook.ensemble.model.PlaylistRequest;
import com.songbook.ensemble.model.SourceConfig;
import com.songbook.ensemble.model.SourceResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Fans one request out to every source and collects the answers under a shared deadline.
 * <p>
 * Each task only produces its own {@link SourceResult}; the maps below are touched by
 * the calling thread alone. Tasks still running when collection ends, whether through
 * the deadline or a fail-fast abort, are cancelled with interruption.
 */
@Slf4j
@Component
public class SourceDispatcher {

    private final SourceClient sourceClient;
    private final Executor sourceTaskExecutor;

    public SourceDispatcher(SourceClient sourceClient, @Qualifier("sourceTaskExecutor") Executor sourceTaskExecutor) {
        this.sourceClient = sourceClient;
        this.sourceTaskExecutor = sourceTaskExecutor;
    }

    public record Outcome(
        Map<String, SourceResult> results,
        Map<String, SourceException> failures
    ) {}

    public Outcome dispatch(List<SourceConfig> sources,
                            PlaylistRequest playlist,
                            int topKPerSource,
                            Duration timeoutPerSource,
                            Duration deadline,
                            boolean failFast) {
        return dispatch(sources, playlist, topKPerSource, timeoutPerSource, deadline, failFast, () -> {});
    }

    /**
     * @param onCollecting runs once every task is submitted, before waiting on the first answer
     * @throws SourceException in fail-fast mode, the first failure observed
     */
    public Outcome dispatch(List<SourceConfig> sources,
                            PlaylistRequest playlist,
                            int topKPerSource,
                            Duration timeoutPerSource,
                            Duration deadline,
                            boolean failFast,
                            Runnable onCollecting) {
        CompletionService<SourceResult> completionService = new ExecutorCompletionService<>(sourceTaskExecutor);
        Map<Future<SourceResult>, SourceConfig> inFlight = new LinkedHashMap<>();
        Map<String, SourceResult> results = new HashMap<>();
        Map<String, SourceException> failures = new HashMap<>();
        long deadlineNanos = System.nanoTime() + deadline.toNanos();

        try {
            for (SourceConfig source : sources) {
                inFlight.put(completionService.submit(
                    () -> sourceClient.fetch(source, playlist, topKPerSource, timeoutPerSource)), source);
            }
            onCollecting.run();

            while (!inFlight.isEmpty()) {
                long remaining = deadlineNanos - System.nanoTime();
                Future<SourceResult> completed = remaining > 0
                    ? completionService.poll(remaining, TimeUnit.NANOSECONDS)
                    : null;

                if (completed == null) {
                    log.warn("Shared deadline of {} ms elapsed with {} source(s) pending",
                        deadline.toMillis(), inFlight.size());
                    for (SourceConfig pending : inFlight.values()) {
                        SourceTimeoutException timeout = new SourceTimeoutException(pending.name(), deadline);
                        if (failFast) {
                            throw timeout;
                        }
                        failures.put(pending.name(), timeout);
                    }
                    break;
                }

                SourceConfig source = inFlight.remove(completed);
                try {
                    results.put(source.name(), completed.get());
                } catch (ExecutionException e) {
                    SourceException failure = asSourceException(source, e.getCause());
                    if (failFast) {
                        throw failure;
                    }
                    log.warn("{}; continuing with the remaining sources", failure.getMessage());
                    failures.put(source.name(), failure);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while collecting source results", e);
        } finally {
            if (!inFlight.isEmpty()) {
                log.debug("Cancelling {} in-flight source call(s)", inFlight.size());
                inFlight.keySet().forEach(future -> future.cancel(true));
            }
        }

        return new Outcome(results, failures);
    }

    private SourceException asSourceException(SourceConfig source, Throwable cause) {
        if (cause instanceof SourceException sourceException) {
            return sourceException;
        }
        return SourceHttpException.transport(source.name(), cause);
    }
}
