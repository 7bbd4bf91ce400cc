package com.terradrift.core.orchestration;

import com.terradrift.core.compare.ComparisonOptions;
import com.terradrift.core.compare.DriftClassifier;
import com.terradrift.core.error.ConfigurationException;
import com.terradrift.core.metrics.DriftMetrics;
import com.terradrift.core.model.ConfigValue;
import com.terradrift.core.model.DriftReport;
import com.terradrift.core.source.DeclarativeConfigResolver;
import com.terradrift.core.source.LiveResourceFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Checks many resources concurrently on a bounded worker pool.
 *
 * <p>Each distinct identifier becomes one task that fetches the live tree, resolves the
 * declared tree and classifies the difference. A failing task yields a
 * {@link ResourceOutcome.Status#FAILED} outcome for its identifier only; the others keep
 * running. The summary lists outcomes in submission order.
 *
 * <p>{@link #cancel()} may be called from any thread (typically a JVM shutdown hook).
 * Tasks that have not started end as {@link ResourceOutcome.Status#CANCELLED} without touching
 * the fetcher, and in-flight tasks are interrupted so a blocking SDK call aborts. Every task
 * still reports an outcome.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DriftRunner runner = new DriftRunner(fetcher, resolver, new DriftClassifier(), metrics, 5);
 * RunSummary summary = runner.run(List.of("i-1", "i-2"), ComparisonOptions.defaults(), ProgressListener.NONE);
 * }</pre>
 *
 * <p>One instance runs one batch at a time. Each {@link #run} starts uncancelled, so a runner
 * can be reused after a cancelled batch.
 */
public class DriftRunner {

    private static final Logger log = LoggerFactory.getLogger(DriftRunner.class);

    private final LiveResourceFetcher fetcher;
    private final DeclarativeConfigResolver resolver;
    private final DriftClassifier classifier;
    private final DriftMetrics metrics;
    private final int concurrency;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Map<String, Thread> inFlight = new ConcurrentHashMap<>();
    private volatile CountDownLatch finished = new CountDownLatch(0);

    public DriftRunner(LiveResourceFetcher fetcher,
                       DeclarativeConfigResolver resolver,
                       DriftClassifier classifier,
                       DriftMetrics metrics,
                       int concurrency) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        if (concurrency < 1) {
            throw new ConfigurationException("Concurrency must be at least 1, got " + concurrency);
        }
        this.concurrency = concurrency;
    }

    /**
     * Checks every identifier and waits for all checks to end.
     *
     * @param resourceIds identifiers to check; duplicates are checked once
     * @param options attribute checklist and matching strategy
     * @param listener progress callback
     * @return outcomes in submission order
     * @throws ConfigurationException if no identifier is given
     */
    public RunSummary run(List<String> resourceIds, ComparisonOptions options, ProgressListener listener) {
        Objects.requireNonNull(resourceIds, "resourceIds must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(listener, "listener must not be null");

        Set<String> distinct = new LinkedHashSet<>(resourceIds);
        if (distinct.isEmpty()) {
            throw new ConfigurationException("At least one resource identifier is required");
        }

        int total = distinct.size();
        int poolSize = Math.min(concurrency, total);
        log.info("Checking {} resource(s) against {} with {} worker(s)", total, resolver.describe(), poolSize);

        cancelled.set(false);
        finished = new CountDownLatch(1);
        AtomicInteger completed = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, workerThreadFactory());
        try {
            Map<String, Future<ResourceOutcome>> futures = new LinkedHashMap<>();
            for (String resourceId : distinct) {
                futures.put(resourceId, executor.submit(() -> {
                    ResourceOutcome outcome = check(resourceId, options);
                    listener.onOutcome(outcome, completed.incrementAndGet(), total);
                    return outcome;
                }));
            }

            List<ResourceOutcome> outcomes = new ArrayList<>(total);
            futures.forEach((resourceId, future) -> outcomes.add(await(resourceId, future)));

            RunSummary summary = new RunSummary(outcomes);
            log.info("Run finished: {} completed, {} failed, {} cancelled, {} drifted attribute(s)",
                summary.count(ResourceOutcome.Status.COMPLETED),
                summary.count(ResourceOutcome.Status.FAILED),
                summary.count(ResourceOutcome.Status.CANCELLED),
                summary.totalDriftCount());
            return summary;
        } finally {
            executor.shutdown();
            finished.countDown();
        }
    }

    /**
     * Stops the current run: pending checks are skipped and in-flight checks are interrupted.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.warn("Cancelling drift run; {} check(s) in flight", inFlight.size());
        }
        inFlight.values().forEach(Thread::interrupt);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Waits for the current run, if any, to return its summary.
     *
     * @param timeout maximum time to wait
     * @return true if no run is active when this returns
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private ResourceOutcome check(String resourceId, ComparisonOptions options) {
        // Clear an interrupt left over from a cancel that raced the previous task on this thread
        Thread.interrupted();
        // Register before reading the flag: a cancel either sees this thread or is seen here
        inFlight.put(resourceId, Thread.currentThread());
        try {
            if (cancelled.get()) {
                log.debug("Skipping {}: run cancelled", resourceId);
                return ResourceOutcome.cancelled(resourceId);
            }

            long start = System.nanoTime();
            ConfigValue live = fetcher.fetch(resourceId);
            ConfigValue declared = resolver.resolve(resourceId);
            DriftReport report = classifier.classify(resourceId, live, declared, options);

            metrics.recordDriftCheck(Duration.ofNanos(System.nanoTime() - start));
            report.records().keySet().forEach(metrics::recordDriftDetected);
            log.debug("Checked {}: {} drifted attribute(s)", resourceId, report.driftCount());
            return ResourceOutcome.completed(report);
        } catch (RuntimeException e) {
            if (cancelled.get()) {
                log.debug("Check of {} aborted by cancellation: {}", resourceId, e.getMessage());
                return ResourceOutcome.cancelled(resourceId);
            }
            log.error("Drift check failed for {}: {}", resourceId, e.getMessage());
            log.debug("Failure detail for {}", resourceId, e);
            return ResourceOutcome.failed(resourceId, e);
        } finally {
            inFlight.remove(resourceId);
            Thread.interrupted();
        }
    }

    private ResourceOutcome await(String resourceId, Future<ResourceOutcome> future) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return future.get();
                } catch (InterruptedException e) {
                    interrupted = true;
                    cancel();
                } catch (ExecutionException e) {
                    log.error("Drift check crashed for {}", resourceId, e.getCause());
                    return ResourceOutcome.failed(resourceId, e.getCause());
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "terradrift-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
