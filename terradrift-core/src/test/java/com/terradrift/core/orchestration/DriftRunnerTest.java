package com.terradrift.core.orchestration;

import com.terradrift.core.compare.ComparisonOptions;
import com.terradrift.core.compare.DriftClassifier;
import com.terradrift.core.error.ConfigurationException;
import com.terradrift.core.error.FetchException;
import com.terradrift.core.error.ResourceNotFoundException;
import com.terradrift.core.metrics.DriftMetrics;
import com.terradrift.core.model.ConfigValue;
import com.terradrift.core.normalize.ConfigNormalizer;
import com.terradrift.core.source.DeclarativeConfigResolver;
import com.terradrift.core.source.LiveResourceFetcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

/**
 * Tests for {@link DriftRunner}.
 */
class DriftRunnerTest {

    private static final ComparisonOptions OPTIONS = ComparisonOptions.of(List.of("instance_type"));

    private final Map<String, ConfigValue> declared = new ConcurrentHashMap<>();
    private SimpleMeterRegistry registry;
    private DriftMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new DriftMetrics(registry);
        declared.put("i-1", instance("t2.micro"));
        declared.put("i-2", instance("t2.micro"));
        declared.put("i-3", instance("t2.micro"));
    }

    @Test
    void run_mixedResults_isolatesFailuresAndKeepsSubmissionOrder() {
        // Given
        LiveResourceFetcher fetcher = id -> {
            if (id.equals("i-2")) {
                throw new FetchException(id, "Instance i-2 not found");
            }
            return id.equals("i-3") ? instance("t2.large") : instance("t2.micro");
        };
        DriftRunner runner = runner(fetcher, 3);

        // When
        RunSummary summary = runner.run(List.of("i-1", "i-2", "i-3"), OPTIONS, ProgressListener.NONE);

        // Then
        assertThat(summary.outcomes()).extracting(ResourceOutcome::resourceId).containsExactly("i-1", "i-2", "i-3");
        assertThat(summary.get("i-1").orElseThrow().status()).isEqualTo(ResourceOutcome.Status.COMPLETED);
        assertThat(summary.get("i-1").orElseThrow().hasDrift()).isFalse();
        assertThat(summary.get("i-2").orElseThrow().status()).isEqualTo(ResourceOutcome.Status.FAILED);
        assertThat(summary.get("i-2").orElseThrow().error()).isInstanceOf(FetchException.class);
        assertThat(summary.get("i-3").orElseThrow().hasDrift()).isTrue();
        assertThat(summary.hasFailures()).isTrue();
        assertThat(summary.totalDriftCount()).isEqualTo(1);
    }

    @Test
    void run_resourceMissingFromDeclaredSource_failsOnlyThatResource() {
        DriftRunner runner = runner(id -> instance("t2.micro"), 2);

        RunSummary summary = runner.run(List.of("i-1", "i-9"), OPTIONS, ProgressListener.NONE);

        assertThat(summary.get("i-1").orElseThrow().status()).isEqualTo(ResourceOutcome.Status.COMPLETED);
        assertThat(summary.get("i-9").orElseThrow().error()).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void run_duplicateIds_areCheckedOnce() {
        AtomicInteger fetches = new AtomicInteger();
        DriftRunner runner = runner(id -> {
            fetches.incrementAndGet();
            return instance("t2.micro");
        }, 2);

        RunSummary summary = runner.run(List.of("i-1", "i-2", "i-1"), OPTIONS, ProgressListener.NONE);

        assertThat(summary.outcomes()).hasSize(2);
        assertThat(fetches).hasValue(2);
    }

    @Test
    void run_reportsProgressForEveryResource() {
        // Given
        List<String> progress = Collections.synchronizedList(new ArrayList<>());
        DriftRunner runner = runner(id -> instance("t2.micro"), 2);

        // When
        runner.run(List.of("i-1", "i-2", "i-3"), OPTIONS,
            (outcome, completed, total) -> progress.add(completed + "/" + total));

        // Then
        assertThat(progress).containsExactlyInAnyOrder("1/3", "2/3", "3/3");
    }

    @Test
    void run_neverExceedsConfiguredConcurrency() {
        // Given
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        for (int i = 4; i <= 8; i++) {
            declared.put("i-" + i, instance("t2.micro"));
        }
        DriftRunner runner = runner(id -> {
            peak.accumulateAndGet(active.incrementAndGet(), Math::max);
            try {
                Thread.sleep(30);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            active.decrementAndGet();
            return instance("t2.micro");
        }, 2);

        // When
        RunSummary summary = runner.run(
            List.of("i-1", "i-2", "i-3", "i-4", "i-5", "i-6", "i-7", "i-8"), OPTIONS, ProgressListener.NONE);

        // Then
        assertThat(summary.isSuccessful()).isTrue();
        assertThat(peak.get()).isBetween(1, 2);
    }

    @Test
    void cancel_duringRun_marksInFlightAndPendingChecksCancelled() throws Exception {
        // Given
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch neverReleased = new CountDownLatch(1);
        AtomicInteger fetches = new AtomicInteger();
        DriftRunner runner = runner(id -> {
            fetches.incrementAndGet();
            started.countDown();
            try {
                neverReleased.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchException(id, "interrupted");
            }
            return instance("t2.micro");
        }, 1);

        Thread canceller = new Thread(() -> {
            try {
                if (started.await(5, TimeUnit.SECONDS)) {
                    runner.cancel();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        canceller.start();

        // When
        RunSummary summary = runner.run(List.of("i-1", "i-2", "i-3"), OPTIONS, ProgressListener.NONE);
        canceller.join();

        // Then
        assertThat(runner.isCancelled()).isTrue();
        assertThat(summary.outcomes()).hasSize(3)
            .allSatisfy(outcome -> assertThat(outcome.status()).isEqualTo(ResourceOutcome.Status.CANCELLED));
        assertThat(summary.wasCancelled()).isTrue();
        assertThat(fetches).hasValue(1);
        assertThat(runner.awaitCompletion(Duration.ofSeconds(1))).isTrue();
    }

    @RepeatedTest(20)
    void cancel_whileWorkersAreBeingDispatched_interruptsEveryFetchThatStarts() {
        // Given: every fetch blocks far longer than the timeout unless interrupted
        List<String> ids = new ArrayList<>();
        for (int i = 1; i <= 32; i++) {
            ids.add("i-" + i);
        }
        CountDownLatch firstFetch = new CountDownLatch(1);
        DriftRunner runner = runner(id -> {
            firstFetch.countDown();
            try {
                Thread.sleep(60_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchException(id, "interrupted");
            }
            return instance("t2.micro");
        }, 8);

        Thread canceller = new Thread(() -> {
            try {
                if (firstFetch.await(5, TimeUnit.SECONDS)) {
                    runner.cancel();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        canceller.start();

        // When
        RunSummary summary = assertTimeoutPreemptively(Duration.ofSeconds(10),
            () -> runner.run(ids, OPTIONS, ProgressListener.NONE));

        // Then
        assertThat(summary.outcomes()).hasSize(32)
            .allSatisfy(outcome -> assertThat(outcome.status()).isEqualTo(ResourceOutcome.Status.CANCELLED));
    }

    @Test
    void run_afterCancelledRun_checksResourcesAgain() {
        // Given
        DriftRunner runner = runner(id -> instance("t2.micro"), 2);
        runner.cancel();

        // When
        RunSummary summary = runner.run(List.of("i-1", "i-2"), OPTIONS, ProgressListener.NONE);

        // Then
        assertThat(runner.isCancelled()).isFalse();
        assertThat(summary.isSuccessful()).isTrue();
        assertThat(summary.outcomes())
            .allSatisfy(outcome -> assertThat(outcome.status()).isEqualTo(ResourceOutcome.Status.COMPLETED));
    }

    @Test
    void run_recordsCheckAndDriftMetrics() {
        DriftRunner runner = runner(id -> instance("t2.large"), 1);

        runner.run(List.of("i-1", "i-2"), OPTIONS, ProgressListener.NONE);

        assertThat(registry.get(DriftMetrics.DRIFT_CHECKS).counter().count()).isEqualTo(2.0);
        assertThat(registry.get(DriftMetrics.DRIFT_DETECTED).tag("attribute", "instance_type").counter().count())
            .isEqualTo(2.0);
    }

    @Test
    void run_noIds_throwsConfigurationError() {
        DriftRunner runner = runner(id -> instance("t2.micro"), 1);

        assertThatThrownBy(() -> runner.run(List.of(), OPTIONS, ProgressListener.NONE))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void constructor_nonPositiveConcurrency_throwsConfigurationError() {
        assertThatThrownBy(() -> runner(id -> instance("t2.micro"), 0))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("at least 1");
    }

    private DriftRunner runner(LiveResourceFetcher fetcher, int concurrency) {
        return new DriftRunner(fetcher, new MapResolver(declared), new DriftClassifier(), metrics, concurrency);
    }

    private static ConfigValue instance(String instanceType) {
        return ConfigNormalizer.normalize(Map.of("instance_type", instanceType));
    }

    private record MapResolver(Map<String, ConfigValue> entries) implements DeclarativeConfigResolver {

        @Override
        public ConfigValue resolve(String resourceId) {
            ConfigValue value = entries.get(resourceId);
            if (value == null) {
                throw new ResourceNotFoundException("aws_instance", resourceId, describe());
            }
            return value;
        }

        @Override
        public String describe() {
            return "in-memory definitions";
        }
    }
}
