package com.terradrift.cli;

import com.terradrift.TerraDriftCLI;
import com.terradrift.core.cache.TtlCache;
import com.terradrift.core.compare.ComparisonOptions;
import com.terradrift.core.compare.DriftClassifier;
import com.terradrift.core.config.ConfigLoader;
import com.terradrift.core.config.TerraDriftConfig;
import com.terradrift.core.error.ConfigurationException;
import com.terradrift.core.error.DefinitionParseException;
import com.terradrift.core.error.DriftException;
import com.terradrift.core.metrics.DriftMetrics;
import com.terradrift.core.orchestration.DriftRunner;
import com.terradrift.core.orchestration.ProgressListener;
import com.terradrift.core.orchestration.ResourceOutcome;
import com.terradrift.core.orchestration.RunSummary;
import com.terradrift.core.renderer.ReportRenderer;
import com.terradrift.core.renderer.ReportRenderers;
import com.terradrift.core.source.CachingResourceFetcher;
import com.terradrift.core.source.DeclarativeConfigResolver;
import com.terradrift.core.source.LiveResourceFetcher;
import com.terradrift.core.source.RetryPolicy;
import com.terradrift.core.source.aws.Ec2InstanceFetcher;
import com.terradrift.core.source.terraform.DeclarativeSources;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import software.amazon.awssdk.services.ec2.Ec2Client;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Command to compare live EC2 instances with their Terraform declaration.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load {@code terradrift.yaml} and apply command-line overrides</li>
 *   <li>Pick the declarative source: a state file ({@code -s}) or {@code .tf} files ({@code -c})</li>
 *   <li>Check every instance on a bounded worker pool</li>
 *   <li>Render the reports to stdout in the chosen format</li>
 * </ol>
 *
 * <p>Progress and errors go to stderr so the report can be piped. Exit codes are listed in
 * {@link ExitCodes}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * terradrift drift -i i-0abc,i-0def -s terraform.tfstate
 * terradrift drift -i web-1 -c ./infra -a instance_type,tags -o yaml --fail-on-drift
 * }</pre>
 */
@Command(
    name = "drift",
    description = "Detect drift between live EC2 instances and Terraform",
    mixinStandardHelpOptions = true
)
public class DriftCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DriftCommand.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    @ParentCommand
    private TerraDriftCLI parent;

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"-i", "--instances"},
        description = "Instance IDs to check, comma-separated",
        split = ",",
        required = true
    )
    private List<String> instanceIds;

    @Option(names = {"-s", "--state"}, description = "Terraform state file")
    private Path statePath;

    @Option(names = {"-c", "--config"}, description = "Terraform .tf file or directory")
    private Path definitionPath;

    @Option(
        names = {"-a", "--attributes"},
        description = "Attributes to check, comma-separated (default: common EC2 attributes)",
        split = ","
    )
    private List<String> attributes;

    @Option(names = {"-n", "--concurrency"}, description = "Maximum concurrent checks (default: 5)")
    private Integer concurrency;

    @Option(names = {"-o", "--output"}, description = "Output format: text, json or yaml (default: text)")
    private String output;

    @Option(names = {"--region"}, description = "AWS region (default: SDK region chain)")
    private String region;

    @Option(names = {"--matching"}, description = "List matching: bipartite or greedy (default: bipartite)")
    private String matching;

    @Option(names = {"--settings"}, description = "Settings file (default: terradrift.yaml)")
    private Path settingsPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"--fail-on-drift"}, description = "Exit with code 3 if drift is detected")
    private boolean failOnDrift;

    private final Function<String, Ec2Client> clientFactory;

    public DriftCommand() {
        this(Ec2InstanceFetcher::createClient);
    }

    DriftCommand(Function<String, Ec2Client> clientFactory) {
        this.clientFactory = clientFactory;
    }

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            TerraDriftConfig config = ConfigLoader.load(settingsPath);
            ComparisonOptions options = CheckSettings.comparisonOptions(config, attributes, matching);
            DeclarativeConfigResolver resolver = DeclarativeSources.of(statePath, definitionPath, config.check().toLookup());
            ReportRenderer renderer = ReportRenderers.forFormat(output != null ? output : config.run().outputOrDefault());
            RetryPolicy retryPolicy = config.retry().toRetryPolicy();
            Duration cacheTtl = config.cache().ttl();

            List<String> ids = CheckSettings.trimmed(instanceIds);
            if (ids.isEmpty()) {
                throw new ConfigurationException("At least one instance ID is required");
            }
            int workers = concurrency != null ? concurrency : config.run().concurrencyOrDefault();
            if (workers < 1) {
                throw new ConfigurationException("Concurrency must be at least 1, got " + workers);
            }

            String effectiveRegion = region != null ? region : config.aws().region();
            log.info("Checking {} instance(s) against {} (region: {})", ids.size(), resolver.describe(),
                effectiveRegion != null ? effectiveRegion : "default");

            DriftMetrics metrics = new DriftMetrics(new SimpleMeterRegistry());
            RunSummary summary;
            try (Ec2Client client = clientFactory.apply(effectiveRegion)) {
                LiveResourceFetcher fetcher = liveFetcher(client, retryPolicy, cacheTtl, metrics);
                DriftRunner runner = new DriftRunner(fetcher, resolver, new DriftClassifier(), metrics, workers);
                summary = runWithShutdownHook(runner, ids, options, err);
            }

            out.print(renderer.renderAll(summary.reports()));
            out.flush();
            printFailures(summary, err);
            logMetrics(metrics);

            return exitCode(summary);

        } catch (DriftException e) {
            return reportRunError(e, err);
        } catch (Exception e) {
            log.error("Drift check failed", e);
            err.println("✗ Drift check failed: " + e.getMessage());
            return ExitCodes.FAILED;
        }
    }

    /**
     * Maps an error raised outside the per-resource checks to an exit code. Fatal kinds are
     * invocation errors.
     */
    private static int reportRunError(DriftException e, PrintWriter err) {
        if (e.isFatal()) {
            log.error("Invalid configuration: {}", e.getMessage());
            err.println("✗ " + e.getMessage());
            return ExitCodes.CONFIGURATION_ERROR;
        }
        log.error("Drift check failed", e);
        err.println("✗ " + failureMessage(e));
        return ExitCodes.FAILED;
    }

    private static String failureMessage(Throwable error) {
        if (error instanceof DriftException driftError) {
            return driftError.getKind().getDefaultMessage() + ": " + driftError.getMessage();
        }
        return error.getMessage();
    }

    private static LiveResourceFetcher liveFetcher(Ec2Client client, RetryPolicy retryPolicy, Duration ttl,
                                                   DriftMetrics metrics) {
        LiveResourceFetcher fetcher = new Ec2InstanceFetcher(client, retryPolicy, metrics);
        if (ttl.isZero()) {
            log.debug("Live result caching disabled");
            return fetcher;
        }
        return new CachingResourceFetcher(fetcher, new TtlCache<>(ttl));
    }

    /**
     * Runs the batch with a JVM shutdown hook that cancels it on SIGINT/SIGTERM.
     */
    private RunSummary runWithShutdownHook(DriftRunner runner, List<String> ids, ComparisonOptions options,
                                           PrintWriter err) {
        Thread hook = new Thread(() -> {
            runner.cancel();
            try {
                runner.awaitCompletion(SHUTDOWN_GRACE);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "terradrift-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return runner.run(ids, options, progressListener(err));
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM shutdown in progress; hook left registered");
            }
        }
    }

    private ProgressListener progressListener(PrintWriter err) {
        if (parent != null && parent.isQuiet()) {
            return ProgressListener.NONE;
        }
        return (outcome, completed, total) -> {
            synchronized (err) {
                err.println("[" + completed + "/" + total + "] " + outcome.resourceId() + ": " + describe(outcome));
                err.flush();
            }
        };
    }

    private static String describe(ResourceOutcome outcome) {
        return switch (outcome.status()) {
            case COMPLETED -> outcome.hasDrift()
                ? outcome.report().driftCount() + " drifted attribute(s)"
                : "no drift";
            case FAILED -> "failed";
            case CANCELLED -> "cancelled";
        };
    }

    private static void printFailures(RunSummary summary, PrintWriter err) {
        for (ResourceOutcome outcome : summary.outcomes()) {
            if (outcome.status() == ResourceOutcome.Status.FAILED) {
                err.println("✗ " + outcome.resourceId() + ": " + failureMessage(outcome.error()));
                if (outcome.error() instanceof DefinitionParseException parseError) {
                    log.error("Declarative source {} is unusable", parseError.getSource());
                }
            } else if (outcome.status() == ResourceOutcome.Status.CANCELLED) {
                err.println("✗ " + outcome.resourceId() + ": cancelled");
            }
        }
        err.flush();
    }

    private static void logMetrics(DriftMetrics metrics) {
        if (!log.isDebugEnabled()) {
            return;
        }
        log.debug("Metrics summary:");
        for (Meter meter : metrics.getRegistry().getMeters()) {
            StringBuilder line = new StringBuilder(meter.getId().getName());
            meter.getId().getTags().forEach(tag -> line.append(' ').append(tag.getKey()).append('=').append(tag.getValue()));
            for (Measurement measurement : meter.measure()) {
                line.append(' ').append(measurement.getStatistic().name().toLowerCase(Locale.ROOT)).append('=').append(measurement.getValue());
            }
            log.debug("  {}", line);
        }
    }

    private int exitCode(RunSummary summary) {
        if (!summary.isSuccessful()) {
            return ExitCodes.FAILED;
        }
        if (failOnDrift && summary.hasDrift()) {
            return ExitCodes.DRIFT_DETECTED;
        }
        return ExitCodes.OK;
    }
}
