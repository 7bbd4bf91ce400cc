package com.terradrift.cli;

import com.terradrift.TerraDriftCLI;
import com.terradrift.core.compare.ComparisonOptions;
import com.terradrift.core.compare.DriftClassifier;
import com.terradrift.core.config.ConfigLoader;
import com.terradrift.core.config.TerraDriftConfig;
import com.terradrift.core.error.ConfigurationException;
import com.terradrift.core.error.DriftException;
import com.terradrift.core.model.ConfigValue;
import com.terradrift.core.model.DriftReport;
import com.terradrift.core.renderer.ReportRenderer;
import com.terradrift.core.renderer.ReportRenderers;
import com.terradrift.core.source.terraform.StateFileResolver;
import com.terradrift.core.source.terraform.TerraformLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to preview drift between two Terraform state files without AWS access.
 *
 * <p>The target state plays the part of the live resource: the report shows what would
 * be reported as drift if the instance looked like the target.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * terradrift simulate -i i-0abc -s current.tfstate -t planned.tfstate
 * }</pre>
 */
@Command(
    name = "simulate",
    description = "Compare one instance between two Terraform state files",
    mixinStandardHelpOptions = true
)
public class SimulateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SimulateCommand.class);

    @ParentCommand
    private TerraDriftCLI parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-i", "--instance"}, description = "Instance ID to compare", required = true)
    private String instanceId;

    @Option(names = {"-s", "--state"}, description = "Current Terraform state file", required = true)
    private Path statePath;

    @Option(names = {"-t", "--target-state"}, description = "Target Terraform state file", required = true)
    private Path targetStatePath;

    @Option(
        names = {"-a", "--attributes"},
        description = "Attributes to check, comma-separated (default: common EC2 attributes)",
        split = ","
    )
    private List<String> attributes;

    @Option(names = {"-o", "--output"}, description = "Output format: text, json or yaml (default: text)")
    private String output;

    @Option(names = {"--matching"}, description = "List matching: bipartite or greedy (default: bipartite)")
    private String matching;

    @Option(names = {"--settings"}, description = "Settings file (default: terradrift.yaml)")
    private Path settingsPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"--fail-on-drift"}, description = "Exit with code 3 if drift is detected")
    private boolean failOnDrift;

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
            ReportRenderer renderer = ReportRenderers.forFormat(output != null ? output : config.run().outputOrDefault());
            if (instanceId.isBlank()) {
                throw new ConfigurationException("Instance ID must not be blank");
            }
            String id = instanceId.trim();

            TerraformLookup lookup = config.check().toLookup();
            log.info("Simulating drift for {} between {} and {}", id, statePath, targetStatePath);
            ConfigValue declared = new StateFileResolver(statePath, lookup).resolve(id);
            ConfigValue target = new StateFileResolver(targetStatePath, lookup).resolve(id);

            DriftReport report = new DriftClassifier().classify(id, target, declared, options);
            out.print(renderer.render(report));
            out.flush();

            return failOnDrift && report.hasDrift() ? ExitCodes.DRIFT_DETECTED : ExitCodes.OK;

        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            err.println("✗ " + e.getMessage());
            return ExitCodes.CONFIGURATION_ERROR;
        } catch (DriftException e) {
            log.error("Simulation failed: {}", e.getMessage());
            err.println("✗ Simulation failed: " + e.getMessage());
            return ExitCodes.FAILED;
        }
    }
}
