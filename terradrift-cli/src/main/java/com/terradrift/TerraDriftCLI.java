package com.terradrift;

import ch.qos.logback.classic.Level;
import com.terradrift.cli.DriftCommand;
import com.terradrift.cli.SimulateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for TerraDrift.
 *
 * <p>TerraDrift compares live EC2 instances with their Terraform definitions and reports,
 * attribute by attribute, where they disagree.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code drift} - Compare live instances with a state file or {@code .tf} definitions</li>
 *   <li>{@code simulate} - Compare one instance between two state files, without AWS access</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Check two instances against a state file
 * terradrift drift -i i-0abc,i-0def -s terraform.tfstate
 *
 * # Check against .tf files, JSON output, verbose logging
 * terradrift -v drift -i web-1 -c ./infra -o json
 *
 * # Preview drift between two state snapshots
 * terradrift simulate -i i-0abc -s current.tfstate -t planned.tfstate
 * }</pre>
 */
@Command(
    name = "terradrift",
    mixinStandardHelpOptions = true,
    version = "TerraDrift 1.0.0-SNAPSHOT",
    description = "Detects configuration drift between live EC2 instances and Terraform",
    subcommands = {
        DriftCommand.class,
        SimulateCommand.class
    }
)
public class TerraDriftCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TerraDriftCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("TerraDrift - Configuration drift detection for EC2 and Terraform");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'terradrift --help' to see available commands");
        System.out.println("Use 'terradrift <command> --help' for command-specific help");
    }

    /**
     * Sets the root logger level from the global options. Subcommands call this before running.
     */
    public void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new TerraDriftCLI()).execute(args);
        System.exit(exitCode);
    }
}
