package com.repoforensics;

import ch.qos.logback.classic.Level;
import com.repoforensics.cli.HotspotsCommand;
import com.repoforensics.cli.ListCommand;
import com.repoforensics.cli.RankCommand;
import com.repoforensics.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for Repo Forensics.
 *
 * <p>Repo Forensics reads the output of repository mining tools (commit history, code-maat
 * style CSV exports, complexity reports) and ranks the contributors of a repository by a
 * weighted combination of activity, ownership and hotspot signals.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code rank} - Rank developers and write reports</li>
 *   <li>{@code hotspots} - Compute the hotspot table only</li>
 *   <li>{@code validate} - Validate a configuration file</li>
 *   <li>{@code list} - List available sources, generators, or renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Rank developers from a results directory
 * repo-forensics rank ./results/my-repo
 *
 * # Show a detailed breakdown of the top 5
 * repo-forensics rank ./results/my-repo --detailed 5
 *
 * # Emphasise hotspot work
 * repo-forensics rank ./results/my-repo --weight-hotspots 0.30 --weight-commits 0.05
 * }</pre>
 */
@Command(
    name = "repo-forensics",
    mixinStandardHelpOptions = true,
    version = "Repo Forensics 1.0.0-SNAPSHOT",
    description = "Developer ranking and hotspot analysis from repository mining results",
    subcommands = {
        RankCommand.class,
        HotspotsCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class RepoForensicsCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("Repo Forensics - Developer Ranking and Hotspot Analysis");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'repo-forensics --help' to see available commands");
        System.out.println("Use 'repo-forensics <command> --help' for command-specific help");
    }

    /**
     * Sets the Logback root level from the global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        RepoForensicsCLI cli = new RepoForensicsCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
