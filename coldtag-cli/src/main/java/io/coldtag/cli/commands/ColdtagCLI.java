package io.coldtag.cli.commands;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/// Main entry point for the Coldtag CLI application.
///
/// Registers the subcommands:
/// - `evaluate` - evaluate the function of one tag against JSON roster and readings files
/// - `kinds` - list the function catalogue
///
/// @see EvaluateCommand
/// @see KindsCommand
@Command(
        name = "coldtag",
        description = "Cold-chain tag function evaluator",
        mixinStandardHelpOptions = true,
        version = "coldtag 1.0.0",
        subcommands = {EvaluateCommand.class, KindsCommand.class})
public class ColdtagCLI {

    public static void main(String[] args) {
        configureLogging();
        System.exit(new CommandLine(new ColdtagCLI()).execute(args));
    }

    private static void configureLogging() {
        try (InputStream in = ColdtagCLI.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Failed to load logging configuration: " + e.getMessage());
        }
    }
}
