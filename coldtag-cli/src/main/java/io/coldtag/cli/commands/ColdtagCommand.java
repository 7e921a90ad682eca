package io.coldtag.cli.commands;

import io.coldtag.cli.exception.InputFileException;
import io.coldtag.cli.ui.AnsiStyles;
import io.coldtag.core.ColdtagConfig;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.concurrent.Callable;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import picocli.CommandLine.Option;

/// Base class for Coldtag CLI commands.
///
/// Owns the options every command shares and the {@link #call()} / {@link #execute()}
/// contract. Subclasses return their process exit code from {@link #execute()}.
///
/// ### Configuration resolution
/// 1. CLI option `--config <file>`
/// 2. `coldtag.properties` on the classpath
/// 3. built-in defaults
///
/// @see EvaluateCommand
/// @see KindsCommand
public abstract class ColdtagCommand implements Callable<Integer> {

    /// Exit code for unreadable or malformed input files.
    public static final int EXIT_INPUT_ERROR = 2;

    private static final String CLASSPATH_CONFIG = "/coldtag.properties";

    // Strong reference so the level set by --verbose is not lost to garbage collection.
    private static final Logger rootLogger = Logger.getLogger("io.coldtag");

    @Option(
            names = "--no-color",
            description = "Disable ANSI colors in the output")
    protected boolean noColor;

    @Option(
            names = {"-v", "--verbose"},
            description = "Log evaluation steps to stderr")
    protected boolean verbose;

    @Option(
            names = {"-c", "--config"},
            description = "Properties file overriding the coldtag.* defaults")
    protected Path configFile;

    @Override
    public final Integer call() {
        if (verbose) {
            enableVerboseLogging();
        }
        return execute();
    }

    /// Runs the command.
    ///
    /// @return the process exit code
    protected abstract int execute();

    /// Returns the output styles for this invocation.
    protected AnsiStyles styles() {
        return AnsiStyles.of(!noColor);
    }

    /// Loads the engine configuration.
    ///
    /// @return the configuration, never null
    /// @throws InputFileException if the config file cannot be read or holds invalid values
    protected ColdtagConfig loadConfig() throws InputFileException {
        Properties properties = new Properties();
        try {
            if (configFile != null) {
                try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
                    properties.load(reader);
                }
            } else {
                try (InputStream in = ColdtagCommand.class.getResourceAsStream(CLASSPATH_CONFIG)) {
                    if (in != null) {
                        properties.load(in);
                    }
                }
            }
            return ColdtagConfig.fromProperties(properties);
        } catch (IOException | IllegalArgumentException e) {
            throw new InputFileException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    /// Reads a UTF-8 input file.
    ///
    /// @param path the file, not null
    /// @param what name of the file in error messages, not null
    /// @return the file content, never null
    /// @throws InputFileException if the file cannot be read
    protected static String readFile(Path path, String what) throws InputFileException {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InputFileException("Cannot read " + what + " file " + path, e);
        }
    }

    private static void enableVerboseLogging() {
        rootLogger.setLevel(Level.FINE);
        Handler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        rootLogger.addHandler(handler);
        rootLogger.setUseParentHandlers(false);
    }
}
