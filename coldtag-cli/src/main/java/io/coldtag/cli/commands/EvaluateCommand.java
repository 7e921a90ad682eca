package io.coldtag.cli.commands;

import io.coldtag.cli.exception.InputFileException;
import io.coldtag.cli.ui.AnsiStyles;
import io.coldtag.core.ColdtagConfig;
import io.coldtag.core.ColdtagEnvironment;
import io.coldtag.core.ColdtagFactory;
import io.coldtag.core.function.FunctionConfig;
import io.coldtag.core.reading.InMemoryReadingStore;
import io.coldtag.core.reading.Reading;
import io.coldtag.core.result.FunctionResult;
import io.coldtag.core.session.EvaluationSession;
import io.coldtag.core.tag.InMemoryTagRepository;
import io.coldtag.core.tag.Tag;
import io.coldtag.core.tag.TagRepository;
import io.coldtag.serialization.ColdtagSerializer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Evaluates the function stored on one tag of a JSON roster.
///
/// Loads the roster and the task's readings into in-memory stores, runs the tag's function
/// through an {@link EvaluationSession} and prints status, message and detail log. With
/// `--apply` the updated roster, carrying the new value and run snapshot, is written out.
///
/// ### Usage
/// ```bash
/// coldtag evaluate --tags roster.json --readings readings.json --task T-1 avgTemp-tag
/// coldtag evaluate --tags roster.json --task T-1 --apply out.json hot-spot
/// ```
///
/// ### Exit codes
/// - `0` the function succeeded
/// - `1` the function failed with a classified error
/// - `2` an input file could not be read
@Command(
        name = "evaluate",
        description = "Evaluate the function of one tag",
        mixinStandardHelpOptions = true)
public class EvaluateCommand extends ColdtagCommand {

    private static final Logger logger = Logger.getLogger(EvaluateCommand.class.getName());

    @Parameters(index = "0", description = "Id of the tag whose function is evaluated")
    private String tagId;

    @Option(
            names = {"-t", "--tags"},
            required = true,
            description = "JSON roster: an array of tags")
    private Path tagsFile;

    @Option(
            names = {"-r", "--readings"},
            description = "JSON array of readings of the task")
    private Path readingsFile;

    @Option(
            names = "--task",
            description = "Task whose readings are queried")
    private String taskId;

    @Option(
            names = "--apply",
            description = "Write the updated roster to this file")
    private Path applyFile;

    @Override
    protected int execute() {
        AnsiStyles styles = styles();
        try {
            ColdtagConfig config = loadConfig();
            List<Tag> tags = ColdtagSerializer.readTags(readFile(tagsFile, "roster"));
            List<Reading> readings =
                    readingsFile != null
                            ? ColdtagSerializer.readReadings(
                                    readFile(readingsFile, "readings"), config.getZone())
                            : List.of();

            FunctionResult result = evaluate(config, tags, readings);
            return result.isSuccess() ? 0 : 1;
        } catch (InputFileException | IllegalArgumentException e) {
            System.err.println(styles.crossmark() + " " + e.getMessage());
            return EXIT_INPUT_ERROR;
        }
    }

    private FunctionResult evaluate(ColdtagConfig config, List<Tag> tags, List<Reading> readings)
            throws InputFileException {
        TagRepository repository = new InMemoryTagRepository(tags);
        InMemoryReadingStore store = new InMemoryReadingStore();
        if (taskId != null) {
            store.load(taskId, readings);
        }
        logger.fine("Loaded " + tags.size() + " tags and " + readings.size() + " readings");

        try (ColdtagEnvironment environment =
                ColdtagFactory.createEnvironment(config, repository, store)) {
            EvaluationSession session = environment.session(tagId, taskId);
            FunctionResult result = session.execute();
            print(result, repository);
            if (applyFile != null) {
                apply(tags, repository);
            }
            return result;
        }
    }

    private void print(FunctionResult result, TagRepository repository) {
        AnsiStyles styles = styles();
        String functionType =
                repository
                        .findById(tagId)
                        .map(Tag::getFunctionConfig)
                        .map(FunctionConfig::getFunctionType)
                        .orElse("-");

        System.out.println(
                (result.isSuccess() ? styles.checkmark() : styles.crossmark())
                        + " "
                        + styles.bold(tagId)
                        + " "
                        + styles.dim("(" + functionType + ")"));
        System.out.println(
                "  "
                        + styles.successOrError(result.getStatus().getId(), result.isSuccess())
                        + (result.getErrorCode() != null ? " " + result.getErrorCode() : ""));
        System.out.println("  " + result.getMessage());
        if (result.getDetail() != null && !result.getDetail().isEmpty()) {
            System.out.println(styles.separator());
            for (String line : result.getDetail().split("\n", -1)) {
                System.out.println("  " + styles.dim(line));
            }
        }
    }

    private void apply(List<Tag> original, TagRepository repository) throws InputFileException {
        List<Tag> updated = new ArrayList<>(original.size());
        for (Tag tag : original) {
            updated.add(repository.findById(tag.getId()).orElse(tag));
        }
        try {
            Files.writeString(applyFile, ColdtagSerializer.toJson(updated), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InputFileException("Cannot write roster file " + applyFile, e);
        }
        System.out.println("Roster written to " + applyFile);
    }
}
