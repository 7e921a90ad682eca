package io.coldtag.core.session;

import io.coldtag.core.function.FunctionConfig;
import io.coldtag.core.metric.FunctionEvaluator;
import io.coldtag.core.normalize.Locations;
import io.coldtag.core.result.ErrorCode;
import io.coldtag.core.result.FunctionResult;
import io.coldtag.core.tag.Tag;
import io.coldtag.core.tag.TagRepository;
import io.coldtag.core.tag.TagType;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Objects;
import java.util.logging.Logger;

/// Runs the function attached to one tag and writes the outcome back onto it.
///
/// Every run reads a fresh {@link io.coldtag.core.tag.TagRoster} snapshot from the repository,
/// evaluates it through the {@link FunctionEvaluator} and then saves the evaluated tag:
///
/// - on success the tag value is replaced; location tags store the normalized device list,
///   every other type the value as returned
/// - on any outcome the config receives a {@link RunSnapshot}
///
/// No other tag is modified. Failures are reported through {@link #getStatus()} and
/// {@link #getMessage()}; nothing is thrown.
///
/// @implNote Runs are synchronous. One session may be shared across threads; status fields are
/// volatile, but concurrent runs of the same session race on the write-back.
public class EvaluationSession {

    private static final Logger logger = Logger.getLogger(EvaluationSession.class.getName());

    private static final String NOT_CONFIGURED = "请先配置函数方法";

    private final String tagId;
    private final TagRepository repository;
    private final String taskId;
    private final FunctionEvaluator evaluator;
    private final Clock clock;

    private volatile SessionStatus status = SessionStatus.IDLE;
    private volatile String message = "";
    private volatile FunctionResult lastResult;

    /// Creates a session for one tag.
    ///
    /// @param tagId id of the tag to evaluate, not null
    /// @param repository tag storage, not null
    /// @param taskId task whose readings are queried, may be null
    /// @param evaluator the evaluator, not null
    /// @param clock clock stamping run snapshots, not null
    public EvaluationSession(
            String tagId,
            TagRepository repository,
            String taskId,
            FunctionEvaluator evaluator,
            Clock clock) {
        this.tagId = Objects.requireNonNull(tagId, "tagId must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.taskId = taskId;
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Runs the tag's stored function config.
    ///
    /// @return the result, never null
    public FunctionResult execute() {
        FunctionConfig stored =
                repository.findById(tagId).map(Tag::getFunctionConfig).orElse(null);
        return execute(stored);
    }

    /// Runs a function config and stores it, with its run snapshot, on the tag.
    ///
    /// @param config the config to run, may be null (fails with {@link ErrorCode#MISSING_INPUT})
    /// @return the result, never null
    public FunctionResult execute(FunctionConfig config) {
        status = SessionStatus.RUNNING;
        message = "";

        Tag tag = repository.findById(tagId).orElse(null);
        if (tag == null) {
            logger.warning("Tag not found: " + tagId);
            return finish(FunctionResult.error(ErrorCode.TAG_NOT_FOUND, "标签不存在: " + tagId, null));
        }

        FunctionResult result;
        FunctionConfig base;
        if (config == null) {
            result = FunctionResult.error(ErrorCode.MISSING_INPUT, NOT_CONFIGURED, null);
            base = FunctionConfig.builder().build();
        } else {
            result = evaluator.evaluate(config, taskId, repository.snapshot());
            base = config;
        }

        FunctionConfig updated = RunSnapshot.of(result, clock.instant()).applyTo(base);
        Tag.Builder write = tag.toBuilder().functionConfig(updated);
        if (result.isSuccess()) {
            write.value(coerce(tag.getType(), result.getValue()));
        }
        repository.save(write.build());
        return finish(result);
    }

    /// Evaluates a config without touching the repository or the session state.
    ///
    /// @param config the config to evaluate, may be null
    /// @return the result, never null
    public FunctionResult evaluate(FunctionConfig config) {
        if (config == null) {
            return FunctionResult.error(ErrorCode.MISSING_INPUT, NOT_CONFIGURED, null);
        }
        return evaluator.evaluate(config, taskId, repository.snapshot());
    }

    public String getTagId() {
        return tagId;
    }

    public SessionStatus getStatus() {
        return status;
    }

    /// Returns the message of the last run.
    ///
    /// @return the message, empty while idle or running
    public String getMessage() {
        return message;
    }

    /// Returns the result of the last run.
    ///
    /// @return the result, null before the first run finished
    public FunctionResult getLastResult() {
        return lastResult;
    }

    private FunctionResult finish(FunctionResult result) {
        lastResult = result;
        message = result.getMessage();
        status = result.isSuccess() ? SessionStatus.SUCCESS : SessionStatus.ERROR;
        logger.info("Tag " + tagId + " finished with " + status + ": " + message);
        return result;
    }

    private static Object coerce(TagType type, Object value) {
        if (type == TagType.LOCATION) {
            return new ArrayList<>(Locations.toLocationSet(value));
        }
        return value;
    }
}
