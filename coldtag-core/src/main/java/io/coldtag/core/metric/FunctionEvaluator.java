package io.coldtag.core.metric;

import io.coldtag.core.ColdtagConfig;
import io.coldtag.core.exception.EvaluationException;
import io.coldtag.core.exception.ReadingStoreException;
import io.coldtag.core.function.FunctionConfig;
import io.coldtag.core.function.FunctionKind;
import io.coldtag.core.function.FunctionSpec;
import io.coldtag.core.function.FunctionSpecBinder;
import io.coldtag.core.result.ErrorCode;
import io.coldtag.core.result.FunctionResult;
import io.coldtag.core.result.ResultFormatter;
import io.coldtag.core.tag.TagRoster;
import io.coldtag.core.window.DataWindowResolver;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Evaluates one function config against a tag snapshot.
///
/// This is the single point where failures become results: every {@link EvaluationException}
/// is turned into an error result carrying its code, message and detail, a store failure into
/// {@link ErrorCode#DATA_SOURCE_FAILURE} and any unexpected runtime failure into
/// {@link ErrorCode#INTERNAL_ERROR}. {@link #evaluate} therefore never throws.
///
/// ### Flow
/// 1. resolve the {@link FunctionKind} from the config's type identifier
/// 2. bind the config to its {@link FunctionSpec}, checking required inputs
/// 3. dispatch the spec to the registered {@link MetricAlgorithm}
///
/// @implNote Stateless and thread-safe as long as the registry and store are.
///
/// @see io.coldtag.core.session.EvaluationSession for write-back of results
public class FunctionEvaluator {

    private static final Logger logger = Logger.getLogger(FunctionEvaluator.class.getName());

    private final MetricRegistry registry;
    private final FunctionSpecBinder binder;
    private final ColdtagConfig config;
    private final DataWindowResolver windowResolver;
    private final ResultFormatter formatter;

    /// Creates an evaluator.
    ///
    /// @param registry algorithm registry, not null
    /// @param config defaults table, not null
    /// @param windowResolver window resolution and reading access, not null
    public FunctionEvaluator(
            MetricRegistry registry, ColdtagConfig config, DataWindowResolver windowResolver) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.windowResolver =
                Objects.requireNonNull(windowResolver, "windowResolver must not be null");
        this.binder = new FunctionSpecBinder(config);
        this.formatter = new ResultFormatter();
    }

    /// Evaluates a function config.
    ///
    /// @param functionConfig the stored config, may be null
    /// @param taskId the task whose readings are queried, may be null
    /// @param roster the tag snapshot, not null
    /// @return success or error result, never null
    public FunctionResult evaluate(FunctionConfig functionConfig, String taskId, TagRoster roster) {
        Objects.requireNonNull(roster, "roster must not be null");
        if (functionConfig == null) {
            return formatter.error(ErrorCode.MISSING_INPUT, "请先配置函数方法", null);
        }

        Optional<FunctionKind> kind = functionConfig.getKind();
        if (kind.isEmpty()) {
            logger.warning("Unknown function type: " + functionConfig.getFunctionType());
            return formatter.error(ErrorCode.UNKNOWN_FUNCTION_KIND, "未知函数类型", null);
        }

        logger.info("Evaluating " + kind.get().getId() + " for task " + taskId);
        FunctionResult result;
        try {
            FunctionSpec spec = binder.bind(kind.get(), functionConfig, taskId);
            EvaluationContext context =
                    EvaluationContext.builder()
                            .taskId(taskId)
                            .roster(roster)
                            .config(config)
                            .windowResolver(windowResolver)
                            .formatter(formatter)
                            .build();
            result = dispatch(spec, context);
        } catch (EvaluationException e) {
            result = formatter.error(e);
        } catch (ReadingStoreException e) {
            logger.log(Level.WARNING, "Reading store failed for task " + taskId, e);
            result = formatter.error(ErrorCode.DATA_SOURCE_FAILURE, "数据查询失败: " + e.getMessage(), null);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Evaluation of " + kind.get().getId() + " failed", e);
            result = formatter.error(ErrorCode.INTERNAL_ERROR, "计算失败: " + e.getMessage(), null);
        }

        logger.info(
                "Evaluated "
                        + kind.get().getId()
                        + ": "
                        + result.getStatus()
                        + (result.getErrorCode() != null ? " " + result.getErrorCode() : ""));
        return result;
    }

    private <S extends FunctionSpec> FunctionResult dispatch(S spec, EvaluationContext context)
            throws EvaluationException, ReadingStoreException {
        MetricAlgorithm<S> algorithm =
                registry.getAlgorithmFor(spec)
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "No algorithm registered for "
                                                        + spec.getClass().getSimpleName()));
        return algorithm.evaluate(spec, context);
    }
}
