package io.coldtag.core;

import io.coldtag.core.metric.FunctionEvaluator;
import io.coldtag.core.metric.MetricRegistry;
import io.coldtag.core.reading.ReadingStore;
import io.coldtag.core.result.ErrorCode;
import io.coldtag.core.result.FunctionResult;
import io.coldtag.core.session.EvaluationSession;
import io.coldtag.core.tag.TagRepository;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Container holding the wired evaluation components.
///
/// It implements {@link AutoCloseable} so the worker pool used by
/// {@link #executeAll(String, List)} is shut down with it.
///
/// @implNote All fields are final and set at construction time. Safe for concurrent use as
/// long as the repository and store are.
///
/// @apiNote Create instances via {@link ColdtagFactory} rather than direct construction.
///
/// @see ColdtagFactory#createEnvironment(ColdtagConfig, TagRepository, ReadingStore)
public final class ColdtagEnvironment implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(ColdtagEnvironment.class.getName());

    private final ColdtagConfig config;
    private final MetricRegistry metricRegistry;
    private final FunctionEvaluator evaluator;
    private final TagRepository tagRepository;
    private final ReadingStore readingStore;
    private final ExecutorService executorService;
    private final Clock clock;

    /// Creates a new environment.
    ///
    /// @param config defaults table, not null
    /// @param metricRegistry algorithm registry, not null
    /// @param evaluator function evaluator, not null
    /// @param tagRepository tag storage, not null
    /// @param readingStore reading storage, not null
    /// @param executorService worker pool for batch evaluation, not null
    /// @param clock clock stamping run snapshots, not null
    public ColdtagEnvironment(
            ColdtagConfig config,
            MetricRegistry metricRegistry,
            FunctionEvaluator evaluator,
            TagRepository tagRepository,
            ReadingStore readingStore,
            ExecutorService executorService,
            Clock clock) {
        this.config = config;
        this.metricRegistry = metricRegistry;
        this.evaluator = evaluator;
        this.tagRepository = tagRepository;
        this.readingStore = readingStore;
        this.executorService = executorService;
        this.clock = clock;
    }

    public ColdtagConfig getConfig() {
        return config;
    }

    public MetricRegistry getMetricRegistry() {
        return metricRegistry;
    }

    public FunctionEvaluator getEvaluator() {
        return evaluator;
    }

    public TagRepository getTagRepository() {
        return tagRepository;
    }

    public ReadingStore getReadingStore() {
        return readingStore;
    }

    public ExecutorService getExecutorService() {
        return executorService;
    }

    /// Opens a session for one tag.
    ///
    /// @param tagId id of the tag to evaluate, not null
    /// @param taskId task whose readings are queried, may be null
    /// @return new session, never null
    public EvaluationSession session(String tagId, String taskId) {
        return new EvaluationSession(tagId, tagRepository, taskId, evaluator, clock);
    }

    /// Runs the stored function of every listed tag concurrently on the worker pool.
    ///
    /// Each tag is written back independently. A tag whose run could not complete is reported
    /// as {@link ErrorCode#INTERNAL_ERROR}.
    ///
    /// @param taskId task whose readings are queried, may be null
    /// @param tagIds tags to evaluate, not null
    /// @return results keyed by tag id in request order, never null
    public Map<String, FunctionResult> executeAll(String taskId, List<String> tagIds) {
        Map<String, Future<FunctionResult>> futures = new LinkedHashMap<>();
        for (String tagId : new LinkedHashSet<>(tagIds)) {
            EvaluationSession session = session(tagId, taskId);
            futures.put(tagId, executorService.submit(() -> session.execute()));
        }

        Map<String, FunctionResult> results = new LinkedHashMap<>();
        for (Map.Entry<String, Future<FunctionResult>> entry : futures.entrySet()) {
            results.put(entry.getKey(), await(entry.getKey(), entry.getValue()));
        }
        return results;
    }

    private static FunctionResult await(String tagId, Future<FunctionResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FunctionResult.error(ErrorCode.INTERNAL_ERROR, "计算被中断", null);
        } catch (ExecutionException e) {
            logger.log(Level.SEVERE, "Batch evaluation failed for tag " + tagId, e.getCause());
            return FunctionResult.error(
                    ErrorCode.INTERNAL_ERROR, "计算失败: " + e.getCause().getMessage(), null);
        }
    }

    /// Shuts down the worker pool.
    @Override
    public void close() {
        executorService.shutdown();
    }
}
