package io.coldtag.core;

import io.coldtag.core.metric.DefaultMetricRegistry;
import io.coldtag.core.metric.FunctionEvaluator;
import io.coldtag.core.metric.MetricRegistry;
import io.coldtag.core.reading.InMemoryReadingStore;
import io.coldtag.core.reading.ReadingStore;
import io.coldtag.core.tag.InMemoryTagRepository;
import io.coldtag.core.tag.TagRepository;
import io.coldtag.core.window.DataWindowResolver;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/// Factory for creating and wiring {@link ColdtagEnvironment} instances.
///
/// {@snippet :
/// try (ColdtagEnvironment env = ColdtagFactory.createEnvironment(config, tags, readings)) {
///     FunctionResult result = env.session("maxTempTag", "task-1").execute();
/// }
/// }
///
/// @see ColdtagEnvironment
/// @see ColdtagConfig
public final class ColdtagFactory {

    private ColdtagFactory() {}

    /// Creates an environment with default configuration and empty in-memory stores.
    ///
    /// @return a fully-configured environment, never null
    public static ColdtagEnvironment createEnvironment() {
        return createEnvironment(
                ColdtagConfig.defaults(), new InMemoryTagRepository(), new InMemoryReadingStore());
    }

    /// Creates an environment over the given stores.
    ///
    /// @apiNote **Side effects**: creates a fixed thread pool of `config.getPoolSize()` threads.
    ///
    /// @param config defaults table, not null
    /// @param tagRepository tag storage, not null
    /// @param readingStore reading storage, not null
    /// @return a fully-configured environment, never null
    public static ColdtagEnvironment createEnvironment(
            ColdtagConfig config, TagRepository tagRepository, ReadingStore readingStore) {
        return createEnvironment(
                config,
                new DefaultMetricRegistry(),
                tagRepository,
                readingStore,
                Executors.newFixedThreadPool(config.getPoolSize()),
                Clock.systemUTC());
    }

    /// Creates an environment with explicit collaborators.
    ///
    /// Useful for tests with a fixed clock or a custom registry.
    ///
    /// @param config defaults table, not null
    /// @param metricRegistry algorithm registry, not null
    /// @param tagRepository tag storage, not null
    /// @param readingStore reading storage, not null
    /// @param executorService worker pool, not null
    /// @param clock clock stamping run snapshots, not null
    /// @return a fully-configured environment, never null
    public static ColdtagEnvironment createEnvironment(
            ColdtagConfig config,
            MetricRegistry metricRegistry,
            TagRepository tagRepository,
            ReadingStore readingStore,
            ExecutorService executorService,
            Clock clock) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(metricRegistry, "metricRegistry must not be null");
        Objects.requireNonNull(tagRepository, "tagRepository must not be null");
        Objects.requireNonNull(readingStore, "readingStore must not be null");
        Objects.requireNonNull(executorService, "executorService must not be null");
        Objects.requireNonNull(clock, "clock must not be null");

        DataWindowResolver resolver = new DataWindowResolver(readingStore, config.getZone());
        FunctionEvaluator evaluator = new FunctionEvaluator(metricRegistry, config, resolver);
        return new ColdtagEnvironment(
                config,
                metricRegistry,
                evaluator,
                tagRepository,
                readingStore,
                executorService,
                clock);
    }
}
