package io.coldtag.core.metric;

import io.coldtag.core.function.FunctionSpec;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Default implementation of {@link MetricRegistry} with every built-in algorithm registered.
///
/// All built-in algorithms are stateless, so one registry can serve concurrent evaluations.
public class DefaultMetricRegistry implements MetricRegistry {

    private final Map<Class<? extends FunctionSpec>, MetricAlgorithm<?>> registry =
            new ConcurrentHashMap<>();

    /// Creates a registry with all built-in algorithms pre-registered.
    public DefaultMetricRegistry() {
        register(new ScalarAggregateAlgorithm());
        register(new ThresholdAlgorithm());
        register(new ExtremumAlgorithm());
        register(new MinuteBucketAlgorithm());
        register(new CenterPointDeviationAlgorithm());
        register(new AvgDeviationAlgorithm());
        register(new PowerAlgorithm());
        register(new DeviceTimePointAlgorithm());
        register(new CoolingRateAlgorithm());
    }

    @Override
    @SuppressWarnings("unchecked")
    public <S extends FunctionSpec> Optional<MetricAlgorithm<S>> getAlgorithm(Class<S> specType) {
        return Optional.ofNullable((MetricAlgorithm<S>) registry.get(specType));
    }

    @Override
    public <S extends FunctionSpec> void register(MetricAlgorithm<S> algorithm) {
        if (algorithm == null) {
            throw new IllegalArgumentException("algorithm cannot be null");
        }
        registry.put(algorithm.getSpecType(), algorithm);
    }

    @Override
    public boolean hasAlgorithm(Class<? extends FunctionSpec> specType) {
        return registry.containsKey(specType);
    }
}
