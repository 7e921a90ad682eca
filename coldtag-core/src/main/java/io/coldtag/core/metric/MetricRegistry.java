package io.coldtag.core.metric;

import io.coldtag.core.function.FunctionSpec;
import java.util.Optional;

/// Registry of metric algorithms keyed by the {@link FunctionSpec} subtype they handle.
///
/// {@snippet :
/// MetricAlgorithm<FunctionSpec.Scalar> algorithm =
///         registry.getAlgorithm(FunctionSpec.Scalar.class).orElseThrow();
/// registry.register(new MyScalarAlgorithm());
/// }
public interface MetricRegistry {

    /// Get the algorithm for a spec type.
    ///
    /// @param specType the spec class
    /// @param <S> the spec type
    /// @return the algorithm, or empty if none is registered
    <S extends FunctionSpec> Optional<MetricAlgorithm<S>> getAlgorithm(Class<S> specType);

    /// Get the algorithm for a spec instance. Convenience method that uses the spec's class.
    ///
    /// @param spec the spec
    /// @param <S> the spec type
    /// @return the algorithm, or empty if none is registered
    @SuppressWarnings("unchecked")
    default <S extends FunctionSpec> Optional<MetricAlgorithm<S>> getAlgorithmFor(S spec) {
        return getAlgorithm((Class<S>) spec.getClass());
    }

    /// Register an algorithm, replacing any algorithm for the same spec type. The spec type
    /// is taken from {@link MetricAlgorithm#getSpecType()}.
    ///
    /// @param algorithm the algorithm to register
    /// @param <S> the spec type
    <S extends FunctionSpec> void register(MetricAlgorithm<S> algorithm);

    boolean hasAlgorithm(Class<? extends FunctionSpec> specType);
}
