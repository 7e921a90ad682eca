package io.coldtag.core.metric;

import io.coldtag.core.exception.EvaluationException;
import io.coldtag.core.exception.ReadingStoreException;
import io.coldtag.core.function.FunctionSpec;
import io.coldtag.core.result.FunctionResult;

/// Strategy interface computing the metrics of one {@link FunctionSpec} subtype.
///
/// Implementations are stateless and thread-safe; everything an evaluation needs arrives
/// through the spec and the {@link EvaluationContext}. Classified failures are thrown as
/// {@link EvaluationException} and turned into error results by {@link FunctionEvaluator}.
///
/// ### Example implementation
/// {@snippet :
/// public class MyAlgorithm implements MetricAlgorithm<FunctionSpec.Scalar> {
///     public Class<FunctionSpec.Scalar> getSpecType() {
///         return FunctionSpec.Scalar.class;
///     }
///     public FunctionResult evaluate(FunctionSpec.Scalar spec, EvaluationContext context) {
///         DataWindow window = context.getWindowResolver().fetch(...);
///         return context.getFormatter().number(value, 1, log);
///     }
/// }
/// }
///
/// @param <S> the spec type this algorithm handles
public interface MetricAlgorithm<S extends FunctionSpec> {

    /// Returns the spec type this algorithm handles. Used for registry lookups.
    ///
    /// @return the spec class, never null
    Class<S> getSpecType();

    /// Computes the metric described by a spec.
    ///
    /// @param spec the typed function description, not null
    /// @param context evaluation inputs and services, not null
    /// @return the result, never null
    /// @throws EvaluationException for classified failures (missing input, no data, ...)
    /// @throws ReadingStoreException if the reading store fails
    FunctionResult evaluate(S spec, EvaluationContext context)
            throws EvaluationException, ReadingStoreException;
}
