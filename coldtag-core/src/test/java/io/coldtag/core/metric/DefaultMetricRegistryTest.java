package io.coldtag.core.metric;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.coldtag.core.function.FunctionKind;
import io.coldtag.core.function.FunctionSpec;
import io.coldtag.core.function.WindowRef;
import io.coldtag.core.result.DetailLog;
import io.coldtag.core.result.FunctionResult;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DefaultMetricRegistryTest {

    private DefaultMetricRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultMetricRegistry();
    }

    @Test
    void shouldRegisterEveryBuiltInSpecType() {
        for (Class<?> type : FunctionSpec.class.getPermittedSubclasses()) {
            @SuppressWarnings("unchecked")
            Class<? extends FunctionSpec> specType = (Class<? extends FunctionSpec>) type;
            assertThat(registry.hasAlgorithm(specType)).as(type.getSimpleName()).isTrue();
        }
    }

    @Test
    void shouldFindAlgorithmForSpecInstance() {
        FunctionSpec.Scalar spec =
                new FunctionSpec.Scalar(
                        FunctionKind.MAX_TEMP, new WindowRef(List.of("loc"), "start", "end"));

        assertThat(registry.getAlgorithmFor(spec))
                .hasValueSatisfying(
                        algorithm -> assertThat(algorithm).isInstanceOf(ScalarAggregateAlgorithm.class));
    }

    @Test
    void shouldReplaceAlgorithmForSameSpecType() {
        MetricAlgorithm<FunctionSpec.Power> replacement =
                new MetricAlgorithm<>() {
                    @Override
                    public Class<FunctionSpec.Power> getSpecType() {
                        return FunctionSpec.Power.class;
                    }

                    @Override
                    public FunctionResult evaluate(FunctionSpec.Power spec, EvaluationContext context) {
                        return context.getFormatter().number(1, 2, DetailLog.start());
                    }
                };

        registry.register(replacement);

        assertThat(registry.getAlgorithm(FunctionSpec.Power.class)).containsSame(replacement);
    }

    @Test
    void shouldRejectNullAlgorithm() {
        assertThatThrownBy(() -> registry.register(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
