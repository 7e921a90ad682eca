package io.coldtag.core.metric;

import io.coldtag.core.exception.EvaluationException;
import io.coldtag.core.exception.ReadingStoreException;
import io.coldtag.core.function.FunctionKind;
import io.coldtag.core.function.FunctionSpec;
import io.coldtag.core.reading.Measure;
import io.coldtag.core.reading.Reading;
import io.coldtag.core.result.Decimals;
import io.coldtag.core.result.DetailLog;
import io.coldtag.core.result.FunctionResult;
import io.coldtag.core.window.DataWindow;
import io.coldtag.core.window.DataWindowResolver;
import java.util.List;

/// Maximum, minimum and mean of temperature or humidity over the queried devices.
///
/// Handles `maxTemp`, `minTemp`, `avgTemp`, `maxHumidity`, `minHumidity` and `avgHumidity`.
public class ScalarAggregateAlgorithm implements MetricAlgorithm<FunctionSpec.Scalar> {

    @Override
    public Class<FunctionSpec.Scalar> getSpecType() {
        return FunctionSpec.Scalar.class;
    }

    @Override
    public FunctionResult evaluate(FunctionSpec.Scalar spec, EvaluationContext context)
            throws EvaluationException, ReadingStoreException {
        DataWindowResolver resolver = context.getWindowResolver();
        DataWindow window =
                resolver.fetch(
                        context.getTaskId(), resolver.prepare(spec.window(), context.getRoster()));

        FunctionKind kind = spec.kind();
        Measure measure = kind.getMeasure();
        List<Reading> readings = Samples.finite(window, measure, "没有可计算的数据");

        double value =
                switch (kind) {
                    case MAX_TEMP, MAX_HUMIDITY -> Samples.max(readings, measure);
                    case MIN_TEMP, MIN_HUMIDITY -> Samples.min(readings, measure);
                    default -> Samples.mean(readings, measure);
                };

        int decimals = kind.getPrecision().orElse(1);
        DetailLog log =
                DetailLog.start(window.queryInfo())
                        .entry("结果", Decimals.display(Decimals.round(value, decimals)));
        return context.getFormatter().number(value, decimals, log);
    }
}
