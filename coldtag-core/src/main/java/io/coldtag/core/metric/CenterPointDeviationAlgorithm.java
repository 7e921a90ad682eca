package io.coldtag.core.metric;

import io.coldtag.core.exception.EvaluationException;
import io.coldtag.core.exception.ReadingStoreException;
import io.coldtag.core.function.FunctionSpec;
import io.coldtag.core.normalize.Locations;
import io.coldtag.core.normalize.TagValues;
import io.coldtag.core.reading.Measure;
import io.coldtag.core.reading.Reading;
import io.coldtag.core.result.Decimals;
import io.coldtag.core.result.DetailLog;
import io.coldtag.core.result.ErrorCode;
import io.coldtag.core.result.FunctionResult;
import io.coldtag.core.tag.Tag;
import io.coldtag.core.window.DataWindow;
import io.coldtag.core.window.DataWindowResolver;
import io.coldtag.core.window.WindowQuery;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/// Deviation of the window's mean temperature from a center point's set temperature.
///
/// The set temperature is the single numeric value of the referenced center point tag.
/// A list value or a delimited string holding more than one value is rejected with
/// {@link ErrorCode#MULTIPLE_VALUES_NOT_ALLOWED}. The tag is checked before the store is queried.
public class CenterPointDeviationAlgorithm implements MetricAlgorithm<FunctionSpec.CenterPoint> {

    private static final String LABEL = "中心点布点";

    @Override
    public Class<FunctionSpec.CenterPoint> getSpecType() {
        return FunctionSpec.CenterPoint.class;
    }

    @Override
    public FunctionResult evaluate(FunctionSpec.CenterPoint spec, EvaluationContext context)
            throws EvaluationException, ReadingStoreException {
        DataWindowResolver resolver = context.getWindowResolver();
        WindowQuery query = resolver.prepare(spec.window(), context.getRoster());
        double setPoint =
                setPoint(context.getRoster().require(spec.centerPointTagId(), "中心点布点标签不存在"));

        DataWindow window = resolver.fetch(context.getTaskId(), query);
        List<Reading> readings = Samples.temperatures(window);
        double mean = Samples.mean(readings, Measure.TEMPERATURE);
        double deviation = Math.abs(setPoint - mean);
        int decimals = spec.kind().getPrecision().orElse(1);

        DetailLog log =
                DetailLog.start(window.queryInfo())
                        .entry("中心点温度设定值", Decimals.display(setPoint))
                        .entry("平均温度", Decimals.fixed(mean, 1))
                        .entry("偏差值", Decimals.display(Decimals.round(deviation, decimals)));
        return context.getFormatter().number(deviation, decimals, log);
    }

    /// Reads the single set temperature of a center point tag.
    static double setPoint(Tag tag) throws EvaluationException {
        Object value = tag.getValue();
        if (TagValues.isBlank(value)) {
            throw new EvaluationException(ErrorCode.INVALID_VALUE, LABEL + "标签值不能为空");
        }
        if (value instanceof Collection) {
            Collection<?> values = (Collection<?>) value;
            if (values.size() > 1) {
                throw new EvaluationException(
                        ErrorCode.MULTIPLE_VALUES_NOT_ALLOWED, "中心点布点标签只能有一个值，当前有多个值");
            }
            return TagInputs.number(values.iterator().next(), LABEL);
        }
        if (value instanceof CharSequence) {
            List<String> parts = new ArrayList<>();
            for (String part : Locations.DELIMITERS.split(value.toString())) {
                if (!part.trim().isEmpty()) {
                    parts.add(part.trim());
                }
            }
            if (parts.size() > 1) {
                throw new EvaluationException(
                        ErrorCode.MULTIPLE_VALUES_NOT_ALLOWED,
                        "中心点布点标签只能有一个值，当前有多个值（用 | 或逗号分隔）");
            }
            return TagInputs.number(parts.isEmpty() ? null : parts.get(0), LABEL);
        }
        return TagInputs.number(value, LABEL);
    }
}
