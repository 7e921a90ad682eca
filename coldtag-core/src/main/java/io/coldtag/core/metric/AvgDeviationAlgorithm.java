package io.coldtag.core.metric;

import io.coldtag.core.exception.EvaluationException;
import io.coldtag.core.exception.ReadingStoreException;
import io.coldtag.core.function.FunctionSpec;
import io.coldtag.core.reading.Reading;
import io.coldtag.core.result.Decimals;
import io.coldtag.core.result.DetailLog;
import io.coldtag.core.result.FunctionResult;
import io.coldtag.core.tag.TagRoster;
import io.coldtag.core.window.DataWindow;
import io.coldtag.core.window.DataWindowResolver;
import io.coldtag.core.window.WindowQuery;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Width of a temperature band minus the mean of the per-device mean temperatures.
///
/// Each bound comes from its tag when one is referenced, otherwise from the literal or
/// configured fallback. Bounds are resolved before the store is queried.
public class AvgDeviationAlgorithm implements MetricAlgorithm<FunctionSpec.AvgDeviation> {

    @Override
    public Class<FunctionSpec.AvgDeviation> getSpecType() {
        return FunctionSpec.AvgDeviation.class;
    }

    @Override
    public FunctionResult evaluate(FunctionSpec.AvgDeviation spec, EvaluationContext context)
            throws EvaluationException, ReadingStoreException {
        DataWindowResolver resolver = context.getWindowResolver();
        TagRoster roster = context.getRoster();
        WindowQuery query = resolver.prepare(spec.window(), roster);
        double max = bound(spec.max(), roster, "最高温度");
        double min = bound(spec.min(), roster, "最低温度");

        DataWindow window = resolver.fetch(context.getTaskId(), query);
        List<Reading> readings = Samples.temperatures(window);
        Map<String, Double> means = Samples.deviceMeans(readings);
        double meanOfMeans = Samples.mean(new ArrayList<>(means.values()));
        double value = (max - min) - meanOfMeans;
        int decimals = spec.kind().getPrecision().orElse(1);

        List<String> lines = new ArrayList<>(means.size());
        for (Map.Entry<String, Double> entry : means.entrySet()) {
            lines.add(entry.getKey() + ": 平均温度 " + Decimals.fixed(entry.getValue(), 1));
        }
        DetailLog log =
                DetailLog.start(window.queryInfo())
                        .entry("最高温度", Decimals.display(max))
                        .entry("最低温度", Decimals.display(min))
                        .entry("设备数量", means.size())
                        .entry("平均温度的平均值", Decimals.fixed(meanOfMeans, 1))
                        .entry("平均偏差值", Decimals.display(Decimals.round(value, decimals)))
                        .preview("设备详情", lines, context.getConfig().getPreviewLimit());
        return context.getFormatter().number(value, decimals, log);
    }

    private static double bound(FunctionSpec.TempBound bound, TagRoster roster, String label)
            throws EvaluationException {
        if (!bound.fromTag()) {
            return bound.fallback();
        }
        return TagInputs.number(roster.require(bound.tagId(), label + "标签不存在"), label);
    }
}
