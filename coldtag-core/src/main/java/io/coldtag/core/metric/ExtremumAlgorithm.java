package io.coldtag.core.metric;

import io.coldtag.core.exception.EvaluationException;
import io.coldtag.core.exception.ReadingStoreException;
import io.coldtag.core.function.FunctionSpec;
import io.coldtag.core.function.OutputCategory;
import io.coldtag.core.normalize.Locations;
import io.coldtag.core.normalize.TimeFormats;
import io.coldtag.core.reading.Measure;
import io.coldtag.core.reading.Reading;
import io.coldtag.core.result.Decimals;
import io.coldtag.core.result.DetailLog;
import io.coldtag.core.result.ErrorCode;
import io.coldtag.core.result.FunctionResult;
import io.coldtag.core.window.DataWindow;
import io.coldtag.core.window.DataWindowResolver;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Device or time of the extreme temperature.
///
/// The extremum is taken over the finite temperatures of the queried devices. Readings tied
/// with it are matched by exact `double` equality. `maxTempLocation`/`minTempLocation` report
/// the tied devices, `tempMaxTime`/`tempMinTime` the earliest tied reading's time.
public class ExtremumAlgorithm implements MetricAlgorithm<FunctionSpec.Extremum> {

    @Override
    public Class<FunctionSpec.Extremum> getSpecType() {
        return FunctionSpec.Extremum.class;
    }

    @Override
    public FunctionResult evaluate(FunctionSpec.Extremum spec, EvaluationContext context)
            throws EvaluationException, ReadingStoreException {
        DataWindowResolver resolver = context.getWindowResolver();
        DataWindow window =
                resolver.fetch(
                        context.getTaskId(), resolver.prepare(spec.window(), context.getRoster()));

        List<Reading> readings = Samples.temperatures(window);
        double target =
                spec.isMax()
                        ? Samples.max(readings, Measure.TEMPERATURE)
                        : Samples.min(readings, Measure.TEMPERATURE);
        List<Reading> tied = new ArrayList<>();
        for (Reading reading : readings) {
            if (reading.temperature() == target) {
                tied.add(reading);
            }
        }

        String label = spec.isMax() ? "最高温度" : "最低温度";
        DetailLog log = DetailLog.start(window.queryInfo());
        if (tied.isEmpty()) {
            log.entry("目标温度", Decimals.display(target));
            throw new EvaluationException(
                    ErrorCode.NO_MATCH, "未找到对应温度的测点", log.render());
        }

        if (spec.kind().getCategory() == OutputCategory.LOCATION) {
            Set<String> devices = new LinkedHashSet<>();
            for (Reading reading : tied) {
                devices.add(reading.deviceId());
            }
            String output = String.join(Locations.JOINER, devices);
            log.entry(label, Decimals.display(target)).entry("测点", output);
            return context.getFormatter().text(output, log);
        }

        String time = TimeFormats.minuteKey(tied.get(0).timestamp());
        log.entry(label, Decimals.fixed(target, 1))
                .entry("对应时间", time)
                .entry("匹配数据点数量", tied.size());
        return context.getFormatter().text(time, log);
    }
}
