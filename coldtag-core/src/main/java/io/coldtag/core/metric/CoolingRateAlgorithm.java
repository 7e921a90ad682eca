package io.coldtag.core.metric;

import io.coldtag.core.exception.EvaluationException;
import io.coldtag.core.exception.ReadingStoreException;
import io.coldtag.core.function.FunctionSpec;
import io.coldtag.core.reading.Reading;
import io.coldtag.core.result.Decimals;
import io.coldtag.core.result.DetailLog;
import io.coldtag.core.result.ErrorCode;
import io.coldtag.core.result.FunctionResult;
import io.coldtag.core.window.DataWindow;
import io.coldtag.core.window.DataWindowResolver;
import io.coldtag.core.window.Interval;
import java.util.ArrayList;
import java.util.List;

/// Mean cooling rate between the first and last minute of the window.
///
/// Each endpoint temperature is the mean of the per-device means within that endpoint's
/// minute, rounded to one decimal. Both minutes are cut from the readings already fetched for
/// the window, so nothing outside `[start, end]` takes part. The rate is `|start - end| / wholeMinutes`, in °C per minute.
public class CoolingRateAlgorithm implements MetricAlgorithm<FunctionSpec.CoolingRate> {

    @Override
    public Class<FunctionSpec.CoolingRate> getSpecType() {
        return FunctionSpec.CoolingRate.class;
    }

    @Override
    public FunctionResult evaluate(FunctionSpec.CoolingRate spec, EvaluationContext context)
            throws EvaluationException, ReadingStoreException {
        DataWindowResolver resolver = context.getWindowResolver();
        DataWindow window =
                resolver.fetch(
                        context.getTaskId(), resolver.prepare(spec.window(), context.getRoster()));
        if (window.matched().isEmpty()) {
            throw new EvaluationException(
                    ErrorCode.NO_DATA, Samples.NO_MATCHED_DATA, window.queryInfo());
        }

        Interval interval = window.interval();
        long minutes = interval.wholeMinutes();
        if (minutes <= 0) {
            throw new EvaluationException(
                    ErrorCode.INVALID_INTERVAL,
                    "时间范围无效，结束时间必须晚于开始时间",
                    window.queryInfo());
        }

        List<Reading> matched = window.matched();
        double startMean =
                endpointMean(
                        within(matched, interval, Interval.minuteOf(interval.start())),
                        "开始时间点没有数据");
        double endMean =
                endpointMean(
                        within(matched, interval, Interval.minuteOf(interval.end())),
                        "结束时间点没有数据");

        double diff = Math.abs(startMean - endMean);
        double rate = diff / minutes;
        int decimals = spec.kind().getPrecision().orElse(3);
        DetailLog log =
                DetailLog.start(window.queryInfo())
                        .entry("开始时间点平均温度", Decimals.display(startMean) + "℃")
                        .entry("结束时间点平均温度", Decimals.display(endMean) + "℃")
                        .entry("温度差", Decimals.fixed(diff, 1) + "℃")
                        .entry("时间差", minutes + " 分钟")
                        .entry("降温速率", Decimals.display(Decimals.round(rate, decimals)) + " ℃/分钟");
        return context.getFormatter().number(rate, decimals, log);
    }

    /// Returns the readings inside both the window and the half-open minute.
    private static List<Reading> within(List<Reading> readings, Interval window, Interval minute) {
        List<Reading> inMinute = new ArrayList<>();
        for (Reading reading : readings) {
            if (window.contains(reading.timestamp())
                    && minute.containsHalfOpen(reading.timestamp())) {
                inMinute.add(reading);
            }
        }
        return inMinute;
    }

    private static double endpointMean(List<Reading> readings, String emptyMessage)
            throws EvaluationException {
        List<Reading> finite = new ArrayList<>();
        for (Reading reading : readings) {
            if (Double.isFinite(reading.temperature())) {
                finite.add(reading);
            }
        }
        if (finite.isEmpty()) {
            throw new EvaluationException(ErrorCode.NO_DATA, emptyMessage);
        }
        return Decimals.round(
                Samples.mean(new ArrayList<>(Samples.deviceMeans(finite).values())), 1);
    }
}
