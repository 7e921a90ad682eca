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
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Threshold detection over the queried devices.
///
/// ### Modes
/// - **arrival** (`*ReachUpper/Lower`): each device's first qualifying reading is found; the
///   devices whose first reach is the earliest are reported, joined by `" | "`
/// - **exceed** (`*ExceedUpper/Lower`): every device with any qualifying reading is reported
/// - **first-reach time** (`tempFirstReach*Time`): the `YYYY-MM-DD HH:mm` time of the first
///   qualifying reading of any device
///
/// Upper kinds qualify on `value >= threshold`, lower kinds on `value <= threshold`. Readings
/// are scanned in chronological order; devices are reported in the order they first qualified.
public class ThresholdAlgorithm implements MetricAlgorithm<FunctionSpec.Threshold> {

    private static final String NOT_REACHED = "未找到满足条件的测点";

    @Override
    public Class<FunctionSpec.Threshold> getSpecType() {
        return FunctionSpec.Threshold.class;
    }

    @Override
    public FunctionResult evaluate(FunctionSpec.Threshold spec, EvaluationContext context)
            throws EvaluationException, ReadingStoreException {
        DataWindowResolver resolver = context.getWindowResolver();
        DataWindow window =
                resolver.fetch(
                        context.getTaskId(), resolver.prepare(spec.window(), context.getRoster()));

        Measure measure = spec.kind().getMeasure();
        List<Reading> readings = window.finite(measure);
        String threshold = Decimals.display(spec.threshold());
        DetailLog log = DetailLog.start(window.queryInfo()).entry("阈值", threshold);

        if (spec.kind().getCategory() == OutputCategory.TIME) {
            return firstReachTime(spec, readings, measure, log, context);
        }
        return switch (spec.kind()) {
            case TEMP_REACH_UPPER, TEMP_REACH_LOWER, HUMIDITY_REACH_UPPER, HUMIDITY_REACH_LOWER ->
                    arrival(spec, readings, measure, log, context);
            default -> exceed(spec, readings, measure, log, context);
        };
    }

    private FunctionResult arrival(
            FunctionSpec.Threshold spec,
            List<Reading> readings,
            Measure measure,
            DetailLog log,
            EvaluationContext context)
            throws EvaluationException {
        Map<String, LocalDateTime> firstReach = new LinkedHashMap<>();
        for (Reading reading : readings) {
            if (spec.reached(measure.of(reading))) {
                firstReach.putIfAbsent(reading.deviceId(), reading.timestamp());
            }
        }
        if (firstReach.isEmpty()) {
            throw notReached(log);
        }

        LocalDateTime earliest = null;
        for (LocalDateTime time : firstReach.values()) {
            if (earliest == null || time.isBefore(earliest)) {
                earliest = time;
            }
        }
        List<String> fastest = new ArrayList<>();
        for (Map.Entry<String, LocalDateTime> entry : firstReach.entrySet()) {
            if (entry.getValue().equals(earliest)) {
                fastest.add(entry.getKey());
            }
        }

        String output = String.join(Locations.JOINER, fastest);
        log.entry("最快", output);
        return context.getFormatter().text(output, log);
    }

    private FunctionResult exceed(
            FunctionSpec.Threshold spec,
            List<Reading> readings,
            Measure measure,
            DetailLog log,
            EvaluationContext context)
            throws EvaluationException {
        Set<String> devices = new LinkedHashSet<>();
        for (Reading reading : readings) {
            if (spec.reached(measure.of(reading))) {
                devices.add(reading.deviceId());
            }
        }
        if (devices.isEmpty()) {
            throw notReached(log);
        }

        String output = String.join(Locations.JOINER, devices);
        log.entry("测点", output);
        return context.getFormatter().text(output, log);
    }

    private FunctionResult firstReachTime(
            FunctionSpec.Threshold spec,
            List<Reading> readings,
            Measure measure,
            DetailLog log,
            EvaluationContext context)
            throws EvaluationException {
        for (Reading reading : readings) {
            if (spec.reached(measure.of(reading))) {
                String time = TimeFormats.minuteKey(reading.timestamp());
                log.entry("第一次到达时间", time);
                return context.getFormatter().text(time, log);
            }
        }
        throw notReached(log);
    }

    private static EvaluationException notReached(DetailLog log) {
        return new EvaluationException(
                ErrorCode.NO_MATCH, NOT_REACHED, log.line("未满足条件").render());
    }
}
