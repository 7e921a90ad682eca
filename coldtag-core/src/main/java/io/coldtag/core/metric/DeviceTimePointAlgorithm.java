package io.coldtag.core.metric;

import io.coldtag.core.exception.EvaluationException;
import io.coldtag.core.exception.ReadingStoreException;
import io.coldtag.core.function.FunctionSpec;
import io.coldtag.core.function.InputRole;
import io.coldtag.core.normalize.Locations;
import io.coldtag.core.normalize.TagDate;
import io.coldtag.core.normalize.TagDates;
import io.coldtag.core.normalize.TimeFormats;
import io.coldtag.core.reading.Measure;
import io.coldtag.core.reading.Reading;
import io.coldtag.core.result.Decimals;
import io.coldtag.core.result.DetailLog;
import io.coldtag.core.result.ErrorCode;
import io.coldtag.core.result.FunctionResult;
import io.coldtag.core.tag.TagRoster;
import io.coldtag.core.window.DataWindowResolver;
import io.coldtag.core.window.Interval;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/// Mean temperature of one device during the minute containing a time point.
///
/// The location tags must resolve to exactly one device. The minute window is half-open,
/// `[HH:mm:00, HH:mm+1:00)`.
public class DeviceTimePointAlgorithm implements MetricAlgorithm<FunctionSpec.TimePoint> {

    @Override
    public Class<FunctionSpec.TimePoint> getSpecType() {
        return FunctionSpec.TimePoint.class;
    }

    @Override
    public FunctionResult evaluate(FunctionSpec.TimePoint spec, EvaluationContext context)
            throws EvaluationException, ReadingStoreException {
        DataWindowResolver resolver = context.getWindowResolver();
        TagRoster roster = context.getRoster();

        Set<String> locations =
                resolver.resolveLocations(spec.locationTagIds(), roster, InputRole.SINGLE_LOCATION);
        if (locations.size() > 1) {
            throw new EvaluationException(
                    ErrorCode.MULTIPLE_VALUES_NOT_ALLOWED, "只能选择一个布点标签，当前有多个布点");
        }
        String device = locations.iterator().next();

        TagDate time =
                TagDates.parseTagDate(roster.require(spec.timeTagId(), "时间标签不存在"), resolver.getZone());
        if (!time.isPresent()) {
            throw new EvaluationException(ErrorCode.INVALID_VALUE, "时间标签值无效");
        }

        Interval minute = Interval.minuteOf(time.dateTime());
        List<Reading> readings = resolver.fetchMinute(context.getTaskId(), minute, locations);
        String human = TimeFormats.human(minute.start());
        if (readings.isEmpty()) {
            String detail =
                    DetailLog.start()
                            .entry("查询设备", device)
                            .entry("查询时间", human)
                            .entry("查询窗口", TimeFormats.range(minute.start(), minute.end()))
                            .line("命中: 0 条")
                            .render();
            throw new EvaluationException(
                    ErrorCode.NO_DATA, "时间点 " + human + " 没有设备 " + device + " 的数据", detail);
        }

        List<Reading> finite = new ArrayList<>();
        List<String> values = new ArrayList<>();
        for (Reading reading : readings) {
            if (Double.isFinite(reading.temperature())) {
                finite.add(reading);
                values.add(Decimals.fixed(reading.temperature(), 2));
            }
        }
        if (finite.isEmpty()) {
            throw new EvaluationException(ErrorCode.NO_DATA, Samples.NO_VALID_TEMPERATURE);
        }

        double mean = Samples.mean(finite, Measure.TEMPERATURE);
        int decimals = spec.kind().getPrecision().orElse(2);
        DetailLog log =
                DetailLog.start()
                        .entry("设备", Locations.join(locations))
                        .entry("时间点", human)
                        .entry("数据条数", finite.size())
                        .entry("温度值", String.join(", ", values))
                        .entry("平均温度", Decimals.display(Decimals.round(mean, decimals)) + "℃");
        return context.getFormatter().number(mean, decimals, log);
    }
}
