package io.coldtag.core.metric;

import io.coldtag.core.exception.EvaluationException;
import io.coldtag.core.function.FunctionKind;
import io.coldtag.core.function.FunctionSpec;
import io.coldtag.core.normalize.TimeFormats;
import io.coldtag.core.result.Decimals;
import io.coldtag.core.result.DetailLog;
import io.coldtag.core.result.ErrorCode;
import io.coldtag.core.result.FunctionResult;
import io.coldtag.core.tag.Tag;
import io.coldtag.core.tag.TagRoster;
import io.coldtag.core.window.Interval;

/// Battery metrics computed from start and end charge tags.
///
/// Charges are percentages; no readings are queried.
///
/// ### Kinds
/// - `powerConsumptionRate`: `(start - end) / hours`, percent per hour
/// - `maxPowerUsageDuration`: the configured capacity budget divided by the power
///   `(start - end) / (wholeMinutes / 60)`, in hours
public class PowerAlgorithm implements MetricAlgorithm<FunctionSpec.Power> {

    @Override
    public Class<FunctionSpec.Power> getSpecType() {
        return FunctionSpec.Power.class;
    }

    @Override
    public FunctionResult evaluate(FunctionSpec.Power spec, EvaluationContext context)
            throws EvaluationException {
        TagRoster roster = context.getRoster();
        Interval interval =
                context.getWindowResolver()
                        .resolveInterval(spec.startTagId(), spec.endTagId(), roster);

        Tag startTag = roster.find(spec.startPowerTagId()).orElse(null);
        Tag endTag = roster.find(spec.endPowerTagId()).orElse(null);
        if (startTag == null || endTag == null) {
            throw new EvaluationException(ErrorCode.TAG_NOT_FOUND, "开始电量或结束电量标签不存在");
        }
        double start = TagInputs.number(startTag, "开始电量");
        double end = TagInputs.number(endTag, "结束电量");

        double hours = interval.hours();
        if (hours <= 0) {
            throw new EvaluationException(
                    ErrorCode.INVALID_INTERVAL, "时间范围无效，结束时间必须晚于开始时间");
        }

        int decimals = spec.kind().getPrecision().orElse(2);
        DetailLog log =
                DetailLog.start()
                        .entry("本地时间", TimeFormats.range(interval.start(), interval.end()))
                        .entry("开始电量", Decimals.display(start) + "%")
                        .entry("结束电量", Decimals.display(end) + "%");

        if (spec.kind() == FunctionKind.POWER_CONSUMPTION_RATE) {
            double rate = (start - end) / hours;
            log.entry("时间差", Decimals.fixed(hours, 2) + " 小时")
                    .entry("耗电率", Decimals.display(Decimals.round(rate, decimals)) + "%/小时");
            return context.getFormatter().number(rate, decimals, log);
        }

        long minutes = interval.wholeMinutes();
        double power = (start - end) / (minutes / 60.0);
        log.entry("时间差", minutes + " 分钟");
        if (power == 0 || !Double.isFinite(power)) {
            throw new EvaluationException(
                    ErrorCode.INVALID_COMPUTATION, "功率计算无效，开始电量不能等于结束电量", log.render());
        }
        double duration = context.getConfig().getPowerCapacityBudget() / power;
        log.entry("功率", Decimals.fixed(power, 2) + "%/小时")
                .entry("最长使用时长", Decimals.display(Decimals.round(duration, decimals)) + " 小时");
        return context.getFormatter().number(duration, decimals, log);
    }
}
