package io.coldtag.core.metric;

import io.coldtag.core.exception.EvaluationException;
import io.coldtag.core.exception.ReadingStoreException;
import io.coldtag.core.function.FunctionKind;
import io.coldtag.core.function.FunctionSpec;
import io.coldtag.core.reading.Measure;
import io.coldtag.core.reading.Reading;
import io.coldtag.core.result.Decimals;
import io.coldtag.core.result.DetailLog;
import io.coldtag.core.result.ErrorCode;
import io.coldtag.core.result.FunctionResult;
import io.coldtag.core.result.ResultFormatter;
import io.coldtag.core.window.DataWindow;
import io.coldtag.core.window.DataWindowResolver;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/// Spread metrics over minute buckets and per-device ranges.
///
/// A minute bucket collects the temperatures whose timestamps truncate to the same minute
/// (`YYYY-MM-DD HH:mm`). Only finite temperatures of the queried devices take part.
///
/// ### Kinds
/// - `maxTempDiffAtSameTime`, `maxTempDiffTimePoint`: the bucket with the largest `max - min`;
///   the earliest bucket wins ties
/// - `tempUniformity`: sum of per-device ranges divided by the window length in whole minutes
/// - `tempVariationRangeSum`: sum of per-device ranges
/// - `tempFluctuation`: `(max - min) / 2` over all samples, shown with a `±` prefix
/// - `centerPointTempFluctuation`: `|max - min| / 2` over all samples
/// - `tempUniformityAverage`: mean of the per-bucket spreads
/// - `tempUniformityMax`, `tempUniformityMin`, `tempUniformityValue`: buckets sorted by key are
///   paired first half against second half (index `y` with `n / 2 + y + n % 2` for
///   `y < ceil(n / 2)`) and their maxima and minima summed; the value kind reports
///   `|maxSum - minSum| / n`
public class MinuteBucketAlgorithm implements MetricAlgorithm<FunctionSpec.Bucket> {

    @Override
    public Class<FunctionSpec.Bucket> getSpecType() {
        return FunctionSpec.Bucket.class;
    }

    @Override
    public FunctionResult evaluate(FunctionSpec.Bucket spec, EvaluationContext context)
            throws EvaluationException, ReadingStoreException {
        DataWindowResolver resolver = context.getWindowResolver();
        DataWindow window =
                resolver.fetch(
                        context.getTaskId(), resolver.prepare(spec.window(), context.getRoster()));

        List<Reading> readings = Samples.temperatures(window);
        DetailLog log = DetailLog.start(window.queryInfo());
        int limit = context.getConfig().getPreviewLimit();
        ResultFormatter formatter = context.getFormatter();

        return switch (spec.kind()) {
            case MAX_TEMP_DIFF_AT_SAME_TIME, MAX_TEMP_DIFF_TIME_POINT ->
                    maxDiff(spec, readings, log, formatter);
            case TEMP_UNIFORMITY -> uniformity(spec, window, readings, log, limit, formatter);
            case TEMP_VARIATION_RANGE_SUM -> variationRangeSum(spec, readings, log, limit, formatter);
            case TEMP_FLUCTUATION -> fluctuation(spec, readings, log, formatter);
            case CENTER_POINT_TEMP_FLUCTUATION ->
                    centerPointFluctuation(spec, readings, log, formatter);
            case TEMP_UNIFORMITY_AVERAGE -> uniformityAverage(spec, readings, log, limit, formatter);
            default -> pairedUniformity(spec, readings, log, limit, formatter);
        };
    }

    private FunctionResult maxDiff(
            FunctionSpec.Bucket spec,
            List<Reading> readings,
            DetailLog log,
            ResultFormatter formatter) {
        List<Samples.MinuteBucket> buckets = Samples.minuteBuckets(readings);
        Samples.MinuteBucket widest = buckets.get(0);
        for (Samples.MinuteBucket bucket : buckets) {
            if (bucket.spread() > widest.spread()) {
                widest = bucket;
            }
        }

        boolean timePoint = spec.kind() == FunctionKind.MAX_TEMP_DIFF_TIME_POINT;
        String diff =
                timePoint
                        ? Decimals.fixed(widest.spread(), 1)
                        : Decimals.display(Decimals.round(widest.spread(), spec.decimals()));
        log.entry("最大温度差值", diff)
                .entry("对应时间点", widest.key())
                .entry("该时间点最高温度", Decimals.fixed(widest.max(), 1))
                .entry("该时间点最低温度", Decimals.fixed(widest.min(), 1))
                .entry("时间点总数", buckets.size());
        if (timePoint) {
            return formatter.text(widest.key(), log);
        }
        return formatter.number(widest.spread(), spec.decimals(), log);
    }

    private FunctionResult uniformity(
            FunctionSpec.Bucket spec,
            DataWindow window,
            List<Reading> readings,
            DetailLog log,
            int limit,
            ResultFormatter formatter)
            throws EvaluationException {
        long minutes = window.interval().wholeMinutes();
        if (minutes <= 0) {
            throw new EvaluationException(
                    ErrorCode.INVALID_INTERVAL, "时间范围无效，结束时间必须晚于开始时间", log.render());
        }

        List<Samples.DeviceRange> ranges = Samples.deviceRanges(readings);
        double sum = rangeSum(ranges);
        double value = Math.abs(sum / minutes);
        log.entry("时间范围", minutes + " 分钟")
                .entry("设备数量", ranges.size())
                .entry("温度变化范围总和", Decimals.fixed(sum, 2))
                .entry("均匀度值", Decimals.display(Decimals.round(value, spec.decimals())))
                .preview("设备详情", rangeLines(ranges), limit);
        return formatter.number(value, spec.decimals(), log);
    }

    private FunctionResult variationRangeSum(
            FunctionSpec.Bucket spec,
            List<Reading> readings,
            DetailLog log,
            int limit,
            ResultFormatter formatter) {
        List<Samples.DeviceRange> ranges = Samples.deviceRanges(readings);
        double value = Math.abs(rangeSum(ranges));
        log.entry("设备数量", ranges.size())
                .entry("温度变化范围总和", Decimals.display(Decimals.round(value, spec.decimals())))
                .preview("设备详情", rangeLines(ranges), limit);
        return formatter.number(value, spec.decimals(), log);
    }

    private FunctionResult fluctuation(
            FunctionSpec.Bucket spec,
            List<Reading> readings,
            DetailLog log,
            ResultFormatter formatter) {
        int decimals = spec.decimals();
        double max = Samples.max(readings, Measure.TEMPERATURE);
        double min = Samples.min(readings, Measure.TEMPERATURE);
        double value = (max - min) / 2;
        log.entry("小数位数", decimals)
                .entry("最高温度", Decimals.fixed(max, decimals))
                .entry("最低温度", Decimals.fixed(min, decimals))
                .entry("温度差", Decimals.fixed(max - min, decimals))
                .entry(
                        "温度波动度(±(max-min)/2)",
                        "±" + Decimals.display(Decimals.round(value, decimals)));
        return formatter.number(value, decimals, "±", log);
    }

    private FunctionResult centerPointFluctuation(
            FunctionSpec.Bucket spec,
            List<Reading> readings,
            DetailLog log,
            ResultFormatter formatter) {
        double max = Samples.max(readings, Measure.TEMPERATURE);
        double min = Samples.min(readings, Measure.TEMPERATURE);
        double value = Math.abs((max - min) / 2);
        log.entry("最高温度", Decimals.fixed(max, 2))
                .entry("最低温度", Decimals.fixed(min, 2))
                .entry("温度差", Decimals.fixed(max - min, 2))
                .entry("波动度", Decimals.display(Decimals.round(value, spec.decimals())));
        return formatter.number(value, spec.decimals(), log);
    }

    private FunctionResult uniformityAverage(
            FunctionSpec.Bucket spec,
            List<Reading> readings,
            DetailLog log,
            int limit,
            ResultFormatter formatter) {
        int decimals = spec.decimals();
        List<Samples.MinuteBucket> buckets = Samples.minuteBuckets(readings);
        List<Double> spreads = new ArrayList<>(buckets.size());
        List<String> lines = new ArrayList<>(buckets.size());
        for (Samples.MinuteBucket bucket : buckets) {
            spreads.add(bucket.spread());
            lines.add(
                    (lines.size() + 1)
                            + ". "
                            + bucket.key()
                            + " 差值:"
                            + Decimals.fixed(bucket.spread(), decimals));
        }
        double value = Samples.mean(spreads);
        log.entry("小数位数", decimals)
                .entry("时间点数量", buckets.size())
                .entry("温度均匀度(差值算术平均)", Decimals.display(Decimals.round(value, decimals)))
                .preview("每次测量差值(前" + limit + "条)", lines, limit);
        return formatter.number(value, decimals, log);
    }

    private FunctionResult pairedUniformity(
            FunctionSpec.Bucket spec,
            List<Reading> readings,
            DetailLog log,
            int limit,
            ResultFormatter formatter) {
        List<Samples.MinuteBucket> buckets = new ArrayList<>(Samples.minuteBuckets(readings));
        buckets.sort(Comparator.comparing(Samples.MinuteBucket::key));
        double[] sums = pairedSums(buckets);
        double maxSum = sums[0];
        double minSum = sums[1];
        int n = buckets.size();
        int decimals = spec.decimals();

        log.entry("时间点数量", n);
        double value =
                switch (spec.kind()) {
                    case TEMP_UNIFORMITY_MAX -> {
                        log.entry("最高温度总和", Decimals.display(Decimals.round(maxSum, decimals)));
                        yield maxSum;
                    }
                    case TEMP_UNIFORMITY_MIN -> {
                        log.entry("最低温度总和", Decimals.display(Decimals.round(minSum, decimals)));
                        yield minSum;
                    }
                    default -> {
                        double uniformity = Math.abs((maxSum - minSum) / n);
                        log.entry("最大温度总和", Decimals.fixed(maxSum, 1))
                                .entry("最小温度总和", Decimals.fixed(minSum, 1))
                                .entry(
                                        "均匀度值",
                                        Decimals.display(Decimals.round(uniformity, decimals)));
                        yield uniformity;
                    }
                };
        log.preview("时间点详情", bucketLines(buckets), limit);
        return formatter.number(value, decimals, log);
    }

    /// Pairs the first half of the key-sorted buckets with the second half.
    ///
    /// @return `{maxSum, minSum}`
    static double[] pairedSums(List<Samples.MinuteBucket> buckets) {
        int n = buckets.size();
        int half = (n + 1) / 2;
        double maxSum = 0;
        double minSum = 0;
        for (int y = 0; y < half; y++) {
            maxSum += buckets.get(y).max();
            minSum += buckets.get(y).min();
            int y2 = n / 2 + y + n % 2;
            if (y2 < n) {
                maxSum += buckets.get(y2).max();
                minSum += buckets.get(y2).min();
            }
        }
        return new double[] {maxSum, minSum};
    }

    private static double rangeSum(List<Samples.DeviceRange> ranges) {
        double sum = 0;
        for (Samples.DeviceRange range : ranges) {
            sum += range.spread();
        }
        return sum;
    }

    private static List<String> rangeLines(List<Samples.DeviceRange> ranges) {
        List<String> lines = new ArrayList<>(ranges.size());
        for (Samples.DeviceRange range : ranges) {
            lines.add(
                    range.deviceId()
                            + ": "
                            + Decimals.fixed(range.min(), 1)
                            + "~"
                            + Decimals.fixed(range.max(), 1)
                            + " (范围: "
                            + Decimals.fixed(range.spread(), 1)
                            + ")");
        }
        return lines;
    }

    private static List<String> bucketLines(List<Samples.MinuteBucket> buckets) {
        List<String> lines = new ArrayList<>(buckets.size());
        for (int i = 0; i < buckets.size(); i++) {
            Samples.MinuteBucket bucket = buckets.get(i);
            lines.add(
                    i
                            + ": "
                            + bucket.key()
                            + " - 最大:"
                            + Decimals.fixed(bucket.max(), 1)
                            + ", 最小:"
                            + Decimals.fixed(bucket.min(), 1)
                            + ", 平均:"
                            + Decimals.fixed(bucket.mean(), 1));
        }
        return lines;
    }
}
