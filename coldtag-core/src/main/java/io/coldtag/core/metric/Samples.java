package io.coldtag.core.metric;

import io.coldtag.core.exception.EvaluationException;
import io.coldtag.core.normalize.TimeFormats;
import io.coldtag.core.reading.Measure;
import io.coldtag.core.reading.Reading;
import io.coldtag.core.result.ErrorCode;
import io.coldtag.core.window.DataWindow;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Grouping and aggregation helpers shared by the algorithms.
///
/// Groupings keep first-appearance order of chronologically sorted input, so device lists and
/// bucket lists come out in time order.
final class Samples {

    static final String NO_MATCHED_DATA = "时间范围内没有匹配的布点数据";
    static final String NO_VALID_TEMPERATURE = "没有有效的温度数据";

    private Samples() {}

    /// Returns the window's finite temperature readings of the queried devices.
    ///
    /// @throws EvaluationException with {@link ErrorCode#NO_DATA} when no reading of a queried
    ///     device is present, or none of them has a finite temperature
    static List<Reading> temperatures(DataWindow window) throws EvaluationException {
        return finite(window, Measure.TEMPERATURE, NO_VALID_TEMPERATURE);
    }

    static List<Reading> finite(DataWindow window, Measure measure, String emptyMessage)
            throws EvaluationException {
        if (window.matched().isEmpty()) {
            throw new EvaluationException(ErrorCode.NO_DATA, NO_MATCHED_DATA, window.queryInfo());
        }
        List<Reading> finite = window.finite(measure);
        if (finite.isEmpty()) {
            throw new EvaluationException(ErrorCode.NO_DATA, emptyMessage, window.queryInfo());
        }
        return finite;
    }

    static double max(List<Reading> readings, Measure measure) {
        double max = Double.NEGATIVE_INFINITY;
        for (Reading reading : readings) {
            max = Math.max(max, measure.of(reading));
        }
        return max;
    }

    static double min(List<Reading> readings, Measure measure) {
        double min = Double.POSITIVE_INFINITY;
        for (Reading reading : readings) {
            min = Math.min(min, measure.of(reading));
        }
        return min;
    }

    static double mean(List<Reading> readings, Measure measure) {
        double sum = 0;
        for (Reading reading : readings) {
            sum += measure.of(reading);
        }
        return sum / readings.size();
    }

    static double mean(List<Double> values) {
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    /// Groups readings by device.
    static Map<String, List<Reading>> byDevice(List<Reading> readings) {
        Map<String, List<Reading>> groups = new LinkedHashMap<>();
        for (Reading reading : readings) {
            groups.computeIfAbsent(reading.deviceId(), id -> new ArrayList<>()).add(reading);
        }
        return groups;
    }

    /// Mean temperature of every device.
    static Map<String, Double> deviceMeans(List<Reading> readings) {
        Map<String, Double> means = new LinkedHashMap<>();
        for (Map.Entry<String, List<Reading>> entry : byDevice(readings).entrySet()) {
            means.put(entry.getKey(), mean(entry.getValue(), Measure.TEMPERATURE));
        }
        return means;
    }

    /// Groups temperatures into minute buckets keyed `YYYY-MM-DD HH:mm`.
    static List<MinuteBucket> minuteBuckets(List<Reading> readings) {
        Map<String, List<Double>> groups = new LinkedHashMap<>();
        for (Reading reading : readings) {
            groups.computeIfAbsent(
                            TimeFormats.minuteKey(reading.timestamp()), key -> new ArrayList<>())
                    .add(reading.temperature());
        }
        List<MinuteBucket> buckets = new ArrayList<>(groups.size());
        for (Map.Entry<String, List<Double>> entry : groups.entrySet()) {
            buckets.add(MinuteBucket.of(entry.getKey(), entry.getValue()));
        }
        return buckets;
    }

    /// Temperature range of one device over a window.
    record DeviceRange(String deviceId, double min, double max) {

        double spread() {
            return max - min;
        }
    }

    static List<DeviceRange> deviceRanges(List<Reading> readings) {
        List<DeviceRange> ranges = new ArrayList<>();
        for (Map.Entry<String, List<Reading>> entry : byDevice(readings).entrySet()) {
            List<Reading> deviceReadings = entry.getValue();
            ranges.add(
                    new DeviceRange(
                            entry.getKey(),
                            min(deviceReadings, Measure.TEMPERATURE),
                            max(deviceReadings, Measure.TEMPERATURE)));
        }
        return ranges;
    }

    /// Temperatures sampled within one minute.
    record MinuteBucket(String key, double max, double min, double mean) {

        static MinuteBucket of(String key, List<Double> values) {
            double max = Double.NEGATIVE_INFINITY;
            double min = Double.POSITIVE_INFINITY;
            for (double value : values) {
                max = Math.max(max, value);
                min = Math.min(min, value);
            }
            return new MinuteBucket(key, max, min, Samples.mean(values));
        }

        double spread() {
            return max - min;
        }
    }
}
