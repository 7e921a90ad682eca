package io.coldtag.core.function;

import io.coldtag.core.reading.Measure;
import io.coldtag.core.tag.TagType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Set;

/// The closed catalogue of tag functions.
///
/// Each kind carries its wire identifier, the editor's display label, its
/// {@link AlgorithmFamily}, the {@link OutputCategory} of its value, the measure it reads, its
/// canonical precision (numeric kinds only), its built-in default threshold (threshold kinds
/// only) and the {@link InputRole}s it needs. Adding a kind means adding a constant here and
/// teaching {@link FunctionSpecBinder} and the metric registry about it.
public enum FunctionKind {

    // Device-set results
    TEMP_REACH_UPPER(
            "tempReachUpper", "数据温度第一个到达上限测点",
            AlgorithmFamily.THRESHOLD, OutputCategory.LOCATION, Measure.TEMPERATURE,
            null, 8.0, Inputs.THRESHOLD),
    TEMP_REACH_LOWER(
            "tempReachLower", "数据温度第一个到达下限测点",
            AlgorithmFamily.THRESHOLD, OutputCategory.LOCATION, Measure.TEMPERATURE,
            null, 2.0, Inputs.THRESHOLD),
    HUMIDITY_REACH_UPPER(
            "humidityReachUpper", "数据湿度第一个到达上限测点",
            AlgorithmFamily.THRESHOLD, OutputCategory.LOCATION, Measure.HUMIDITY,
            null, 80.0, Inputs.THRESHOLD),
    HUMIDITY_REACH_LOWER(
            "humidityReachLower", "数据湿度第一个到达下限测点",
            AlgorithmFamily.THRESHOLD, OutputCategory.LOCATION, Measure.HUMIDITY,
            null, 20.0, Inputs.THRESHOLD),
    TEMP_EXCEED_UPPER(
            "tempExceedUpper", "数据温度超过上限测点",
            AlgorithmFamily.THRESHOLD, OutputCategory.LOCATION, Measure.TEMPERATURE,
            null, 8.0, Inputs.THRESHOLD),
    TEMP_EXCEED_LOWER(
            "tempExceedLower", "数据温度低于下限测点",
            AlgorithmFamily.THRESHOLD, OutputCategory.LOCATION, Measure.TEMPERATURE,
            null, 2.0, Inputs.THRESHOLD),
    HUMIDITY_EXCEED_UPPER(
            "humidityExceedUpper", "数据湿度超过上限测点",
            AlgorithmFamily.THRESHOLD, OutputCategory.LOCATION, Measure.HUMIDITY,
            null, 80.0, Inputs.THRESHOLD),
    HUMIDITY_EXCEED_LOWER(
            "humidityExceedLower", "数据湿度低于下限测点",
            AlgorithmFamily.THRESHOLD, OutputCategory.LOCATION, Measure.HUMIDITY,
            null, 20.0, Inputs.THRESHOLD),
    MAX_TEMP_LOCATION(
            "maxTempLocation", "数据温度最高值对应测点",
            AlgorithmFamily.EXTREMUM, OutputCategory.LOCATION, Measure.TEMPERATURE,
            null, null, Inputs.WINDOW),
    MIN_TEMP_LOCATION(
            "minTempLocation", "数据温度最低值对应测点",
            AlgorithmFamily.EXTREMUM, OutputCategory.LOCATION, Measure.TEMPERATURE,
            null, null, Inputs.WINDOW),

    // Numeric results
    MAX_TEMP(
            "maxTemp", "数据最高温度",
            AlgorithmFamily.SCALAR, OutputCategory.NUMBER, Measure.TEMPERATURE,
            1, null, Inputs.WINDOW),
    MIN_TEMP(
            "minTemp", "数据最低温度",
            AlgorithmFamily.SCALAR, OutputCategory.NUMBER, Measure.TEMPERATURE,
            1, null, Inputs.WINDOW),
    AVG_TEMP(
            "avgTemp", "数据平均温度",
            AlgorithmFamily.SCALAR, OutputCategory.NUMBER, Measure.TEMPERATURE,
            1, null, Inputs.WINDOW),
    MAX_HUMIDITY(
            "maxHumidity", "数据最高湿度",
            AlgorithmFamily.SCALAR, OutputCategory.NUMBER, Measure.HUMIDITY,
            1, null, Inputs.WINDOW),
    MIN_HUMIDITY(
            "minHumidity", "数据最低湿度",
            AlgorithmFamily.SCALAR, OutputCategory.NUMBER, Measure.HUMIDITY,
            1, null, Inputs.WINDOW),
    AVG_HUMIDITY(
            "avgHumidity", "数据平均湿度",
            AlgorithmFamily.SCALAR, OutputCategory.NUMBER, Measure.HUMIDITY,
            1, null, Inputs.WINDOW),
    CENTER_POINT_TEMP_DEVIATION(
            "centerPointTempDeviation", "数据中心点温度偏差值",
            AlgorithmFamily.EXTERNAL_VALUE, OutputCategory.NUMBER, Measure.TEMPERATURE,
            1, null, Inputs.CENTER_POINT),
    TEMP_UNIFORMITY(
            "tempUniformity", "数据温度均匀度值",
            AlgorithmFamily.MINUTE_BUCKET, OutputCategory.NUMBER, Measure.TEMPERATURE,
            2, null, Inputs.WINDOW),
    CENTER_POINT_TEMP_FLUCTUATION(
            "centerPointTempFluctuation", "数据中心点温度波动度",
            AlgorithmFamily.MINUTE_BUCKET, OutputCategory.NUMBER, Measure.TEMPERATURE,
            2, null, Inputs.WINDOW),
    TEMP_VARIATION_RANGE_SUM(
            "tempVariationRangeSum", "数据变化范围求和",
            AlgorithmFamily.MINUTE_BUCKET, OutputCategory.NUMBER, Measure.TEMPERATURE,
            1, null, Inputs.WINDOW),
    TEMP_AVG_DEVIATION(
            "tempAvgDeviation", "数据温度平均偏差值",
            AlgorithmFamily.EXTERNAL_VALUE, OutputCategory.NUMBER, Measure.TEMPERATURE,
            1, null, Inputs.TEMP_BOUNDS),
    TEMP_UNIFORMITY_MAX(
            "tempUniformityMax", "数据温度均匀度计算最高温度",
            AlgorithmFamily.MINUTE_BUCKET, OutputCategory.NUMBER, Measure.TEMPERATURE,
            1, null, Inputs.WINDOW),
    TEMP_UNIFORMITY_MIN(
            "tempUniformityMin", "数据温度均匀度计算最低",
            AlgorithmFamily.MINUTE_BUCKET, OutputCategory.NUMBER, Measure.TEMPERATURE,
            1, null, Inputs.WINDOW),
    TEMP_UNIFORMITY_VALUE(
            "tempUniformityValue", "数据温度均匀度计算值",
            AlgorithmFamily.MINUTE_BUCKET, OutputCategory.NUMBER, Measure.TEMPERATURE,
            2, null, Inputs.WINDOW),
    POWER_CONSUMPTION_RATE(
            "powerConsumptionRate", "耗电率计算",
            AlgorithmFamily.EXTERNAL_VALUE, OutputCategory.NUMBER, null,
            2, null, Inputs.POWER),
    MAX_POWER_USAGE_DURATION(
            "maxPowerUsageDuration", "电量最长使用时长",
            AlgorithmFamily.EXTERNAL_VALUE, OutputCategory.NUMBER, null,
            2, null, Inputs.POWER),
    AVG_COOLING_RATE(
            "avgCoolingRate", "平均降温速率",
            AlgorithmFamily.EXTERNAL_VALUE, OutputCategory.NUMBER, Measure.TEMPERATURE,
            3, null, Inputs.WINDOW),
    DEVICE_TIME_POINT_TEMP(
            "deviceTimePointTemp", "获取设备时间点温度",
            AlgorithmFamily.EXTERNAL_VALUE, OutputCategory.NUMBER, Measure.TEMPERATURE,
            2, null, Inputs.TIME_POINT),
    MAX_TEMP_DIFF_AT_SAME_TIME(
            "maxTempDiffAtSameTime", "同一时间各测点间最大温度差值",
            AlgorithmFamily.MINUTE_BUCKET, OutputCategory.NUMBER, Measure.TEMPERATURE,
            1, null, Inputs.WINDOW),
    TEMP_FLUCTUATION(
            "tempFluctuation", "温度波动度",
            AlgorithmFamily.MINUTE_BUCKET, OutputCategory.NUMBER, Measure.TEMPERATURE,
            2, null, Inputs.TUNABLE),
    TEMP_UNIFORMITY_AVERAGE(
            "tempUniformityAverage", "温度均匀度",
            AlgorithmFamily.MINUTE_BUCKET, OutputCategory.NUMBER, Measure.TEMPERATURE,
            2, null, Inputs.TUNABLE),

    // Time results
    TEMP_FIRST_REACH_UPPER_TIME(
            "tempFirstReachUpperTime", "数据温度第一次到达上限时间",
            AlgorithmFamily.THRESHOLD, OutputCategory.TIME, Measure.TEMPERATURE,
            null, 8.0, Inputs.THRESHOLD),
    TEMP_FIRST_REACH_LOWER_TIME(
            "tempFirstReachLowerTime", "数据温度第一次到达下限时间",
            AlgorithmFamily.THRESHOLD, OutputCategory.TIME, Measure.TEMPERATURE,
            null, 2.0, Inputs.THRESHOLD),
    TEMP_MAX_TIME(
            "tempMaxTime", "数据取最高点时间",
            AlgorithmFamily.EXTREMUM, OutputCategory.TIME, Measure.TEMPERATURE,
            null, null, Inputs.WINDOW),
    TEMP_MIN_TIME(
            "tempMinTime", "数据取最低点时间",
            AlgorithmFamily.EXTREMUM, OutputCategory.TIME, Measure.TEMPERATURE,
            null, null, Inputs.WINDOW),
    MAX_TEMP_DIFF_TIME_POINT(
            "maxTempDiffTimePoint", "同一时间各测点间最大温度差时间点",
            AlgorithmFamily.MINUTE_BUCKET, OutputCategory.TIME, Measure.TEMPERATURE,
            null, null, Inputs.WINDOW);

    private final String id;
    private final String label;
    private final AlgorithmFamily family;
    private final OutputCategory category;
    private final Measure measure;
    private final Integer precision;
    private final Double defaultThreshold;
    private final Set<InputRole> inputRoles;

    FunctionKind(
            String id,
            String label,
            AlgorithmFamily family,
            OutputCategory category,
            Measure measure,
            Integer precision,
            Double defaultThreshold,
            Set<InputRole> inputRoles) {
        this.id = id;
        this.label = label;
        this.family = family;
        this.category = category;
        this.measure = measure;
        this.precision = precision;
        this.defaultThreshold = defaultThreshold;
        this.inputRoles = inputRoles;
    }

    /// Returns the wire identifier stored in function configs, e.g. `maxTemp`.
    public String getId() {
        return id;
    }

    /// Returns the editor's display label.
    public String getLabel() {
        return label;
    }

    public AlgorithmFamily getFamily() {
        return family;
    }

    public OutputCategory getCategory() {
        return category;
    }

    /// Returns the measure this kind reads.
    ///
    /// @return the measure, null for kinds that read no samples (power kinds)
    public Measure getMeasure() {
        return measure;
    }

    /// Returns the canonical number of decimal places.
    ///
    /// @return precision for numeric kinds, empty for device-set and time kinds
    public OptionalInt getPrecision() {
        return precision != null ? OptionalInt.of(precision) : OptionalInt.empty();
    }

    /// Returns the built-in default threshold.
    ///
    /// @return the default for threshold kinds, empty otherwise
    public OptionalDouble getDefaultThreshold() {
        return defaultThreshold != null
                ? OptionalDouble.of(defaultThreshold)
                : OptionalDouble.empty();
    }

    /// Returns the inputs this kind reads, in validation order.
    ///
    /// @return unmodifiable set, never null
    public Set<InputRole> getInputRoles() {
        return inputRoles;
    }

    public boolean requires(InputRole role) {
        return inputRoles.contains(role);
    }

    /// Checks whether this kind reads the reading store. Power kinds do not.
    public boolean readsStore() {
        return requires(InputRole.TASK);
    }

    /// Resolves a kind from its wire identifier.
    ///
    /// @param id the identifier, may be null
    /// @return the kind, or empty if the identifier is not in the catalogue
    public static Optional<FunctionKind> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (FunctionKind kind : values()) {
            if (kind.id.equals(id)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /// Lists the kinds a tag of the given type may host, in catalogue order.
    ///
    /// @param type the tag type, may be null
    /// @return unmodifiable list, empty for types that cannot host a function
    public static List<FunctionKind> forTagType(TagType type) {
        OutputCategory category = OutputCategory.forTagType(type);
        if (category == null) {
            return List.of();
        }
        List<FunctionKind> kinds = new ArrayList<>();
        for (FunctionKind kind : values()) {
            if (kind.category == category) {
                kinds.add(kind);
            }
        }
        return Collections.unmodifiableList(kinds);
    }

    /// Returns the kind the editor preselects for a tag type.
    ///
    /// @param type the tag type, may be null
    /// @return the default kind, or empty for types that cannot host a function
    public static Optional<FunctionKind> defaultFor(TagType type) {
        OutputCategory category = OutputCategory.forTagType(type);
        if (category == null) {
            return Optional.empty();
        }
        return switch (category) {
            case LOCATION -> Optional.of(TEMP_REACH_UPPER);
            case NUMBER -> Optional.of(MAX_TEMP);
            case TIME -> Optional.of(TEMP_FIRST_REACH_UPPER_TIME);
        };
    }

    private static final class Inputs {
        static final Set<InputRole> WINDOW =
                of(InputRole.TASK, InputRole.LOCATIONS, InputRole.START_TIME, InputRole.END_TIME);
        static final Set<InputRole> THRESHOLD = with(WINDOW, InputRole.THRESHOLD);
        static final Set<InputRole> TUNABLE = with(WINDOW, InputRole.DECIMAL_PLACES);
        static final Set<InputRole> CENTER_POINT = with(WINDOW, InputRole.CENTER_POINT);
        static final Set<InputRole> TEMP_BOUNDS =
                with(with(WINDOW, InputRole.MAX_TEMP), InputRole.MIN_TEMP);
        static final Set<InputRole> POWER =
                of(
                        InputRole.START_TIME,
                        InputRole.END_TIME,
                        InputRole.START_POWER,
                        InputRole.END_POWER);
        static final Set<InputRole> TIME_POINT =
                of(InputRole.TASK, InputRole.SINGLE_LOCATION, InputRole.TIME_POINT);

        private static Set<InputRole> of(InputRole first, InputRole... rest) {
            return Collections.unmodifiableSet(EnumSet.of(first, rest));
        }

        private static Set<InputRole> with(Set<InputRole> base, InputRole role) {
            EnumSet<InputRole> roles = EnumSet.copyOf(base);
            roles.add(role);
            return Collections.unmodifiableSet(roles);
        }
    }
}
