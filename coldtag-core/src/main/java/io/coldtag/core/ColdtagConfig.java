package io.coldtag.core;

import io.coldtag.core.function.FunctionKind;
import io.coldtag.core.function.InputRole;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Properties;

/// Defaults table of the evaluation engine.
///
/// Holds every value a function falls back to when its config leaves it open, plus the
/// runtime settings of an environment. Use {@link #defaults()}, the {@link Builder}, or
/// {@link #fromProperties(Properties)}.
///
/// ### Default Values
/// - thresholds: `tempReachUpper`/`tempExceedUpper`/`tempFirstReachUpperTime` `8`, the lower
///   temperature kinds `2`, humidity upper `80`, humidity lower `20`
/// - decimal places of `tempFluctuation` and `tempUniformityAverage`: `2`
/// - `tempAvgDeviation` band: max `8`, min `2`
/// - power capacity budget: `90`
/// - detail preview limit: `10` lines
/// - zone: the system default, used to read epoch-millisecond tag values as local time
/// - pool size: `4` workers for batch evaluation
///
/// ### Property Keys
/// | Key | Value |
/// |-----|-------|
/// | `coldtag.threshold.<kind>` | threshold of a threshold kind, e.g. `coldtag.threshold.tempReachUpper` |
/// | `coldtag.decimals.<kind>` | decimal places of a kind with tunable precision |
/// | `coldtag.avg-deviation.max-temp` | default band maximum |
/// | `coldtag.avg-deviation.min-temp` | default band minimum |
/// | `coldtag.power.capacity-budget` | capacity budget in percent |
/// | `coldtag.detail.preview-limit` | preview lines in detail logs |
/// | `coldtag.zone` | zone id |
/// | `coldtag.pool-size` | batch worker count |
///
/// @implNote Immutable and thread-safe.
///
/// @see ColdtagFactory
public final class ColdtagConfig {

    static final String PREFIX = "coldtag.";
    static final String THRESHOLD_PREFIX = PREFIX + "threshold.";
    static final String DECIMALS_PREFIX = PREFIX + "decimals.";
    static final String MAX_TEMP_KEY = PREFIX + "avg-deviation.max-temp";
    static final String MIN_TEMP_KEY = PREFIX + "avg-deviation.min-temp";
    static final String CAPACITY_KEY = PREFIX + "power.capacity-budget";
    static final String PREVIEW_KEY = PREFIX + "detail.preview-limit";
    static final String ZONE_KEY = PREFIX + "zone";
    static final String POOL_SIZE_KEY = PREFIX + "pool-size";

    private static final int MAX_DECIMALS = 20;

    private final Map<FunctionKind, Double> thresholds;
    private final Map<FunctionKind, Integer> decimalPlaces;
    private final double avgDeviationMaxTemp;
    private final double avgDeviationMinTemp;
    private final double powerCapacityBudget;
    private final int previewLimit;
    private final ZoneId zone;
    private final int poolSize;

    private ColdtagConfig(Builder builder) {
        this.thresholds = Collections.unmodifiableMap(new EnumMap<>(builder.thresholds));
        this.decimalPlaces = Collections.unmodifiableMap(new EnumMap<>(builder.decimalPlaces));
        this.avgDeviationMaxTemp = builder.avgDeviationMaxTemp;
        this.avgDeviationMinTemp = builder.avgDeviationMinTemp;
        this.powerCapacityBudget = builder.powerCapacityBudget;
        this.previewLimit = builder.previewLimit;
        this.zone = builder.zone;
        this.poolSize = builder.poolSize;
    }

    /// Returns the built-in defaults.
    ///
    /// @return default configuration, never null
    public static ColdtagConfig defaults() {
        return builder().build();
    }

    /// Returns the default threshold of a kind.
    ///
    /// @param kind the function kind, not null
    /// @return the threshold, empty when the kind has no threshold
    public OptionalDouble threshold(FunctionKind kind) {
        Double value = thresholds.get(kind);
        return value != null ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    /// Returns the precision applied to a kind's result.
    ///
    /// Kinds with a tunable precision use the configured default, other numeric kinds their
    /// canonical precision.
    ///
    /// @param kind the function kind, not null
    /// @return decimal places, `0` for kinds without a numeric result
    public int decimalPlaces(FunctionKind kind) {
        Integer value = decimalPlaces.get(kind);
        return value != null ? value : kind.getPrecision().orElse(0);
    }

    /// Returns the default thresholds by kind.
    ///
    /// @return unmodifiable map, never null
    public Map<FunctionKind, Double> getThresholds() {
        return thresholds;
    }

    public double getAvgDeviationMaxTemp() {
        return avgDeviationMaxTemp;
    }

    public double getAvgDeviationMinTemp() {
        return avgDeviationMinTemp;
    }

    /// Returns the battery capacity, in percent, `maxPowerUsageDuration` divides by the power.
    public double getPowerCapacityBudget() {
        return powerCapacityBudget;
    }

    /// Returns the maximum number of preview lines in a detail log section.
    public int getPreviewLimit() {
        return previewLimit;
    }

    public ZoneId getZone() {
        return zone;
    }

    public int getPoolSize() {
        return poolSize;
    }

    /// Reads a configuration from properties, starting from the defaults.
    ///
    /// Keys outside the `coldtag.` namespace are ignored.
    ///
    /// @param properties the properties, not null
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if a value is malformed or names an unknown kind
    public static ColdtagConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        Builder builder = builder();
        for (String key : properties.stringPropertyNames()) {
            if (!key.startsWith(PREFIX)) {
                continue;
            }
            String value = properties.getProperty(key).trim();
            if (key.startsWith(THRESHOLD_PREFIX)) {
                builder.threshold(kindOf(key, THRESHOLD_PREFIX), parseDouble(key, value));
            } else if (key.startsWith(DECIMALS_PREFIX)) {
                builder.decimalPlaces(kindOf(key, DECIMALS_PREFIX), parseInt(key, value));
            } else if (MAX_TEMP_KEY.equals(key)) {
                builder.avgDeviationMaxTemp(parseDouble(key, value));
            } else if (MIN_TEMP_KEY.equals(key)) {
                builder.avgDeviationMinTemp(parseDouble(key, value));
            } else if (CAPACITY_KEY.equals(key)) {
                builder.powerCapacityBudget(parseDouble(key, value));
            } else if (PREVIEW_KEY.equals(key)) {
                builder.previewLimit(parseInt(key, value));
            } else if (ZONE_KEY.equals(key)) {
                builder.zone(parseZone(key, value));
            } else if (POOL_SIZE_KEY.equals(key)) {
                builder.poolSize(parseInt(key, value));
            }
        }
        return builder.build();
    }

    private static FunctionKind kindOf(String key, String prefix) {
        String id = key.substring(prefix.length());
        return FunctionKind.fromId(id)
                .orElseThrow(
                        () -> new IllegalArgumentException("Unknown function kind in " + key));
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static ZoneId parseZone(String key, String value) {
        try {
            return ZoneId.of(value);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid zone for " + key + ": " + value, e);
        }
    }

    public Builder toBuilder() {
        Builder builder = builder();
        builder.thresholds.clear();
        builder.thresholds.putAll(thresholds);
        builder.decimalPlaces.clear();
        builder.decimalPlaces.putAll(decimalPlaces);
        return builder.avgDeviationMaxTemp(avgDeviationMaxTemp)
                .avgDeviationMinTemp(avgDeviationMinTemp)
                .powerCapacityBudget(powerCapacityBudget)
                .previewLimit(previewLimit)
                .zone(zone)
                .poolSize(poolSize);
    }

    /// Creates a builder pre-populated with the built-in defaults.
    ///
    /// @return new builder, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link ColdtagConfig}.
    public static final class Builder {
        private final Map<FunctionKind, Double> thresholds = new EnumMap<>(FunctionKind.class);
        private final Map<FunctionKind, Integer> decimalPlaces =
                new EnumMap<>(FunctionKind.class);
        private double avgDeviationMaxTemp = 8;
        private double avgDeviationMinTemp = 2;
        private double powerCapacityBudget = 90;
        private int previewLimit = 10;
        private ZoneId zone = ZoneId.systemDefault();
        private int poolSize = 4;

        private Builder() {
            for (FunctionKind kind : FunctionKind.values()) {
                kind.getDefaultThreshold().ifPresent(value -> thresholds.put(kind, value));
                if (kind.requires(InputRole.DECIMAL_PLACES)) {
                    decimalPlaces.put(kind, kind.getPrecision().orElse(2));
                }
            }
        }

        /// Overrides the default threshold of a threshold kind.
        ///
        /// @param kind a kind with a threshold, not null
        /// @param threshold the new default, must be finite
        /// @return this builder for chaining
        /// @throws IllegalArgumentException if the kind has no threshold or the value is not finite
        public Builder threshold(FunctionKind kind, double threshold) {
            Objects.requireNonNull(kind, "kind must not be null");
            if (!kind.requires(InputRole.THRESHOLD)) {
                throw new IllegalArgumentException(kind.getId() + " has no threshold");
            }
            if (!Double.isFinite(threshold)) {
                throw new IllegalArgumentException("threshold must be finite: " + threshold);
            }
            thresholds.put(kind, threshold);
            return this;
        }

        /// Overrides the default precision of a kind with tunable precision.
        ///
        /// @param kind a kind with tunable precision, not null
        /// @param places decimal places, between 0 and 20
        /// @return this builder for chaining
        /// @throws IllegalArgumentException if the kind's precision is fixed or `places` is out
        ///     of range
        public Builder decimalPlaces(FunctionKind kind, int places) {
            Objects.requireNonNull(kind, "kind must not be null");
            if (!kind.requires(InputRole.DECIMAL_PLACES)) {
                throw new IllegalArgumentException(kind.getId() + " has a fixed precision");
            }
            if (places < 0 || places > MAX_DECIMALS) {
                throw new IllegalArgumentException(
                        "decimal places must be between 0 and " + MAX_DECIMALS + ": " + places);
            }
            decimalPlaces.put(kind, places);
            return this;
        }

        public Builder avgDeviationMaxTemp(double avgDeviationMaxTemp) {
            this.avgDeviationMaxTemp = avgDeviationMaxTemp;
            return this;
        }

        public Builder avgDeviationMinTemp(double avgDeviationMinTemp) {
            this.avgDeviationMinTemp = avgDeviationMinTemp;
            return this;
        }

        public Builder powerCapacityBudget(double powerCapacityBudget) {
            this.powerCapacityBudget = powerCapacityBudget;
            return this;
        }

        /// Sets the preview limit.
        ///
        /// @param previewLimit lines per preview section, must be positive
        /// @return this builder for chaining
        public Builder previewLimit(int previewLimit) {
            if (previewLimit <= 0) {
                throw new IllegalArgumentException("previewLimit must be positive: " + previewLimit);
            }
            this.previewLimit = previewLimit;
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = Objects.requireNonNull(zone, "zone must not be null");
            return this;
        }

        /// Sets the batch worker count.
        ///
        /// @param poolSize number of workers, must be positive
        /// @return this builder for chaining
        public Builder poolSize(int poolSize) {
            if (poolSize <= 0) {
                throw new IllegalArgumentException("poolSize must be positive: " + poolSize);
            }
            this.poolSize = poolSize;
            return this;
        }

        public ColdtagConfig build() {
            return new ColdtagConfig(this);
        }
    }
}
