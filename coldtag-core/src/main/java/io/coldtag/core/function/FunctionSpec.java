package io.coldtag.core.function;

import java.util.List;
import java.util.Objects;

/// Sealed hierarchy of typed function descriptions.
///
/// A {@link FunctionConfig} carries every field any kind might read; a spec carries only the
/// inputs its kind actually needs, already validated for presence and with defaults applied.
///
/// ### Permitted Subtypes
/// - {@link Scalar} - max, min or mean of a measure
/// - {@link Threshold} - arrival, exceed and first-reach-time detection
/// - {@link Extremum} - device or time of the extreme temperature
/// - {@link Bucket} - minute-bucketed and per-device spread metrics
/// - {@link CenterPoint} - deviation from a center-point set value
/// - {@link AvgDeviation} - temperature band minus mean of device means
/// - {@link Power} - battery consumption metrics
/// - {@link TimePoint} - one device's temperature at one minute
/// - {@link CoolingRate} - mean cooling rate between two minutes
///
/// @implNote Thread-safe. All permitted subtypes are immutable records.
///
/// @see FunctionSpecBinder for construction from a config
/// @see io.coldtag.core.metric.MetricRegistry for dispatch
public sealed interface FunctionSpec
        permits FunctionSpec.Scalar,
                FunctionSpec.Threshold,
                FunctionSpec.Extremum,
                FunctionSpec.Bucket,
                FunctionSpec.CenterPoint,
                FunctionSpec.AvgDeviation,
                FunctionSpec.Power,
                FunctionSpec.TimePoint,
                FunctionSpec.CoolingRate {

    /// Returns the kind this spec describes.
    ///
    /// @return the kind, never null
    FunctionKind kind();

    record Scalar(FunctionKind kind, WindowRef window) implements FunctionSpec {
        public Scalar {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(window, "window must not be null");
        }
    }

    /// @param threshold the threshold, override or default
    record Threshold(FunctionKind kind, WindowRef window, double threshold)
            implements FunctionSpec {
        public Threshold {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(window, "window must not be null");
        }

        /// Checks whether the predicate is `value >= threshold` rather than `value <= threshold`.
        public boolean isUpper() {
            return switch (kind) {
                case TEMP_REACH_UPPER,
                        HUMIDITY_REACH_UPPER,
                        TEMP_EXCEED_UPPER,
                        HUMIDITY_EXCEED_UPPER,
                        TEMP_FIRST_REACH_UPPER_TIME -> true;
                default -> false;
            };
        }

        /// Checks whether a value satisfies this spec's predicate.
        public boolean reached(double value) {
            return isUpper() ? value >= threshold : value <= threshold;
        }
    }

    record Extremum(FunctionKind kind, WindowRef window) implements FunctionSpec {
        public Extremum {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(window, "window must not be null");
        }

        /// Checks whether the kind looks for the maximum rather than the minimum.
        public boolean isMax() {
            return kind == FunctionKind.MAX_TEMP_LOCATION || kind == FunctionKind.TEMP_MAX_TIME;
        }
    }

    /// @param decimals precision applied to the result
    record Bucket(FunctionKind kind, WindowRef window, int decimals) implements FunctionSpec {
        public Bucket {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(window, "window must not be null");
        }
    }

    /// @param centerPointTagId tag holding the center point's set temperature, not null
    record CenterPoint(FunctionKind kind, WindowRef window, String centerPointTagId)
            implements FunctionSpec {
        public CenterPoint {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(window, "window must not be null");
            Objects.requireNonNull(centerPointTagId, "centerPointTagId must not be null");
        }
    }

    record AvgDeviation(FunctionKind kind, WindowRef window, TempBound max, TempBound min)
            implements FunctionSpec {
        public AvgDeviation {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(window, "window must not be null");
            Objects.requireNonNull(max, "max must not be null");
            Objects.requireNonNull(min, "min must not be null");
        }
    }

    /// Start and end of the power window plus the tags holding the start and end charge.
    record Power(
            FunctionKind kind,
            String startTagId,
            String endTagId,
            String startPowerTagId,
            String endPowerTagId)
            implements FunctionSpec {
        public Power {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(startPowerTagId, "startPowerTagId must not be null");
            Objects.requireNonNull(endPowerTagId, "endPowerTagId must not be null");
        }
    }

    /// @param locationTagIds location tags that must resolve to exactly one device
    /// @param timeTagId tag holding the time point, not null
    record TimePoint(FunctionKind kind, List<String> locationTagIds, String timeTagId)
            implements FunctionSpec {
        public TimePoint {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(timeTagId, "timeTagId must not be null");
            locationTagIds = locationTagIds != null ? List.copyOf(locationTagIds) : List.of();
        }
    }

    record CoolingRate(FunctionKind kind, WindowRef window) implements FunctionSpec {
        public CoolingRate {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(window, "window must not be null");
        }
    }

    /// One bound of the temperature band: read from a tag when `tagId` is set, else the
    /// literal `fallback`.
    ///
    /// @param tagId tag holding the bound, may be null
    /// @param fallback literal or configured default used without a tag
    record TempBound(String tagId, double fallback) {

        public boolean fromTag() {
            return tagId != null && !tagId.isBlank();
        }
    }
}
