package io.coldtag.core.function;

/// The five families of computation a {@link FunctionKind} belongs to.
public enum AlgorithmFamily {

    /// Max, min or mean of one measure over the matched readings.
    SCALAR,

    /// Threshold arrival, exceed and first-reach-time detection.
    THRESHOLD,

    /// Device or time of the extreme temperature.
    EXTREMUM,

    /// Minute-bucketed and per-device spread metrics (uniformity, variation, fluctuation).
    MINUTE_BUCKET,

    /// Metrics combining readings with values taken from other tags (center point, power,
    /// time point, cooling rate, average deviation).
    EXTERNAL_VALUE
}
