package io.coldtag.core.reading;

/// The physical quantity a metric reads from a {@link Reading}.
public enum Measure {
    TEMPERATURE {
        @Override
        public double of(Reading reading) {
            return reading.temperature();
        }
    },

    HUMIDITY {
        @Override
        public double of(Reading reading) {
            return reading.humidity();
        }
    };

    /// Extracts this measure from a reading.
    ///
    /// @param reading the sample, not null
    /// @return the sampled value, may be NaN
    public abstract double of(Reading reading);
}
