package io.coldtag.core.function;

import io.coldtag.core.result.FunctionStatus;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Stored description of the function attached to a tag.
///
/// This is the flat record the report editor persists: a function type identifier plus every
/// tag reference and literal any kind may read, and the snapshot of the last run. Only the
/// fields relevant to the configured kind are read; {@link FunctionSpecBinder} turns a config
/// into the typed {@link FunctionSpec} the algorithms consume.
///
/// The `last*` fields are history only and never feed a computation.
///
/// @implNote Immutable. Use {@link #toBuilder()} to derive a modified copy.
public final class FunctionConfig {

    private final String functionType;
    private final List<String> locationTagIds;
    private final String startTagId;
    private final String endTagId;
    private final Double threshold;
    private final String centerPointTagId;
    private final String maxTempTagId;
    private final String minTempTagId;
    private final Double maxTemp;
    private final Double minTemp;
    private final String startPowerTagId;
    private final String endPowerTagId;
    private final String timeTagId;
    private final Integer decimalPlaces;
    private final Instant lastRunAt;
    private final FunctionStatus lastStatus;
    private final String lastMessage;
    private final Object lastResult;

    private FunctionConfig(Builder builder) {
        this.functionType = builder.functionType;
        this.locationTagIds =
                builder.locationTagIds != null ? List.copyOf(builder.locationTagIds) : List.of();
        this.startTagId = builder.startTagId;
        this.endTagId = builder.endTagId;
        this.threshold = builder.threshold;
        this.centerPointTagId = builder.centerPointTagId;
        this.maxTempTagId = builder.maxTempTagId;
        this.minTempTagId = builder.minTempTagId;
        this.maxTemp = builder.maxTemp;
        this.minTemp = builder.minTemp;
        this.startPowerTagId = builder.startPowerTagId;
        this.endPowerTagId = builder.endPowerTagId;
        this.timeTagId = builder.timeTagId;
        this.decimalPlaces = builder.decimalPlaces;
        this.lastRunAt = builder.lastRunAt;
        this.lastStatus = builder.lastStatus;
        this.lastMessage = builder.lastMessage;
        this.lastResult = builder.lastResult;
    }

    /// Returns the raw function type identifier.
    ///
    /// @return identifier such as `maxTemp`, may be null or outside the catalogue
    public String getFunctionType() {
        return functionType;
    }

    /// Resolves the function type against the catalogue.
    ///
    /// @return the kind, or empty when the identifier is unknown
    public Optional<FunctionKind> getKind() {
        return FunctionKind.fromId(functionType);
    }

    /// Returns the referenced location tag ids.
    ///
    /// @return unmodifiable list, never null
    public List<String> getLocationTagIds() {
        return locationTagIds;
    }

    public String getStartTagId() {
        return startTagId;
    }

    public String getEndTagId() {
        return endTagId;
    }

    /// Returns the threshold override.
    ///
    /// @return the override, null to use the kind's default
    public Double getThreshold() {
        return threshold;
    }

    public String getCenterPointTagId() {
        return centerPointTagId;
    }

    public String getMaxTempTagId() {
        return maxTempTagId;
    }

    public String getMinTempTagId() {
        return minTempTagId;
    }

    /// Returns the literal maximum temperature, used when no max-temperature tag is set.
    public Double getMaxTemp() {
        return maxTemp;
    }

    /// Returns the literal minimum temperature, used when no min-temperature tag is set.
    public Double getMinTemp() {
        return minTemp;
    }

    public String getStartPowerTagId() {
        return startPowerTagId;
    }

    public String getEndPowerTagId() {
        return endPowerTagId;
    }

    public String getTimeTagId() {
        return timeTagId;
    }

    /// Returns the precision override for kinds with a tunable precision.
    ///
    /// @return the override, null to use the configured default
    public Integer getDecimalPlaces() {
        return decimalPlaces;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public FunctionStatus getLastStatus() {
        return lastStatus;
    }

    /// Returns the log text of the last run (detail log, or message when there was none).
    public String getLastMessage() {
        return lastMessage;
    }

    /// Returns the value of the last run.
    ///
    /// @return the value, an empty string after a failed run, null before the first run
    public Object getLastResult() {
        return lastResult;
    }

    public Builder toBuilder() {
        return builder()
                .functionType(functionType)
                .locationTagIds(locationTagIds)
                .startTagId(startTagId)
                .endTagId(endTagId)
                .threshold(threshold)
                .centerPointTagId(centerPointTagId)
                .maxTempTagId(maxTempTagId)
                .minTempTagId(minTempTagId)
                .maxTemp(maxTemp)
                .minTemp(minTemp)
                .startPowerTagId(startPowerTagId)
                .endPowerTagId(endPowerTagId)
                .timeTagId(timeTagId)
                .decimalPlaces(decimalPlaces)
                .lastRunAt(lastRunAt)
                .lastStatus(lastStatus)
                .lastMessage(lastMessage)
                .lastResult(lastResult);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FunctionConfig)) {
            return false;
        }
        FunctionConfig that = (FunctionConfig) o;
        return Objects.equals(functionType, that.functionType)
                && locationTagIds.equals(that.locationTagIds)
                && Objects.equals(startTagId, that.startTagId)
                && Objects.equals(endTagId, that.endTagId)
                && Objects.equals(threshold, that.threshold)
                && Objects.equals(centerPointTagId, that.centerPointTagId)
                && Objects.equals(maxTempTagId, that.maxTempTagId)
                && Objects.equals(minTempTagId, that.minTempTagId)
                && Objects.equals(maxTemp, that.maxTemp)
                && Objects.equals(minTemp, that.minTemp)
                && Objects.equals(startPowerTagId, that.startPowerTagId)
                && Objects.equals(endPowerTagId, that.endPowerTagId)
                && Objects.equals(timeTagId, that.timeTagId)
                && Objects.equals(decimalPlaces, that.decimalPlaces)
                && Objects.equals(lastRunAt, that.lastRunAt)
                && lastStatus == that.lastStatus
                && Objects.equals(lastMessage, that.lastMessage)
                && Objects.equals(lastResult, that.lastResult);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                functionType,
                locationTagIds,
                startTagId,
                endTagId,
                threshold,
                centerPointTagId,
                timeTagId,
                lastRunAt,
                lastStatus);
    }

    @Override
    public String toString() {
        return "FunctionConfig{functionType='"
                + functionType
                + "', locationTagIds="
                + locationTagIds
                + ", lastStatus="
                + lastStatus
                + '}';
    }

    public static final class Builder {
        private String functionType;
        private List<String> locationTagIds;
        private String startTagId;
        private String endTagId;
        private Double threshold;
        private String centerPointTagId;
        private String maxTempTagId;
        private String minTempTagId;
        private Double maxTemp;
        private Double minTemp;
        private String startPowerTagId;
        private String endPowerTagId;
        private String timeTagId;
        private Integer decimalPlaces;
        private Instant lastRunAt;
        private FunctionStatus lastStatus;
        private String lastMessage;
        private Object lastResult;

        private Builder() {}

        public Builder functionType(String functionType) {
            this.functionType = functionType;
            return this;
        }

        /// Sets the function type from a catalogue kind.
        public Builder kind(FunctionKind kind) {
            this.functionType = kind != null ? kind.getId() : null;
            return this;
        }

        public Builder locationTagIds(List<String> locationTagIds) {
            this.locationTagIds = locationTagIds;
            return this;
        }

        public Builder startTagId(String startTagId) {
            this.startTagId = startTagId;
            return this;
        }

        public Builder endTagId(String endTagId) {
            this.endTagId = endTagId;
            return this;
        }

        public Builder threshold(Double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder centerPointTagId(String centerPointTagId) {
            this.centerPointTagId = centerPointTagId;
            return this;
        }

        public Builder maxTempTagId(String maxTempTagId) {
            this.maxTempTagId = maxTempTagId;
            return this;
        }

        public Builder minTempTagId(String minTempTagId) {
            this.minTempTagId = minTempTagId;
            return this;
        }

        public Builder maxTemp(Double maxTemp) {
            this.maxTemp = maxTemp;
            return this;
        }

        public Builder minTemp(Double minTemp) {
            this.minTemp = minTemp;
            return this;
        }

        public Builder startPowerTagId(String startPowerTagId) {
            this.startPowerTagId = startPowerTagId;
            return this;
        }

        public Builder endPowerTagId(String endPowerTagId) {
            this.endPowerTagId = endPowerTagId;
            return this;
        }

        public Builder timeTagId(String timeTagId) {
            this.timeTagId = timeTagId;
            return this;
        }

        public Builder decimalPlaces(Integer decimalPlaces) {
            this.decimalPlaces = decimalPlaces;
            return this;
        }

        public Builder lastRunAt(Instant lastRunAt) {
            this.lastRunAt = lastRunAt;
            return this;
        }

        public Builder lastStatus(FunctionStatus lastStatus) {
            this.lastStatus = lastStatus;
            return this;
        }

        public Builder lastMessage(String lastMessage) {
            this.lastMessage = lastMessage;
            return this;
        }

        public Builder lastResult(Object lastResult) {
            this.lastResult = lastResult;
            return this;
        }

        public FunctionConfig build() {
            return new FunctionConfig(this);
        }
    }
}
