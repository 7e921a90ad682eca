package io.coldtag.core.function;

/// An input a function kind reads besides the readings themselves.
///
/// Roles are validated in declaration order, so the first missing required role is the one
/// reported. Defaulted roles (threshold, max/min temperature, decimal places) fall back to the
/// configured defaults and are never missing.
public enum InputRole {
    TASK("未关联任务，无法计算", false),
    LOCATIONS("请选择至少一个布点标签，且标签值不能为空", false),
    SINGLE_LOCATION("请选择一个布点标签，且标签值不能为空", false),
    START_TIME("请选择开始时间标签", false),
    END_TIME("请选择结束时间标签", false),
    START_POWER("请选择开始电量和结束电量标签", false),
    END_POWER("请选择开始电量和结束电量标签", false),
    CENTER_POINT("请选择中心点布点标签", false),
    TIME_POINT("请选择时间标签", false),
    THRESHOLD(null, true),
    MAX_TEMP(null, true),
    MIN_TEMP(null, true),
    DECIMAL_PLACES(null, true);

    private final String missingMessage;
    private final boolean defaulted;

    InputRole(String missingMessage, boolean defaulted) {
        this.missingMessage = missingMessage;
        this.defaulted = defaulted;
    }

    /// Returns the message reported when this role is absent from a config.
    ///
    /// @return user-facing message, null for defaulted roles
    public String getMissingMessage() {
        return missingMessage;
    }

    public boolean isDefaulted() {
        return defaulted;
    }
}
