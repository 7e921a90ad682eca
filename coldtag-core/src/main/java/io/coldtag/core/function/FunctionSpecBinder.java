package io.coldtag.core.function;

import io.coldtag.core.ColdtagConfig;
import io.coldtag.core.exception.EvaluationException;
import io.coldtag.core.result.ErrorCode;
import java.util.List;
import java.util.Objects;

/// Turns a flat {@link FunctionConfig} into the typed {@link FunctionSpec} of its kind.
///
/// Every required {@link InputRole} is checked for presence, in role order, before anything
/// is looked up or queried; the first absent role fails the bind with
/// {@link ErrorCode#MISSING_INPUT}. Defaulted roles take the config's override or the
/// {@link ColdtagConfig} default.
///
/// @implNote Stateless and thread-safe.
public class FunctionSpecBinder {

    private static final int MAX_DECIMALS = 20;

    private final ColdtagConfig config;

    public FunctionSpecBinder(ColdtagConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /// Binds a config to its kind's spec.
    ///
    /// @param kind the resolved kind, not null
    /// @param functionConfig the stored config, not null
    /// @param taskId the task whose readings are queried, may be null
    /// @return the typed spec, never null
    /// @throws EvaluationException with {@link ErrorCode#MISSING_INPUT} naming the first absent
    ///     role, or {@link ErrorCode#INVALID_VALUE} for an out-of-range precision override
    public FunctionSpec bind(FunctionKind kind, FunctionConfig functionConfig, String taskId)
            throws EvaluationException {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(functionConfig, "functionConfig must not be null");

        for (InputRole role : kind.getInputRoles()) {
            if (!role.isDefaulted() && !isPresent(role, functionConfig, taskId)) {
                throw new EvaluationException(ErrorCode.MISSING_INPUT, role.getMissingMessage());
            }
        }

        WindowRef window =
                new WindowRef(
                        functionConfig.getLocationTagIds(),
                        functionConfig.getStartTagId(),
                        functionConfig.getEndTagId());

        return switch (kind) {
            case CENTER_POINT_TEMP_DEVIATION -> new FunctionSpec.CenterPoint(
                    kind, window, functionConfig.getCenterPointTagId());
            case TEMP_AVG_DEVIATION -> new FunctionSpec.AvgDeviation(
                    kind,
                    window,
                    new FunctionSpec.TempBound(
                            functionConfig.getMaxTempTagId(),
                            orDefault(functionConfig.getMaxTemp(), config.getAvgDeviationMaxTemp())),
                    new FunctionSpec.TempBound(
                            functionConfig.getMinTempTagId(),
                            orDefault(functionConfig.getMinTemp(), config.getAvgDeviationMinTemp())));
            case POWER_CONSUMPTION_RATE, MAX_POWER_USAGE_DURATION -> new FunctionSpec.Power(
                    kind,
                    functionConfig.getStartTagId(),
                    functionConfig.getEndTagId(),
                    functionConfig.getStartPowerTagId(),
                    functionConfig.getEndPowerTagId());
            case DEVICE_TIME_POINT_TEMP -> new FunctionSpec.TimePoint(
                    kind, functionConfig.getLocationTagIds(), functionConfig.getTimeTagId());
            case AVG_COOLING_RATE -> new FunctionSpec.CoolingRate(kind, window);
            default -> bindFamily(kind, window, functionConfig);
        };
    }

    private FunctionSpec bindFamily(FunctionKind kind, WindowRef window, FunctionConfig functionConfig)
            throws EvaluationException {
        return switch (kind.getFamily()) {
            case SCALAR -> new FunctionSpec.Scalar(kind, window);
            case THRESHOLD -> new FunctionSpec.Threshold(
                    kind, window, threshold(kind, functionConfig));
            case EXTREMUM -> new FunctionSpec.Extremum(kind, window);
            case MINUTE_BUCKET -> new FunctionSpec.Bucket(
                    kind, window, decimals(kind, functionConfig));
            default -> throw new IllegalStateException("No spec shape for function kind " + kind);
        };
    }

    private static boolean isPresent(InputRole role, FunctionConfig config, String taskId) {
        return switch (role) {
            case TASK -> hasText(taskId);
            case LOCATIONS, SINGLE_LOCATION -> hasAny(config.getLocationTagIds());
            case START_TIME -> hasText(config.getStartTagId());
            case END_TIME -> hasText(config.getEndTagId());
            case START_POWER -> hasText(config.getStartPowerTagId());
            case END_POWER -> hasText(config.getEndPowerTagId());
            case CENTER_POINT -> hasText(config.getCenterPointTagId());
            case TIME_POINT -> hasText(config.getTimeTagId());
            default -> true;
        };
    }

    private double threshold(FunctionKind kind, FunctionConfig functionConfig) {
        Double override = functionConfig.getThreshold();
        if (override != null) {
            return override;
        }
        return config.threshold(kind).orElse(0);
    }

    private int decimals(FunctionKind kind, FunctionConfig functionConfig)
            throws EvaluationException {
        Integer override = kind.requires(InputRole.DECIMAL_PLACES)
                ? functionConfig.getDecimalPlaces()
                : null;
        if (override == null) {
            return config.decimalPlaces(kind);
        }
        if (override < 0 || override > MAX_DECIMALS) {
            throw new EvaluationException(ErrorCode.INVALID_VALUE, "小数位数无效: " + override);
        }
        return override;
    }

    private static double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean hasAny(List<String> ids) {
        for (String id : ids) {
            if (hasText(id)) {
                return true;
            }
        }
        return false;
    }
}
