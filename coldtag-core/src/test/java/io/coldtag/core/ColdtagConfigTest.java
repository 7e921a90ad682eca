package io.coldtag.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.coldtag.core.function.FunctionKind;
import java.time.ZoneId;
import java.util.Properties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ColdtagConfig")
class ColdtagConfigTest {

    @Nested
    @DisplayName("defaults")
    class Defaults {

        @Test
        void shouldSeedThresholdsFromKinds() {
            ColdtagConfig config = ColdtagConfig.defaults();

            assertThat(config.threshold(FunctionKind.TEMP_REACH_UPPER)).hasValue(8.0);
            assertThat(config.threshold(FunctionKind.TEMP_EXCEED_LOWER)).hasValue(2.0);
            assertThat(config.threshold(FunctionKind.HUMIDITY_REACH_UPPER)).hasValue(80.0);
            assertThat(config.threshold(FunctionKind.HUMIDITY_EXCEED_LOWER)).hasValue(20.0);
            assertThat(config.threshold(FunctionKind.TEMP_FIRST_REACH_LOWER_TIME)).hasValue(2.0);
            assertThat(config.threshold(FunctionKind.MAX_TEMP)).isEmpty();
        }

        @Test
        void shouldUseCanonicalPrecisionForFixedKinds() {
            ColdtagConfig config = ColdtagConfig.defaults();

            assertThat(config.decimalPlaces(FunctionKind.TEMP_FLUCTUATION)).isEqualTo(2);
            assertThat(config.decimalPlaces(FunctionKind.AVG_COOLING_RATE)).isEqualTo(3);
            assertThat(config.decimalPlaces(FunctionKind.MAX_TEMP_LOCATION)).isZero();
        }

        @Test
        void shouldCarryRuntimeDefaults() {
            ColdtagConfig config = ColdtagConfig.defaults();

            assertThat(config.getAvgDeviationMaxTemp()).isEqualTo(8.0);
            assertThat(config.getAvgDeviationMinTemp()).isEqualTo(2.0);
            assertThat(config.getPowerCapacityBudget()).isEqualTo(90.0);
            assertThat(config.getPreviewLimit()).isEqualTo(10);
            assertThat(config.getPoolSize()).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("builder")
    class Builder {

        @Test
        void shouldRejectThresholdForKindWithoutThreshold() {
            assertThatThrownBy(() -> ColdtagConfig.builder().threshold(FunctionKind.MAX_TEMP, 5))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("maxTemp");
        }

        @Test
        void shouldRejectNonFiniteThreshold() {
            assertThatThrownBy(
                            () ->
                                    ColdtagConfig.builder()
                                            .threshold(FunctionKind.TEMP_REACH_UPPER, Double.NaN))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldRejectDecimalPlacesForFixedPrecisionKind() {
            assertThatThrownBy(() -> ColdtagConfig.builder().decimalPlaces(FunctionKind.AVG_TEMP, 2))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldKeepOriginalUntouchedWhenDerivingCopy() {
            ColdtagConfig original = ColdtagConfig.defaults();

            ColdtagConfig copy =
                    original.toBuilder().threshold(FunctionKind.TEMP_REACH_UPPER, 6).build();

            assertThat(copy.threshold(FunctionKind.TEMP_REACH_UPPER)).hasValue(6.0);
            assertThat(original.threshold(FunctionKind.TEMP_REACH_UPPER)).hasValue(8.0);
        }
    }

    @Nested
    @DisplayName("fromProperties")
    class FromProperties {

        @Test
        void shouldReadEveryKey() {
            // Given
            Properties properties = new Properties();
            properties.setProperty("coldtag.threshold.tempReachUpper", "7.5");
            properties.setProperty("coldtag.decimals.tempUniformityAverage", "3");
            properties.setProperty("coldtag.avg-deviation.max-temp", "10");
            properties.setProperty("coldtag.avg-deviation.min-temp", "0");
            properties.setProperty("coldtag.power.capacity-budget", "80");
            properties.setProperty("coldtag.detail.preview-limit", "5");
            properties.setProperty("coldtag.zone", "Asia/Shanghai");
            properties.setProperty("coldtag.pool-size", "2");
            properties.setProperty("other.key", "ignored");

            // When
            ColdtagConfig config = ColdtagConfig.fromProperties(properties);

            // Then
            assertThat(config.threshold(FunctionKind.TEMP_REACH_UPPER)).hasValue(7.5);
            assertThat(config.decimalPlaces(FunctionKind.TEMP_UNIFORMITY_AVERAGE)).isEqualTo(3);
            assertThat(config.getAvgDeviationMaxTemp()).isEqualTo(10.0);
            assertThat(config.getAvgDeviationMinTemp()).isZero();
            assertThat(config.getPowerCapacityBudget()).isEqualTo(80.0);
            assertThat(config.getPreviewLimit()).isEqualTo(5);
            assertThat(config.getZone()).isEqualTo(ZoneId.of("Asia/Shanghai"));
            assertThat(config.getPoolSize()).isEqualTo(2);
        }

        @Test
        void shouldRejectMalformedNumber() {
            Properties properties = new Properties();
            properties.setProperty("coldtag.power.capacity-budget", "lots");

            assertThatThrownBy(() -> ColdtagConfig.fromProperties(properties))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("coldtag.power.capacity-budget");
        }

        @Test
        void shouldRejectUnknownKind() {
            Properties properties = new Properties();
            properties.setProperty("coldtag.threshold.tempWarmest", "3");

            assertThatThrownBy(() -> ColdtagConfig.fromProperties(properties))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unknown function kind");
        }

        @Test
        void shouldRejectUnknownZone() {
            Properties properties = new Properties();
            properties.setProperty("coldtag.zone", "Mars/Olympus");

            assertThatThrownBy(() -> ColdtagConfig.fromProperties(properties))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
