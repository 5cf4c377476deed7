package io.github.samzhu.advisor.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import io.github.samzhu.advisor.config.AdvisorProperties.AnomalyConfig;
import io.github.samzhu.advisor.config.AdvisorProperties.PriorityConfig;
import io.github.samzhu.advisor.dto.Priority;

class AdvisorPropertiesTest {

    @Test
    void shouldFillMissingSectionsWithDefaults() {
        // When
        AdvisorProperties properties = AdvisorProperties.defaults();

        // Then
        assertThat(properties.baseline().minSamples()).isEqualTo(10);
        assertThat(properties.anomaly().zThreshold()).isEqualTo(2.0);
        assertThat(properties.caching().minOccurrences()).isEqualTo(5);
        assertThat(properties.suggestion().minActionableSavings()).isEqualTo(1.0);
        assertThat(properties.recommendation().cooldownDays()).isEqualTo(14);
        assertThat(properties.recommendation().persistLimit()).isEqualTo(10);
        assertThat(properties.pricing()).isEmpty();
    }

    @Test
    void shouldReplaceNonPositiveValues() {
        // When: 只設定部分欄位時，其餘欄位綁定為 0
        AnomalyConfig anomaly = new AnomalyConfig(2.5, 0, 0, 0, 0);

        // Then
        assertThat(anomaly.zThreshold()).isEqualTo(2.5);
        assertThat(anomaly.highZThreshold()).isEqualTo(3.0);
        assertThat(anomaly.errorRateRatio()).isEqualTo(1.5);
        assertThat(anomaly.recentHours()).isEqualTo(24);
    }

    @Test
    void shouldClassifyPriorityBySavings() {
        // Given
        PriorityConfig priority = PriorityConfig.defaults();

        // When / Then
        assertThat(priority.classify(50.0)).isEqualTo(Priority.HIGH);
        assertThat(priority.classify(49.99)).isEqualTo(Priority.MEDIUM);
        assertThat(priority.classify(10.0)).isEqualTo(Priority.MEDIUM);
        assertThat(priority.classify(9.99)).isEqualTo(Priority.LOW);
        assertThat(priority.classify(0.0)).isEqualTo(Priority.LOW);
    }
}
