package io.github.samzhu.advisor.service;

import static io.github.samzhu.advisor.service.EventFixtures.CLOCK;
import static io.github.samzhu.advisor.service.EventFixtures.PROJECT;
import static io.github.samzhu.advisor.service.EventFixtures.baseline;
import static io.github.samzhu.advisor.service.EventFixtures.calls;
import static io.github.samzhu.advisor.service.EventFixtures.failedCall;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.advisor.config.AdvisorProperties;
import io.github.samzhu.advisor.document.UsageEvent;
import io.github.samzhu.advisor.dto.Anomaly;
import io.github.samzhu.advisor.dto.AnomalyMetric;
import io.github.samzhu.advisor.dto.Priority;
import io.github.samzhu.advisor.repository.ProjectBaselineRepository;
import io.github.samzhu.advisor.repository.UsageEventRepository;

class AnomalyDetectionServiceTest {

    private UsageEventRepository eventRepository;
    private ProjectBaselineRepository baselineRepository;
    private AnomalyDetectionService anomalyService;

    @BeforeEach
    void setUp() {
        eventRepository = mock(UsageEventRepository.class);
        baselineRepository = mock(ProjectBaselineRepository.class);
        anomalyService = new AnomalyDetectionService(
            baselineRepository,
            new EventAggregationService(eventRepository),
            AdvisorProperties.defaults(),
            CLOCK);
    }

    @Test
    void shouldFlagHighLatencyAnomaly() {
        // Given: 基準延遲 500ms ± 50ms，近期平均 700ms
        when(baselineRepository.findByProjectId(PROJECT))
            .thenReturn(List.of(baseline("bot", "gpt-4", 0.1, 0.0, 500, 50, 0.0)));
        when(eventRepository.findInWindow(eq(PROJECT), any(), any()))
            .thenReturn(calls(20, "bot", "gpt-4", 0.1, 700));

        // When
        List<Anomaly> anomalies = anomalyService.detectAnomalies(PROJECT, 24);

        // Then: z = (700 - 500) / 50 = 4.0
        Anomaly latency = find(anomalies, AnomalyMetric.LATENCY_MS);
        assertThat(latency.zScore()).isCloseTo(4.0, within(1e-9));
        assertThat(latency.anomaly()).isTrue();
        assertThat(latency.severity()).isEqualTo(Priority.HIGH);
        assertThat(latency.metricName()).isEqualTo("latency_ms");
    }

    @Test
    void shouldSkipMetricsWithZeroStddev() {
        // Given: 成本與延遲標準差皆為 0
        when(baselineRepository.findByProjectId(PROJECT))
            .thenReturn(List.of(baseline("bot", "gpt-4", 0.1, 0.0, 500, 0.0, 0.0)));
        when(eventRepository.findInWindow(eq(PROJECT), any(), any()))
            .thenReturn(calls(20, "bot", "gpt-4", 5.0, 9000));

        // When
        List<Anomaly> anomalies = anomalyService.detectAnomalies(PROJECT, 24);

        // Then: 只剩錯誤率被評估
        assertThat(anomalies).extracting(Anomaly::metric).containsExactly(AnomalyMetric.ERROR_RATE);
        assertThat(anomalies.get(0).anomaly()).isFalse();
    }

    @Test
    void shouldRateMediumZScoreAtTwoSigma() {
        // Given: 成本 0.10 ± 0.02，近期 0.15 → z = 2.5
        when(baselineRepository.findByProjectId(PROJECT))
            .thenReturn(List.of(baseline("bot", "gpt-4", 0.10, 0.02, 500, 0.0, 0.0)));
        when(eventRepository.findInWindow(eq(PROJECT), any(), any()))
            .thenReturn(calls(10, "bot", "gpt-4", 0.15, 500));

        // When
        Anomaly cost = find(anomalyService.detectAnomalies(PROJECT, 24), AnomalyMetric.COST_PER_CALL);

        // Then
        assertThat(cost.zScore()).isCloseTo(2.5, within(1e-6));
        assertThat(cost.anomaly()).isTrue();
        assertThat(cost.severity()).isEqualTo(Priority.MEDIUM);
    }

    @Test
    void shouldNotFlagSmallDeviation() {
        // Given: z = 1.0
        when(baselineRepository.findByProjectId(PROJECT))
            .thenReturn(List.of(baseline("bot", "gpt-4", 0.10, 0.02, 500, 0.0, 0.0)));
        when(eventRepository.findInWindow(eq(PROJECT), any(), any()))
            .thenReturn(calls(10, "bot", "gpt-4", 0.12, 500));

        // When
        Anomaly cost = find(anomalyService.detectAnomalies(PROJECT, 24), AnomalyMetric.COST_PER_CALL);

        // Then
        assertThat(cost.anomaly()).isFalse();
        assertThat(cost.severity()).isEqualTo(Priority.LOW);
    }

    @Test
    void shouldFlagErrorRateByRatio() {
        // Given: 基準錯誤率 2%，近期 3/10 = 30%（超過 2 倍）
        when(baselineRepository.findByProjectId(PROJECT))
            .thenReturn(List.of(baseline("bot", "gpt-4", 0.1, 0.0, 500, 0.0, 0.02)));
        List<UsageEvent> events = new ArrayList<>(calls(7, "bot", "gpt-4", 0.1, 500));
        for (int i = 0; i < 3; i++) {
            events.add(failedCall("bot", "gpt-4", 0.1));
        }
        when(eventRepository.findInWindow(eq(PROJECT), any(), any())).thenReturn(events);

        // When
        Anomaly errorRate = find(anomalyService.detectAnomalies(PROJECT, 24), AnomalyMetric.ERROR_RATE);

        // Then
        assertThat(errorRate.currentValue()).isCloseTo(0.3, within(1e-9));
        assertThat(errorRate.anomaly()).isTrue();
        assertThat(errorRate.severity()).isEqualTo(Priority.HIGH);
        // Bernoulli 標準差 sqrt(0.02 × 0.98)
        assertThat(errorRate.baselineStddev()).isCloseTo(Math.sqrt(0.02 * 0.98), within(1e-9));
    }

    @Test
    void shouldRateMediumErrorRateBetweenRatios() {
        // Given: 基準 12%，近期 2/10 = 20%（1.5 倍 18% 以上、2 倍 24% 以下）
        when(baselineRepository.findByProjectId(PROJECT))
            .thenReturn(List.of(baseline("bot", "gpt-4", 0.1, 0.0, 500, 0.0, 0.12)));
        List<UsageEvent> events = new ArrayList<>(calls(8, "bot", "gpt-4", 0.1, 500));
        events.add(failedCall("bot", "gpt-4", 0.1));
        events.add(failedCall("bot", "gpt-4", 0.1));
        when(eventRepository.findInWindow(eq(PROJECT), any(), any())).thenReturn(events);

        // When
        Anomaly errorRate = find(anomalyService.detectAnomalies(PROJECT, 24), AnomalyMetric.ERROR_RATE);

        // Then
        assertThat(errorRate.anomaly()).isTrue();
        assertThat(errorRate.severity()).isEqualTo(Priority.MEDIUM);
    }

    @Test
    void shouldSkipBaselinesWithoutRecentEvents() {
        // Given
        when(baselineRepository.findByProjectId(PROJECT))
            .thenReturn(List.of(baseline("bot", "gpt-4", 0.1, 0.01, 500, 50, 0.0)));
        when(eventRepository.findInWindow(eq(PROJECT), any(), any()))
            .thenReturn(calls(10, "other", "gpt-4", 0.1, 500));

        // When / Then
        assertThat(anomalyService.detectAnomalies(PROJECT, 24)).isEmpty();
    }

    @Test
    void shouldNotQueryEventsWithoutBaselines() {
        // Given
        when(baselineRepository.findByProjectId(PROJECT)).thenReturn(List.of());

        // When / Then
        assertThat(anomalyService.detectAnomalies(PROJECT, 24)).isEmpty();
        verify(eventRepository, never()).findInWindow(any(), any(), any());
    }

    private Anomaly find(List<Anomaly> anomalies, AnomalyMetric metric) {
        return anomalies.stream()
            .filter(a -> a.metric() == metric)
            .findFirst()
            .orElseThrow(() -> new AssertionError("No " + metric.value() + " anomaly evaluated"));
    }
}
