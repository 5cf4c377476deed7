package io.github.samzhu.advisor.service;

import static io.github.samzhu.advisor.service.EventFixtures.CLOCK;
import static io.github.samzhu.advisor.service.EventFixtures.NOW;
import static io.github.samzhu.advisor.service.EventFixtures.PROJECT;
import static io.github.samzhu.advisor.service.EventFixtures.baseline;
import static io.github.samzhu.advisor.service.EventFixtures.call;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import io.github.samzhu.advisor.config.AdvisorProperties;
import io.github.samzhu.advisor.document.ProjectBaseline;
import io.github.samzhu.advisor.document.UsageEvent;
import io.github.samzhu.advisor.dto.AgentModelKey;
import io.github.samzhu.advisor.dto.BaselineRefreshResult;
import io.github.samzhu.advisor.repository.ProjectBaselineRepository;
import io.github.samzhu.advisor.repository.UsageEventRepository;
import io.github.samzhu.advisor.util.TimeWindow;

class BaselineServiceTest {

    private UsageEventRepository eventRepository;
    private ProjectBaselineRepository baselineRepository;
    private BaselineService baselineService;

    @BeforeEach
    void setUp() {
        eventRepository = mock(UsageEventRepository.class);
        baselineRepository = mock(ProjectBaselineRepository.class);
        baselineService = new BaselineService(
            baselineRepository,
            new EventAggregationService(eventRepository),
            AdvisorProperties.defaults(),
            CLOCK);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldComputeBaselineForGroupsWithEnoughSamples() {
        // Given: bot/gpt-4 有 12 筆，search/gpt-4o 只有 5 筆
        List<UsageEvent> events = new ArrayList<>();
        double costSum = 0;
        for (int i = 1; i <= 12; i++) {
            double cost = 0.01 * i;
            costSum += cost;
            events.add(call("bot", "gpt-4", cost, 100L * i));
        }
        events.addAll(EventFixtures.calls(5, "search", "gpt-4o", 0.02, 300));
        when(eventRepository.findInWindow(eq(PROJECT), any(), any())).thenReturn(events);

        // When
        BaselineRefreshResult result = baselineService.computeBaselines(PROJECT, 30);

        // Then
        ArgumentCaptor<List<ProjectBaseline>> captor = ArgumentCaptor.forClass(List.class);
        verify(baselineRepository).saveAll(captor.capture());
        List<ProjectBaseline> saved = captor.getValue();

        assertThat(saved).hasSize(1);
        ProjectBaseline b = saved.get(0);
        assertThat(b.id()).isEqualTo("proj-1_bot_gpt-4");
        assertThat(b.sampleCount()).isEqualTo(12);
        assertThat(b.avgCostPerCall()).isCloseTo(costSum / 12, within(1e-6));
        assertThat(b.avgLatencyMs()).isCloseTo(650.0, within(1e-6));
        assertThat(b.stddevLatencyMs()).isGreaterThan(0);
        assertThat(b.p50LatencyMs()).isBetween(500.0, 800.0);
        assertThat(b.p95LatencyMs()).isBetween(1000.0, 1200.0);
        assertThat(b.avgErrorRate()).isZero();
        assertThat(b.lastCalculatedAt()).isEqualTo(NOW);

        assertThat(result.baselinesComputed()).isEqualTo(1);
        assertThat(result.eventCount()).isEqualTo(17);
        assertThat(result.groupsSkipped()).containsExactly(new AgentModelKey("search", "gpt-4o"));
    }

    @Test
    void shouldNotSaveWhenNoGroupQualifies() {
        // Given
        when(eventRepository.findInWindow(eq(PROJECT), any(), any()))
            .thenReturn(EventFixtures.calls(9, "bot", "gpt-4", 0.1, 200));

        // When
        BaselineRefreshResult result = baselineService.computeBaselines(PROJECT, 30);

        // Then
        assertThat(result.baselinesComputed()).isZero();
        verify(baselineRepository, never()).saveAll(anyIterable());
    }

    @Test
    void shouldSkipBootstrapWhenBaselinesExist() {
        // Given
        when(baselineRepository.existsByProjectId(PROJECT)).thenReturn(true);

        // When
        boolean computed = baselineService.ensureBaselinesExist(PROJECT, TimeWindow.lastDays(CLOCK, 30),
            EventFixtures.calls(10, "bot", "gpt-4", 0.1, 200));

        // Then
        assertThat(computed).isFalse();
        verify(baselineRepository, never()).saveAll(anyIterable());
    }

    @Test
    void shouldBootstrapWhenNoBaselinesExist() {
        // Given
        when(baselineRepository.existsByProjectId(PROJECT)).thenReturn(false);
        List<UsageEvent> loaded = EventFixtures.calls(10, "bot", "gpt-4", 0.1, 200);

        // When
        boolean computed = baselineService.ensureBaselinesExist(PROJECT, TimeWindow.lastDays(CLOCK, 30), loaded);

        // Then: 使用已載入的事件，不再查詢
        assertThat(computed).isTrue();
        verify(baselineRepository).saveAll(anyIterable());
        verify(eventRepository, never()).findInWindow(any(), any(), any());
    }

    @Test
    void shouldComputeFromSuppliedEventsWithoutQuerying() {
        // Given
        TimeWindow window = TimeWindow.lastDays(CLOCK, 7);
        List<UsageEvent> loaded = new ArrayList<>(EventFixtures.calls(10, "bot", "gpt-4", 0.1, 200));
        loaded.addAll(EventFixtures.calls(3, "search", "gpt-4o", 0.02, 300));

        // When
        BaselineRefreshResult result = baselineService.computeBaselines(PROJECT, window, loaded);

        // Then
        assertThat(result.days()).isEqualTo(7);
        assertThat(result.eventCount()).isEqualTo(13);
        assertThat(result.baselinesComputed()).isEqualTo(1);
        assertThat(result.calculatedAt()).isEqualTo(NOW);
        verify(eventRepository, never()).findInWindow(any(), any(), any());
    }

    @Test
    void shouldReturnEmptyForMissingBaseline() {
        // Given
        when(baselineRepository.findByProjectIdAndAgentNameAndModel(PROJECT, "bot", "gpt-4"))
            .thenReturn(Optional.empty());

        // When / Then
        assertThat(baselineService.getBaseline(PROJECT, "bot", "gpt-4")).isEmpty();
    }

    @Test
    void shouldFilterBaselinesByAgentOrModel() {
        // Given
        ProjectBaseline bot = baseline("bot", "gpt-4", 0.1, 0.01, 500, 50, 0.0);
        ProjectBaseline search = baseline("search", "gpt-4", 0.1, 0.01, 500, 50, 0.0);
        when(baselineRepository.findByProjectIdAndAgentName(PROJECT, "bot")).thenReturn(List.of(bot));
        when(baselineRepository.findByProjectIdAndModel(PROJECT, "gpt-4")).thenReturn(List.of(bot, search));
        when(baselineRepository.findByProjectIdAndAgentNameAndModel(PROJECT, "search", "gpt-4"))
            .thenReturn(Optional.of(search));

        // When / Then
        assertThat(baselineService.getBaselines(PROJECT, "bot", null)).containsExactly(bot);
        assertThat(baselineService.getBaselines(PROJECT, null, "gpt-4")).containsExactly(bot, search);
        assertThat(baselineService.getBaselines(PROJECT, "search", "gpt-4")).containsExactly(search);
    }
}
