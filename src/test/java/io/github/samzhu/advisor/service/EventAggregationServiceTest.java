package io.github.samzhu.advisor.service;

import static io.github.samzhu.advisor.service.EventFixtures.CLOCK;
import static io.github.samzhu.advisor.service.EventFixtures.NOW;
import static io.github.samzhu.advisor.service.EventFixtures.PROJECT;
import static io.github.samzhu.advisor.service.EventFixtures.call;
import static io.github.samzhu.advisor.service.EventFixtures.event;
import static io.github.samzhu.advisor.service.EventFixtures.failedCall;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.advisor.document.UsageEvent;
import io.github.samzhu.advisor.dto.AgentModelKey;
import io.github.samzhu.advisor.dto.GroupStats;
import io.github.samzhu.advisor.repository.UsageEventRepository;
import io.github.samzhu.advisor.util.TimeWindow;

class EventAggregationServiceTest {

    private UsageEventRepository eventRepository;
    private EventAggregationService aggregationService;

    @BeforeEach
    void setUp() {
        eventRepository = mock(UsageEventRepository.class);
        aggregationService = new EventAggregationService(eventRepository);
    }

    @Test
    void shouldQueryClosedWindow() {
        // Given
        TimeWindow window = TimeWindow.lastDays(CLOCK, 7);
        List<UsageEvent> events = List.of(call("bot", "gpt-4", 0.1, 200));
        when(eventRepository.findInWindow(PROJECT, NOW.minus(Duration.ofDays(7)), NOW)).thenReturn(events);

        // When
        List<UsageEvent> result = aggregationService.findEvents(PROJECT, window);

        // Then
        assertThat(result).isEqualTo(events);
        verify(eventRepository).findInWindow(PROJECT, NOW.minus(Duration.ofDays(7)), NOW);
    }

    @Test
    void shouldSummarizeWithSampleStddev() {
        // Given: 成本 1, 2, 3, 4，其中一筆失敗
        List<UsageEvent> events = List.of(
            call("bot", "gpt-4", 1.0, 100),
            call("bot", "gpt-4", 2.0, 200),
            call("bot", "gpt-4", 3.0, 300),
            failedCall("bot", "gpt-4", 4.0));

        // When
        GroupStats stats = aggregationService.summarize(events);

        // Then
        // mean = 2.5, sample variance = (2.25 + 0.25 + 0.25 + 2.25) / 3 = 1.6667
        assertThat(stats.callCount()).isEqualTo(4);
        assertThat(stats.errorCount()).isEqualTo(1);
        assertThat(stats.totalCost()).isCloseTo(10.0, within(1e-9));
        assertThat(stats.failedCost()).isCloseTo(4.0, within(1e-9));
        assertThat(stats.costPerCall().mean()).isCloseTo(2.5, within(1e-9));
        assertThat(stats.costPerCall().stddev()).isCloseTo(Math.sqrt(5.0 / 3.0), within(1e-9));
        assertThat(stats.errorRate()).isEqualTo(0.25);
        assertThat(stats.totalInputTokens()).isEqualTo(400);
        assertThat(stats.totalOutputTokens()).isEqualTo(200);
    }

    @Test
    void shouldReturnZeroStddevForIdenticalValues() {
        // Given
        List<UsageEvent> events = EventFixtures.calls(25, "bot", "gpt-4", 0.1, 500);

        // When
        GroupStats stats = aggregationService.summarize(events);

        // Then
        assertThat(stats.costPerCall().stddev()).isZero();
        assertThat(stats.latencyMs().stddev()).isZero();
        assertThat(stats.latencyMs().mean()).isEqualTo(500.0);
    }

    @Test
    void shouldReturnZeroStddevForSingleEvent() {
        // When
        GroupStats stats = aggregationService.summarize(List.of(call("bot", "gpt-4", 0.5, 800)));

        // Then
        assertThat(stats.costPerCall().mean()).isEqualTo(0.5);
        assertThat(stats.costPerCall().stddev()).isZero();
    }

    @Test
    void shouldAverageDailyCallsOverActiveUtcDays() {
        // Given: 3 筆在 2/27，1 筆在 2/28
        List<UsageEvent> events = List.of(
            event("bot", "gpt-4", 10, 10, 0.1, 100, true, null, Instant.parse("2026-02-27T01:00:00Z")),
            event("bot", "gpt-4", 10, 10, 0.1, 100, true, null, Instant.parse("2026-02-27T12:00:00Z")),
            event("bot", "gpt-4", 10, 10, 0.1, 100, true, null, Instant.parse("2026-02-27T23:59:59Z")),
            event("bot", "gpt-4", 10, 10, 0.1, 100, true, null, Instant.parse("2026-02-28T00:00:00Z")));

        // When
        GroupStats stats = aggregationService.summarize(events);

        // Then
        assertThat(stats.activeDays()).isEqualTo(2);
        assertThat(stats.avgDailyCalls()).isEqualTo(2.0);
    }

    @Test
    void shouldReturnEmptyStatsForNoEvents() {
        // When
        GroupStats stats = aggregationService.summarize(List.of());

        // Then
        assertThat(stats.callCount()).isZero();
        assertThat(stats.errorRate()).isZero();
        assertThat(stats.avgDailyCalls()).isZero();
    }

    @Test
    void shouldGroupByAgentAndModel() {
        // Given
        List<UsageEvent> events = List.of(
            call("bot", "gpt-4", 0.1, 100),
            call("search", "gpt-4o", 0.2, 100),
            call("bot", "gpt-4", 0.3, 100),
            call("bot", "gpt-4o", 0.4, 100));

        // When
        Map<AgentModelKey, GroupStats> groups = aggregationService.summarizeByAgentAndModel(events);

        // Then
        assertThat(groups.keySet()).containsExactly(
            new AgentModelKey("bot", "gpt-4"),
            new AgentModelKey("search", "gpt-4o"),
            new AgentModelKey("bot", "gpt-4o"));
        assertThat(groups.get(new AgentModelKey("bot", "gpt-4")).callCount()).isEqualTo(2);
        assertThat(groups.get(new AgentModelKey("bot", "gpt-4")).totalCost()).isCloseTo(0.4, within(1e-9));
    }
}
