package io.github.samzhu.advisor.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import io.github.samzhu.advisor.document.ProjectBaseline;
import io.github.samzhu.advisor.document.UsageEvent;

/**
 * 測試用的事件與基準線工廠。
 */
final class EventFixtures {

    static final String PROJECT = "proj-1";
    static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private EventFixtures() {
    }

    static UsageEvent event(String agent, String model, long inputTokens, long outputTokens,
            double cost, long latencyMs, boolean success, String inputHash, Instant timestamp) {
        return new UsageEvent(UUID.randomUUID().toString(), PROJECT, agent, model,
            inputTokens, outputTokens, cost, latencyMs, timestamp, success, inputHash);
    }

    static UsageEvent call(String agent, String model, double cost, long latencyMs) {
        return event(agent, model, 100, 50, cost, latencyMs, true, null, NOW.minus(Duration.ofHours(1)));
    }

    static UsageEvent failedCall(String agent, String model, double cost) {
        return event(agent, model, 100, 50, cost, 300, false, null, NOW.minus(Duration.ofHours(1)));
    }

    static UsageEvent hashed(String agent, String hash, double cost, Instant timestamp) {
        return event(agent, "gpt-4o", 100, 50, cost, 300, true, hash, timestamp);
    }

    static List<UsageEvent> calls(int count, String agent, String model, double cost, long latencyMs) {
        List<UsageEvent> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(call(agent, model, cost, latencyMs));
        }
        return events;
    }

    static ProjectBaseline baseline(String agent, String model,
            double avgCost, double stddevCost,
            double avgLatency, double stddevLatency,
            double errorRate) {
        return new ProjectBaseline(ProjectBaseline.createId(PROJECT, agent, model), PROJECT, agent, model,
            avgCost, stddevCost, 100, 0, 50, 0, avgLatency, stddevLatency, avgLatency, avgLatency,
            10, errorRate, 100, NOW.minus(Duration.ofDays(1)));
    }
}
