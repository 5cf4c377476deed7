package io.github.samzhu.advisor.dto.api;

import java.time.Instant;

import io.github.samzhu.advisor.document.ProjectBaseline;
import io.github.samzhu.advisor.util.Rounding;

/**
 * 基準線 API 回應。
 *
 * <p>用於 GET /api/v1/optimizations/baselines 端點。
 */
public record BaselineResponse(
    String agentName,
    String model,
    Stat costPerCall,
    Stat inputTokens,
    Stat outputTokens,
    LatencyStat latencyMs,
    double avgDailyCalls,
    double avgErrorRate,
    int sampleCount,
    Instant lastCalculatedAt
) {

    /**
     * 平均值與標準差。
     */
    public record Stat(
        double avg,
        double stddev
    ) {}

    /**
     * 延遲統計（含百分位）。
     */
    public record LatencyStat(
        double avg,
        double stddev,
        double p50,
        double p95
    ) {}

    public static BaselineResponse fromBaseline(ProjectBaseline b) {
        return new BaselineResponse(
            b.agentName(),
            b.model(),
            new Stat(Rounding.measurement(b.avgCostPerCall()), Rounding.measurement(b.stddevCostPerCall())),
            new Stat(Rounding.scale(b.avgInputTokens(), 1), Rounding.scale(b.stddevInputTokens(), 1)),
            new Stat(Rounding.scale(b.avgOutputTokens(), 1), Rounding.scale(b.stddevOutputTokens(), 1)),
            new LatencyStat(
                Rounding.scale(b.avgLatencyMs(), 1),
                Rounding.scale(b.stddevLatencyMs(), 1),
                Rounding.scale(b.p50LatencyMs(), 1),
                Rounding.scale(b.p95LatencyMs(), 1)),
            Rounding.scale(b.avgDailyCalls(), 1),
            Rounding.measurement(b.avgErrorRate()),
            b.sampleCount(),
            b.lastCalculatedAt()
        );
    }
}
