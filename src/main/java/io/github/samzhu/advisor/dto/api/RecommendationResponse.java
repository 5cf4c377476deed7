package io.github.samzhu.advisor.dto.api;

import java.time.Instant;
import java.util.Map;

import io.github.samzhu.advisor.document.Recommendation;
import io.github.samzhu.advisor.document.RecommendationStatus;
import io.github.samzhu.advisor.dto.SuggestionType;

/**
 * 建議記錄 API 回應。
 *
 * <p>用於 GET /api/v1/optimizations/recommendations 與實施/忽略端點。
 */
public record RecommendationResponse(
    String id,
    SuggestionType type,
    String title,
    String description,
    String agentName,
    String model,
    String alternativeModel,
    double estimatedMonthlySavings,
    double estimatedSavingsPercent,
    Map<String, Object> metrics,
    RecommendationStatus status,
    Instant createdAt,
    Instant expiresAt,
    Instant implementedAt,
    Instant dismissedAt,
    String dismissFeedback,
    Double actualMonthlySavings
) {
    public static RecommendationResponse fromRecommendation(Recommendation r) {
        return new RecommendationResponse(
            r.id(),
            r.recommendationType(),
            r.title(),
            r.description(),
            r.agentName(),
            r.model(),
            r.alternativeModel(),
            r.estimatedMonthlySavings(),
            r.estimatedSavingsPercent(),
            r.metricsSnapshot(),
            r.status(),
            r.createdAt(),
            r.expiresAt(),
            r.implementedAt(),
            r.dismissedAt(),
            r.dismissFeedback(),
            r.actualMonthlySavings()
        );
    }
}
