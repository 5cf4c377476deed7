package io.github.samzhu.advisor.dto.api;

import java.util.List;

import io.github.samzhu.advisor.dto.Suggestion;

/**
 * 建議清單 API 回應。
 *
 * <p>用於 GET /api/v1/optimizations 與 POST /api/v1/optimizations/recommendations/generate 端點。
 */
public record SuggestionListResponse(
    String projectId,
    int days,
    int count,
    List<Suggestion> suggestions
) {
    public static SuggestionListResponse of(String projectId, int days, List<Suggestion> suggestions) {
        return new SuggestionListResponse(projectId, days, suggestions.size(), suggestions);
    }
}
