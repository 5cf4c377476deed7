package io.github.samzhu.advisor.dto.api;

import java.util.List;

import io.github.samzhu.advisor.dto.CachingOpportunity;
import io.github.samzhu.advisor.util.Rounding;

/**
 * 快取機會 API 回應。
 *
 * <p>用於 GET /api/v1/optimizations/caching-opportunities 端點。
 */
public record CachingOpportunitiesResponse(
    String projectId,
    int minOccurrences,
    double totalMonthlySavings,
    List<CachingOpportunity> opportunities
) {
    public static CachingOpportunitiesResponse of(String projectId, int minOccurrences,
            List<CachingOpportunity> opportunities) {
        double total = opportunities.stream().mapToDouble(CachingOpportunity::estimatedMonthlySavings).sum();
        return new CachingOpportunitiesResponse(
            projectId,
            minOccurrences,
            Rounding.money(total),
            opportunities.stream().map(CachingOpportunity::rounded).toList());
    }
}
