package io.github.samzhu.advisor.dto.api;

import jakarta.validation.constraints.NotNull;

/**
 * 回報實際節省請求。
 *
 * <p>用於 POST /api/v1/optimizations/recommendations/{id}/actual-savings 端點。
 */
public record ActualSavingsRequest(
    @NotNull(message = "actualMonthlySavings is required")
    Double actualMonthlySavings
) {}
