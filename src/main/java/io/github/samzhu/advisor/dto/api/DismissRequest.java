package io.github.samzhu.advisor.dto.api;

import jakarta.validation.constraints.Size;

/**
 * 忽略建議請求。
 *
 * <p>用於 POST /api/v1/optimizations/recommendations/{id}/dismiss 端點，body 可省略。
 */
public record DismissRequest(
    @Size(max = 1000, message = "feedback must be at most 1000 characters")
    String feedback
) {}
