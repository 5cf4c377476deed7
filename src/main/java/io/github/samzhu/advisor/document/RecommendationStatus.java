package io.github.samzhu.advisor.document;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 建議狀態。
 *
 * <p>狀態只能單向轉換：{@code PENDING → IMPLEMENTED | DISMISSED | EXPIRED}，
 * 後三者為終止狀態。
 */
public enum RecommendationStatus {
    PENDING("pending"),
    IMPLEMENTED("implemented"),
    DISMISSED("dismissed"),
    EXPIRED("expired");

    private final String value;

    RecommendationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }
}
