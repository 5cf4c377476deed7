package io.github.samzhu.advisor.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 優化建議類型。
 *
 * <p>{@link #PROMPT_OPTIMIZATION} 由延遲分析器產生（延遲偏高通常來自過長的 prompt）。
 */
public enum SuggestionType {
    MODEL_DOWNGRADE("model_downgrade"),
    CACHING("caching"),
    PROMPT_OPTIMIZATION("prompt_optimization"),
    ERROR_REDUCTION("error_reduction"),
    ANOMALY_ALERT("anomaly_alert");

    private final String value;

    SuggestionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
