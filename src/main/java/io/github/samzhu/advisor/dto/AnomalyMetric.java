package io.github.samzhu.advisor.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 異常偵測評估的指標。
 */
public enum AnomalyMetric {
    COST_PER_CALL("cost_per_call", "cost"),
    LATENCY_MS("latency_ms", "latency"),
    ERROR_RATE("error_rate", "error");

    private final String value;
    private final String label;

    AnomalyMetric(String value, String label) {
        this.value = value;
        this.label = label;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** @return 用於標題與描述的簡短名稱 */
    public String label() {
        return label;
    }
}
