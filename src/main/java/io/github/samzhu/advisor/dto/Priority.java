package io.github.samzhu.advisor.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 建議優先級，同時作為異常嚴重度。
 */
public enum Priority {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    Priority(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
