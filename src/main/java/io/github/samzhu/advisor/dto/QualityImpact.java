package io.github.samzhu.advisor.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 改用較便宜模型時預期的能力落差。
 */
public enum QualityImpact {
    MINIMAL("minimal"),
    MODERATE("moderate"),
    SIGNIFICANT("significant");

    private final String value;

    QualityImpact(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * 依能力等級差距判斷品質影響。
     *
     * @param tierDrop 目前模型等級減去替代模型等級
     * @return 0 以下為 minimal，1 為 moderate，2 以上為 significant
     */
    public static QualityImpact fromTierDrop(int tierDrop) {
        if (tierDrop <= 0) {
            return MINIMAL;
        }
        if (tierDrop == 1) {
            return MODERATE;
        }
        return SIGNIFICANT;
    }
}
