package io.github.samzhu.advisor.exception;

/**
 * 定價服務無法回應時拋出，例如學習資料查詢失敗。
 *
 * <p>呼叫端只略過受影響模型的替代分析。
 */
public class PricingUnavailableException extends RuntimeException {

    private final String modelName;

    public PricingUnavailableException(String modelName, Throwable cause) {
        super(String.format("Pricing lookup failed for model '%s'", modelName), cause);
        this.modelName = modelName;
    }

    public String getModelName() {
        return modelName;
    }
}
