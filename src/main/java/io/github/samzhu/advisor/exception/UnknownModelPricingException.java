package io.github.samzhu.advisor.exception;

/**
 * 未知模型定價異常。
 *
 * <p>當事件中的模型沒有配置定價時拋出。
 *
 * <p>處理方式：
 * <ul>
 *   <li>模型替代分析會略過該 (agent, model) 群組，其餘分析照常進行</li>
 *   <li>應在 application.yaml 的 {@code advisor.pricing} 新增該模型的定價配置</li>
 * </ul>
 */
public class UnknownModelPricingException extends RuntimeException {

    private final String modelName;

    public UnknownModelPricingException(String modelName) {
        super(String.format("Unknown model pricing: model='%s'. " +
            "Please add pricing configuration under advisor.pricing in application.yaml", modelName));
        this.modelName = modelName;
    }

    public String getModelName() {
        return modelName;
    }
}
