package io.github.samzhu.advisor.service;

import java.util.List;

import io.github.samzhu.advisor.dto.ModelAlternative;

/**
 * 替代模型查詢介面。
 *
 * <p>模型替代分析只依賴此介面，預設實作為 {@link PricingService}。
 */
public interface ModelAlternativeProvider {

    /**
     * 查詢比目前模型便宜的替代模型。
     *
     * @param model 目前模型
     * @param avgInputTokens 平均輸入 token
     * @param avgOutputTokens 平均輸出 token
     * @param maxResults 最多回傳筆數
     * @return 依預估節省降序排列的替代模型，沒有時為空列表
     * @throws io.github.samzhu.advisor.exception.UnknownModelPricingException 目前模型沒有定價
     * @throws io.github.samzhu.advisor.exception.PricingUnavailableException 定價資料無法取得
     */
    List<ModelAlternative> discoverAlternatives(String model, double avgInputTokens,
            double avgOutputTokens, int maxResults);
}
