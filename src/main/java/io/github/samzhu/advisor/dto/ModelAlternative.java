package io.github.samzhu.advisor.dto;

/**
 * 定價服務回傳的替代模型。
 *
 * @param model 替代模型名稱
 * @param savings 每千 token 的價差與節省百分比
 * @param qualityImpact 預期品質影響
 * @param source {@code learned}（有實際實施紀錄）或 {@code dynamic}（僅依定價推算）
 * @param confidenceScore 信心分數 (0-1)
 * @param timesImplemented 此替代方案被實施的次數
 * @param savingsAccuracy 實際節省 / 預估節省的平均值，無資料時為 null
 */
public record ModelAlternative(
    String model,
    Savings savings,
    QualityImpact qualityImpact,
    String source,
    double confidenceScore,
    int timesImplemented,
    Double savingsAccuracy
) {

    /**
     * 價差資訊。
     *
     * @param inputPer1k 每千輸入 token 的價差 (USD)
     * @param outputPer1k 每千輸出 token 的價差 (USD)
     * @param percentage 以平均 token 組合估算的節省百分比
     */
    public record Savings(
        double inputPer1k,
        double outputPer1k,
        double percentage
    ) {}
}
