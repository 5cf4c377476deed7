package io.github.samzhu.advisor.dto;

/**
 * 單一指標的異常評估結果（不持久化）。
 *
 * <p>{@link io.github.samzhu.advisor.service.AnomalyDetectionService} 回傳所有被評估的指標，
 * 呼叫端依 {@code anomaly} 過濾。
 *
 * @param agentName agent 名稱
 * @param model 模型名稱
 * @param metric 評估的指標
 * @param currentValue 近期視窗的數值
 * @param baselineMean 基準線平均
 * @param baselineStddev 基準線標準差
 * @param zScore 偏離基準線的標準差數
 * @param severity 嚴重度
 * @param anomaly 是否判定為異常
 */
public record Anomaly(
    String agentName,
    String model,
    AnomalyMetric metric,
    double currentValue,
    double baselineMean,
    double baselineStddev,
    double zScore,
    Priority severity,
    boolean anomaly
) {

    /**
     * @return 指標名稱，例如 {@code cost_per_call}
     */
    public String metricName() {
        return metric.value();
    }

    /**
     * @return 當前值是否高於基準線
     */
    public boolean isAboveBaseline() {
        return currentValue > baselineMean;
    }

    /**
     * @return 用於描述的上下文，格式為 {@code agent/model}
     */
    public String context() {
        return agentName + "/" + model;
    }
}
