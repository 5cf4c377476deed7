package io.github.samzhu.advisor.dto;

/**
 * 一組用量事件的統計摘要。
 *
 * <p>由 {@link io.github.samzhu.advisor.service.EventAggregationService#summarize} 產生，
 * 供基準線計算與各分析器使用。標準差採樣本標準差 (n-1)，少於 2 筆時為 0。
 *
 * @param callCount 呼叫數
 * @param errorCount 失敗呼叫數
 * @param totalCost 總成本 (USD)
 * @param failedCost 失敗呼叫的成本 (USD)
 * @param totalInputTokens 總輸入 token
 * @param totalOutputTokens 總輸出 token
 * @param costPerCall 每次呼叫成本統計
 * @param inputTokens 輸入 token 統計
 * @param outputTokens 輸出 token 統計
 * @param latencyMs 延遲統計
 * @param activeDays 有事件的 UTC 日數
 * @param avgDailyCalls 有事件的日子的平均每日呼叫數
 */
public record GroupStats(
    int callCount,
    int errorCount,
    double totalCost,
    double failedCost,
    long totalInputTokens,
    long totalOutputTokens,
    MetricStats costPerCall,
    MetricStats inputTokens,
    MetricStats outputTokens,
    MetricStats latencyMs,
    int activeDays,
    double avgDailyCalls
) {

    /**
     * 平均值與標準差。
     */
    public record MetricStats(
        double mean,
        double stddev
    ) {
        public static MetricStats empty() {
            return new MetricStats(0.0, 0.0);
        }
    }

    public static GroupStats empty() {
        return new GroupStats(0, 0, 0.0, 0.0, 0, 0,
            MetricStats.empty(), MetricStats.empty(), MetricStats.empty(), MetricStats.empty(), 0, 0.0);
    }

    /**
     * @return 錯誤率 (0.0 - 1.0)，沒有呼叫時為 0
     */
    public double errorRate() {
        return callCount > 0 ? (double) errorCount / callCount : 0.0;
    }
}
