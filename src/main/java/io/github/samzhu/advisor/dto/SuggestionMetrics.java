package io.github.samzhu.advisor.dto;

import io.github.samzhu.advisor.util.Rounding;

/**
 * 建議附帶的分析指標，每種建議類型對應一種 record。
 */
public sealed interface SuggestionMetrics {

    /**
     * @return 套用統一捨入規則後的副本
     */
    SuggestionMetrics rounded();

    /**
     * 模型替代建議指標。
     */
    record ModelDowngrade(
        int currentCalls,
        double currentMonthlyCost,
        double avgOutputTokens,
        double avgInputTokens,
        double savingsPercentage,
        QualityImpact qualityImpact,
        String source,
        double confidenceScore,
        int timesImplemented,
        Double savingsAccuracy
    ) implements SuggestionMetrics {
        @Override
        public ModelDowngrade rounded() {
            return new ModelDowngrade(currentCalls, Rounding.money(currentMonthlyCost),
                Rounding.scale(avgOutputTokens, 1), Rounding.scale(avgInputTokens, 1),
                Rounding.percent(savingsPercentage), qualityImpact, source,
                Rounding.scale(confidenceScore, 2), timesImplemented,
                savingsAccuracy != null ? Rounding.scale(savingsAccuracy, 2) : null);
        }
    }

    /**
     * 快取建議指標。
     */
    record Caching(
        int uniquePatterns,
        int totalCalls,
        int duplicateCalls,
        double duplicateRate
    ) implements SuggestionMetrics {
        @Override
        public Caching rounded() {
            return new Caching(uniquePatterns, totalCalls, duplicateCalls, Rounding.percent(duplicateRate));
        }
    }

    /**
     * 異常警示指標。
     */
    record AnomalyAlert(
        AnomalyMetric metric,
        double currentValue,
        double baselineMean,
        double baselineStddev,
        double zScore
    ) implements SuggestionMetrics {
        @Override
        public AnomalyAlert rounded() {
            return new AnomalyAlert(metric, Rounding.measurement(currentValue),
                Rounding.measurement(baselineMean), Rounding.measurement(baselineStddev),
                Rounding.zScore(zScore));
        }
    }

    /**
     * 錯誤減少建議指標，錯誤率以百分比表示。
     */
    record ErrorReduction(
        int totalCalls,
        int errorCount,
        double errorRate,
        double baselineErrorRate,
        double wastedCost
    ) implements SuggestionMetrics {
        @Override
        public ErrorReduction rounded() {
            return new ErrorReduction(totalCalls, errorCount, Rounding.percent(errorRate),
                Rounding.percent(baselineErrorRate), Rounding.money(wastedCost));
        }
    }

    /**
     * 延遲（prompt 優化）建議指標。
     */
    record Latency(
        double avgLatencyMs,
        double baselineLatencyMs,
        double zScore,
        double avgInputTokens
    ) implements SuggestionMetrics {
        @Override
        public Latency rounded() {
            return new Latency(Rounding.scale(avgLatencyMs, 0), Rounding.scale(baselineLatencyMs, 0),
                Rounding.zScore(zScore), Rounding.scale(avgInputTokens, 0));
        }
    }
}
