package io.github.samzhu.advisor.dto;

/**
 * 建議成效統計。
 *
 * @param total 建議總數
 * @param pending 待處理（未過期）數
 * @param implemented 已實施數
 * @param dismissed 已忽略數
 * @param expired 已過期數（含逾期仍為 PENDING 的記錄）
 * @param implementationRate 已實施 / (已實施 + 已忽略 + 已過期) × 100
 * @param estimatedMonthlySavings 已實施建議的預估每月節省總和
 * @param actualMonthlySavings 已回報實際節省的建議之實際節省總和
 * @param savingsAccuracy 實際 / 預估節省（僅計算有回報的建議），無資料時為 null
 */
public record RecommendationEffectiveness(
    long total,
    long pending,
    long implemented,
    long dismissed,
    long expired,
    double implementationRate,
    double estimatedMonthlySavings,
    double actualMonthlySavings,
    Double savingsAccuracy
) {}
