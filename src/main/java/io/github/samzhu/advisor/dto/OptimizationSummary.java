package io.github.samzhu.advisor.dto;

import java.util.List;
import java.util.Map;

/**
 * 優化摘要。
 *
 * @param totalPotentialSavingsMonthly 所有建議的每月預估節省總和
 * @param totalPotentialSavingsPercent 佔目前每月支出的百分比
 * @param currentMonthlySpend 依視窗換算的每月支出
 * @param suggestionCount 建議數
 * @param highPriorityCount high 優先級建議數
 * @param byType 各類型（以 {@code type} 值為鍵）的建議數與節省
 * @param effectiveness 建議成效統計
 * @param suggestions 前 N 筆建議
 * @param hasData 視窗內是否有事件
 * @param hasBaselines 是否已有基準線
 * @param eventCount 視窗內事件數
 * @param emptyReason 沒有建議時的原因，有建議時為 null
 */
public record OptimizationSummary(
    double totalPotentialSavingsMonthly,
    double totalPotentialSavingsPercent,
    double currentMonthlySpend,
    int suggestionCount,
    int highPriorityCount,
    Map<String, TypeBreakdown> byType,
    RecommendationEffectiveness effectiveness,
    List<Suggestion> suggestions,
    boolean hasData,
    boolean hasBaselines,
    long eventCount,
    EmptyReason emptyReason
) {

    /**
     * 單一建議類型的統計。
     *
     * @param count 建議數
     * @param savings 每月預估節省總和
     */
    public record TypeBreakdown(
        int count,
        double savings
    ) {}
}
