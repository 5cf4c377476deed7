package io.github.samzhu.advisor.dto;

import java.util.List;

import io.github.samzhu.advisor.util.Rounding;

/**
 * 優化建議（不持久化），回傳給 API 呼叫端的基本單位。
 *
 * @param type 建議類型
 * @param title 標題
 * @param description 描述
 * @param agentName agent 名稱
 * @param model 目前使用的模型，快取建議為 null
 * @param alternativeModel 建議改用的模型，僅模型替代建議有值
 * @param estimatedSavingsMonthly 預估每月節省 (USD)
 * @param estimatedSavingsPercent 預估節省百分比
 * @param priority 優先級
 * @param actionItems 依序執行的具體建議步驟
 * @param metrics 該類型的分析指標
 */
public record Suggestion(
    SuggestionType type,
    String title,
    String description,
    String agentName,
    String model,
    String alternativeModel,
    double estimatedSavingsMonthly,
    double estimatedSavingsPercent,
    Priority priority,
    List<String> actionItems,
    SuggestionMetrics metrics
) {
    public Suggestion {
        actionItems = actionItems == null ? List.of() : List.copyOf(actionItems);
    }

    /**
     * 套用統一捨入規則：金額 2 位、百分比 1 位。
     *
     * @return 捨入後的副本
     */
    public Suggestion rounded() {
        return new Suggestion(type, title, description, agentName, model, alternativeModel,
            Rounding.money(estimatedSavingsMonthly),
            Rounding.percent(estimatedSavingsPercent),
            priority, actionItems,
            metrics != null ? metrics.rounded() : null);
    }
}
