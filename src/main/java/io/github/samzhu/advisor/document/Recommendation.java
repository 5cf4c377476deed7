package io.github.samzhu.advisor.document;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import io.github.samzhu.advisor.dto.SuggestionType;

/**
 * 已持久化的優化建議文件。
 *
 * <p>由 {@link io.github.samzhu.advisor.service.RecommendationTrackingService} 從排名前段的
 * 建議建立，是本服務中唯一有生命週期的實體：
 * <pre>
 * PENDING ──→ IMPLEMENTED   (使用者標記已實施)
 *    ├──────→ DISMISSED     (使用者忽略，可附回饋)
 *    └──────→ EXPIRED       (超過 expiresAt，讀取或操作時才判定)
 * </pre>
 *
 * <p>設計原則：
 * <ul>
 *   <li>ID 自動生成：由 MongoDB 自動產生 ObjectId</li>
 *   <li>只做狀態轉換，不刪除：終止狀態的記錄保留供成效統計</li>
 *   <li>去重：同一 (projectId, type, agentName, model) 只允許一筆 PENDING，
 *       由 partial unique index 保證</li>
 * </ul>
 */
@Document(collection = "recommendations")
@CompoundIndexes({
    @CompoundIndex(name = "pending_dedup_idx",
        def = "{'projectId': 1, 'recommendationType': 1, 'agentName': 1, 'model': 1}",
        unique = true,
        partialFilter = "{ 'status': 'PENDING' }"),
    @CompoundIndex(name = "project_status_idx", def = "{'projectId': 1, 'status': 1, 'createdAt': -1}")
})
public record Recommendation(
    @Id String id,

    // ========== 基本識別 ==========
    String projectId,
    SuggestionType recommendationType,
    String title,
    String description,
    String agentName,
    String model,
    String alternativeModel,

    // ========== 預估成效 ==========
    /** 預估每月節省 (USD) */
    double estimatedMonthlySavings,
    /** 預估節省百分比 */
    double estimatedSavingsPercent,
    /** 建立當下的分析指標快照 */
    Map<String, Object> metricsSnapshot,

    // ========== 狀態 ==========
    RecommendationStatus status,
    Instant createdAt,
    Instant expiresAt,
    Instant implementedAt,
    Instant dismissedAt,
    String dismissFeedback,

    // ========== 實際成效（由外部回報）==========
    /** 實施後實際每月節省 (USD)，未回報時為 null */
    Double actualMonthlySavings,
    Instant actualSavingsRecordedAt
) {

    /**
     * 建立新的待處理建議。
     *
     * @param projectId 專案 ID
     * @param type 建議類型
     * @param title 標題
     * @param description 描述
     * @param agentName agent 名稱，可為 null
     * @param model 模型名稱，可為 null
     * @param alternativeModel 替代模型，可為 null
     * @param estimatedMonthlySavings 預估每月節省
     * @param estimatedSavingsPercent 預估節省百分比
     * @param metricsSnapshot 指標快照
     * @param now 建立時間
     * @param cooldownDays 有效天數
     * @return PENDING 狀態的 Recommendation
     */
    public static Recommendation create(
            String projectId,
            SuggestionType type,
            String title,
            String description,
            String agentName,
            String model,
            String alternativeModel,
            double estimatedMonthlySavings,
            double estimatedSavingsPercent,
            Map<String, Object> metricsSnapshot,
            Instant now,
            int cooldownDays) {

        return new Recommendation(
            null, // ID 自動產生
            projectId,
            type,
            title,
            description,
            agentName,
            model,
            alternativeModel,
            estimatedMonthlySavings,
            estimatedSavingsPercent,
            metricsSnapshot,
            RecommendationStatus.PENDING,
            now,
            now.plus(cooldownDays, ChronoUnit.DAYS),
            null,
            null,
            null,
            null,
            null
        );
    }

    /**
     * 是否已超過有效期限。
     */
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    /**
     * 是否仍可被實施或忽略（PENDING 且未過期）。
     */
    public boolean isActionableAt(Instant now) {
        return status == RecommendationStatus.PENDING && !isExpiredAt(now);
    }

    public Recommendation markImplemented(Instant now) {
        return new Recommendation(id, projectId, recommendationType, title, description,
            agentName, model, alternativeModel, estimatedMonthlySavings, estimatedSavingsPercent,
            metricsSnapshot, RecommendationStatus.IMPLEMENTED, createdAt, expiresAt,
            now, dismissedAt, dismissFeedback, actualMonthlySavings, actualSavingsRecordedAt);
    }

    public Recommendation markDismissed(Instant now, String feedback) {
        return new Recommendation(id, projectId, recommendationType, title, description,
            agentName, model, alternativeModel, estimatedMonthlySavings, estimatedSavingsPercent,
            metricsSnapshot, RecommendationStatus.DISMISSED, createdAt, expiresAt,
            implementedAt, now, feedback, actualMonthlySavings, actualSavingsRecordedAt);
    }

    public Recommendation markExpired() {
        return new Recommendation(id, projectId, recommendationType, title, description,
            agentName, model, alternativeModel, estimatedMonthlySavings, estimatedSavingsPercent,
            metricsSnapshot, RecommendationStatus.EXPIRED, createdAt, expiresAt,
            implementedAt, dismissedAt, dismissFeedback, actualMonthlySavings, actualSavingsRecordedAt);
    }

    public Recommendation withActualSavings(double actual, Instant now) {
        return new Recommendation(id, projectId, recommendationType, title, description,
            agentName, model, alternativeModel, estimatedMonthlySavings, estimatedSavingsPercent,
            metricsSnapshot, status, createdAt, expiresAt,
            implementedAt, dismissedAt, dismissFeedback, actual, now);
    }
}
