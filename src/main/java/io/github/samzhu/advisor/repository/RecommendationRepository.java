package io.github.samzhu.advisor.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.advisor.document.Recommendation;
import io.github.samzhu.advisor.document.RecommendationStatus;
import io.github.samzhu.advisor.dto.SuggestionType;

/**
 * 優化建議資料存取介面。
 *
 * <p>提供對 {@code recommendations} 集合的 CRUD 操作。記錄只做狀態轉換，不刪除。
 *
 * @see io.github.samzhu.advisor.document.Recommendation
 */
public interface RecommendationRepository extends MongoRepository<Recommendation, String> {

    /**
     * 依 ID 查詢，且必須屬於指定專案。
     *
     * @param id 建議 ID
     * @param projectId 專案 ID
     * @return 建議（如存在）
     */
    Optional<Recommendation> findByIdAndProjectId(String id, String projectId);

    /**
     * 查詢相同 (project, type, agent, model) 的建議（用於去重）。
     *
     * @param projectId 專案 ID
     * @param recommendationType 建議類型
     * @param agentName agent 名稱，可為 null
     * @param model 模型名稱，可為 null
     * @param status 狀態
     * @return 符合條件的建議
     */
    List<Recommendation> findByProjectIdAndRecommendationTypeAndAgentNameAndModelAndStatus(
            String projectId, SuggestionType recommendationType, String agentName, String model,
            RecommendationStatus status);

    /**
     * 查詢指定狀態且尚未過期的建議，依建立時間降序排列。
     *
     * @param projectId 專案 ID
     * @param status 狀態
     * @param now 目前時間
     * @return 建議列表，最新的在前
     */
    List<Recommendation> findByProjectIdAndStatusAndExpiresAtAfterOrderByCreatedAtDesc(
            String projectId, RecommendationStatus status, Instant now);

    /**
     * 查詢專案的所有建議（用於成效統計）。
     */
    List<Recommendation> findByProjectId(String projectId);

    // ========== 跨專案學習 ==========

    /**
     * 查詢指定模型替代方案的所有記錄，用於替代模型信心分數。
     *
     * @param recommendationType 建議類型
     * @param model 原模型
     * @param alternativeModel 替代模型
     * @param status 狀態
     * @return 符合條件的建議
     */
    List<Recommendation> findByRecommendationTypeAndModelAndAlternativeModelAndStatus(
            SuggestionType recommendationType, String model, String alternativeModel,
            RecommendationStatus status);
}
