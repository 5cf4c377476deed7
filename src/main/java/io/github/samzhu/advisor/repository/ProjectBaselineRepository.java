package io.github.samzhu.advisor.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.advisor.document.ProjectBaseline;

/**
 * 統計基準線資料存取介面。
 *
 * <p>提供對 {@code project_baselines} 集合的查詢。寫入由
 * {@link io.github.samzhu.advisor.service.BaselineService} 以固定 ID 的 {@code save} 完成，
 * 重算時覆寫同一份文件。
 *
 * @see io.github.samzhu.advisor.document.ProjectBaseline
 */
public interface ProjectBaselineRepository extends MongoRepository<ProjectBaseline, String> {

    /**
     * 查詢專案的所有基準線。
     */
    List<ProjectBaseline> findByProjectId(String projectId);

    List<ProjectBaseline> findByProjectIdAndAgentName(String projectId, String agentName);

    List<ProjectBaseline> findByProjectIdAndModel(String projectId, String model);

    /**
     * 查詢單一 (agent, model) 的基準線。
     *
     * @param projectId 專案 ID
     * @param agentName agent 名稱
     * @param model 模型名稱
     * @return 基準線（如存在）
     */
    Optional<ProjectBaseline> findByProjectIdAndAgentNameAndModel(String projectId, String agentName, String model);

    /**
     * 檢查專案是否已有任何基準線。
     */
    boolean existsByProjectId(String projectId);
}
