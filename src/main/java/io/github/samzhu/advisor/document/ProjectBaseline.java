package io.github.samzhu.advisor.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * (project, agent, model) 統計基準線文件。
 *
 * <p>記錄某個 agent 使用某個模型在歷史視窗內的統計摘要，作為異常偵測與
 * 延遲/錯誤分析的比較基準：
 * <ul>
 *   <li>每次呼叫成本的平均與標準差</li>
 *   <li>輸入/輸出 token 的平均與標準差</li>
 *   <li>延遲的平均、標準差與百分位數 (P50/P95，T-Digest 計算)</li>
 *   <li>每日平均呼叫量與平均錯誤率</li>
 * </ul>
 *
 * <p>只有當 {@code sampleCount >= 10} 時才會建立基準線。
 * 文件 ID 格式：{@code {projectId}_{agentName}_{model}}，重算時以相同 ID 覆寫（upsert）。
 */
@Document(collection = "project_baselines")
public record ProjectBaseline(
    @Id String id,
    @Indexed String projectId,
    String agentName,
    String model,

    // === 成本 ===
    double avgCostPerCall,
    double stddevCostPerCall,

    // === Token ===
    double avgInputTokens,
    double stddevInputTokens,
    double avgOutputTokens,
    double stddevOutputTokens,

    // === 延遲 ===
    double avgLatencyMs,
    double stddevLatencyMs,
    double p50LatencyMs,
    double p95LatencyMs,

    // === 呼叫量與錯誤 ===
    double avgDailyCalls,
    double avgErrorRate,

    int sampleCount,
    Instant lastCalculatedAt
) {

    /**
     * 產生複合主鍵。
     *
     * @param projectId 專案 ID
     * @param agentName agent 名稱
     * @param model 模型名稱
     * @return 複合 ID，格式為 {@code projectId_agentName_model}
     */
    public static String createId(String projectId, String agentName, String model) {
        return projectId + "_" + agentName + "_" + model;
    }
}
