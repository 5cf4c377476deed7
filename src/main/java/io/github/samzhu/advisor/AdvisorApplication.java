package io.github.samzhu.advisor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Advisor Service - LLM API 成本優化與異常偵測服務。
 *
 * <p>此服務讀取 LLM 用量事件（由上游 ingestion pipeline 寫入），負責：
 * <ul>
 *   <li>計算每個 (project, agent, model) 的統計基準線 (baseline)</li>
 *   <li>比對近期用量與基準線，偵測成本/延遲/錯誤率異常</li>
 *   <li>偵測重複輸入模式，估算快取可節省的成本</li>
 *   <li>整合多個分析器，產生排序後的優化建議</li>
 *   <li>追蹤建議的生命週期（實施/忽略/過期）與實際成效</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * usage_events ──→ BaselineService ──→ project_baselines
 *      │                                     │
 *      ├──→ AnomalyDetectionService ←────────┘
 *      ├──→ PatternAnalysisService
 *      ↓
 * SuggestionService ──→ RecommendationTrackingService ──→ recommendations
 * </pre>
 *
 * <p>所有計算都在請求時針對有限的歷史視窗執行，本服務不包含背景排程。
 */
@SpringBootApplication
public class AdvisorApplication {

    private static final Logger log = LoggerFactory.getLogger(AdvisorApplication.class);

    public static void main(String[] args) {
        log.info("Starting Advisor Service - LLM Cost Optimization");
        SpringApplication.run(AdvisorApplication.class, args);
    }
}
