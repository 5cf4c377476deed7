package io.github.samzhu.advisor.config;

import java.math.BigDecimal;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.github.samzhu.advisor.dto.Priority;

/**
 * Advisor 服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link BaselineConfig} - 基準線計算的最低樣本數與預設視窗</li>
 *   <li>{@link AnomalyConfig} - 異常偵測的 z-score 與錯誤率倍數門檻</li>
 *   <li>{@link CachingConfig} - 重複輸入模式的最低出現次數與節省門檻</li>
 *   <li>{@link SuggestionConfig} - 各分析器的最低呼叫數、成本與錯誤門檻</li>
 *   <li>{@link PriorityConfig} - 依每月節省金額分級的門檻</li>
 *   <li>{@link RecommendationConfig} - 建議冷卻期與每次持久化的數量</li>
 *   <li>{@link ModelPricing} - 各 LLM 模型的 token 定價，用於替代模型比較</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * advisor:
 *   baseline:
 *     min-samples: 10
 *     default-days: 30
 *     digest-compression: 100
 *   anomaly:
 *     z-threshold: 2.0
 *     high-z-threshold: 3.0
 *     error-rate-ratio: 1.5
 *     high-error-rate-ratio: 2.0
 *     recent-hours: 24
 *   recommendation:
 *     cooldown-days: 14
 *     persist-limit: 10
 *   pricing:
 *     gpt-4o:
 *       input-per-million: 2.50
 *       output-per-million: 10.00
 *       quality-tier: 1
 * </pre>
 *
 * <p>每個區塊缺省時使用 {@code defaults()}，各欄位小於等於 0 時套用預設值。
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "advisor")
public record AdvisorProperties(
    BaselineConfig baseline,
    AnomalyConfig anomaly,
    CachingConfig caching,
    SuggestionConfig suggestion,
    PriorityConfig priority,
    RecommendationConfig recommendation,
    Map<String, ModelPricing> pricing
) {
    public AdvisorProperties {
        if (baseline == null) {
            baseline = BaselineConfig.defaults();
        }
        if (anomaly == null) {
            anomaly = AnomalyConfig.defaults();
        }
        if (caching == null) {
            caching = CachingConfig.defaults();
        }
        if (suggestion == null) {
            suggestion = SuggestionConfig.defaults();
        }
        if (priority == null) {
            priority = PriorityConfig.defaults();
        }
        if (recommendation == null) {
            recommendation = RecommendationConfig.defaults();
        }
        if (pricing == null) {
            pricing = Map.of();
        }
    }

    /**
     * 建立全部使用預設值的配置（無定價資料）。
     */
    public static AdvisorProperties defaults() {
        return new AdvisorProperties(null, null, null, null, null, null, null);
    }

    /**
     * 基準線計算設定。
     *
     * <p>延遲百分位使用 T-Digest 計算，{@code digestCompression} 控制精度和記憶體使用的平衡。
     *
     * @param minSamples 建立基準線所需的最少呼叫數，預設 10
     * @param defaultDays 自動建立基準線時使用的歷史天數，預設 30
     * @param digestCompression T-Digest 壓縮因子，預設 100
     */
    public record BaselineConfig(
        int minSamples,
        int defaultDays,
        int digestCompression
    ) {
        public BaselineConfig {
            if (minSamples <= 0) {
                minSamples = 10;
            }
            if (defaultDays <= 0) {
                defaultDays = 30;
            }
            if (digestCompression <= 0) {
                digestCompression = 100;
            }
        }

        public static BaselineConfig defaults() {
            return new BaselineConfig(10, 30, 100);
        }
    }

    /**
     * 異常偵測設定。
     *
     * <p>成本與延遲採 z-score：{@code |z| >= zThreshold} 視為異常，
     * {@code |z| > highZThreshold} 為 high。錯誤率採倍數比較：
     * 當前錯誤率超過基準 × {@code errorRateRatio} 視為異常，
     * 超過基準 × {@code highErrorRateRatio} 為 high。
     *
     * @param zThreshold 異常 z-score 門檻，預設 2.0
     * @param highZThreshold high 嚴重度 z-score 門檻，預設 3.0
     * @param errorRateRatio 錯誤率異常倍數，預設 1.5
     * @param highErrorRateRatio 錯誤率 high 嚴重度倍數，預設 2.0
     * @param recentHours 近期比較視窗（小時），預設 24
     */
    public record AnomalyConfig(
        double zThreshold,
        double highZThreshold,
        double errorRateRatio,
        double highErrorRateRatio,
        int recentHours
    ) {
        public AnomalyConfig {
            if (zThreshold <= 0) {
                zThreshold = 2.0;
            }
            if (highZThreshold <= 0) {
                highZThreshold = 3.0;
            }
            if (errorRateRatio <= 0) {
                errorRateRatio = 1.5;
            }
            if (highErrorRateRatio <= 0) {
                highErrorRateRatio = 2.0;
            }
            if (recentHours <= 0) {
                recentHours = 24;
            }
        }

        public static AnomalyConfig defaults() {
            return new AnomalyConfig(2.0, 3.0, 1.5, 2.0, 24);
        }
    }

    /**
     * 快取機會分析設定。
     *
     * @param minOccurrences 輸入 hash 至少出現次數才算重複模式，預設 5
     * @param minSavings 每月節省低於此金額 (USD) 的機會會被捨棄，預設 1.0
     * @param defaultDays 未指定時的分析天數，預設 30
     */
    public record CachingConfig(
        int minOccurrences,
        double minSavings,
        int defaultDays
    ) {
        public CachingConfig {
            if (minOccurrences <= 0) {
                minOccurrences = 5;
            }
            if (minSavings <= 0) {
                minSavings = 1.0;
            }
            if (defaultDays <= 0) {
                defaultDays = 30;
            }
        }

        public static CachingConfig defaults() {
            return new CachingConfig(5, 1.0, 30);
        }
    }

    /**
     * 建議分析器設定。
     *
     * @param minCalls 分析 (agent, model) 群組所需的最少呼叫數，預設 10
     * @param minGroupCost 模型替代分析所需的最低期間成本 (USD)，預設 0.01
     * @param minActionableSavings 模型替代建議的最低每月節省 (USD)，預設 1.0
     * @param maxAlternatives 向定價服務查詢的替代模型數，預設 3
     * @param minErrors 錯誤分析所需的最少錯誤數，預設 3
     * @param defaultErrorRate 無基準線時使用的錯誤率，預設 0.02
     * @param minWastedMonthly 錯誤浪費低於此金額 (USD/月) 不建議，預設 0.50
     * @param latencyZThreshold 延遲建議的 z-score 門檻，預設 2.0
     * @param latencyHighZThreshold 延遲建議 high 優先級門檻，預設 3.0
     * @param summaryTopN 摘要中附帶的建議數，預設 5
     */
    public record SuggestionConfig(
        int minCalls,
        double minGroupCost,
        double minActionableSavings,
        int maxAlternatives,
        int minErrors,
        double defaultErrorRate,
        double minWastedMonthly,
        double latencyZThreshold,
        double latencyHighZThreshold,
        int summaryTopN
    ) {
        public SuggestionConfig {
            if (minCalls <= 0) {
                minCalls = 10;
            }
            if (minGroupCost <= 0) {
                minGroupCost = 0.01;
            }
            if (minActionableSavings <= 0) {
                minActionableSavings = 1.0;
            }
            if (maxAlternatives <= 0) {
                maxAlternatives = 3;
            }
            if (minErrors <= 0) {
                minErrors = 3;
            }
            if (defaultErrorRate <= 0) {
                defaultErrorRate = 0.02;
            }
            if (minWastedMonthly <= 0) {
                minWastedMonthly = 0.50;
            }
            if (latencyZThreshold <= 0) {
                latencyZThreshold = 2.0;
            }
            if (latencyHighZThreshold <= 0) {
                latencyHighZThreshold = 3.0;
            }
            if (summaryTopN <= 0) {
                summaryTopN = 5;
            }
        }

        public static SuggestionConfig defaults() {
            return new SuggestionConfig(10, 0.01, 1.0, 3, 3, 0.02, 0.50, 2.0, 3.0, 5);
        }
    }

    /**
     * 優先級門檻。
     *
     * @param highThreshold 每月節省 >= 此值為 high，預設 50
     * @param mediumThreshold 每月節省 >= 此值為 medium，預設 10
     */
    public record PriorityConfig(
        double highThreshold,
        double mediumThreshold
    ) {
        public PriorityConfig {
            if (highThreshold <= 0) {
                highThreshold = 50.0;
            }
            if (mediumThreshold <= 0) {
                mediumThreshold = 10.0;
            }
        }

        public static PriorityConfig defaults() {
            return new PriorityConfig(50.0, 10.0);
        }

        /**
         * 依每月節省金額決定優先級。
         *
         * @param monthlySavings 每月節省 (USD)
         * @return 優先級
         */
        public Priority classify(double monthlySavings) {
            if (monthlySavings >= highThreshold) {
                return Priority.HIGH;
            }
            if (monthlySavings >= mediumThreshold) {
                return Priority.MEDIUM;
            }
            return Priority.LOW;
        }
    }

    /**
     * 建議追蹤設定。
     *
     * @param cooldownDays 待處理建議的有效天數，期間內相同建議不重複建立，預設 14
     * @param persistLimit 每次產生建議時持久化的前 N 筆，預設 10
     */
    public record RecommendationConfig(
        int cooldownDays,
        int persistLimit
    ) {
        public RecommendationConfig {
            if (cooldownDays <= 0) {
                cooldownDays = 14;
            }
            if (persistLimit <= 0) {
                persistLimit = 10;
            }
        }

        public static RecommendationConfig defaults() {
            return new RecommendationConfig(14, 10);
        }
    }

    /**
     * LLM 模型的 token 定價設定。
     *
     * <p>價格單位為「美元 / 百萬 tokens」。{@code qualityTier} 表示模型能力等級，
     * 數字越大能力越強，用於判斷改用較便宜模型時的品質影響。
     *
     * @param inputPerMillion 輸入 token 單價 (USD/百萬)
     * @param outputPerMillion 輸出 token 單價 (USD/百萬)
     * @param qualityTier 能力等級 (0 起算)
     */
    public record ModelPricing(
        BigDecimal inputPerMillion,
        BigDecimal outputPerMillion,
        int qualityTier
    ) {
        public ModelPricing {
            if (inputPerMillion == null) {
                inputPerMillion = BigDecimal.ZERO;
            }
            if (outputPerMillion == null) {
                outputPerMillion = BigDecimal.ZERO;
            }
        }
    }
}
