package io.github.samzhu.advisor.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import io.github.samzhu.advisor.config.AdvisorProperties;
import io.github.samzhu.advisor.config.AdvisorProperties.ModelPricing;
import io.github.samzhu.advisor.document.Recommendation;
import io.github.samzhu.advisor.document.RecommendationStatus;
import io.github.samzhu.advisor.dto.ModelAlternative;
import io.github.samzhu.advisor.dto.ModelAlternative.Savings;
import io.github.samzhu.advisor.dto.QualityImpact;
import io.github.samzhu.advisor.dto.SuggestionType;
import io.github.samzhu.advisor.exception.PricingUnavailableException;
import io.github.samzhu.advisor.exception.UnknownModelPricingException;
import io.github.samzhu.advisor.repository.RecommendationRepository;

/**
 * LLM 模型定價與替代模型服務。
 *
 * <p>定價來自 {@code advisor.pricing}，單位為「美元 / 百萬 tokens」：
 * <pre>
 * 每次呼叫成本 = (avgInputTokens × inputPrice / 1M) + (avgOutputTokens × outputPrice / 1M)
 * 節省百分比   = (目前成本 - 替代成本) / 目前成本 × 100
 * </pre>
 *
 * <p>信心分數會參考已實施的 model_downgrade 建議（跨專案）：
 * <ul>
 *   <li>{@code learned} - 同一組 (model, alternative) 曾被實施過，依實施次數與實際節省準確度提高分數</li>
 *   <li>{@code dynamic} - 僅依定價推算，分數固定為 0.5</li>
 * </ul>
 */
@Service
public class PricingService implements ModelAlternativeProvider {

    private static final Logger log = LoggerFactory.getLogger(PricingService.class);
    private static final BigDecimal ONE_MILLION = new BigDecimal("1000000");
    private static final BigDecimal ONE_THOUSAND = new BigDecimal("1000");
    private static final int FUZZY_MATCH_LENGTH = 15;

    static final String SOURCE_LEARNED = "learned";
    static final String SOURCE_DYNAMIC = "dynamic";
    static final double DYNAMIC_CONFIDENCE = 0.5;

    private final AdvisorProperties properties;
    private final RecommendationRepository recommendationRepository;

    public PricingService(AdvisorProperties properties, RecommendationRepository recommendationRepository) {
        this.properties = properties;
        this.recommendationRepository = recommendationRepository;
        log.info("PricingService initialized with {} model pricing configurations", properties.pricing().size());
    }

    @Override
    public List<ModelAlternative> discoverAlternatives(String model, double avgInputTokens,
            double avgOutputTokens, int maxResults) {
        if (model == null) {
            return List.of();
        }
        Map.Entry<String, ModelPricing> current = findPricing(model);
        if (current == null) {
            log.warn("Unknown model pricing detected: model='{}'. " +
                "Please add pricing configuration under advisor.pricing", model);
            throw new UnknownModelPricingException(model);
        }

        ModelPricing currentPricing = current.getValue();
        double currentCost = costPerCall(currentPricing, avgInputTokens, avgOutputTokens);
        if (currentCost <= 0) {
            return List.of();
        }

        List<Candidate> candidates = new ArrayList<>();
        for (var entry : properties.pricing().entrySet()) {
            if (entry.getKey().equals(current.getKey())) {
                continue;
            }
            ModelPricing alt = entry.getValue();
            double altCost = costPerCall(alt, avgInputTokens, avgOutputTokens);
            double percentage = (currentCost - altCost) / currentCost * 100.0;
            if (percentage <= 0) {
                continue;
            }
            candidates.add(new Candidate(entry.getKey(), alt, percentage));
        }

        candidates.sort(Comparator.comparingDouble(Candidate::percentage).reversed()
            .thenComparing(Candidate::model));

        List<ModelAlternative> alternatives = new ArrayList<>();
        for (Candidate candidate : candidates.subList(0, Math.min(maxResults, candidates.size()))) {
            alternatives.add(toAlternative(model, currentPricing, candidate));
        }

        log.debug("Discovered {} alternatives for {} (avgIn={}, avgOut={})",
            alternatives.size(), model, avgInputTokens, avgOutputTokens);
        return alternatives;
    }

    private ModelAlternative toAlternative(String model, ModelPricing currentPricing, Candidate candidate) {
        ModelPricing alt = candidate.pricing();
        Savings savings = new Savings(
            perThousandDelta(currentPricing.inputPerMillion(), alt.inputPerMillion()),
            perThousandDelta(currentPricing.outputPerMillion(), alt.outputPerMillion()),
            candidate.percentage());
        QualityImpact impact = QualityImpact.fromTierDrop(currentPricing.qualityTier() - alt.qualityTier());

        List<Recommendation> implemented;
        try {
            implemented = recommendationRepository.findByRecommendationTypeAndModelAndAlternativeModelAndStatus(
                SuggestionType.MODEL_DOWNGRADE, model, candidate.model(), RecommendationStatus.IMPLEMENTED);
        } catch (DataAccessException e) {
            throw new PricingUnavailableException(model, e);
        }

        if (implemented.isEmpty()) {
            return new ModelAlternative(candidate.model(), savings, impact, SOURCE_DYNAMIC,
                DYNAMIC_CONFIDENCE, 0, null);
        }

        int timesImplemented = implemented.size();
        Double accuracy = savingsAccuracy(implemented);
        return new ModelAlternative(candidate.model(), savings, impact, SOURCE_LEARNED,
            learnedConfidence(timesImplemented, accuracy), timesImplemented, accuracy);
    }

    /**
     * 已回報實際節省的建議中，實際 / 預估的平均值。
     */
    static Double savingsAccuracy(List<Recommendation> implemented) {
        OptionalDouble accuracy = implemented.stream()
            .filter(r -> r.actualMonthlySavings() != null && r.estimatedMonthlySavings() > 0)
            .mapToDouble(r -> r.actualMonthlySavings() / r.estimatedMonthlySavings())
            .average();
        return accuracy.isPresent() ? accuracy.getAsDouble() : null;
    }

    /**
     * 依實施次數與準確度計算信心分數，範圍 [0.5, 1.0]。
     *
     * <p>實施 10 次以上得到完整的經驗加分 (0.3)；準確度越接近 1 越高，最多加 0.2。
     */
    static double learnedConfidence(int timesImplemented, Double accuracy) {
        double experience = 0.3 * Math.min(1.0, timesImplemented / 10.0);
        double precision = accuracy == null ? 0.0 : 0.2 * Math.max(0.0, 1.0 - Math.abs(1.0 - accuracy));
        return Math.min(1.0, DYNAMIC_CONFIDENCE + experience + precision);
    }

    private double costPerCall(ModelPricing pricing, double avgInputTokens, double avgOutputTokens) {
        return BigDecimal.valueOf(avgInputTokens).multiply(pricing.inputPerMillion())
            .add(BigDecimal.valueOf(avgOutputTokens).multiply(pricing.outputPerMillion()))
            .divide(ONE_MILLION, 10, RoundingMode.HALF_UP)
            .doubleValue();
    }

    private double perThousandDelta(BigDecimal currentPerMillion, BigDecimal altPerMillion) {
        return currentPerMillion.subtract(altPerMillion)
            .divide(ONE_THOUSAND, 10, RoundingMode.HALF_UP)
            .doubleValue();
    }

    /**
     * 查找模型定價，支援完全比對和模糊比對。
     *
     * <p>模糊比對處理版本號變化（例如 claude-sonnet-4-20250514 vs claude-sonnet-4-20250601），
     * 多個鍵都符合時取最長者，避免 gpt-4o-mini 被比對到 gpt-4。
     *
     * @param model 模型名稱
     * @return 定價設定（含設定鍵），找不到時回傳 null
     */
    Map.Entry<String, ModelPricing> findPricing(String model) {
        Map<String, ModelPricing> pricing = properties.pricing();
        if (pricing.containsKey(model)) {
            return Map.entry(model, pricing.get(model));
        }

        Map.Entry<String, ModelPricing> best = null;
        for (var entry : pricing.entrySet()) {
            String key = entry.getKey();
            int matchLength = Math.min(FUZZY_MATCH_LENGTH, key.length());
            if (model.startsWith(key.substring(0, matchLength))
                    && (best == null || key.length() > best.getKey().length())) {
                best = entry;
            }
        }
        if (best != null) {
            log.debug("Fuzzy matched pricing: {} -> {}", model, best.getKey());
        }
        return best;
    }

    private record Candidate(String model, ModelPricing pricing, double percentage) {}
}
