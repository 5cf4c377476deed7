package io.github.samzhu.advisor.service;

import static io.github.samzhu.advisor.service.ActionItems.format;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import io.github.samzhu.advisor.config.AdvisorProperties;
import io.github.samzhu.advisor.config.AdvisorProperties.SuggestionConfig;
import io.github.samzhu.advisor.document.ProjectBaseline;
import io.github.samzhu.advisor.document.Recommendation;
import io.github.samzhu.advisor.document.UsageEvent;
import io.github.samzhu.advisor.dto.AgentModelKey;
import io.github.samzhu.advisor.dto.Anomaly;
import io.github.samzhu.advisor.dto.CachingOpportunity;
import io.github.samzhu.advisor.dto.EmptyReason;
import io.github.samzhu.advisor.dto.GroupStats;
import io.github.samzhu.advisor.dto.ModelAlternative;
import io.github.samzhu.advisor.dto.OptimizationSummary;
import io.github.samzhu.advisor.dto.OptimizationSummary.TypeBreakdown;
import io.github.samzhu.advisor.dto.Priority;
import io.github.samzhu.advisor.dto.QualityImpact;
import io.github.samzhu.advisor.dto.Suggestion;
import io.github.samzhu.advisor.dto.SuggestionMetrics;
import io.github.samzhu.advisor.dto.SuggestionType;
import io.github.samzhu.advisor.exception.PricingUnavailableException;
import io.github.samzhu.advisor.exception.UnknownModelPricingException;
import io.github.samzhu.advisor.util.Rounding;
import io.github.samzhu.advisor.util.TimeWindow;

/**
 * 優化建議產生服務。
 *
 * <p>每次呼叫執行五個彼此獨立的分析器，合併成一份依優先級過濾、依每月節省降序的建議清單：
 * <ol>
 *   <li>模型替代 - 向 {@link ModelAlternativeProvider} 查詢較便宜的模型</li>
 *   <li>快取 - 來自 {@link PatternAnalysisService} 的重複輸入模式</li>
 *   <li>異常警示 - 來自 {@link AnomalyDetectionService} 的異常指標</li>
 *   <li>錯誤減少 - 錯誤率明顯高於基準線時估算浪費的成本</li>
 *   <li>延遲 (prompt 優化) - 平均延遲高於基準線 2σ 以上</li>
 * </ol>
 *
 * <p>產生建議本身沒有副作用（首次使用時自動建立基準線除外），
 * 只有 {@link #getSuggestions} 在 {@code persist = true} 時才會寫入建議記錄。
 * 金額與百分比的捨入只在建議離開此服務時套用一次。
 */
@Service
public class SuggestionService {

    private static final Logger log = LoggerFactory.getLogger(SuggestionService.class);

    private final EventAggregationService aggregationService;
    private final BaselineService baselineService;
    private final AnomalyDetectionService anomalyDetectionService;
    private final PatternAnalysisService patternAnalysisService;
    private final ModelAlternativeProvider alternativeProvider;
    private final RecommendationTrackingService trackingService;
    private final AdvisorProperties properties;
    private final Clock clock;

    public SuggestionService(
            EventAggregationService aggregationService,
            BaselineService baselineService,
            AnomalyDetectionService anomalyDetectionService,
            PatternAnalysisService patternAnalysisService,
            ModelAlternativeProvider alternativeProvider,
            RecommendationTrackingService trackingService,
            AdvisorProperties properties,
            Clock clock) {
        this.aggregationService = aggregationService;
        this.baselineService = baselineService;
        this.anomalyDetectionService = anomalyDetectionService;
        this.patternAnalysisService = patternAnalysisService;
        this.alternativeProvider = alternativeProvider;
        this.trackingService = trackingService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 產生建議但不寫入任何建議記錄。
     *
     * @param projectId 專案 ID
     * @param days 分析天數
     * @param includeLowPriority 是否保留 low 優先級
     * @return 依每月節省降序的建議
     */
    public List<Suggestion> generateSuggestions(String projectId, int days, boolean includeLowPriority) {
        TimeWindow window = TimeWindow.lastDays(clock, days);
        List<UsageEvent> events = loadEvents(projectId, window);
        return synthesize(projectId, window, events, includeLowPriority);
    }

    /**
     * 產生建議，並可選擇將前 N 筆寫入建議記錄以追蹤處理結果。
     *
     * <p>每筆建議記錄各自寫入，冷卻期內的重複建議會被略過。
     * 單筆寫入失敗只記錄警告，不影響其餘建議與回傳結果。
     *
     * @param projectId 專案 ID
     * @param days 分析天數
     * @param includeLowPriority 是否保留 low 優先級
     * @param persist 是否寫入建議記錄
     * @return 依每月節省降序的建議
     */
    public List<Suggestion> getSuggestions(String projectId, int days, boolean includeLowPriority, boolean persist) {
        List<Suggestion> suggestions = generateSuggestions(projectId, days, includeLowPriority);
        if (!persist) {
            return suggestions;
        }

        int limit = properties.recommendation().persistLimit();
        int created = 0;
        int failed = 0;
        for (Suggestion suggestion : suggestions.subList(0, Math.min(limit, suggestions.size()))) {
            try {
                Optional<Recommendation> recommendation = trackingService.createRecommendation(projectId, suggestion);
                if (recommendation.isPresent()) {
                    created++;
                }
            } catch (DataAccessException | TransactionException e) {
                failed++;
                log.warn("Failed to persist recommendation '{}' for project {}: {}",
                    suggestion.title(), projectId, e.getMessage());
            }
        }
        log.info("Persisted recommendations for project {}: {} created, {} failed from top {} of {} suggestions",
            projectId, created, failed, Math.min(limit, suggestions.size()), suggestions.size());
        return suggestions;
    }

    /**
     * 產生優化摘要，不寫入建議記錄。
     *
     * @param projectId 專案 ID
     * @param days 分析天數
     * @return 摘要，沒有建議時附帶原因
     */
    public OptimizationSummary getSummary(String projectId, int days) {
        TimeWindow window = TimeWindow.lastDays(clock, days);
        List<UsageEvent> events = loadEvents(projectId, window);
        List<Suggestion> suggestions = synthesize(projectId, window, events, true);

        double totalSavings = suggestions.stream().mapToDouble(Suggestion::estimatedSavingsMonthly).sum();
        int highPriority = (int) suggestions.stream().filter(s -> s.priority() == Priority.HIGH).count();
        double monthlySpend = window.toMonthly(aggregationService.totalCost(events));
        double savingsPercent = monthlySpend > 0 ? totalSavings / monthlySpend * 100 : 0.0;

        Map<String, TypeBreakdown> byType = new LinkedHashMap<>();
        for (Suggestion s : suggestions) {
            byType.merge(s.type().value(), new TypeBreakdown(1, s.estimatedSavingsMonthly()),
                (a, b) -> new TypeBreakdown(a.count() + b.count(), Rounding.money(a.savings() + b.savings())));
        }

        boolean hasData = !events.isEmpty();
        boolean hasBaselines = baselineService.hasBaselines(projectId);
        EmptyReason emptyReason = suggestions.isEmpty()
            ? classifyEmpty(hasData, hasBaselines, events.size())
            : null;

        int topN = properties.suggestion().summaryTopN();
        return new OptimizationSummary(
            Rounding.money(totalSavings),
            Rounding.percent(savingsPercent),
            Rounding.money(monthlySpend),
            suggestions.size(),
            highPriority,
            byType,
            trackingService.getRecommendationEffectiveness(projectId),
            List.copyOf(suggestions.subList(0, Math.min(topN, suggestions.size()))),
            hasData,
            hasBaselines,
            events.size(),
            emptyReason);
    }

    /**
     * 載入視窗事件一次，首次使用時以同一批事件建立基準線。
     */
    private List<UsageEvent> loadEvents(String projectId, TimeWindow window) {
        List<UsageEvent> events = aggregationService.findEvents(projectId, window);
        baselineService.ensureBaselinesExist(projectId, window, events);
        return events;
    }

    private EmptyReason classifyEmpty(boolean hasData, boolean hasBaselines, int eventCount) {
        if (!hasData) {
            return EmptyReason.NO_DATA;
        }
        if (!hasBaselines && eventCount < properties.baseline().minSamples()) {
            return EmptyReason.INSUFFICIENT_DATA;
        }
        if (!hasBaselines) {
            return EmptyReason.NO_BASELINES;
        }
        return EmptyReason.OPTIMIZED;
    }

    private List<Suggestion> synthesize(String projectId, TimeWindow window, List<UsageEvent> events,
            boolean includeLowPriority) {
        long startTime = System.currentTimeMillis();
        Map<AgentModelKey, GroupStats> groups = aggregationService.summarizeByAgentAndModel(events);

        List<Suggestion> suggestions = new ArrayList<>();
        suggestions.addAll(analyzeModelUsage(groups, window));
        suggestions.addAll(analyzeCachingOpportunities(events, window));
        suggestions.addAll(analyzeAnomalies(projectId));
        suggestions.addAll(analyzeErrorPatterns(projectId, groups, window));
        suggestions.addAll(analyzeLatencyIssues(projectId, groups));

        List<Suggestion> result = new ArrayList<>(suggestions.size());
        for (Suggestion suggestion : suggestions) {
            if (!includeLowPriority && suggestion.priority() == Priority.LOW) {
                continue;
            }
            result.add(suggestion.rounded());
        }
        // List.sort 為穩定排序，同金額保留分析器順序
        result.sort(Comparator.comparingDouble(Suggestion::estimatedSavingsMonthly).reversed());

        log.debug("Synthesized {} suggestions ({} before priority filter) for project {} in {}ms",
            result.size(), suggestions.size(), projectId, System.currentTimeMillis() - startTime);
        return result;
    }

    // ========== 模型替代 ==========

    List<Suggestion> analyzeModelUsage(Map<AgentModelKey, GroupStats> groups, TimeWindow window) {
        SuggestionConfig config = properties.suggestion();
        List<Suggestion> suggestions = new ArrayList<>();

        groups.forEach((key, stats) -> {
            if (key.model() == null || stats.callCount() < config.minCalls()
                    || stats.totalCost() < config.minGroupCost()) {
                return;
            }

            List<ModelAlternative> alternatives;
            try {
                alternatives = alternativeProvider.discoverAlternatives(key.model(),
                    stats.inputTokens().mean(), stats.outputTokens().mean(), config.maxAlternatives());
            } catch (UnknownModelPricingException | PricingUnavailableException e) {
                log.warn("Skipping model downgrade analysis for {}/{}: {}",
                    key.agentName(), key.model(), e.getMessage());
                return;
            }

            alternatives.stream()
                .filter(alt -> periodSavings(stats, alt) > 0)
                .findFirst()
                .flatMap(alt -> toModelDowngrade(key, stats, alt, window))
                .ifPresent(suggestions::add);
        });
        return suggestions;
    }

    private double periodSavings(GroupStats stats, ModelAlternative alt) {
        double inputSavings = stats.totalInputTokens() / 1000.0 * alt.savings().inputPer1k();
        double outputSavings = stats.totalOutputTokens() / 1000.0 * alt.savings().outputPer1k();
        return inputSavings + outputSavings;
    }

    private Optional<Suggestion> toModelDowngrade(AgentModelKey key, GroupStats stats,
            ModelAlternative alt, TimeWindow window) {
        double monthlySavings = window.toMonthly(periodSavings(stats, alt));
        if (monthlySavings < properties.suggestion().minActionableSavings()) {
            log.debug("Discarding {} -> {} for {}: ${}/month below threshold",
                key.model(), alt.model(), key.agentName(), monthlySavings);
            return Optional.empty();
        }

        double monthlyCost = window.toMonthly(stats.totalCost());
        double savingsPercent = monthlyCost > 0 ? monthlySavings / monthlyCost * 100 : 0.0;
        QualityImpact impact = alt.qualityImpact() != null ? alt.qualityImpact() : QualityImpact.SIGNIFICANT;

        return Optional.of(new Suggestion(
            SuggestionType.MODEL_DOWNGRADE,
            format("Consider %s for %s", alt.model(), key.agentName()),
            format("Agent '%s' uses %s with average output of %.0f tokens. Switching to %s could reduce costs.",
                key.agentName(), key.model(), stats.outputTokens().mean(), alt.model()),
            key.agentName(),
            key.model(),
            alt.model(),
            monthlySavings,
            savingsPercent,
            properties.priority().classify(monthlySavings),
            ActionItems.modelSwitch(key.agentName(), key.model(), alt.model(), monthlySavings, impact,
                stats.callCount()),
            new SuggestionMetrics.ModelDowngrade(
                stats.callCount(),
                monthlyCost,
                stats.outputTokens().mean(),
                stats.inputTokens().mean(),
                alt.savings().percentage(),
                impact,
                alt.source(),
                alt.confidenceScore(),
                alt.timesImplemented(),
                alt.savingsAccuracy())));
    }

    // ========== 快取 ==========

    List<Suggestion> analyzeCachingOpportunities(List<UsageEvent> events, TimeWindow window) {
        List<CachingOpportunity> opportunities = patternAnalysisService.analyzeCachingOpportunities(
            events, properties.caching().minOccurrences(), properties.caching().minSavings(), window);

        List<Suggestion> suggestions = new ArrayList<>();
        for (CachingOpportunity opp : opportunities) {
            double monthlySavings = opp.estimatedMonthlySavings();
            suggestions.add(new Suggestion(
                SuggestionType.CACHING,
                format("Add caching for %s", opp.agentName()),
                format("Agent '%s' has %.1f%% duplicate queries. Implementing response caching could save "
                    + "approximately $%.2f/month based on observed patterns.",
                    opp.agentName(), opp.duplicateRate(), monthlySavings),
                opp.agentName(),
                null,
                null,
                monthlySavings,
                opp.duplicateRate(),
                properties.priority().classify(monthlySavings),
                ActionItems.caching(opp.agentName(), opp.duplicateRate(), opp.uniquePatterns(), opp.duplicateCalls()),
                new SuggestionMetrics.Caching(opp.uniquePatterns(), opp.totalCalls(),
                    opp.duplicateCalls(), opp.duplicateRate())));
        }
        return suggestions;
    }

    // ========== 異常警示 ==========

    List<Suggestion> analyzeAnomalies(String projectId) {
        List<Suggestion> suggestions = new ArrayList<>();
        for (Anomaly anomaly : anomalyDetectionService.detectAnomalies(projectId)) {
            if (!anomaly.anomaly()) {
                continue;
            }
            suggestions.add(new Suggestion(
                SuggestionType.ANOMALY_ALERT,
                format("Anomaly detected: %s for %s", anomaly.metric().label(), anomaly.context()),
                describeAnomaly(anomaly),
                anomaly.agentName(),
                anomaly.model(),
                null,
                0.0,
                0.0,
                anomaly.severity(),
                ActionItems.anomaly(anomaly.metric(), anomaly.context(), anomaly.zScore(),
                    anomaly.currentValue(), anomaly.baselineMean()),
                new SuggestionMetrics.AnomalyAlert(anomaly.metric(), anomaly.currentValue(),
                    anomaly.baselineMean(), anomaly.baselineStddev(), anomaly.zScore())));
        }
        return suggestions;
    }

    private String describeAnomaly(Anomaly anomaly) {
        String direction = anomaly.isAboveBaseline() ? "higher" : "lower";
        return switch (anomaly.metric()) {
            case COST_PER_CALL -> format(
                "Cost per call is %.1f standard deviations %s than normal for %s. Current: $%.4f, Baseline: $%.4f",
                Math.abs(anomaly.zScore()), direction, anomaly.context(),
                anomaly.currentValue(), anomaly.baselineMean());
            case LATENCY_MS -> format(
                "Latency is %.1f standard deviations %s than normal for %s. Current: %.0fms, Baseline: %.0fms",
                Math.abs(anomaly.zScore()), direction, anomaly.context(),
                anomaly.currentValue(), anomaly.baselineMean());
            case ERROR_RATE -> format(
                "Error rate is elevated for %s. Current: %.1f%%, Baseline: %.1f%%",
                anomaly.context(), anomaly.currentValue() * 100, anomaly.baselineMean() * 100);
        };
    }

    // ========== 錯誤減少 ==========

    List<Suggestion> analyzeErrorPatterns(String projectId, Map<AgentModelKey, GroupStats> groups, TimeWindow window) {
        SuggestionConfig config = properties.suggestion();
        double ratio = properties.anomaly().errorRateRatio();
        List<Suggestion> suggestions = new ArrayList<>();

        groups.forEach((key, stats) -> {
            if (stats.callCount() < config.minCalls() || stats.errorCount() < config.minErrors()) {
                return;
            }

            double errorRate = stats.errorRate();
            double baselineErrorRate = baselineService.getBaseline(projectId, key.agentName(), key.model())
                .map(ProjectBaseline::avgErrorRate)
                .orElse(config.defaultErrorRate());

            if (errorRate <= baselineErrorRate * ratio) {
                return;
            }

            double monthlyWasted = window.toMonthly(stats.failedCost());
            if (monthlyWasted < config.minWastedMonthly()) {
                return;
            }

            suggestions.add(new Suggestion(
                SuggestionType.ERROR_REDUCTION,
                format("Reduce errors in %s", key.agentName()),
                format("Agent '%s' using %s has %.1f%% error rate (baseline: %.1f%%), wasting $%.2f/month on failed calls.",
                    key.agentName(), key.model(), errorRate * 100, baselineErrorRate * 100, monthlyWasted),
                key.agentName(),
                key.model(),
                null,
                monthlyWasted,
                errorRate * 100,
                properties.priority().classify(monthlyWasted),
                ActionItems.errors(key.agentName(), key.model(), errorRate, baselineErrorRate,
                    stats.errorCount(), monthlyWasted),
                new SuggestionMetrics.ErrorReduction(stats.callCount(), stats.errorCount(),
                    errorRate * 100, baselineErrorRate * 100, stats.failedCost())));
        });
        return suggestions;
    }

    // ========== 延遲 ==========

    List<Suggestion> analyzeLatencyIssues(String projectId, Map<AgentModelKey, GroupStats> groups) {
        SuggestionConfig config = properties.suggestion();
        List<Suggestion> suggestions = new ArrayList<>();

        groups.forEach((key, stats) -> {
            if (stats.callCount() < config.minCalls()) {
                return;
            }
            Optional<ProjectBaseline> baseline = baselineService.getBaseline(projectId, key.agentName(), key.model());
            if (baseline.isEmpty() || baseline.get().stddevLatencyMs() <= 0) {
                return;
            }

            ProjectBaseline b = baseline.get();
            double avgLatency = stats.latencyMs().mean();
            double zScore = (avgLatency - b.avgLatencyMs()) / b.stddevLatencyMs();
            if (zScore < config.latencyZThreshold()) {
                return;
            }

            double avgInput = stats.inputTokens().mean();
            suggestions.add(new Suggestion(
                SuggestionType.PROMPT_OPTIMIZATION,
                format("Optimize prompts for %s", key.agentName()),
                format("Agent '%s' has elevated latency (%.0fms vs %.0fms baseline) with %.0f average input tokens. "
                    + "Consider shortening prompts or using streaming.",
                    key.agentName(), avgLatency, b.avgLatencyMs(), avgInput),
                key.agentName(),
                key.model(),
                null,
                0.0,
                0.0,
                zScore > config.latencyHighZThreshold() ? Priority.HIGH : Priority.MEDIUM,
                ActionItems.latency(key.agentName(), key.model(), avgLatency, b.avgLatencyMs(), avgInput,
                    zScore, config.latencyHighZThreshold()),
                new SuggestionMetrics.Latency(avgLatency, b.avgLatencyMs(), zScore, avgInput)));
        });
        return suggestions;
    }
}
