package io.github.samzhu.advisor.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.advisor.config.AdvisorProperties;
import io.github.samzhu.advisor.document.UsageEvent;
import io.github.samzhu.advisor.dto.CachingOpportunity;
import io.github.samzhu.advisor.util.TimeWindow;

/**
 * 重複輸入模式分析服務。
 *
 * <p>依 (agent, inputHash) 分組找出重複出現的請求，估算導入回應快取可節省的成本：
 * <ul>
 *   <li>出現次數達 {@code minOccurrences} 的 hash 才算重複模式</li>
 *   <li>每個模式第一次出現（時間最早）的呼叫無法被快取，其餘呼叫的成本即為可節省金額</li>
 *   <li>沒有 {@code inputHash} 的事件只計入總呼叫數</li>
 * </ul>
 */
@Service
public class PatternAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(PatternAnalysisService.class);

    private final EventAggregationService aggregationService;
    private final AdvisorProperties properties;
    private final Clock clock;

    public PatternAnalysisService(
            EventAggregationService aggregationService,
            AdvisorProperties properties,
            Clock clock) {
        this.aggregationService = aggregationService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 使用預設節省門檻與分析天數。
     *
     * @param projectId 專案 ID
     * @param minOccurrences 最低出現次數
     * @return 快取機會，依預估節省降序
     */
    public List<CachingOpportunity> analyzeCachingOpportunities(String projectId, int minOccurrences) {
        return analyzeCachingOpportunities(projectId, minOccurrences,
            properties.caching().minSavings(), properties.caching().defaultDays());
    }

    /**
     * 分析專案的快取機會。
     *
     * @param projectId 專案 ID
     * @param minOccurrences 最低出現次數
     * @param minSavings 最低每月節省 (USD)，低於此值的機會會被捨棄
     * @param days 分析天數
     * @return 快取機會，依預估節省降序
     */
    public List<CachingOpportunity> analyzeCachingOpportunities(
            String projectId, int minOccurrences, double minSavings, int days) {
        TimeWindow window = TimeWindow.lastDays(clock, days);
        List<CachingOpportunity> opportunities = analyzeCachingOpportunities(
            aggregationService.findEvents(projectId, window), minOccurrences, minSavings, window);
        log.debug("Found {} caching opportunities for project {}", opportunities.size(), projectId);
        return opportunities;
    }

    /**
     * 以呼叫端已載入的事件分析快取機會，不再查詢事件。
     *
     * @param events 視窗內的事件
     * @param minOccurrences 最低出現次數
     * @param minSavings 最低每月節省 (USD)
     * @param window 事件所屬的時間視窗，用於換算每月節省
     * @return 快取機會，依預估節省降序
     */
    public List<CachingOpportunity> analyzeCachingOpportunities(
            List<UsageEvent> events, int minOccurrences, double minSavings, TimeWindow window) {
        // 只出現一次的輸入不構成重複
        int threshold = Math.max(minOccurrences, 2);

        Map<String, List<UsageEvent>> byAgent = events.stream()
            .collect(Collectors.groupingBy(e -> String.valueOf(e.agentName()), LinkedHashMap::new, Collectors.toList()));

        List<CachingOpportunity> opportunities = new ArrayList<>();
        byAgent.forEach((agent, agentEvents) -> {
            CachingOpportunity opportunity = analyzeAgent(agentEvents, threshold, window);
            if (opportunity == null) {
                return;
            }
            if (opportunity.estimatedMonthlySavings() < minSavings) {
                log.debug("Dropping caching opportunity for {}: ${}/month < ${}",
                    agent, opportunity.estimatedMonthlySavings(), minSavings);
                return;
            }
            opportunities.add(opportunity);
        });

        opportunities.sort(Comparator.comparingDouble(CachingOpportunity::estimatedMonthlySavings).reversed());
        return opportunities;
    }

    private CachingOpportunity analyzeAgent(List<UsageEvent> agentEvents, int minOccurrences, TimeWindow window) {
        Map<String, List<UsageEvent>> byHash = agentEvents.stream()
            .filter(UsageEvent::hasInputHash)
            .collect(Collectors.groupingBy(UsageEvent::inputHash));

        int uniquePatterns = 0;
        int duplicateCalls = 0;
        double extraCost = 0.0;

        for (List<UsageEvent> occurrences : byHash.values()) {
            if (occurrences.size() < minOccurrences) {
                continue;
            }
            uniquePatterns++;
            duplicateCalls += occurrences.size() - 1;
            // 第一次出現的呼叫不算節省
            extraCost += occurrences.stream()
                .sorted(Comparator.comparing(UsageEvent::timestamp))
                .skip(1)
                .mapToDouble(UsageEvent::cost)
                .sum();
        }

        if (uniquePatterns == 0) {
            return null;
        }

        int totalCalls = agentEvents.size();
        double duplicateRate = (double) duplicateCalls / totalCalls * 100.0;

        return new CachingOpportunity(
            agentEvents.get(0).agentName(),
            uniquePatterns,
            totalCalls,
            duplicateCalls,
            duplicateRate,
            window.toMonthly(extraCost));
    }
}
