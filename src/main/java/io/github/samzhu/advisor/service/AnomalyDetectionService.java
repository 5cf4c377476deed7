package io.github.samzhu.advisor.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.advisor.config.AdvisorProperties;
import io.github.samzhu.advisor.config.AdvisorProperties.AnomalyConfig;
import io.github.samzhu.advisor.document.ProjectBaseline;
import io.github.samzhu.advisor.dto.AgentModelKey;
import io.github.samzhu.advisor.dto.Anomaly;
import io.github.samzhu.advisor.dto.AnomalyMetric;
import io.github.samzhu.advisor.dto.GroupStats;
import io.github.samzhu.advisor.dto.Priority;
import io.github.samzhu.advisor.repository.ProjectBaselineRepository;
import io.github.samzhu.advisor.util.TimeWindow;

/**
 * 異常偵測服務。
 *
 * <p>將近期視窗（預設 24 小時）的統計值與已儲存的基準線比較：
 * <ul>
 *   <li>cost_per_call、latency_ms：z-score，基準線標準差為 0 時略過該指標</li>
 *   <li>error_rate：倍數比較，z-score 僅供參考（以基準錯誤率的 Bernoulli 標準差計算）</li>
 * </ul>
 *
 * <p>回傳所有被評估的指標，呼叫端依 {@link Anomaly#anomaly()} 過濾。結果不持久化。
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final ProjectBaselineRepository baselineRepository;
    private final EventAggregationService aggregationService;
    private final AdvisorProperties properties;
    private final Clock clock;

    public AnomalyDetectionService(
            ProjectBaselineRepository baselineRepository,
            EventAggregationService aggregationService,
            AdvisorProperties properties,
            Clock clock) {
        this.baselineRepository = baselineRepository;
        this.aggregationService = aggregationService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 使用預設近期視窗偵測異常。
     */
    public List<Anomaly> detectAnomalies(String projectId) {
        return detectAnomalies(projectId, properties.anomaly().recentHours());
    }

    /**
     * 偵測專案近期的異常。
     *
     * @param projectId 專案 ID
     * @param recentHours 近期視窗（小時）
     * @return 所有被評估的指標
     */
    public List<Anomaly> detectAnomalies(String projectId, int recentHours) {
        List<ProjectBaseline> baselines = baselineRepository.findByProjectId(projectId);
        if (baselines.isEmpty()) {
            log.debug("No baselines for project {}, skipping anomaly detection", projectId);
            return List.of();
        }

        TimeWindow window = TimeWindow.lastHours(clock, recentHours);
        Map<AgentModelKey, GroupStats> recent = aggregationService.summarizeByAgentAndModel(
            aggregationService.findEvents(projectId, window));

        List<Anomaly> results = new ArrayList<>();
        for (ProjectBaseline baseline : baselines) {
            GroupStats current = recent.get(new AgentModelKey(baseline.agentName(), baseline.model()));
            if (current == null || current.callCount() == 0) {
                continue;
            }

            evaluateZScore(baseline, AnomalyMetric.COST_PER_CALL, current.costPerCall().mean(),
                baseline.avgCostPerCall(), baseline.stddevCostPerCall(), results);
            evaluateZScore(baseline, AnomalyMetric.LATENCY_MS, current.latencyMs().mean(),
                baseline.avgLatencyMs(), baseline.stddevLatencyMs(), results);
            results.add(evaluateErrorRate(baseline, current.errorRate()));
        }

        long flagged = results.stream().filter(Anomaly::anomaly).count();
        log.debug("Anomaly detection for project {}: {} metrics evaluated, {} flagged",
            projectId, results.size(), flagged);
        return results;
    }

    private void evaluateZScore(ProjectBaseline baseline, AnomalyMetric metric,
            double currentValue, double mean, double stddev, List<Anomaly> results) {
        if (stddev <= 0) {
            return;
        }
        AnomalyConfig config = properties.anomaly();
        double zScore = (currentValue - mean) / stddev;
        double absZ = Math.abs(zScore);
        boolean anomaly = absZ >= config.zThreshold();

        Priority severity;
        if (absZ > config.highZThreshold()) {
            severity = Priority.HIGH;
        } else if (anomaly) {
            severity = Priority.MEDIUM;
        } else {
            severity = Priority.LOW;
        }

        results.add(new Anomaly(baseline.agentName(), baseline.model(), metric,
            currentValue, mean, stddev, zScore, severity, anomaly));
    }

    private Anomaly evaluateErrorRate(ProjectBaseline baseline, double currentRate) {
        AnomalyConfig config = properties.anomaly();
        double baselineRate = baseline.avgErrorRate();
        double stddev = Math.sqrt(baselineRate * (1.0 - baselineRate));
        double zScore = stddev > 0 ? (currentRate - baselineRate) / stddev : 0.0;

        boolean anomaly = currentRate > baselineRate * config.errorRateRatio();
        Priority severity;
        if (!anomaly) {
            severity = Priority.LOW;
        } else if (currentRate > baselineRate * config.highErrorRateRatio()) {
            severity = Priority.HIGH;
        } else {
            severity = Priority.MEDIUM;
        }

        return new Anomaly(baseline.agentName(), baseline.model(), AnomalyMetric.ERROR_RATE,
            currentRate, baselineRate, stddev, zScore, severity, anomaly);
    }
}
