package io.github.samzhu.advisor.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.tdunning.math.stats.MergingDigest;
import com.tdunning.math.stats.TDigest;

import io.github.samzhu.advisor.config.AdvisorProperties;
import io.github.samzhu.advisor.document.ProjectBaseline;
import io.github.samzhu.advisor.document.UsageEvent;
import io.github.samzhu.advisor.dto.AgentModelKey;
import io.github.samzhu.advisor.dto.BaselineRefreshResult;
import io.github.samzhu.advisor.dto.GroupStats;
import io.github.samzhu.advisor.repository.ProjectBaselineRepository;
import io.github.samzhu.advisor.util.TimeWindow;

/**
 * 統計基準線服務。
 *
 * <p>為每個 (project, agent, model) 建立統計基準線，作為異常偵測與延遲/錯誤分析的比較點：
 * <ol>
 *   <li>查詢 {@code [now - days, now]} 內的事件</li>
 *   <li>依 (agent, model) 分組，呼叫數少於 {@code advisor.baseline.min-samples} 的群組略過</li>
 *   <li>計算成本、token、延遲的平均與標準差，平均每日呼叫量與錯誤率</li>
 *   <li>以 T-Digest 計算延遲 P50/P95</li>
 *   <li>以固定 ID upsert 到 {@code project_baselines}</li>
 * </ol>
 *
 * <p>基準線只由此服務寫入。重算不在背景排程，由呼叫端明確觸發
 * （或在第一次產生建議時透過 {@link #ensureBaselinesExist} 自動建立）。
 *
 * @see <a href="https://github.com/tdunning/t-digest">T-Digest Algorithm</a>
 */
@Service
public class BaselineService {

    private static final Logger log = LoggerFactory.getLogger(BaselineService.class);

    private final ProjectBaselineRepository baselineRepository;
    private final EventAggregationService aggregationService;
    private final AdvisorProperties properties;
    private final Clock clock;

    public BaselineService(
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
     * 重新計算專案的所有基準線。
     *
     * @param projectId 專案 ID
     * @param days 歷史天數
     * @return 重算結果
     */
    @Transactional
    public BaselineRefreshResult computeBaselines(String projectId, int days) {
        TimeWindow window = TimeWindow.lastDays(clock, days);
        return computeBaselines(projectId, window, aggregationService.findEvents(projectId, window));
    }

    /**
     * 以呼叫端已載入的事件計算基準線，不再查詢事件。
     *
     * @param projectId 專案 ID
     * @param window 事件所屬的時間視窗
     * @param events 視窗內的事件
     * @return 重算結果
     */
    @Transactional
    public BaselineRefreshResult computeBaselines(String projectId, TimeWindow window, List<UsageEvent> events) {
        long startTime = System.currentTimeMillis();
        Instant now = window.end();
        int minSamples = properties.baseline().minSamples();

        Map<AgentModelKey, List<UsageEvent>> groups = aggregationService.groupByAgentAndModel(events);

        List<ProjectBaseline> baselines = new ArrayList<>();
        List<AgentModelKey> skipped = new ArrayList<>();

        groups.forEach((key, groupEvents) -> {
            if (groupEvents.size() < minSamples) {
                log.debug("Skipping baseline for {}/{}: {} calls < {}",
                    key.agentName(), key.model(), groupEvents.size(), minSamples);
                skipped.add(key);
                return;
            }
            baselines.add(buildBaseline(projectId, key, groupEvents, now));
        });

        if (!baselines.isEmpty()) {
            baselineRepository.saveAll(baselines);
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("Baselines computed for project {}: {} upserted, {} skipped, {} events over {} days in {}ms",
            projectId, baselines.size(), skipped.size(), events.size(), window.days(), duration);

        return new BaselineRefreshResult(projectId, window.days(), events.size(),
            baselines.size(), List.copyOf(skipped), now);
    }

    /**
     * 若專案尚無任何基準線，則立即計算一次。
     *
     * <p>這只是首次使用的初始化，不是定期更新策略。
     *
     * @param projectId 專案 ID
     * @param window 事件所屬的時間視窗
     * @param events 呼叫端已載入的視窗事件
     * @return true 表示本次有觸發計算
     */
    @Transactional
    public boolean ensureBaselinesExist(String projectId, TimeWindow window, List<UsageEvent> events) {
        if (hasBaselines(projectId)) {
            return false;
        }
        log.info("No baselines for project {}, computing initial baselines", projectId);
        computeBaselines(projectId, window, events);
        return true;
    }

    /**
     * 檢查專案是否已有基準線。
     */
    public boolean hasBaselines(String projectId) {
        return baselineRepository.existsByProjectId(projectId);
    }

    /**
     * 查詢單一 (agent, model) 的基準線。
     *
     * @return 基準線，不存在時為 empty（正常情況，不是錯誤）
     */
    public Optional<ProjectBaseline> getBaseline(String projectId, String agentName, String model) {
        return baselineRepository.findByProjectIdAndAgentNameAndModel(projectId, agentName, model);
    }

    /**
     * 查詢專案的基準線，可依 agent 或模型過濾。
     *
     * @param projectId 專案 ID
     * @param agentName agent 名稱，null 表示不過濾
     * @param model 模型名稱，null 表示不過濾
     * @return 基準線列表
     */
    public List<ProjectBaseline> getBaselines(String projectId, String agentName, String model) {
        if (agentName != null && model != null) {
            return getBaseline(projectId, agentName, model).map(List::of).orElse(List.of());
        }
        if (agentName != null) {
            return baselineRepository.findByProjectIdAndAgentName(projectId, agentName);
        }
        if (model != null) {
            return baselineRepository.findByProjectIdAndModel(projectId, model);
        }
        return baselineRepository.findByProjectId(projectId);
    }

    private ProjectBaseline buildBaseline(String projectId, AgentModelKey key, List<UsageEvent> events, Instant now) {
        GroupStats stats = aggregationService.summarize(events);

        TDigest digest = new MergingDigest(properties.baseline().digestCompression());
        events.forEach(e -> digest.add(e.latencyMs()));

        log.debug("Baseline {}/{}: n={}, avgCost={}, avgLatency={}ms, errorRate={}",
            key.agentName(), key.model(), stats.callCount(), stats.costPerCall().mean(),
            stats.latencyMs().mean(), stats.errorRate());

        return new ProjectBaseline(
            ProjectBaseline.createId(projectId, key.agentName(), key.model()),
            projectId,
            key.agentName(),
            key.model(),
            stats.costPerCall().mean(),
            stats.costPerCall().stddev(),
            stats.inputTokens().mean(),
            stats.inputTokens().stddev(),
            stats.outputTokens().mean(),
            stats.outputTokens().stddev(),
            stats.latencyMs().mean(),
            stats.latencyMs().stddev(),
            digest.quantile(0.5),
            digest.quantile(0.95),
            stats.avgDailyCalls(),
            stats.errorRate(),
            stats.callCount(),
            now);
    }
}
