package io.github.samzhu.advisor.service;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.advisor.document.UsageEvent;
import io.github.samzhu.advisor.dto.AgentModelKey;
import io.github.samzhu.advisor.dto.GroupStats;
import io.github.samzhu.advisor.dto.GroupStats.MetricStats;
import io.github.samzhu.advisor.repository.UsageEventRepository;
import io.github.samzhu.advisor.util.TimeWindow;

/**
 * 用量事件統計服務。
 *
 * <p>從唯讀的事件儲存查詢時間視窗內的事件，並提供分組統計：
 * <ul>
 *   <li>依 (agent, model) 分組</li>
 *   <li>count / sum / mean / stddev（樣本標準差 n-1）</li>
 *   <li>依 UTC 日期分組後的平均每日呼叫量</li>
 *   <li>錯誤數與失敗呼叫成本</li>
 * </ul>
 *
 * <p>基準線計算與所有分析器都透過此服務取得統計值，確保各處計算口徑一致。
 */
@Service
public class EventAggregationService {

    private static final Logger log = LoggerFactory.getLogger(EventAggregationService.class);
    private static final double STDDEV_EPSILON = 1e-9;

    private final UsageEventRepository eventRepository;

    public EventAggregationService(UsageEventRepository eventRepository) {
        this.eventRepository = eventRepository;
    }

    /**
     * 查詢專案在時間視窗內的事件。
     *
     * @param projectId 專案 ID
     * @param window 時間視窗
     * @return 事件列表
     */
    public List<UsageEvent> findEvents(String projectId, TimeWindow window) {
        List<UsageEvent> events = eventRepository.findInWindow(projectId, window.start(), window.end());
        log.debug("Loaded {} events for project {} in [{}, {}]",
            events.size(), projectId, window.start(), window.end());
        return events;
    }

    /**
     * 依 (agent, model) 分組，保留事件出現順序。
     *
     * @param events 事件列表
     * @return 分組結果
     */
    public Map<AgentModelKey, List<UsageEvent>> groupByAgentAndModel(List<UsageEvent> events) {
        return events.stream()
            .collect(Collectors.groupingBy(
                e -> new AgentModelKey(e.agentName(), e.model()),
                LinkedHashMap::new,
                Collectors.toList()));
    }

    /**
     * 依 (agent, model) 分組並計算每組統計。
     *
     * @param events 事件列表
     * @return 每組的統計摘要
     */
    public Map<AgentModelKey, GroupStats> summarizeByAgentAndModel(List<UsageEvent> events) {
        Map<AgentModelKey, GroupStats> result = new LinkedHashMap<>();
        groupByAgentAndModel(events).forEach((key, groupEvents) -> result.put(key, summarize(groupEvents)));
        return result;
    }

    /**
     * 計算一組事件的統計摘要。
     *
     * @param events 事件列表
     * @return 統計摘要，空列表回傳 {@link GroupStats#empty()}
     */
    public GroupStats summarize(List<UsageEvent> events) {
        if (events.isEmpty()) {
            return GroupStats.empty();
        }

        int callCount = events.size();
        int errorCount = (int) events.stream().filter(e -> !e.success()).count();
        double totalCost = events.stream().mapToDouble(UsageEvent::cost).sum();
        double failedCost = events.stream().filter(e -> !e.success()).mapToDouble(UsageEvent::cost).sum();
        long totalInput = events.stream().mapToLong(UsageEvent::inputTokens).sum();
        long totalOutput = events.stream().mapToLong(UsageEvent::outputTokens).sum();

        // 每日呼叫量：先依 UTC 日期分組，再對有事件的日子取平均
        Map<LocalDate, Long> dailyCounts = events.stream()
            .collect(Collectors.groupingBy(UsageEvent::date, Collectors.counting()));
        double avgDailyCalls = dailyCounts.values().stream()
            .mapToLong(Long::longValue)
            .average()
            .orElse(0.0);

        return new GroupStats(
            callCount,
            errorCount,
            totalCost,
            failedCost,
            totalInput,
            totalOutput,
            stats(events, UsageEvent::cost),
            stats(events, e -> e.inputTokens()),
            stats(events, e -> e.outputTokens()),
            stats(events, e -> e.latencyMs()),
            dailyCounts.size(),
            avgDailyCalls);
    }

    /**
     * 計算總成本。
     */
    public double totalCost(List<UsageEvent> events) {
        return events.stream().mapToDouble(UsageEvent::cost).sum();
    }

    /**
     * 計算平均值與樣本標準差 (n-1)。少於 2 筆或所有值相同時標準差為 0。
     *
     * @param events 事件列表
     * @param extractor 取值函式
     * @return 平均值與標準差
     */
    static MetricStats stats(List<UsageEvent> events, ToDoubleFunction<UsageEvent> extractor) {
        int n = events.size();
        if (n == 0) {
            return MetricStats.empty();
        }
        double mean = events.stream().mapToDouble(extractor).average().orElse(0.0);
        if (n < 2) {
            return new MetricStats(mean, 0.0);
        }
        double sumSquares = events.stream()
            .mapToDouble(extractor)
            .map(v -> (v - mean) * (v - mean))
            .sum();
        double stddev = Math.sqrt(sumSquares / (n - 1));
        // 相同數值累加的浮點誤差不應產生非零標準差
        if (stddev < STDDEV_EPSILON * Math.max(1.0, Math.abs(mean))) {
            stddev = 0.0;
        }
        return new MetricStats(mean, stddev);
    }
}
