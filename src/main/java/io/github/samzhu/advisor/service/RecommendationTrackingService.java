package io.github.samzhu.advisor.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.advisor.config.AdvisorProperties;
import io.github.samzhu.advisor.document.Recommendation;
import io.github.samzhu.advisor.document.RecommendationStatus;
import io.github.samzhu.advisor.dto.RecommendationEffectiveness;
import io.github.samzhu.advisor.dto.Suggestion;
import io.github.samzhu.advisor.exception.RecommendationUnavailableException;
import io.github.samzhu.advisor.exception.RecommendationUnavailableException.Reason;
import io.github.samzhu.advisor.repository.RecommendationRepository;
import io.github.samzhu.advisor.util.Rounding;

/**
 * 優化建議生命週期服務。
 *
 * <p>將排名前段的建議持久化並追蹤使用者的處理結果：
 * <ul>
 *   <li>去重：同一 (project, type, agent, model) 在冷卻期內只保留一筆 PENDING</li>
 *   <li>實施 / 忽略：只有 PENDING 且未過期的建議可以操作</li>
 *   <li>過期：不做背景清理，讀取或操作時才判定</li>
 *   <li>成效：實施率與實際節省準確度，回饋給 {@link PricingService} 的信心分數</li>
 * </ul>
 *
 * <p>讀取後再寫入的去重檢查無法阻擋並行建立，最終由 {@code pending_dedup_idx}
 * partial unique index 保證，撞到索引視同已去重。
 * 建立流程不包在交易中：MongoDB 交易內的寫入錯誤會中止整個交易，
 * 撞索引後 commit 會失敗。每一步都是單一文件寫入，過期標記不隨新增失敗回滾。
 */
@Service
public class RecommendationTrackingService {

    private static final Logger log = LoggerFactory.getLogger(RecommendationTrackingService.class);
    private static final TypeReference<Map<String, Object>> SNAPSHOT_TYPE = new TypeReference<>() {};

    private final RecommendationRepository recommendationRepository;
    private final AdvisorProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RecommendationTrackingService(
            RecommendationRepository recommendationRepository,
            AdvisorProperties properties,
            ObjectMapper objectMapper,
            Clock clock) {
        this.recommendationRepository = recommendationRepository;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * 使用預設冷卻期建立建議。
     */
    public Optional<Recommendation> createRecommendation(String projectId, Suggestion suggestion) {
        return createRecommendation(projectId, suggestion, properties.recommendation().cooldownDays());
    }

    /**
     * 建立待處理建議。
     *
     * @param projectId 專案 ID
     * @param suggestion 來源建議
     * @param cooldownDays 有效天數
     * @return 新建立的建議，已有相同的待處理建議時為 empty
     */
    public Optional<Recommendation> createRecommendation(String projectId, Suggestion suggestion, int cooldownDays) {
        Instant now = clock.instant();

        // 1. 檢查相同 key 的 PENDING 記錄
        List<Recommendation> existing = recommendationRepository
            .findByProjectIdAndRecommendationTypeAndAgentNameAndModelAndStatus(
                projectId, suggestion.type(), suggestion.agentName(), suggestion.model(),
                RecommendationStatus.PENDING);

        if (existing.stream().anyMatch(r -> r.isActionableAt(now))) {
            log.debug("Skipping duplicate recommendation: project={}, type={}, agent={}, model={}",
                projectId, suggestion.type().value(), suggestion.agentName(), suggestion.model());
            return Optional.empty();
        }

        // 2. 過期的 PENDING 轉為 EXPIRED，釋出 partial unique index
        for (Recommendation stale : existing) {
            recommendationRepository.save(stale.markExpired());
            log.debug("Expired stale recommendation: id={}", stale.id());
        }

        // 3. 建立新記錄
        Recommendation recommendation = Recommendation.create(
            projectId,
            suggestion.type(),
            suggestion.title(),
            suggestion.description(),
            suggestion.agentName(),
            suggestion.model(),
            suggestion.alternativeModel(),
            suggestion.estimatedSavingsMonthly(),
            suggestion.estimatedSavingsPercent(),
            toSnapshot(suggestion),
            now,
            Math.max(cooldownDays, 1));

        try {
            Recommendation saved = recommendationRepository.insert(recommendation);
            log.info("Created recommendation: id={}, project={}, type={}, agent={}, savings=${}/month",
                saved.id(), projectId, suggestion.type().value(), suggestion.agentName(),
                suggestion.estimatedSavingsMonthly());
            return Optional.of(saved);
        } catch (DuplicateKeyException e) {
            log.debug("Concurrent pending recommendation already exists: project={}, type={}, agent={}, model={}",
                projectId, suggestion.type().value(), suggestion.agentName(), suggestion.model());
            return Optional.empty();
        }
    }

    /**
     * 標記建議為已實施。
     *
     * @param recommendationId 建議 ID
     * @param projectId 專案 ID
     * @return 更新後的建議
     * @throws RecommendationUnavailableException 不存在、已處理或已過期
     */
    @Transactional(noRollbackFor = RecommendationUnavailableException.class)
    public Recommendation markImplemented(String recommendationId, String projectId) {
        Instant now = clock.instant();
        Recommendation recommendation = requireActionable(recommendationId, projectId, now);

        Recommendation saved = recommendationRepository.save(recommendation.markImplemented(now));
        log.info("Recommendation implemented: id={}, project={}, type={}",
            recommendationId, projectId, recommendation.recommendationType().value());
        return saved;
    }

    /**
     * 標記建議為已忽略。
     *
     * @param recommendationId 建議 ID
     * @param projectId 專案 ID
     * @param feedback 使用者回饋，可為 null
     * @return 更新後的建議
     * @throws RecommendationUnavailableException 不存在、已處理或已過期
     */
    @Transactional(noRollbackFor = RecommendationUnavailableException.class)
    public Recommendation markDismissed(String recommendationId, String projectId, String feedback) {
        Instant now = clock.instant();
        Recommendation recommendation = requireActionable(recommendationId, projectId, now);

        Recommendation saved = recommendationRepository.save(recommendation.markDismissed(now, feedback));
        log.info("Recommendation dismissed: id={}, project={}, hasFeedback={}",
            recommendationId, projectId, feedback != null && !feedback.isBlank());
        return saved;
    }

    /**
     * 查詢未過期的待處理建議，最新的在前。
     */
    public List<Recommendation> getPendingRecommendations(String projectId) {
        return recommendationRepository.findByProjectIdAndStatusAndExpiresAtAfterOrderByCreatedAtDesc(
            projectId, RecommendationStatus.PENDING, clock.instant());
    }

    /**
     * 回報已實施建議的實際每月節省。
     *
     * @param recommendationId 建議 ID
     * @param projectId 專案 ID
     * @param actualMonthlySavings 實際每月節省 (USD)
     * @return 更新後的建議
     * @throws RecommendationUnavailableException 不存在或尚未實施
     */
    @Transactional
    public Recommendation recordActualSavings(String recommendationId, String projectId, double actualMonthlySavings) {
        Recommendation recommendation = recommendationRepository.findByIdAndProjectId(recommendationId, projectId)
            .orElseThrow(() -> new RecommendationUnavailableException(recommendationId, Reason.NOT_FOUND));
        if (recommendation.status() != RecommendationStatus.IMPLEMENTED) {
            throw new RecommendationUnavailableException(recommendationId, Reason.NOT_IMPLEMENTED);
        }

        Recommendation saved = recommendationRepository.save(
            recommendation.withActualSavings(actualMonthlySavings, clock.instant()));
        log.info("Actual savings recorded: id={}, estimated=${}, actual=${}",
            recommendationId, recommendation.estimatedMonthlySavings(), actualMonthlySavings);
        return saved;
    }

    /**
     * 計算專案的建議成效。
     *
     * <p>逾期但仍為 PENDING 的記錄計入 expired（只讀，不回寫狀態）。
     *
     * @param projectId 專案 ID
     * @return 成效統計
     */
    public RecommendationEffectiveness getRecommendationEffectiveness(String projectId) {
        Instant now = clock.instant();
        List<Recommendation> all = recommendationRepository.findByProjectId(projectId);

        long pending = 0;
        long implemented = 0;
        long dismissed = 0;
        long expired = 0;
        double estimated = 0.0;
        double actual = 0.0;
        double reportedEstimated = 0.0;

        for (Recommendation r : all) {
            switch (r.status()) {
                case PENDING -> {
                    if (r.isExpiredAt(now)) {
                        expired++;
                    } else {
                        pending++;
                    }
                }
                case IMPLEMENTED -> {
                    implemented++;
                    estimated += r.estimatedMonthlySavings();
                    if (r.actualMonthlySavings() != null) {
                        actual += r.actualMonthlySavings();
                        reportedEstimated += r.estimatedMonthlySavings();
                    }
                }
                case DISMISSED -> dismissed++;
                case EXPIRED -> expired++;
            }
        }

        long closed = implemented + dismissed + expired;
        double implementationRate = closed > 0 ? (double) implemented / closed * 100.0 : 0.0;
        Double accuracy = reportedEstimated > 0 ? Rounding.scale(actual / reportedEstimated, 2) : null;

        return new RecommendationEffectiveness(
            all.size(),
            pending,
            implemented,
            dismissed,
            expired,
            Rounding.percent(implementationRate),
            Rounding.money(estimated),
            Rounding.money(actual),
            accuracy);
    }

    private Recommendation requireActionable(String recommendationId, String projectId, Instant now) {
        Recommendation recommendation = recommendationRepository.findByIdAndProjectId(recommendationId, projectId)
            .orElseThrow(() -> new RecommendationUnavailableException(recommendationId, Reason.NOT_FOUND));

        if (recommendation.status().isTerminal()) {
            throw new RecommendationUnavailableException(recommendationId, Reason.ALREADY_ACTIONED);
        }
        if (recommendation.isExpiredAt(now)) {
            recommendationRepository.save(recommendation.markExpired());
            log.info("Recommendation expired on access: id={}, expiresAt={}", recommendationId, recommendation.expiresAt());
            throw new RecommendationUnavailableException(recommendationId, Reason.EXPIRED);
        }
        return recommendation;
    }

    private Map<String, Object> toSnapshot(Suggestion suggestion) {
        if (suggestion.metrics() == null) {
            return Map.of();
        }
        return objectMapper.convertValue(suggestion.metrics(), SNAPSHOT_TYPE);
    }
}
