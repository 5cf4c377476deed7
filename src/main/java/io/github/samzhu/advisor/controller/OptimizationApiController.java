package io.github.samzhu.advisor.controller;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.advisor.document.Recommendation;
import io.github.samzhu.advisor.dto.BaselineRefreshResult;
import io.github.samzhu.advisor.dto.OptimizationSummary;
import io.github.samzhu.advisor.dto.RecommendationEffectiveness;
import io.github.samzhu.advisor.dto.Suggestion;
import io.github.samzhu.advisor.dto.api.ActualSavingsRequest;
import io.github.samzhu.advisor.dto.api.BaselineResponse;
import io.github.samzhu.advisor.dto.api.CachingOpportunitiesResponse;
import io.github.samzhu.advisor.dto.api.DismissRequest;
import io.github.samzhu.advisor.dto.api.RecommendationResponse;
import io.github.samzhu.advisor.dto.api.SuggestionListResponse;
import io.github.samzhu.advisor.exception.RecommendationUnavailableException;
import io.github.samzhu.advisor.exception.RecommendationUnavailableException.Reason;
import io.github.samzhu.advisor.service.BaselineService;
import io.github.samzhu.advisor.service.PatternAnalysisService;
import io.github.samzhu.advisor.service.RecommendationTrackingService;
import io.github.samzhu.advisor.service.SuggestionService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * 成本優化 API 控制器。
 *
 * <p>提供建議產生、摘要、基準線、快取機會與建議生命週期等 API 端點。
 * 專案 ID 由上游驗證層透過 {@code X-Project-Id} header 傳入。
 */
@RestController
@RequestMapping("/api/v1/optimizations")
public class OptimizationApiController {

    private static final Logger log = LoggerFactory.getLogger(OptimizationApiController.class);

    static final String PROJECT_HEADER = "X-Project-Id";
    static final String UNAVAILABLE_MESSAGE =
        "This recommendation is no longer available. It may have expired or already been actioned.";

    private final SuggestionService suggestionService;
    private final BaselineService baselineService;
    private final PatternAnalysisService patternAnalysisService;
    private final RecommendationTrackingService trackingService;

    public OptimizationApiController(
            SuggestionService suggestionService,
            BaselineService baselineService,
            PatternAnalysisService patternAnalysisService,
            RecommendationTrackingService trackingService) {
        this.suggestionService = suggestionService;
        this.baselineService = baselineService;
        this.patternAnalysisService = patternAnalysisService;
        this.trackingService = trackingService;
    }

    // ========== 建議 ==========

    /**
     * 取得優化建議（不寫入建議記錄）。
     *
     * @param projectId 專案 ID
     * @param days 分析天數 (1-90)
     * @param includeLowPriority 是否包含 low 優先級
     * @return 建議清單
     */
    @GetMapping
    public ResponseEntity<SuggestionListResponse> getSuggestions(
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestParam(defaultValue = "30") @Min(1) @Max(90) int days,
            @RequestParam(defaultValue = "true") boolean includeLowPriority) {

        log.debug("Getting suggestions: project={}, days={}, includeLow={}", projectId, days, includeLowPriority);

        List<Suggestion> suggestions = suggestionService.getSuggestions(projectId, days, includeLowPriority, false);
        return ResponseEntity.ok(SuggestionListResponse.of(projectId, days, suggestions));
    }

    /**
     * 產生優化建議，並將前段建議寫入建議記錄以追蹤處理結果。
     *
     * @param projectId 專案 ID
     * @param days 分析天數 (1-90)
     * @param includeLowPriority 是否包含 low 優先級
     * @return 建議清單
     */
    @PostMapping("/recommendations/generate")
    public ResponseEntity<SuggestionListResponse> generateRecommendations(
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestParam(defaultValue = "30") @Min(1) @Max(90) int days,
            @RequestParam(defaultValue = "true") boolean includeLowPriority) {

        log.info("Generating recommendations: project={}, days={}", projectId, days);

        List<Suggestion> suggestions = suggestionService.getSuggestions(projectId, days, includeLowPriority, true);
        return ResponseEntity.ok(SuggestionListResponse.of(projectId, days, suggestions));
    }

    /**
     * 取得優化摘要。
     *
     * @param projectId 專案 ID
     * @param days 分析天數 (1-90)
     * @return 摘要
     */
    @GetMapping("/summary")
    public ResponseEntity<OptimizationSummary> getSummary(
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestParam(defaultValue = "30") @Min(1) @Max(90) int days) {

        log.debug("Getting optimization summary: project={}, days={}", projectId, days);
        return ResponseEntity.ok(suggestionService.getSummary(projectId, days));
    }

    // ========== 基準線 ==========

    /**
     * 重新計算基準線。
     *
     * @param projectId 專案 ID
     * @param days 歷史天數 (7-90)
     * @return 重算結果
     */
    @PostMapping("/baselines/refresh")
    public ResponseEntity<BaselineRefreshResult> refreshBaselines(
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestParam(defaultValue = "30") @Min(7) @Max(90) int days) {

        log.info("Refreshing baselines: project={}, days={}", projectId, days);
        return ResponseEntity.ok(baselineService.computeBaselines(projectId, days));
    }

    /**
     * 取得基準線，可依 agent 或模型過濾。
     *
     * @param projectId 專案 ID
     * @param agentName agent 名稱（選填）
     * @param model 模型名稱（選填）
     * @return 基準線列表
     */
    @GetMapping("/baselines")
    public ResponseEntity<List<BaselineResponse>> getBaselines(
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestParam(required = false) String agentName,
            @RequestParam(required = false) String model) {

        log.debug("Getting baselines: project={}, agent={}, model={}", projectId, agentName, model);

        List<BaselineResponse> responses = baselineService.getBaselines(projectId, agentName, model)
            .stream()
            .map(BaselineResponse::fromBaseline)
            .toList();
        return ResponseEntity.ok(responses);
    }

    // ========== 快取機會 ==========

    /**
     * 取得快取機會。
     *
     * @param projectId 專案 ID
     * @param minOccurrences 最低出現次數（至少 2）
     * @return 快取機會
     */
    @GetMapping("/caching-opportunities")
    public ResponseEntity<CachingOpportunitiesResponse> getCachingOpportunities(
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestParam(defaultValue = "5") @Min(2) int minOccurrences) {

        log.debug("Getting caching opportunities: project={}, minOccurrences={}", projectId, minOccurrences);

        return ResponseEntity.ok(CachingOpportunitiesResponse.of(projectId, minOccurrences,
            patternAnalysisService.analyzeCachingOpportunities(projectId, minOccurrences)));
    }

    // ========== 建議記錄 ==========

    /**
     * 取得待處理的建議記錄。
     *
     * @param projectId 專案 ID
     * @return 未過期的待處理建議，最新的在前
     */
    @GetMapping("/recommendations")
    public ResponseEntity<List<RecommendationResponse>> getPendingRecommendations(
            @RequestHeader(PROJECT_HEADER) String projectId) {

        log.debug("Getting pending recommendations: project={}", projectId);

        List<RecommendationResponse> responses = trackingService.getPendingRecommendations(projectId)
            .stream()
            .map(RecommendationResponse::fromRecommendation)
            .toList();
        return ResponseEntity.ok(responses);
    }

    /**
     * 標記建議為已實施。
     *
     * @param projectId 專案 ID
     * @param id 建議 ID
     * @return 更新後的建議
     */
    @PostMapping("/recommendations/{id}/implement")
    public ResponseEntity<RecommendationResponse> implementRecommendation(
            @RequestHeader(PROJECT_HEADER) String projectId,
            @PathVariable String id) {

        log.info("Implementing recommendation: project={}, id={}", projectId, id);

        Recommendation updated = trackingService.markImplemented(id, projectId);
        return ResponseEntity.ok(RecommendationResponse.fromRecommendation(updated));
    }

    /**
     * 標記建議為已忽略。
     *
     * @param projectId 專案 ID
     * @param id 建議 ID
     * @param request 忽略原因（選填）
     * @return 更新後的建議
     */
    @PostMapping("/recommendations/{id}/dismiss")
    public ResponseEntity<RecommendationResponse> dismissRecommendation(
            @RequestHeader(PROJECT_HEADER) String projectId,
            @PathVariable String id,
            @RequestBody(required = false) @Validated DismissRequest request) {

        String feedback = request != null ? request.feedback() : null;
        log.info("Dismissing recommendation: project={}, id={}", projectId, id);

        Recommendation updated = trackingService.markDismissed(id, projectId, feedback);
        return ResponseEntity.ok(RecommendationResponse.fromRecommendation(updated));
    }

    /**
     * 回報已實施建議的實際每月節省。
     *
     * @param projectId 專案 ID
     * @param id 建議 ID
     * @param request 實際節省
     * @return 更新後的建議
     */
    @PostMapping("/recommendations/{id}/actual-savings")
    public ResponseEntity<RecommendationResponse> recordActualSavings(
            @RequestHeader(PROJECT_HEADER) String projectId,
            @PathVariable String id,
            @RequestBody @Validated ActualSavingsRequest request) {

        log.info("Recording actual savings: project={}, id={}, actual={}",
            projectId, id, request.actualMonthlySavings());

        Recommendation updated = trackingService.recordActualSavings(id, projectId, request.actualMonthlySavings());
        return ResponseEntity.ok(RecommendationResponse.fromRecommendation(updated));
    }

    /**
     * 取得建議成效統計。
     *
     * @param projectId 專案 ID
     * @return 成效統計
     */
    @GetMapping("/recommendations/effectiveness")
    public ResponseEntity<RecommendationEffectiveness> getEffectiveness(
            @RequestHeader(PROJECT_HEADER) String projectId) {

        log.debug("Getting recommendation effectiveness: project={}", projectId);
        return ResponseEntity.ok(trackingService.getRecommendationEffectiveness(projectId));
    }

    @ExceptionHandler(RecommendationUnavailableException.class)
    public ResponseEntity<ProblemDetail> handleUnavailable(RecommendationUnavailableException e) {
        log.info("Recommendation unavailable: id={}, reason={}", e.getRecommendationId(), e.getReason());

        if (e.getReason() == Reason.NOT_IMPLEMENTED) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(ProblemDetail.forStatusAndDetail(
                HttpStatus.CONFLICT, "Actual savings can only be recorded for implemented recommendations."));
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, UNAVAILABLE_MESSAGE));
    }
}
