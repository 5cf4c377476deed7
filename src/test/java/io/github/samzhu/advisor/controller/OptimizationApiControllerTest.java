package io.github.samzhu.advisor.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import io.github.samzhu.advisor.document.Recommendation;
import io.github.samzhu.advisor.dto.BaselineRefreshResult;
import io.github.samzhu.advisor.dto.Priority;
import io.github.samzhu.advisor.dto.Suggestion;
import io.github.samzhu.advisor.dto.SuggestionType;
import io.github.samzhu.advisor.exception.RecommendationUnavailableException;
import io.github.samzhu.advisor.exception.RecommendationUnavailableException.Reason;
import io.github.samzhu.advisor.service.BaselineService;
import io.github.samzhu.advisor.service.PatternAnalysisService;
import io.github.samzhu.advisor.service.RecommendationTrackingService;
import io.github.samzhu.advisor.service.SuggestionService;

class OptimizationApiControllerTest {

    private static final String BASE = "/api/v1/optimizations";
    private static final String PROJECT = "proj-1";
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private SuggestionService suggestionService;
    private BaselineService baselineService;
    private PatternAnalysisService patternAnalysisService;
    private RecommendationTrackingService trackingService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        suggestionService = mock(SuggestionService.class);
        baselineService = mock(BaselineService.class);
        patternAnalysisService = mock(PatternAnalysisService.class);
        trackingService = mock(RecommendationTrackingService.class);

        mockMvc = MockMvcBuilders.standaloneSetup(new OptimizationApiController(
            suggestionService, baselineService, patternAnalysisService, trackingService)).build();
    }

    @Test
    void shouldReturnSuggestionsWithCount() throws Exception {
        // Given
        when(suggestionService.getSuggestions(PROJECT, 30, true, false)).thenReturn(List.of(suggestion()));

        // When / Then
        mockMvc.perform(get(BASE).header(OptimizationApiController.PROJECT_HEADER, PROJECT))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.projectId").value(PROJECT))
            .andExpect(jsonPath("$.days").value(30))
            .andExpect(jsonPath("$.count").value(1))
            .andExpect(jsonPath("$.suggestions[0].type").value("caching"))
            .andExpect(jsonPath("$.suggestions[0].priority").value("medium"));
    }

    @Test
    void shouldRequireProjectHeader() throws Exception {
        mockMvc.perform(get(BASE))
            .andExpect(status().isBadRequest());

        verify(suggestionService, never()).getSuggestions(anyString(), anyInt(), anyBoolean(), anyBoolean());
    }

    @Test
    void shouldRejectDaysOutOfRange() throws Exception {
        mockMvc.perform(get(BASE).header(OptimizationApiController.PROJECT_HEADER, PROJECT).param("days", "0"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get(BASE + "/summary").header(OptimizationApiController.PROJECT_HEADER, PROJECT)
                .param("days", "91"))
            .andExpect(status().isBadRequest());

        verify(suggestionService, never()).getSuggestions(anyString(), anyInt(), anyBoolean(), anyBoolean());
    }

    @Test
    void shouldPersistWhenGenerating() throws Exception {
        // Given
        when(suggestionService.getSuggestions(PROJECT, 7, false, true)).thenReturn(List.of());

        // When / Then
        mockMvc.perform(post(BASE + "/recommendations/generate")
                .header(OptimizationApiController.PROJECT_HEADER, PROJECT)
                .param("days", "7")
                .param("includeLowPriority", "false"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(0));

        verify(suggestionService).getSuggestions(PROJECT, 7, false, true);
    }

    @Test
    void shouldRejectShortBaselineWindow() throws Exception {
        mockMvc.perform(post(BASE + "/baselines/refresh")
                .header(OptimizationApiController.PROJECT_HEADER, PROJECT)
                .param("days", "3"))
            .andExpect(status().isBadRequest());

        verify(baselineService, never()).computeBaselines(anyString(), anyInt());
    }

    @Test
    void shouldRefreshBaselines() throws Exception {
        // Given
        when(baselineService.computeBaselines(PROJECT, 14))
            .thenReturn(new BaselineRefreshResult(PROJECT, 14, 250, 3, List.of(), NOW));

        // When / Then
        mockMvc.perform(post(BASE + "/baselines/refresh")
                .header(OptimizationApiController.PROJECT_HEADER, PROJECT)
                .param("days", "14"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.baselinesComputed").value(3));
    }

    @Test
    void shouldRejectSingleOccurrenceThreshold() throws Exception {
        mockMvc.perform(get(BASE + "/caching-opportunities")
                .header(OptimizationApiController.PROJECT_HEADER, PROJECT)
                .param("minOccurrences", "1"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReturnNotFoundForUnavailableRecommendation() throws Exception {
        // Given
        when(trackingService.markImplemented("rec-1", PROJECT))
            .thenThrow(new RecommendationUnavailableException("rec-1", Reason.EXPIRED));

        // When / Then
        mockMvc.perform(post(BASE + "/recommendations/rec-1/implement")
                .header(OptimizationApiController.PROJECT_HEADER, PROJECT))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.detail").value(OptimizationApiController.UNAVAILABLE_MESSAGE));
    }

    @Test
    void shouldPassDismissFeedback() throws Exception {
        // Given
        when(trackingService.markDismissed("rec-1", PROJECT, "Quality matters more"))
            .thenReturn(recommendation().markDismissed(NOW, "Quality matters more"));

        // When / Then
        mockMvc.perform(post(BASE + "/recommendations/rec-1/dismiss")
                .header(OptimizationApiController.PROJECT_HEADER, PROJECT)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"feedback\":\"Quality matters more\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("dismissed"))
            .andExpect(jsonPath("$.dismissFeedback").value("Quality matters more"));
    }

    @Test
    void shouldDismissWithoutBody() throws Exception {
        // Given
        when(trackingService.markDismissed("rec-1", PROJECT, null))
            .thenReturn(recommendation().markDismissed(NOW, null));

        // When / Then
        mockMvc.perform(post(BASE + "/recommendations/rec-1/dismiss")
                .header(OptimizationApiController.PROJECT_HEADER, PROJECT))
            .andExpect(status().isOk());

        verify(trackingService).markDismissed(any(), any(), isNull());
    }

    @Test
    void shouldRejectOverlongFeedback() throws Exception {
        String feedback = "x".repeat(1001);

        mockMvc.perform(post(BASE + "/recommendations/rec-1/dismiss")
                .header(OptimizationApiController.PROJECT_HEADER, PROJECT)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"feedback\":\"" + feedback + "\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReturnConflictForSavingsOnPendingRecommendation() throws Exception {
        // Given
        when(trackingService.recordActualSavings("rec-1", PROJECT, 12.5))
            .thenThrow(new RecommendationUnavailableException("rec-1", Reason.NOT_IMPLEMENTED));

        // When / Then
        mockMvc.perform(post(BASE + "/recommendations/rec-1/actual-savings")
                .header(OptimizationApiController.PROJECT_HEADER, PROJECT)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"actualMonthlySavings\":12.5}"))
            .andExpect(status().isConflict());
    }

    @Test
    void shouldRequireActualSavingsValue() throws Exception {
        mockMvc.perform(post(BASE + "/recommendations/rec-1/actual-savings")
                .header(OptimizationApiController.PROJECT_HEADER, PROJECT)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest());
    }

    private static Suggestion suggestion() {
        return new Suggestion(SuggestionType.CACHING, "Add caching for faq", "Agent 'faq' has duplicates",
            "faq", null, null, 25.0, 40.0, Priority.MEDIUM, List.of("Implement cache"), null);
    }

    private static Recommendation recommendation() {
        Recommendation created = Recommendation.create(PROJECT, SuggestionType.CACHING, "Add caching for faq",
            "Agent 'faq' has duplicates", "faq", null, null, 25.0, 40.0, Map.of(), NOW, 14);
        return new Recommendation("rec-1", created.projectId(), created.recommendationType(), created.title(),
            created.description(), created.agentName(), created.model(), created.alternativeModel(),
            created.estimatedMonthlySavings(), created.estimatedSavingsPercent(), created.metricsSnapshot(),
            created.status(), created.createdAt(), created.expiresAt(), null, null, null, null, null);
    }
}
