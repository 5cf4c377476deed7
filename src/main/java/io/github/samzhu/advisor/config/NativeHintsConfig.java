package io.github.samzhu.advisor.config;

import org.springframework.aot.hint.MemberCategory;
import org.springframework.aot.hint.RuntimeHints;
import org.springframework.aot.hint.RuntimeHintsRegistrar;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.ImportRuntimeHints;

import io.github.samzhu.advisor.document.ProjectBaseline;
import io.github.samzhu.advisor.document.Recommendation;
import io.github.samzhu.advisor.document.UsageEvent;
import io.github.samzhu.advisor.dto.AgentModelKey;
import io.github.samzhu.advisor.dto.BaselineRefreshResult;
import io.github.samzhu.advisor.dto.OptimizationSummary;
import io.github.samzhu.advisor.dto.RecommendationEffectiveness;
import io.github.samzhu.advisor.dto.Suggestion;
import io.github.samzhu.advisor.dto.SuggestionMetrics;
import io.github.samzhu.advisor.dto.api.ActualSavingsRequest;
import io.github.samzhu.advisor.dto.api.BaselineResponse;
import io.github.samzhu.advisor.dto.api.CachingOpportunitiesResponse;
import io.github.samzhu.advisor.dto.api.DismissRequest;
import io.github.samzhu.advisor.dto.api.RecommendationResponse;
import io.github.samzhu.advisor.dto.api.SuggestionListResponse;

/**
 * GraalVM Native Image 執行時期提示配置。
 *
 * <p>Native Image 無法自動偵測 Jackson 與 Spring Data 的反射存取，
 * 此配置註冊以下類別的所有成員：
 * <ul>
 *   <li>MongoDB 文件 - 由 Spring Data 以反射建立 record 實例</li>
 *   <li>建議與摘要 DTO - 由 Jackson 序列化為 API 回應，包含各類型的 {@link SuggestionMetrics}</li>
 *   <li>API 請求/回應 record</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/native-image/introducing-graalvm-native-images.html">Spring Boot Native Image Support</a>
 */
@Configuration
@ImportRuntimeHints(NativeHintsConfig.AdvisorRuntimeHints.class)
public class NativeHintsConfig {

    static class AdvisorRuntimeHints implements RuntimeHintsRegistrar {

        @Override
        public void registerHints(RuntimeHints hints, ClassLoader classLoader) {
            // Document
            hints.reflection()
                .registerType(UsageEvent.class, MemberCategory.values())
                .registerType(ProjectBaseline.class, MemberCategory.values())
                .registerType(Recommendation.class, MemberCategory.values());

            // 建議、摘要與指標
            hints.reflection()
                .registerType(Suggestion.class, MemberCategory.values())
                .registerType(SuggestionMetrics.ModelDowngrade.class, MemberCategory.values())
                .registerType(SuggestionMetrics.Caching.class, MemberCategory.values())
                .registerType(SuggestionMetrics.AnomalyAlert.class, MemberCategory.values())
                .registerType(SuggestionMetrics.ErrorReduction.class, MemberCategory.values())
                .registerType(SuggestionMetrics.Latency.class, MemberCategory.values())
                .registerType(OptimizationSummary.class, MemberCategory.values())
                .registerType(OptimizationSummary.TypeBreakdown.class, MemberCategory.values())
                .registerType(RecommendationEffectiveness.class, MemberCategory.values())
                .registerType(BaselineRefreshResult.class, MemberCategory.values())
                .registerType(AgentModelKey.class, MemberCategory.values());

            // API DTO
            hints.reflection()
                .registerType(SuggestionListResponse.class, MemberCategory.values())
                .registerType(CachingOpportunitiesResponse.class, MemberCategory.values())
                .registerType(BaselineResponse.class, MemberCategory.values())
                .registerType(BaselineResponse.Stat.class, MemberCategory.values())
                .registerType(BaselineResponse.LatencyStat.class, MemberCategory.values())
                .registerType(RecommendationResponse.class, MemberCategory.values())
                .registerType(DismissRequest.class, MemberCategory.values())
                .registerType(ActualSavingsRequest.class, MemberCategory.values());
        }
    }
}
