package io.github.samzhu.advisor.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import io.github.samzhu.advisor.dto.AnomalyMetric;
import io.github.samzhu.advisor.dto.QualityImpact;

/**
 * 各類建議的具體執行步驟。
 *
 * <p>只依計算結果套用簡單門檻規則產生描述文字，不會被執行。
 */
final class ActionItems {

    private static final int GRADUAL_ROLLOUT_CALLS = 1000;
    private static final double PRIORITIZE_SAVINGS = 100.0;
    private static final int MAX_CACHE_SIZE = 10_000;
    private static final double CRITICAL_ERROR_RATE = 0.10;
    private static final int RETRY_ERROR_COUNT = 50;
    private static final double PRE_CALL_VALIDATION_WASTE = 10.0;
    private static final double LARGE_PROMPT_TOKENS = 2000;
    private static final double PROVIDER_DELAY_MS = 1000;
    private static final double URGENT_Z = 3.0;

    private ActionItems() {
    }

    static List<String> modelSwitch(String agent, String currentModel, String alternativeModel,
            double monthlySavings, QualityImpact qualityImpact, int calls) {
        List<String> actions = new ArrayList<>();

        switch (qualityImpact) {
            case MINIMAL -> actions.add(format(
                "Run A/B test: route 10%% of %s traffic to %s and compare output quality scores",
                agent, alternativeModel));
            case MODERATE -> actions.add(format(
                "Evaluate %s on your %s test suite - expect some quality differences",
                alternativeModel, agent));
            default -> actions.add(format(
                "Thoroughly test %s - significant capability differences expected vs %s",
                alternativeModel, currentModel));
        }

        if (calls > GRADUAL_ROLLOUT_CALLS) {
            actions.add(format(
                "With %,d calls/period, implement gradual rollout: 10%% → 25%% → 50%% → 100%% over 2 weeks", calls));
        } else {
            actions.add(format("Switch %s configuration from %s to %s", agent, currentModel, alternativeModel));
        }

        actions.add(format("Monitor %s error rates and user feedback for 48 hours after switch", agent));

        if (monthlySavings > PRIORITIZE_SAVINGS) {
            actions.add(format("Expected savings: $%.2f/month - prioritize this migration", monthlySavings));
        }
        return actions;
    }

    static List<String> caching(String agent, double duplicateRate, int uniquePatterns, int duplicateCalls) {
        List<String> actions = new ArrayList<>();

        int cacheSize = Math.min(uniquePatterns * 2, MAX_CACHE_SIZE);
        actions.add(format("Implement cache with size %,d entries - you have %,d unique query patterns",
            cacheSize, uniquePatterns));

        if (duplicateRate > 50) {
            actions.add(format("High duplicate rate (%.0f%%) - use aggressive caching with 1-hour TTL", duplicateRate));
        } else if (duplicateRate > 20) {
            actions.add(format("Moderate duplicates (%.0f%%) - use 30-minute TTL with LRU eviction", duplicateRate));
        } else {
            actions.add(format("Use 15-minute TTL for %s cache", agent));
        }

        if (duplicateCalls > 100) {
            actions.add(format("Add semantic similarity matching - %,d duplicate calls may have slight variations",
                duplicateCalls));
        }

        actions.add(format("Log cache hits/misses for %s to measure effectiveness", agent));
        return actions;
    }

    static List<String> anomaly(AnomalyMetric metric, String context, double zScore,
            double currentValue, double baselineMean) {
        List<String> actions = new ArrayList<>();
        double deviationPct = baselineMean != 0
            ? Math.abs((currentValue - baselineMean) / baselineMean * 100)
            : 0.0;

        switch (metric) {
            case COST_PER_CALL -> {
                if (currentValue > baselineMean) {
                    actions.add(format("Cost increased %.0f%% for %s - check for prompt length changes or model switches",
                        deviationPct, context));
                    actions.add(format("Compare recent %s token counts to baseline", context));
                } else {
                    actions.add(format("Cost decreased %.0f%% for %s - verify functionality is not degraded",
                        deviationPct, context));
                }
            }
            case LATENCY_MS -> {
                if (currentValue > baselineMean) {
                    actions.add(format("Latency increased %.0f%% for %s - check provider status page for incidents",
                        deviationPct, context));
                    actions.add("Review recent prompt changes that may have increased token count");
                } else {
                    actions.add(format("Latency improved for %s - no action needed", context));
                }
            }
            case ERROR_RATE -> {
                actions.add(format("Error rate at %.1f%% for %s - check API logs for specific error types",
                    currentValue * 100, context));
                actions.add(format("Verify input validation is working for %s", context));
            }
        }

        if (Math.abs(zScore) > URGENT_Z) {
            actions.add(format("Urgent: %.1fσ deviation requires immediate investigation", Math.abs(zScore)));
        }
        return actions;
    }

    static List<String> errors(String agent, String model, double errorRate, double baselineErrorRate,
            int errorCount, double monthlyWasted) {
        List<String> actions = new ArrayList<>();
        double errorIncrease = baselineErrorRate > 0
            ? (errorRate - baselineErrorRate) / baselineErrorRate * 100
            : 0.0;

        if (errorRate > CRITICAL_ERROR_RATE) {
            actions.add(format("Critical: %.1f%% error rate on %s - query last %d failed requests for common patterns",
                errorRate * 100, agent, errorCount));
        } else {
            actions.add(format("Error rate %.0f%% above baseline - review %s error logs from past 24 hours",
                errorIncrease, agent));
        }

        if (errorCount > RETRY_ERROR_COUNT) {
            actions.add(format("Implement retry with exponential backoff for %s - %d failures may be transient",
                model, errorCount));
        }

        if (monthlyWasted > PRE_CALL_VALIDATION_WASTE) {
            actions.add(format("Add pre-call validation for %s - $%.2f/month wasted on failed requests",
                agent, monthlyWasted));
        }

        actions.add(format("Consider adding fallback model for %s when %s fails", agent, model));
        return actions;
    }

    static List<String> latency(String agent, String model, double avgLatency, double baselineLatency,
            double avgInputTokens, double zScore, double highZThreshold) {
        List<String> actions = new ArrayList<>();
        double latencyIncrease = avgLatency - baselineLatency;

        if (avgInputTokens > LARGE_PROMPT_TOKENS) {
            actions.add(format("Reduce prompt size for %s - currently %.0f tokens, aim for <2000 tokens",
                agent, avgInputTokens));
        }

        if (latencyIncrease > PROVIDER_DELAY_MS) {
            actions.add(format("Latency increased by %.0fms - check if %s is experiencing provider-side delays",
                latencyIncrease, model));
        }

        if (zScore > highZThreshold) {
            actions.add(format("Severe latency issue (%.1fσ) - consider switching to faster model variant "
                + "or enabling streaming for %s", zScore, agent));
        } else {
            actions.add(format("Enable response streaming for %s to improve perceived latency", agent));
        }

        actions.add(format("Profile %s prompt construction to identify bottlenecks", agent));
        return actions;
    }

    static String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }
}
