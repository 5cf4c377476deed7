package io.github.samzhu.advisor.dto;

import io.github.samzhu.advisor.util.Rounding;

/**
 * 單一 agent 的快取機會（不持久化）。
 *
 * <p>{@code duplicateCalls} 為每個重複模式除第一次以外的呼叫總數，
 * 即 {@code 重複模式呼叫總數 - uniquePatterns}。
 *
 * @param agentName agent 名稱
 * @param uniquePatterns 達到出現門檻的輸入 hash 數
 * @param totalCalls 該 agent 在視窗內的總呼叫數
 * @param duplicateCalls 可被快取命中的重複呼叫數
 * @param duplicateRate 重複率 (0-100)
 * @param estimatedMonthlySavings 換算為 30 天的預估節省 (USD)
 */
public record CachingOpportunity(
    String agentName,
    int uniquePatterns,
    int totalCalls,
    int duplicateCalls,
    double duplicateRate,
    double estimatedMonthlySavings
) {

    /**
     * @return 重複率 1 位、節省金額 2 位小數的副本
     */
    public CachingOpportunity rounded() {
        return new CachingOpportunity(agentName, uniquePatterns, totalCalls, duplicateCalls,
            Rounding.percent(duplicateRate), Rounding.money(estimatedMonthlySavings));
    }
}
