package io.github.samzhu.advisor.dto;

import java.time.Instant;
import java.util.List;

/**
 * 基準線重算結果。
 *
 * @param projectId 專案 ID
 * @param days 使用的歷史天數
 * @param eventCount 視窗內事件數
 * @param baselinesComputed 建立或更新的基準線數
 * @param groupsSkipped 樣本不足而略過的 (agent, model) 群組
 * @param calculatedAt 計算時間
 */
public record BaselineRefreshResult(
    String projectId,
    int days,
    int eventCount,
    int baselinesComputed,
    List<AgentModelKey> groupsSkipped,
    Instant calculatedAt
) {}
