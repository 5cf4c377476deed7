package io.github.samzhu.advisor.document;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * LLM 用量事件文件（唯讀）。
 *
 * <p>每次 agent 呼叫 LLM API 產生一筆事件，由上游 ingestion pipeline 寫入
 * {@code usage_events}，寫入後不再修改。本服務只讀取事件做統計分析。
 *
 * <p>欄位說明：
 * <ul>
 *   <li>{@code projectId} / {@code agentName} / {@code model} - 分組維度</li>
 *   <li>{@code inputTokens} / {@code outputTokens} - token 用量</li>
 *   <li>{@code cost} - 該次呼叫成本 (USD)，由 ingestion 依當時定價計算</li>
 *   <li>{@code latencyMs} - 呼叫延遲（毫秒）</li>
 *   <li>{@code success} - 呼叫是否成功</li>
 *   <li>{@code inputHash} - 正規化後請求內容的指紋，可為 null，用於重複輸入偵測</li>
 * </ul>
 */
@Document(collection = "usage_events")
@CompoundIndex(name = "project_time_idx", def = "{'projectId': 1, 'timestamp': -1}")
public record UsageEvent(
    @Id String id,
    String projectId,
    String agentName,
    String model,
    long inputTokens,
    long outputTokens,
    double cost,
    long latencyMs,
    Instant timestamp,
    boolean success,
    String inputHash
) {

    /**
     * 事件發生的 UTC 日期，用於計算每日呼叫量。
     *
     * @return UTC 日期
     */
    public LocalDate date() {
        return LocalDate.ofInstant(timestamp, ZoneOffset.UTC);
    }

    /**
     * 是否帶有可用於重複偵測的輸入指紋。
     */
    public boolean hasInputHash() {
        return inputHash != null && !inputHash.isBlank();
    }
}
