package io.github.samzhu.advisor.repository;

import java.time.Instant;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import io.github.samzhu.advisor.document.UsageEvent;

/**
 * 用量事件資料存取介面（唯讀）。
 *
 * <p>{@code usage_events} 由上游 ingestion pipeline 寫入，本服務只進行視窗查詢。
 * 視窗為閉區間 {@code [start, end]}，因此使用 {@code @Query} 明確指定
 * {@code $gte}/{@code $lte}（derived query 的 {@code Between} 為開區間）。
 *
 * @see io.github.samzhu.advisor.document.UsageEvent
 */
public interface UsageEventRepository extends MongoRepository<UsageEvent, String> {

    /**
     * 查詢專案在時間視窗內的所有事件。
     *
     * @param projectId 專案 ID
     * @param start 視窗開始（含）
     * @param end 視窗結束（含）
     * @return 事件列表
     */
    @Query("{ 'projectId': ?0, 'timestamp': { '$gte': ?1, '$lte': ?2 } }")
    List<UsageEvent> findInWindow(String projectId, Instant start, Instant end);
}
