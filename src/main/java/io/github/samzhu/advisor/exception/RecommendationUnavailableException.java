package io.github.samzhu.advisor.exception;

/**
 * 建議無法被實施或忽略。
 *
 * <p>涵蓋四種情況，對呼叫端一律視為可修正的請求錯誤 (404)：
 * <ul>
 *   <li>{@link Reason#NOT_FOUND} - ID 不存在或不屬於該專案</li>
 *   <li>{@link Reason#ALREADY_ACTIONED} - 已實施、已忽略或已過期</li>
 *   <li>{@link Reason#EXPIRED} - 仍為 PENDING 但已超過有效期限</li>
 *   <li>{@link Reason#NOT_IMPLEMENTED} - 回報實際節省時建議尚未實施</li>
 * </ul>
 */
public class RecommendationUnavailableException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        ALREADY_ACTIONED,
        EXPIRED,
        NOT_IMPLEMENTED
    }

    private final String recommendationId;
    private final Reason reason;

    public RecommendationUnavailableException(String recommendationId, Reason reason) {
        super(String.format("Recommendation '%s' is not available: %s", recommendationId, reason));
        this.recommendationId = recommendationId;
        this.reason = reason;
    }

    public String getRecommendationId() {
        return recommendationId;
    }

    public Reason getReason() {
        return reason;
    }
}
