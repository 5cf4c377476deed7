package io.github.samzhu.advisor.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 沒有任何建議時的原因分類，供前端顯示對應的空狀態訊息。
 */
public enum EmptyReason {
    /** 視窗內沒有任何事件 */
    NO_DATA("no_data"),
    /** 事件少於 10 筆且沒有基準線 */
    INSUFFICIENT_DATA("insufficient_data"),
    /** 有事件但每個 (agent, model) 都不足以建立基準線 */
    NO_BASELINES("no_baselines"),
    /** 資料與基準線都存在，確實沒有可優化之處 */
    OPTIMIZED("optimized");

    private final String value;

    EmptyReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
