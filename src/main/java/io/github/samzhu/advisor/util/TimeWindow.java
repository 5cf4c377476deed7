package io.github.samzhu.advisor.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 分析用的閉區間時間視窗 {@code [start, end]}。
 *
 * <p>{@code days} 至少為 1，避免 0 天視窗造成除以零；
 * 所有「期間值 → 每月值」的換算都透過 {@link #toMonthly(double)}。
 *
 * @param start 視窗開始（含）
 * @param end 視窗結束（含）
 * @param days 換算每月值時使用的天數（至少 1）
 */
public record TimeWindow(
    Instant start,
    Instant end,
    int days
) {
    public static final int DAYS_PER_MONTH = 30;

    public TimeWindow {
        if (days < 1) {
            days = 1;
        }
    }

    /**
     * 以 {@code clock} 的現在時間為結束，往前 {@code days} 天。
     *
     * @param clock 時鐘
     * @param days 天數，小於 1 時視為 1
     * @return 時間視窗
     */
    public static TimeWindow lastDays(Clock clock, int days) {
        int effectiveDays = Math.max(days, 1);
        Instant end = clock.instant();
        return new TimeWindow(end.minus(Duration.ofDays(effectiveDays)), end, effectiveDays);
    }

    /**
     * 以 {@code clock} 的現在時間為結束，往前 {@code hours} 小時。
     *
     * @param clock 時鐘
     * @param hours 小時數，小於 1 時視為 1
     * @return 時間視窗，{@code days} 為 1
     */
    public static TimeWindow lastHours(Clock clock, int hours) {
        int effectiveHours = Math.max(hours, 1);
        Instant end = clock.instant();
        return new TimeWindow(end.minus(Duration.ofHours(effectiveHours)), end, 1);
    }

    /**
     * 將視窗內的累計值換算為 30 天的每月值。
     *
     * @param periodValue 視窗內的累計值
     * @return 每月值
     */
    public double toMonthly(double periodValue) {
        return periodValue / days * DAYS_PER_MONTH;
    }
}
