package io.github.samzhu.advisor.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 數值捨入工具類。
 *
 * <p>統一的捨入規則（HALF_UP）：
 * <ul>
 *   <li>金額 - 小數點後 2 位</li>
 *   <li>百分比 - 小數點後 1 位</li>
 *   <li>z-score - 小數點後 2 位</li>
 *   <li>原始量測值（每次呼叫成本、錯誤率等） - 小數點後 4 位</li>
 * </ul>
 *
 * <p>只在建議離開 {@link io.github.samzhu.advisor.service.SuggestionService} 時套用一次。
 */
public final class Rounding {

    private Rounding() {
        // 工具類不允許實例化
    }

    public static double money(double value) {
        return scale(value, 2);
    }

    public static double percent(double value) {
        return scale(value, 1);
    }

    public static double zScore(double value) {
        return scale(value, 2);
    }

    public static double measurement(double value) {
        return scale(value, 4);
    }

    /**
     * 依指定位數捨入；NaN 與無限大回傳 0。
     *
     * @param value 原始值
     * @param places 小數位數
     * @return 捨入後的值
     */
    public static double scale(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value)
            .setScale(places, RoundingMode.HALF_UP)
            .doubleValue();
    }
}
