package io.github.riemr.maintenance.application.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

public final class QuarterMonthUtils {
    public static final int QUARTERS_PER_YEAR = 4;
    public static final int MONTHS_PER_QUARTER = 3;

    private static final String[] MONTH_ABBREVIATIONS = {
            "JAN", "FEB", "MAR", "APR", "MAY", "JUN",
            "JUL", "AUG", "SEP", "OCT", "NOV", "DEC"
    };

    private QuarterMonthUtils() {}

    /** 任意の整数月を 1..12 に折り返す。 */
    public static int wrapMonth(int month) {
        return Math.floorMod(month - 1, 12) + 1;
    }

    /** 初回サービス月 = 契約開始月の翌月（12月開始なら1月）。 */
    public static int firstServiceMonth(LocalDate startDate) {
        return wrapMonth(startDate.getMonthValue() + 1);
    }

    public static int quarterMonth(int firstServiceMonth, int quarterIndex) {
        if (quarterIndex < 1 || quarterIndex > QUARTERS_PER_YEAR) {
            throw new IllegalArgumentException("Quarter index out of range: " + quarterIndex);
        }
        return wrapMonth(firstServiceMonth + MONTHS_PER_QUARTER * (quarterIndex - 1));
    }

    public static String monthAbbreviation(int month) {
        return MONTH_ABBREVIATIONS[wrapMonth(month) - 1];
    }

    /** "NOV Qtr 1" 形式のラベル。 */
    public static String quarterLabel(int month, int quarterIndex) {
        return monthAbbreviation(month) + " Qtr " + quarterIndex;
    }

    /** "Apr, May, Jun" 形式（メモ表示用）。 */
    public static String monthList(List<Integer> months) {
        return months.stream()
                .map(m -> {
                    String abbr = monthAbbreviation(m);
                    return abbr.charAt(0) + abbr.substring(1).toLowerCase();
                })
                .collect(Collectors.joining(", "));
    }

    /** 2.0 → "2", 2.5 → "2.5" */
    public static String formatHours(double hours) {
        return BigDecimal.valueOf(hours).stripTrailingZeros().toPlainString();
    }

    public static String formatMoney(BigDecimal amount) {
        BigDecimal value = amount == null ? BigDecimal.ZERO : amount;
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
