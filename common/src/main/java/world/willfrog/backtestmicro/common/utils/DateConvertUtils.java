package world.willfrog.backtestmicro.common.utils;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;

/**
 * 日期与统计周期换算工具。
 * <p>周期起点统一取自然周期的第一天：周一、月初、季初、年初。</p>
 */
public class DateConvertUtils {

    private static final DateTimeFormatter COMPACT_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

    public static LocalDate convertDateStrToLocalDate(String dateStr, String format) {
        if (dateStr == null || dateStr.isBlank()) {
            return null;
        }
        if ("yyyyMMdd".equals(format)) {
            return LocalDate.parse(dateStr.trim(), COMPACT_FORMAT);
        }
        return LocalDate.parse(dateStr.trim());
    }

    public static String convertLocalDateToString(LocalDate date, String format) {
        if (date == null) {
            return "";
        }
        if ("yyyyMMdd".equals(format)) {
            return date.format(COMPACT_FORMAT);
        }
        return date.toString();
    }

    public static LocalDate weekStart(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    public static LocalDate monthStart(LocalDate date) {
        return date.withDayOfMonth(1);
    }

    public static LocalDate quarterStart(LocalDate date) {
        int firstMonth = ((date.getMonthValue() - 1) / 3) * 3 + 1;
        return LocalDate.of(date.getYear(), firstMonth, 1);
    }

    public static LocalDate yearStart(LocalDate date) {
        return LocalDate.of(date.getYear(), 1, 1);
    }

    /**
     * 月份标签，例如 2024-03
     */
    public static String monthLabel(LocalDate date) {
        return date.format(MONTH_FORMAT);
    }

    /**
     * 季度标签，例如 2024-Q1
     */
    public static String quarterLabel(LocalDate date) {
        return date.getYear() + "-Q" + ((date.getMonthValue() - 1) / 3 + 1);
    }

    public static String yearLabel(LocalDate date) {
        return String.valueOf(date.getYear());
    }
}
