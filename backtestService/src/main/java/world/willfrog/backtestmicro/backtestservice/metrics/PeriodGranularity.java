package world.willfrog.backtestmicro.backtestservice.metrics;

import world.willfrog.backtestmicro.backtestservice.constants.BacktestConstants;
import world.willfrog.backtestmicro.common.utils.DateConvertUtils;

import java.time.LocalDate;

/**
 * 收益聚合粒度。周以周一为起始。
 */
public enum PeriodGranularity {
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly"),
    QUARTERLY("quarterly"),
    YEARLY("yearly");

    private final String key;

    PeriodGranularity(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public LocalDate periodStart(LocalDate date) {
        return switch (this) {
            case DAILY -> date;
            case WEEKLY -> DateConvertUtils.weekStart(date);
            case MONTHLY -> DateConvertUtils.monthStart(date);
            case QUARTERLY -> DateConvertUtils.quarterStart(date);
            case YEARLY -> DateConvertUtils.yearStart(date);
        };
    }

    public String label(LocalDate date) {
        return switch (this) {
            case DAILY, WEEKLY -> DateConvertUtils.convertLocalDateToString(periodStart(date), BacktestConstants.ISO_DATE);
            case MONTHLY -> DateConvertUtils.monthLabel(date);
            case QUARTERLY -> DateConvertUtils.quarterLabel(date);
            case YEARLY -> DateConvertUtils.yearLabel(date);
        };
    }
}
