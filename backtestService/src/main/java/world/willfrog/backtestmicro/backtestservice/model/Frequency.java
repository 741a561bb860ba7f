package world.willfrog.backtestmicro.backtestservice.model;

import world.willfrog.backtestmicro.common.utils.DateConvertUtils;

import java.time.LocalDate;

/**
 * 再平衡 / 定投频率
 */
public enum Frequency {
    NEVER,
    DAILY,
    WEEKLY,
    MONTHLY,
    QUARTERLY,
    YEARLY;

    /**
     * 日期所在周期的起始日；NEVER 没有周期，返回 null
     */
    public LocalDate periodStart(LocalDate date) {
        return switch (this) {
            case NEVER -> null;
            case DAILY -> date;
            case WEEKLY -> DateConvertUtils.weekStart(date);
            case MONTHLY -> DateConvertUtils.monthStart(date);
            case QUARTERLY -> DateConvertUtils.quarterStart(date);
            case YEARLY -> DateConvertUtils.yearStart(date);
        };
    }
}
