package world.willfrog.backtestmicro.backtestservice.model;

import java.time.LocalDate;

/**
 * 交易日。fundingDay 为区间首个交易日，当天投入初始资金。
 */
public record TradingDay(LocalDate date, boolean rebalanceDay, boolean contributionDay, boolean fundingDay) {
}
