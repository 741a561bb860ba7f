package world.willfrog.backtestmicro.backtestservice.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.backtestmicro.backtestservice.exception.ConfigurationException;
import world.willfrog.backtestmicro.backtestservice.model.Frequency;
import world.willfrog.backtestmicro.backtestservice.model.TradingDay;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * 生成回测交易日历。
 * <p>
 * 周期类频率在每个周期边界之后的第一个交易日触发（首个交易日除外）：
 * WEEKLY 为周一，MONTHLY 为每月 1 日，QUARTERLY 为 1/4/7/10 月 1 日，YEARLY 为 1 月 1 日。
 * 两个相邻交易日之间跨过多个边界时只触发一次。
 */
@Slf4j
@Component
public class TradingCalendarGenerator {

    public List<TradingDay> generate(LocalDate startDate,
                                     LocalDate endDate,
                                     Frequency rebalanceFrequency,
                                     Frequency contributionFrequency,
                                     Collection<LocalDate> tradingDates) {
        if (startDate == null || endDate == null) {
            throw new ConfigurationException("start date and end date are required");
        }
        if (!startDate.isBefore(endDate)) {
            throw new ConfigurationException("start date " + startDate + " must be before end date " + endDate);
        }
        NavigableSet<LocalDate> inRange = new TreeSet<>(tradingDates).subSet(startDate, true, endDate, true);
        if (inRange.isEmpty()) {
            throw new ConfigurationException("no trading day between " + startDate + " and " + endDate);
        }

        List<TradingDay> calendar = new ArrayList<>(inRange.size());
        LocalDate previous = null;
        for (LocalDate date : inRange) {
            if (previous == null) {
                calendar.add(new TradingDay(date, false, false, true));
            } else {
                calendar.add(new TradingDay(date,
                        crossesBoundary(rebalanceFrequency, previous, date),
                        crossesBoundary(contributionFrequency, previous, date),
                        false));
            }
            previous = date;
        }
        log.debug("Trading calendar generated: days={}, first={}, last={}", calendar.size(), inRange.first(), inRange.last());
        return calendar;
    }

    // (previous, date] 区间内存在周期边界
    private boolean crossesBoundary(Frequency frequency, LocalDate previous, LocalDate date) {
        if (frequency == null || frequency == Frequency.NEVER) {
            return false;
        }
        return !frequency.periodStart(date).equals(frequency.periodStart(previous));
    }
}
