package world.willfrog.backtestmicro.backtestservice.model;

import lombok.Getter;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

/**
 * 一次查询得到的价格快照，不可变，可在多个回测之间共享。
 */
@Getter
public final class PriceSeriesSnapshot {
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final Map<String, TickerSeries> series;

    public PriceSeriesSnapshot(LocalDate startDate, LocalDate endDate, Map<String, TickerSeries> series) {
        this.startDate = startDate;
        this.endDate = endDate;
        this.series = Collections.unmodifiableMap(new LinkedHashMap<>(series));
    }

    public TickerSeries get(String ticker) {
        return series.get(ticker);
    }

    /**
     * 所有标的有价日期的并集
     */
    public NavigableSet<LocalDate> tradingDates() {
        NavigableSet<LocalDate> dates = new TreeSet<>();
        for (TickerSeries tickerSeries : series.values()) {
            dates.addAll(tickerSeries.getPrices().subMap(startDate, true, endDate, true).keySet());
        }
        return dates;
    }

    public PriceSeriesSnapshot mapSeries(UnaryOperator<TickerSeries> mapper) {
        Map<String, TickerSeries> mapped = new LinkedHashMap<>();
        series.forEach((ticker, tickerSeries) -> mapped.put(ticker, mapper.apply(tickerSeries)));
        return new PriceSeriesSnapshot(startDate, endDate, mapped);
    }
}
