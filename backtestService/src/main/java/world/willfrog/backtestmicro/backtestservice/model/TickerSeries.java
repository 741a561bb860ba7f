package world.willfrog.backtestmicro.backtestservice.model;

import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * 单个标的的复权收盘价与分红序列，构造后不可变。
 */
@Getter
public final class TickerSeries {
    private final String ticker;
    private final String currency;
    private final NavigableMap<LocalDate, BigDecimal> prices;
    private final NavigableMap<LocalDate, BigDecimal> dividends;

    private TickerSeries(String ticker, String currency,
                         NavigableMap<LocalDate, BigDecimal> prices,
                         NavigableMap<LocalDate, BigDecimal> dividends) {
        this.ticker = ticker;
        this.currency = currency;
        this.prices = Collections.unmodifiableNavigableMap(prices);
        this.dividends = Collections.unmodifiableNavigableMap(dividends);
    }

    public static TickerSeries of(String ticker, String currency,
                                  Collection<AssetPrice> prices,
                                  Collection<DividendEvent> dividends) {
        NavigableMap<LocalDate, BigDecimal> priceMap = new TreeMap<>();
        for (AssetPrice price : prices) {
            priceMap.put(price.date(), price.adjustedClose());
        }
        NavigableMap<LocalDate, BigDecimal> dividendMap = new TreeMap<>();
        if (dividends != null) {
            for (DividendEvent dividend : dividends) {
                // 同日多笔分红合并
                dividendMap.merge(dividend.date(), dividend.amountPerShare(), BigDecimal::add);
            }
        }
        return new TickerSeries(ticker, currency, priceMap, dividendMap);
    }

    public BigDecimal priceOn(LocalDate date) {
        return prices.get(date);
    }

    /**
     * 不晚于 date 的最近价格，没有则返回 null
     */
    public BigDecimal lastPriceOnOrBefore(LocalDate date) {
        Map.Entry<LocalDate, BigDecimal> entry = prices.floorEntry(date);
        return entry == null ? null : entry.getValue();
    }

    public BigDecimal dividendOn(LocalDate date) {
        return dividends.get(date);
    }

    public boolean isEmpty() {
        return prices.isEmpty();
    }

    public LocalDate firstDate() {
        return prices.isEmpty() ? null : prices.firstKey();
    }

    public LocalDate lastDate() {
        return prices.isEmpty() ? null : prices.lastKey();
    }

    /**
     * 截取 [start, end] 闭区间
     */
    public TickerSeries slice(LocalDate start, LocalDate end) {
        return new TickerSeries(ticker, currency,
                new TreeMap<>(prices.subMap(start, true, end, true)),
                new TreeMap<>(dividends.subMap(start, true, end, true)));
    }

    /**
     * 按日汇率换算成目标货币，价格与分红逐点各换算一次
     */
    public TickerSeries convert(String targetCurrency, Function<LocalDate, BigDecimal> rateOnDate) {
        NavigableMap<LocalDate, BigDecimal> convertedPrices = new TreeMap<>();
        prices.forEach((date, price) -> convertedPrices.put(date, price.multiply(rateOnDate.apply(date))));
        NavigableMap<LocalDate, BigDecimal> convertedDividends = new TreeMap<>();
        dividends.forEach((date, amount) -> convertedDividends.put(date, amount.multiply(rateOnDate.apply(date))));
        return new TickerSeries(ticker, targetCurrency, convertedPrices, convertedDividends);
    }
}
