package world.willfrog.backtestmicro.backtestservice.service;

import world.willfrog.backtestmicro.backtestservice.model.PriceSeriesSnapshot;
import world.willfrog.backtestmicro.backtestservice.model.TickerSeries;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public interface PriceSeriesProvider {

    /**
     * 查询 [start, end] 内各标的的价格与分红。
     * 任一标的未登记或区间内无价格时抛出 MissingPriceDataException，不返回部分数据。
     */
    PriceSeriesSnapshot query(Collection<String> tickers, LocalDate start, LocalDate end);

    void register(TickerSeries series);

    List<TickerSeries> listSeries();
}
