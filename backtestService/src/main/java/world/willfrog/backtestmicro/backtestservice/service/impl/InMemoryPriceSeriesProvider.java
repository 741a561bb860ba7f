package world.willfrog.backtestmicro.backtestservice.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.backtestmicro.backtestservice.exception.MissingPriceDataException;
import world.willfrog.backtestmicro.backtestservice.model.PriceSeriesSnapshot;
import world.willfrog.backtestmicro.backtestservice.model.TargetAllocation;
import world.willfrog.backtestmicro.backtestservice.model.TickerSeries;
import world.willfrog.backtestmicro.backtestservice.service.PriceSeriesProvider;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
public class InMemoryPriceSeriesProvider implements PriceSeriesProvider {

    private final Map<String, TickerSeries> seriesByTicker = new ConcurrentHashMap<>();

    @Override
    public PriceSeriesSnapshot query(Collection<String> tickers, LocalDate start, LocalDate end) {
        Map<String, TickerSeries> result = new LinkedHashMap<>();
        for (String ticker : tickers) {
            String key = TargetAllocation.normalizeTicker(ticker);
            TickerSeries series = seriesByTicker.get(key);
            if (series == null) {
                throw new MissingPriceDataException("No price series registered for ticker " + key);
            }
            TickerSeries slice = series.slice(start, end);
            if (slice.isEmpty()) {
                throw new MissingPriceDataException("No price for ticker " + key + " between " + start + " and " + end);
            }
            result.put(key, slice);
        }
        return new PriceSeriesSnapshot(start, end, result);
    }

    @Override
    public void register(TickerSeries series) {
        TickerSeries previous = seriesByTicker.put(series.getTicker(), series);
        log.info("Price series registered: ticker={}, currency={}, prices={}, dividends={}, replaced={}",
                series.getTicker(), series.getCurrency(), series.getPrices().size(),
                series.getDividends().size(), previous != null);
    }

    @Override
    public List<TickerSeries> listSeries() {
        List<TickerSeries> series = new ArrayList<>(seriesByTicker.values());
        series.sort(Comparator.comparing(TickerSeries::getTicker));
        return series;
    }
}
