package world.willfrog.backtestmicro.backtestservice.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import world.willfrog.backtestmicro.backtestservice.assembler.BacktestResultAssembler;
import world.willfrog.backtestmicro.backtestservice.dto.BacktestResultResponse;
import world.willfrog.backtestmicro.backtestservice.dto.BacktestRunRequest;
import world.willfrog.backtestmicro.backtestservice.engine.PortfolioSimulator;
import world.willfrog.backtestmicro.backtestservice.engine.TradingCalendarGenerator;
import world.willfrog.backtestmicro.backtestservice.metrics.MetricsCalculator;
import world.willfrog.backtestmicro.backtestservice.metrics.PerformanceMetrics;
import world.willfrog.backtestmicro.backtestservice.model.BacktestConfig;
import world.willfrog.backtestmicro.backtestservice.model.PriceSeriesSnapshot;
import world.willfrog.backtestmicro.backtestservice.model.SimulationResult;
import world.willfrog.backtestmicro.backtestservice.model.TickerSeries;
import world.willfrog.backtestmicro.backtestservice.model.TradingDay;
import world.willfrog.backtestmicro.backtestservice.service.BacktestService;
import world.willfrog.backtestmicro.backtestservice.service.CurrencyRateProvider;
import world.willfrog.backtestmicro.backtestservice.service.PriceSeriesProvider;
import world.willfrog.backtestmicro.backtestservice.validation.BacktestConfigValidator;

import java.util.List;

@Slf4j
@Service
public class BacktestServiceImpl implements BacktestService {

    private final BacktestConfigValidator configValidator;
    private final PriceSeriesProvider priceSeriesProvider;
    private final CurrencyRateProvider currencyRateProvider;
    private final TradingCalendarGenerator calendarGenerator;
    private final PortfolioSimulator simulator;
    private final MetricsCalculator metricsCalculator;
    private final BacktestResultAssembler resultAssembler;

    public BacktestServiceImpl(BacktestConfigValidator configValidator,
                               PriceSeriesProvider priceSeriesProvider,
                               CurrencyRateProvider currencyRateProvider,
                               TradingCalendarGenerator calendarGenerator,
                               PortfolioSimulator simulator,
                               MetricsCalculator metricsCalculator,
                               BacktestResultAssembler resultAssembler) {
        this.configValidator = configValidator;
        this.priceSeriesProvider = priceSeriesProvider;
        this.currencyRateProvider = currencyRateProvider;
        this.calendarGenerator = calendarGenerator;
        this.simulator = simulator;
        this.metricsCalculator = metricsCalculator;
        this.resultAssembler = resultAssembler;
    }

    @Override
    public BacktestResultResponse run(BacktestRunRequest request) {
        BacktestConfig config = configValidator.validate(request);
        log.info("Backtest run: start={}, end={}, tickers={}, initial={}, currency={}",
                config.getStartDate(), config.getEndDate(), config.getTargetAllocation().tickers(),
                config.getInitialInvestment(), config.getBaseCurrency());

        PriceSeriesSnapshot snapshot = toBaseCurrency(
                priceSeriesProvider.query(config.getTargetAllocation().positiveTickers(), config.getStartDate(), config.getEndDate()),
                config.getBaseCurrency());
        List<TradingDay> calendar = calendarGenerator.generate(config.getStartDate(), config.getEndDate(),
                config.getStrategy().getRebalanceFrequency(), config.contributionFrequency(), snapshot.tradingDates());

        SimulationResult simulation = simulator.simulate(config, snapshot, calendar);
        PerformanceMetrics metrics = metricsCalculator.calculate(simulation.getEquityCurve(),
                config.getInitialInvestment(), config.getRiskFreeRate());
        log.info("Backtest finished: finalValue={}, cagr={}, maxDrawdown={}",
                metrics.getFinalValue(), metrics.getCagr(), metrics.getDrawdown().getMaxDrawdown());
        return resultAssembler.assemble(simulation, metrics);
    }

    // 非基准货币的标的逐点换算一次，未标注货币的视为基准货币
    private PriceSeriesSnapshot toBaseCurrency(PriceSeriesSnapshot snapshot, String baseCurrency) {
        return snapshot.mapSeries(series -> {
            if (StringUtils.isBlank(series.getCurrency()) || StringUtils.equalsIgnoreCase(series.getCurrency(), baseCurrency)) {
                return series;
            }
            log.debug("Converting {} from {} to {}", series.getTicker(), series.getCurrency(), baseCurrency);
            return convert(series, baseCurrency);
        });
    }

    private TickerSeries convert(TickerSeries series, String baseCurrency) {
        return series.convert(baseCurrency, date -> currencyRateProvider.rate(series.getCurrency(), baseCurrency, date));
    }
}
