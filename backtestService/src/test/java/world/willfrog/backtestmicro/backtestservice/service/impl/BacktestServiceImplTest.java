package world.willfrog.backtestmicro.backtestservice.service.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.backtestmicro.backtestservice.assembler.BacktestResultAssembler;
import world.willfrog.backtestmicro.backtestservice.config.BacktestProperties;
import world.willfrog.backtestmicro.backtestservice.dto.BacktestResultResponse;
import world.willfrog.backtestmicro.backtestservice.dto.BacktestRunRequest;
import world.willfrog.backtestmicro.backtestservice.engine.PortfolioSimulator;
import world.willfrog.backtestmicro.backtestservice.engine.TradingCalendarGenerator;
import world.willfrog.backtestmicro.backtestservice.engine.TransactionResolverFactory;
import world.willfrog.backtestmicro.backtestservice.exception.ConfigurationException;
import world.willfrog.backtestmicro.backtestservice.exception.MissingPriceDataException;
import world.willfrog.backtestmicro.backtestservice.metrics.MetricsCalculator;
import world.willfrog.backtestmicro.backtestservice.model.AssetPrice;
import world.willfrog.backtestmicro.backtestservice.model.TickerSeries;
import world.willfrog.backtestmicro.backtestservice.service.CurrencyRateProvider;
import world.willfrog.backtestmicro.backtestservice.service.PriceSeriesProvider;
import world.willfrog.backtestmicro.backtestservice.validation.BacktestConfigValidator;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static world.willfrog.backtestmicro.backtestservice.support.BacktestFixtures.flatSeries;
import static world.willfrog.backtestmicro.backtestservice.support.BacktestFixtures.snapshot;

@ExtendWith(MockitoExtension.class)
class BacktestServiceImplTest {

    private static final LocalDate START = LocalDate.of(2020, 1, 1);
    private static final LocalDate END = LocalDate.of(2020, 1, 31);

    @Mock
    private PriceSeriesProvider priceSeriesProvider;

    @Mock
    private CurrencyRateProvider currencyRateProvider;

    private BacktestServiceImpl backtestService;
    private BacktestRunRequest request;

    @BeforeEach
    void setUp() {
        BacktestProperties properties = new BacktestProperties();
        backtestService = new BacktestServiceImpl(
                new BacktestConfigValidator(properties),
                priceSeriesProvider,
                currencyRateProvider,
                new TradingCalendarGenerator(),
                new PortfolioSimulator(new TransactionResolverFactory(properties)),
                new MetricsCalculator(properties),
                new BacktestResultAssembler());

        Map<String, BigDecimal> weights = new LinkedHashMap<>();
        weights.put("SPY", new BigDecimal("0.5"));
        weights.put("VUSA", new BigDecimal("0.5"));
        request = new BacktestRunRequest();
        request.setStartDate(START);
        request.setEndDate(END);
        request.setInitialInvestment(new BigDecimal("10000"));
        request.setTargetWeights(weights);
    }

    @Test
    void run_shouldSimulateAndAssembleResult() {
        // Arrange
        when(priceSeriesProvider.query(anyCollection(), eq(START), eq(END)))
                .thenReturn(snapshot(START, END, flatSeries("SPY", "300", START, END), flatSeries("VUSA", "60", START, END)));

        // Act
        BacktestResultResponse result = backtestService.run(request);

        // Assert
        assertThat(result.getMetrics().getFinalValue()).isEqualByComparingTo("10000.00");
        assertThat(result.getSummary().getTradingDays()).isEqualTo(23);
        verify(priceSeriesProvider).query(List.of("SPY", "VUSA"), START, END);
        verifyNoInteractions(currencyRateProvider);
    }

    @Test
    void run_foreignCurrencySeries_shouldConvertToBaseCurrency() {
        // Arrange
        List<AssetPrice> gbpPrices = flatSeries("VUSA", "50", START, END).getPrices().entrySet().stream()
                .map(entry -> new AssetPrice("VUSA", entry.getKey(), entry.getValue()))
                .toList();
        TickerSeries vusa = TickerSeries.of("VUSA", "GBP", gbpPrices, List.of());
        when(priceSeriesProvider.query(anyCollection(), eq(START), eq(END)))
                .thenReturn(snapshot(START, END, flatSeries("SPY", "300", START, END), vusa));
        when(currencyRateProvider.rate(eq("GBP"), eq("USD"), any(LocalDate.class))).thenReturn(new BigDecimal("1.25"));

        // Act
        BacktestResultResponse result = backtestService.run(request);

        // Assert
        assertThat(result.getChartData().getPortfolioBalance().get(0).getHoldings())
                .filteredOn(holding -> holding.getTicker().equals("VUSA"))
                .singleElement()
                .satisfies(holding -> assertThat(holding.getShares()).isEqualByComparingTo("80"));
        verify(currencyRateProvider, atLeastOnce()).rate(eq("GBP"), eq("USD"), any(LocalDate.class));
    }

    @Test
    void run_missingSeries_shouldPropagateWithoutPartialResult() {
        when(priceSeriesProvider.query(anyCollection(), any(), any()))
                .thenThrow(new MissingPriceDataException("No price series registered for ticker VUSA"));

        assertThatThrownBy(() -> backtestService.run(request)).isInstanceOf(MissingPriceDataException.class);
    }

    @Test
    void run_invalidRequest_shouldFailBeforeQueryingPrices() {
        request.setInitialInvestment(BigDecimal.ZERO);

        assertThatThrownBy(() -> backtestService.run(request)).isInstanceOf(ConfigurationException.class);
        verifyNoInteractions(priceSeriesProvider);
    }
}
