package world.willfrog.backtestmicro.backtestservice.assembler;

import org.junit.jupiter.api.Test;
import world.willfrog.backtestmicro.backtestservice.config.BacktestProperties;
import world.willfrog.backtestmicro.backtestservice.dto.BacktestResultResponse;
import world.willfrog.backtestmicro.backtestservice.dto.ChartDataResponse;
import world.willfrog.backtestmicro.backtestservice.dto.PeriodReturnResponse;
import world.willfrog.backtestmicro.backtestservice.engine.PortfolioSimulator;
import world.willfrog.backtestmicro.backtestservice.engine.TradingCalendarGenerator;
import world.willfrog.backtestmicro.backtestservice.engine.TransactionResolverFactory;
import world.willfrog.backtestmicro.backtestservice.metrics.MetricsCalculator;
import world.willfrog.backtestmicro.backtestservice.metrics.PerformanceMetrics;
import world.willfrog.backtestmicro.backtestservice.model.BacktestConfig;
import world.willfrog.backtestmicro.backtestservice.model.Frequency;
import world.willfrog.backtestmicro.backtestservice.model.PriceSeriesSnapshot;
import world.willfrog.backtestmicro.backtestservice.model.SimulationResult;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;
import static world.willfrog.backtestmicro.backtestservice.support.BacktestFixtures.*;

class BacktestResultAssemblerTest {

    private final BacktestResultAssembler assembler = new BacktestResultAssembler();

    private BacktestResultResponse assembleQuarter() {
        LocalDate start = LocalDate.of(2020, 1, 1);
        LocalDate end = LocalDate.of(2020, 3, 31);
        PriceSeriesSnapshot snapshot = snapshot(start, end,
                wavySeries("AAPL", start, end, 100, 10, 30), flatSeries("BND", "80", start, end));
        BacktestConfig config = config(start, end, "10000", allocation("AAPL", "0.6", "BND", "0.4"),
                basic(Frequency.MONTHLY)).build();
        SimulationResult simulation = new PortfolioSimulator(new TransactionResolverFactory(new BacktestProperties()))
                .simulate(config, snapshot, new TradingCalendarGenerator().generate(start, end, Frequency.MONTHLY, null,
                        snapshot.tradingDates()));
        PerformanceMetrics metrics = new MetricsCalculator(new BacktestProperties())
                .calculate(simulation.getEquityCurve(), config.getInitialInvestment(), BigDecimal.ZERO);
        return assembler.assemble(simulation, metrics);
    }

    @Test
    void assemble_shouldExposeAllChartSeries() {
        // Act
        BacktestResultResponse response = assembleQuarter();

        // Assert
        ChartDataResponse chart = response.getChartData();
        assertThat(chart.getPortfolioGrowth()).hasSize(response.getSummary().getTradingDays());
        assertThat(chart.getPortfolioGrowth().get(0).getDate()).isEqualTo("2020-01-01");
        assertThat(chart.getPortfolioGrowth().get(0).getValue()).isEqualByComparingTo("10000.00");
        assertThat(chart.getPortfolioBalance().get(0).getHoldings())
                .extracting(ChartDataResponse.HoldingWeight::getTicker)
                .containsExactly("AAPL", "BND");
        assertThat(chart.getReturns()).containsOnlyKeys("daily", "weekly", "monthly", "quarterly", "yearly");
        assertThat(chart.getReturns().get("monthly")).extracting(PeriodReturnResponse::getPeriod)
                .containsExactly("2020-01", "2020-02", "2020-03");
        assertThat(chart.getReturns().get("monthly")).allMatch(period -> period.getAggregation() == null);
        assertThat(chart.getMonthlyReturnsHistogram()).extracting(ChartDataResponse.HistogramBucket::getBucket)
                .containsExactly("< -10%", "-10% to -5%", "-5% to 0%", "0% to 5%", "5% to 10%", "10%+");
        assertThat(chart.getMonthlyReturnsHistogram().stream().mapToInt(ChartDataResponse.HistogramBucket::getCount).sum())
                .isEqualTo(3);
    }

    @Test
    void assemble_shouldRoundForDisplayAndLabelExtremes() {
        BacktestResultResponse response = assembleQuarter();

        assertThat(response.getMetrics().getFinalValue().scale()).isEqualTo(2);
        assertThat(response.getMetrics().getCagr().scale()).isEqualTo(6);
        assertThat(response.getMetrics().getTotalContributions()).isEqualByComparingTo("10000");
        assertThat(response.getBestPeriods()).extracting(PeriodReturnResponse::getAggregation)
                .containsExactly("daily", "weekly", "monthly", "quarterly", "yearly");
        assertThat(response.getWorstPeriods()).hasSize(5);
        assertThat(response.getMonthlyWinLoseAnalysis().getWin() + response.getMonthlyWinLoseAnalysis().getLoss())
                .isEqualTo(3);
        assertThat(response.getSummary().getMode()).isEqualTo("BASIC");
        assertThat(response.getSummary().getRebalanceFrequency()).isEqualTo("MONTHLY");
        assertThat(response.getSummary().getStartDate()).isEqualTo("2020-01-01");
        assertThat(response.getSummary().getEndDate()).isEqualTo("2020-03-31");
    }
}
