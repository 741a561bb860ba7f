package world.willfrog.backtestmicro.backtestservice.assembler;

import org.springframework.stereotype.Component;
import world.willfrog.backtestmicro.backtestservice.constants.BacktestConstants;
import world.willfrog.backtestmicro.backtestservice.dto.BacktestResultResponse;
import world.willfrog.backtestmicro.backtestservice.dto.ChartDataResponse;
import world.willfrog.backtestmicro.backtestservice.dto.MaxDrawdownResponse;
import world.willfrog.backtestmicro.backtestservice.dto.MetricsResponse;
import world.willfrog.backtestmicro.backtestservice.dto.PeriodReturnResponse;
import world.willfrog.backtestmicro.backtestservice.dto.SummaryResponse;
import world.willfrog.backtestmicro.backtestservice.dto.WinLoseResponse;
import world.willfrog.backtestmicro.backtestservice.metrics.DrawdownSummary;
import world.willfrog.backtestmicro.backtestservice.metrics.PerformanceMetrics;
import world.willfrog.backtestmicro.backtestservice.metrics.PeriodGranularity;
import world.willfrog.backtestmicro.backtestservice.metrics.PeriodReturn;
import world.willfrog.backtestmicro.backtestservice.model.BacktestConfig;
import world.willfrog.backtestmicro.backtestservice.model.EquityCurvePoint;
import world.willfrog.backtestmicro.backtestservice.model.HoldingSnapshot;
import world.willfrog.backtestmicro.backtestservice.model.SimulationResult;
import world.willfrog.backtestmicro.backtestservice.model.StrategyConfig;
import world.willfrog.backtestmicro.common.utils.DateConvertUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 组装回测结果。金额保留 2 位、比率保留 6 位，仅用于展示，指标计算使用未舍入的值。
 */
@Component
public class BacktestResultAssembler {

    public BacktestResultResponse assemble(SimulationResult simulation, PerformanceMetrics metrics) {
        List<EquityCurvePoint> curve = simulation.getEquityCurve();
        return BacktestResultResponse.builder()
                .summary(toSummary(simulation))
                .metrics(toMetrics(metrics))
                .maxDrawdown(toDrawdown(metrics.getDrawdown()))
                .bestPeriods(toLabelled(metrics.getBestPeriods()))
                .worstPeriods(toLabelled(metrics.getWorstPeriods()))
                .monthlyWinLoseAnalysis(WinLoseResponse.builder()
                        .win(metrics.getMonthlyWinLose().win())
                        .loss(metrics.getMonthlyWinLose().loss())
                        .rate(ratio(metrics.getMonthlyWinLose().rate()))
                        .build())
                .chartData(ChartDataResponse.builder()
                        .portfolioGrowth(curve.stream().map(this::toGrowthPoint).toList())
                        .portfolioBalance(curve.stream().map(this::toBalancePoint).toList())
                        .returns(toReturns(metrics.getPeriodReturns()))
                        .monthlyReturnsHistogram(metrics.getMonthlyReturnHistogram().entrySet().stream()
                                .map(entry -> ChartDataResponse.HistogramBucket.builder()
                                        .bucket(entry.getKey())
                                        .count(entry.getValue())
                                        .build())
                                .toList())
                        .build())
                .build();
    }

    private SummaryResponse toSummary(SimulationResult simulation) {
        BacktestConfig config = simulation.getConfig();
        StrategyConfig strategy = config.getStrategy();
        List<EquityCurvePoint> curve = simulation.getEquityCurve();
        return SummaryResponse.builder()
                .startDate(formatDate(curve.get(0).getDate()))
                .endDate(formatDate(simulation.lastPoint().getDate()))
                .tradingDays(curve.size())
                .mode(strategy.getMode().name())
                .baseCurrency(config.getBaseCurrency())
                .fractionalShares(strategy.isFractionalShares())
                .reinvestDividends(strategy.isReinvestDividends())
                .rebalanceFrequency(strategy.getRebalanceFrequency().name())
                .tradeCount(simulation.getTransactions().size())
                .dividendIncome(money(simulation.totalDividendIncome()))
                .build();
    }

    private MetricsResponse toMetrics(PerformanceMetrics metrics) {
        return MetricsResponse.builder()
                .finalValue(money(metrics.getFinalValue()))
                .cumulativeReturn(ratio(metrics.getCumulativeReturn()))
                .cumulativeGain(money(metrics.getCumulativeGain()))
                .totalContributions(money(metrics.getTotalContributions()))
                .cagr(ratio(metrics.getCagr()))
                .volatility(ratio(metrics.getVolatility()))
                .sharpe(ratio(metrics.getSharpe()))
                .build();
    }

    private MaxDrawdownResponse toDrawdown(DrawdownSummary drawdown) {
        return MaxDrawdownResponse.builder()
                .maxDrawdown(ratio(drawdown.getMaxDrawdown()))
                .peakDate(formatDate(drawdown.getPeakDate()))
                .troughDate(formatDate(drawdown.getTroughDate()))
                .recoveryDate(formatDate(drawdown.getRecoveryDate()))
                .durationDays(drawdown.getDurationDays())
                .build();
    }

    private List<PeriodReturnResponse> toLabelled(Map<PeriodGranularity, PeriodReturn> periods) {
        List<PeriodReturnResponse> result = new ArrayList<>(periods.size());
        periods.forEach((granularity, periodReturn) -> result.add(toPeriodReturn(periodReturn, granularity.key())));
        return result;
    }

    private Map<String, List<PeriodReturnResponse>> toReturns(Map<PeriodGranularity, List<PeriodReturn>> periodReturns) {
        Map<String, List<PeriodReturnResponse>> returns = new LinkedHashMap<>();
        for (PeriodGranularity granularity : PeriodGranularity.values()) {
            returns.put(granularity.key(), periodReturns.getOrDefault(granularity, List.of()).stream()
                    .map(periodReturn -> toPeriodReturn(periodReturn, null))
                    .toList());
        }
        return returns;
    }

    private PeriodReturnResponse toPeriodReturn(PeriodReturn periodReturn, String aggregation) {
        return PeriodReturnResponse.builder()
                .aggregation(aggregation)
                .period(periodReturn.period())
                .periodStart(formatDate(periodReturn.periodStart()))
                .returnValue(ratio(periodReturn.value()))
                .build();
    }

    private ChartDataResponse.GrowthPoint toGrowthPoint(EquityCurvePoint point) {
        return ChartDataResponse.GrowthPoint.builder()
                .date(formatDate(point.getDate()))
                .value(money(point.getTotalValue()))
                .contributions(money(point.getCumulativeContributions()))
                .build();
    }

    private ChartDataResponse.BalancePoint toBalancePoint(EquityCurvePoint point) {
        List<ChartDataResponse.HoldingWeight> holdings = new ArrayList<>(point.getHoldings().size());
        for (HoldingSnapshot holding : point.getHoldings()) {
            holdings.add(ChartDataResponse.HoldingWeight.builder()
                    .ticker(holding.ticker())
                    .shares(holding.shares().setScale(BacktestConstants.RATIO_SCALE, RoundingMode.HALF_UP))
                    .value(money(holding.value()))
                    .weight(holding.weight().setScale(BacktestConstants.RATIO_SCALE, RoundingMode.HALF_UP))
                    .build());
        }
        return ChartDataResponse.BalancePoint.builder()
                .date(formatDate(point.getDate()))
                .cash(money(point.getCashBalance()))
                .holdings(holdings)
                .build();
    }

    private static String formatDate(LocalDate date) {
        return date == null ? null : DateConvertUtils.convertLocalDateToString(date, BacktestConstants.ISO_DATE);
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(BacktestConstants.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal money(double value) {
        return BigDecimal.valueOf(value).setScale(BacktestConstants.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal ratio(double value) {
        return BigDecimal.valueOf(value).setScale(BacktestConstants.RATIO_SCALE, RoundingMode.HALF_UP);
    }
}
