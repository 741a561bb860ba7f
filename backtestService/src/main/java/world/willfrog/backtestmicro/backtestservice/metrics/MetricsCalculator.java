package world.willfrog.backtestmicro.backtestservice.metrics;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.backtestmicro.backtestservice.config.BacktestProperties;
import world.willfrog.backtestmicro.backtestservice.constants.BacktestConstants;
import world.willfrog.backtestmicro.backtestservice.exception.ComputationException;
import world.willfrog.backtestmicro.backtestservice.model.EquityCurvePoint;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于净值曲线计算绩效指标。纯函数：同一曲线多次计算结果完全一致。
 */
@Slf4j
@Component
public class MetricsCalculator {

    static final List<String> HISTOGRAM_BUCKETS = List.of(
            "< -10%", "-10% to -5%", "-5% to 0%", "0% to 5%", "5% to 10%", "10%+");

    private final int tradingDaysPerYear;

    public MetricsCalculator(BacktestProperties properties) {
        this.tradingDaysPerYear = properties.getTradingDaysPerYear() > 0
                ? properties.getTradingDaysPerYear()
                : BacktestConstants.DEFAULT_TRADING_DAYS_PER_YEAR;
    }

    public PerformanceMetrics calculate(List<EquityCurvePoint> curve, BigDecimal initialInvestment, BigDecimal riskFreeRate) {
        if (curve == null || curve.isEmpty()) {
            throw new ComputationException("equity curve is empty");
        }
        if (initialInvestment == null || initialInvestment.signum() <= 0) {
            throw new ComputationException("initial investment must be positive");
        }
        EquityCurvePoint first = curve.get(0);
        EquityCurvePoint last = curve.get(curve.size() - 1);
        double initial = initialInvestment.doubleValue();
        double finalValue = last.getTotalValue().doubleValue();
        double contributions = last.getCumulativeContributions().doubleValue();

        List<LocalDate> returnDates = new ArrayList<>(curve.size());
        List<Double> dailyReturns = dailyReturns(curve, returnDates);

        double volatility = 0d;
        double annualizedReturn = 0d;
        if (!dailyReturns.isEmpty()) {
            annualizedReturn = mean(dailyReturns) * tradingDaysPerYear;
        }
        if (dailyReturns.size() >= 2) {
            volatility = sampleStdDev(dailyReturns) * Math.sqrt(tradingDaysPerYear);
        }
        double rf = riskFreeRate == null ? 0d : riskFreeRate.doubleValue();
        double sharpe = volatility == 0d ? 0d : (annualizedReturn - rf) / volatility;

        Map<PeriodGranularity, List<PeriodReturn>> periodReturns = new EnumMap<>(PeriodGranularity.class);
        Map<PeriodGranularity, PeriodReturn> best = new EnumMap<>(PeriodGranularity.class);
        Map<PeriodGranularity, PeriodReturn> worst = new EnumMap<>(PeriodGranularity.class);
        for (PeriodGranularity granularity : PeriodGranularity.values()) {
            List<PeriodReturn> returns = aggregate(granularity, returnDates, dailyReturns);
            periodReturns.put(granularity, returns);
            if (!returns.isEmpty()) {
                best.put(granularity, extreme(returns, true));
                worst.put(granularity, extreme(returns, false));
            }
        }
        List<PeriodReturn> monthly = periodReturns.get(PeriodGranularity.MONTHLY);

        PerformanceMetrics metrics = PerformanceMetrics.builder()
                .finalValue(finalValue)
                .initialInvestment(initial)
                .totalContributions(contributions)
                .cumulativeReturn(finalValue / initial - 1d)
                .cumulativeGain(last.getTotalValue().subtract(last.getCumulativeContributions()).doubleValue())
                .cagr(cagr(initial, finalValue, first.getDate(), last.getDate()))
                .volatility(volatility)
                .annualizedReturn(annualizedReturn)
                .sharpe(sharpe)
                .drawdown(drawdown(curve))
                .periodReturns(Collections.unmodifiableMap(periodReturns))
                .bestPeriods(Collections.unmodifiableMap(best))
                .worstPeriods(Collections.unmodifiableMap(worst))
                .monthlyWinLose(winLose(monthly))
                .monthlyReturnHistogram(histogram(monthly))
                .build();
        log.debug("Metrics calculated: points={}, cagr={}, volatility={}, sharpe={}, maxDrawdown={}",
                curve.size(), metrics.getCagr(), volatility, sharpe, metrics.getDrawdown().getMaxDrawdown());
        return metrics;
    }

    /**
     * 剔除当日资金流入后的日收益：(V_t - inflow_t) / V_{t-1} - 1
     */
    List<Double> dailyReturns(List<EquityCurvePoint> curve, List<LocalDate> dates) {
        List<Double> returns = new ArrayList<>(Math.max(0, curve.size() - 1));
        for (int i = 1; i < curve.size(); i++) {
            BigDecimal previous = curve.get(i - 1).getTotalValue();
            if (previous.signum() <= 0) {
                throw new ComputationException("portfolio value is not positive on " + curve.get(i - 1).getDate());
            }
            EquityCurvePoint point = curve.get(i);
            BigDecimal organic = point.getTotalValue().subtract(point.getCashInflow());
            returns.add(organic.doubleValue() / previous.doubleValue() - 1d);
            dates.add(point.getDate());
        }
        return returns;
    }

    double cagr(double initial, double finalValue, LocalDate firstDate, LocalDate lastDate) {
        long days = ChronoUnit.DAYS.between(firstDate, lastDate);
        if (days <= 0) {
            return 0d;
        }
        double ratio = finalValue / initial;
        if (ratio <= 0d) {
            throw new ComputationException("final value must be positive to compute CAGR");
        }
        return Math.pow(ratio, BacktestConstants.DAYS_PER_YEAR / days) - 1d;
    }

    DrawdownSummary drawdown(List<EquityCurvePoint> curve) {
        double peak = curve.get(0).getTotalValue().doubleValue();
        LocalDate peakDate = curve.get(0).getDate();
        double maxDrawdown = 0d;
        double drawdownPeak = 0d;
        LocalDate drawdownPeakDate = null;
        LocalDate troughDate = null;
        LocalDate recoveryDate = null;

        for (EquityCurvePoint point : curve) {
            double value = point.getTotalValue().doubleValue();
            if (value > peak) {
                peak = value;
                peakDate = point.getDate();
            }
            double current = peak > 0d ? (value - peak) / peak : 0d;
            if (current < maxDrawdown) {
                maxDrawdown = current;
                drawdownPeak = peak;
                drawdownPeakDate = peakDate;
                troughDate = point.getDate();
                recoveryDate = null;
            } else if (troughDate != null && recoveryDate == null && value >= drawdownPeak) {
                recoveryDate = point.getDate();
            }
        }
        if (troughDate == null) {
            return DrawdownSummary.none();
        }
        LocalDate end = recoveryDate != null ? recoveryDate : curve.get(curve.size() - 1).getDate();
        return DrawdownSummary.builder()
                .maxDrawdown(maxDrawdown)
                .peakDate(drawdownPeakDate)
                .troughDate(troughDate)
                .recoveryDate(recoveryDate)
                .durationDays(ChronoUnit.DAYS.between(drawdownPeakDate, end))
                .build();
    }

    /**
     * 周期内日收益复利累乘，无资金流时等于期末 / 期初 - 1
     */
    List<PeriodReturn> aggregate(PeriodGranularity granularity, List<LocalDate> dates, List<Double> dailyReturns) {
        Map<LocalDate, double[]> growth = new LinkedHashMap<>();
        Map<LocalDate, LocalDate> anyDateOfPeriod = new LinkedHashMap<>();
        for (int i = 0; i < dates.size(); i++) {
            LocalDate start = granularity.periodStart(dates.get(i));
            double factor = 1d + dailyReturns.get(i);
            growth.computeIfAbsent(start, key -> new double[]{1d})[0] *= factor;
            anyDateOfPeriod.putIfAbsent(start, dates.get(i));
        }
        List<PeriodReturn> result = new ArrayList<>(growth.size());
        growth.forEach((start, product) -> result.add(
                new PeriodReturn(granularity, granularity.label(anyDateOfPeriod.get(start)), start, product[0] - 1d)));
        return result;
    }

    // 相同值取首次出现
    private PeriodReturn extreme(List<PeriodReturn> returns, boolean max) {
        PeriodReturn selected = returns.get(0);
        for (PeriodReturn candidate : returns) {
            if (max ? candidate.value() > selected.value() : candidate.value() < selected.value()) {
                selected = candidate;
            }
        }
        return selected;
    }

    WinLoseSummary winLose(List<PeriodReturn> monthly) {
        int win = 0;
        int loss = 0;
        for (PeriodReturn periodReturn : monthly) {
            if (periodReturn.value() > 0d) {
                win++;
            } else {
                loss++;
            }
        }
        int total = win + loss;
        return new WinLoseSummary(win, loss, total == 0 ? 0d : (double) win / total);
    }

    Map<String, Integer> histogram(List<PeriodReturn> monthly) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        HISTOGRAM_BUCKETS.forEach(bucket -> counts.put(bucket, 0));
        for (PeriodReturn periodReturn : monthly) {
            counts.merge(bucketOf(periodReturn.value()), 1, Integer::sum);
        }
        return Collections.unmodifiableMap(counts);
    }

    private static String bucketOf(double value) {
        if (value < -0.10d) {
            return HISTOGRAM_BUCKETS.get(0);
        } else if (value < -0.05d) {
            return HISTOGRAM_BUCKETS.get(1);
        } else if (value < 0d) {
            return HISTOGRAM_BUCKETS.get(2);
        } else if (value < 0.05d) {
            return HISTOGRAM_BUCKETS.get(3);
        } else if (value < 0.10d) {
            return HISTOGRAM_BUCKETS.get(4);
        }
        return HISTOGRAM_BUCKETS.get(5);
    }

    private static double mean(List<Double> values) {
        double sum = 0d;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    private static double sampleStdDev(List<Double> values) {
        double mean = mean(values);
        double squares = 0d;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return Math.sqrt(squares / (values.size() - 1));
    }
}
