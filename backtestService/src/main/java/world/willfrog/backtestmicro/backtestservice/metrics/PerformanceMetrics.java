package world.willfrog.backtestmicro.backtestservice.metrics;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class PerformanceMetrics {
    double finalValue;
    double initialInvestment;
    double totalContributions;
    double cumulativeReturn;
    double cumulativeGain;
    double cagr;
    double volatility;
    double annualizedReturn;
    double sharpe;
    DrawdownSummary drawdown;
    Map<PeriodGranularity, List<PeriodReturn>> periodReturns;
    Map<PeriodGranularity, PeriodReturn> bestPeriods;
    Map<PeriodGranularity, PeriodReturn> worstPeriods;
    WinLoseSummary monthlyWinLose;
    /**
     * 月度收益分布，六个区间按固定顺序且全部存在
     */
    Map<String, Integer> monthlyReturnHistogram;
}
