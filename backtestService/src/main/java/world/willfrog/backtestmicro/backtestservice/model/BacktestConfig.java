package world.willfrog.backtestmicro.backtestservice.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class BacktestConfig {
    LocalDate startDate;
    LocalDate endDate;
    String baseCurrency;
    BigDecimal initialInvestment;
    TargetAllocation targetAllocation;
    /**
     * 可为空，表示不定投
     */
    RecurringContribution recurringContribution;
    StrategyConfig strategy;
    BigDecimal riskFreeRate;
    GapFillPolicy gapFillPolicy;

    public Frequency contributionFrequency() {
        return recurringContribution == null ? null : recurringContribution.frequency();
    }
}
