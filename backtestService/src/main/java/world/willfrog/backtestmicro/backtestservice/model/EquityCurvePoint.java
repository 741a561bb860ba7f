package world.willfrog.backtestmicro.backtestservice.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class EquityCurvePoint {
    LocalDate date;
    BigDecimal cashBalance;
    BigDecimal totalValue;
    /**
     * 当日外部资金流入（初始资金或定投），用于计算剔除现金流的日收益
     */
    BigDecimal cashInflow;
    BigDecimal cumulativeContributions;
    BigDecimal dividendIncome;
    boolean rebalanced;
    List<HoldingSnapshot> holdings;
}
