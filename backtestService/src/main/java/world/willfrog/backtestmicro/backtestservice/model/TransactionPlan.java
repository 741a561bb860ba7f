package world.willfrog.backtestmicro.backtestservice.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * 一次调仓的结果。deltas 只包含非零变动，正数买入、负数卖出。
 */
@Value
@Builder(toBuilder = true)
public class TransactionPlan {
    BigDecimal totalInvestable;
    Map<String, BigDecimal> targetShares;
    Map<String, BigDecimal> deltas;
    BigDecimal leftoverCash;
    @Builder.Default
    BigDecimal commissions = BigDecimal.ZERO;

    public int tradeCount() {
        return deltas.size();
    }
}
