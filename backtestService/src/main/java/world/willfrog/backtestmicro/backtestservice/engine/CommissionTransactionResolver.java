package world.willfrog.backtestmicro.backtestservice.engine;

import lombok.extern.slf4j.Slf4j;
import world.willfrog.backtestmicro.backtestservice.exception.ComputationException;
import world.willfrog.backtestmicro.backtestservice.model.TargetAllocation;
import world.willfrog.backtestmicro.backtestservice.model.TransactionPlan;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 在目标权重调仓之上按笔收取固定佣金。
 * <p>
 * 先预留佣金再交给被装饰的 resolver 分配，成交笔数超过预留时按新笔数重新预留。
 * 预留只增不减且成交笔数有上限，因此轮数不超过可交易标的数加一。
 * 剩余现金始终从原始现金推算：cash − Σ(delta × price) − commissions。
 */
@Slf4j
public class CommissionTransactionResolver implements TransactionResolver {

    private final TransactionResolver delegate;
    private final BigDecimal commissionPerTrade;

    public CommissionTransactionResolver(TransactionResolver delegate, BigDecimal commissionPerTrade) {
        this.delegate = delegate;
        this.commissionPerTrade = commissionPerTrade;
    }

    @Override
    public TransactionPlan resolve(BigDecimal cash,
                                   Map<String, BigDecimal> holdings,
                                   Map<String, BigDecimal> prices,
                                   TargetAllocation allocation,
                                   boolean fractionalShares) {
        if (commissionPerTrade.signum() == 0) {
            return delegate.resolve(cash, holdings, prices, allocation, fractionalShares);
        }
        BigDecimal capacity = cash;
        for (Map.Entry<String, BigDecimal> holding : holdings.entrySet()) {
            capacity = capacity.add(holding.getValue().multiply(TargetWeightTransactionResolver.requirePrice(prices, holding.getKey())));
        }
        Set<String> tradable = new LinkedHashSet<>(allocation.tickers());
        tradable.addAll(holdings.keySet());
        return withCommission(cash, capacity, prices, holdings, tradable.size(),
                reserved -> delegate.resolve(cash.subtract(reserved), holdings, prices, allocation, fractionalShares));
    }

    @Override
    public TransactionPlan allocateCash(BigDecimal cash,
                                        Map<String, BigDecimal> prices,
                                        TargetAllocation allocation,
                                        boolean fractionalShares) {
        if (commissionPerTrade.signum() == 0) {
            return delegate.allocateCash(cash, prices, allocation, fractionalShares);
        }
        return withCommission(cash, cash, prices, Map.of(), allocation.positiveTickers().size(),
                reserved -> delegate.allocateCash(cash.subtract(reserved), prices, allocation, fractionalShares));
    }

    /**
     * @param capacity 可用于分配的总价值，预留佣金后不为正时不交易
     * @param maxTrades 单次调仓可能产生的最大成交笔数
     */
    private TransactionPlan withCommission(BigDecimal cash,
                                           BigDecimal capacity,
                                           Map<String, BigDecimal> prices,
                                           Map<String, BigDecimal> holdings,
                                           int maxTrades,
                                           Function<BigDecimal, TransactionPlan> planner) {
        BigDecimal reserved = BigDecimal.ZERO;
        for (int round = 0; round <= maxTrades + 1; round++) {
            if (capacity.subtract(reserved).signum() <= 0) {
                log.debug("Commission reservation exceeds capacity: capacity={}, reserved={}", capacity, reserved);
                return idle(cash, capacity, holdings);
            }
            TransactionPlan plan = planner.apply(reserved);
            BigDecimal commissions = commissionPerTrade.multiply(BigDecimal.valueOf(plan.tradeCount()));
            if (commissions.compareTo(reserved) <= 0) {
                BigDecimal leftover = cash.subtract(tradedValue(plan, prices)).subtract(commissions);
                log.debug("Commission applied: trades={}, commissions={}, rounds={}", plan.tradeCount(), commissions, round + 1);
                return plan.toBuilder()
                        .totalInvestable(capacity)
                        .leftoverCash(leftover)
                        .commissions(commissions)
                        .build();
            }
            reserved = commissions;
        }
        throw new ComputationException("commission reservation exceeded " + maxTrades + " trades");
    }

    private static BigDecimal tradedValue(TransactionPlan plan, Map<String, BigDecimal> prices) {
        BigDecimal value = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> delta : plan.getDeltas().entrySet()) {
            value = value.add(delta.getValue().multiply(TargetWeightTransactionResolver.requirePrice(prices, delta.getKey())));
        }
        return value;
    }

    private static TransactionPlan idle(BigDecimal cash, BigDecimal capacity, Map<String, BigDecimal> holdings) {
        return TransactionPlan.builder()
                .totalInvestable(capacity)
                .targetShares(new LinkedHashMap<>(holdings))
                .deltas(Map.of())
                .leftoverCash(cash)
                .build();
    }
}
