package world.willfrog.backtestmicro.backtestservice.engine;

import world.willfrog.backtestmicro.backtestservice.model.TargetAllocation;
import world.willfrog.backtestmicro.backtestservice.model.TransactionPlan;

import java.math.BigDecimal;
import java.util.Map;

/**
 * 根据目标权重计算调仓份额。实现需要保证
 * {@code Σ(targetShares × price) + leftoverCash + commissions == totalInvestable}。
 */
public interface TransactionResolver {

    /**
     * 全量再平衡：以现金加持仓市值为可投资总额，按目标权重重新分配。
     * 不在目标中的持仓全部卖出。
     *
     * @param prices 需覆盖所有持仓以及正权重标的
     */
    TransactionPlan resolve(BigDecimal cash,
                            Map<String, BigDecimal> holdings,
                            Map<String, BigDecimal> prices,
                            TargetAllocation allocation,
                            boolean fractionalShares);

    /**
     * 只买不卖：按目标权重把现金投入，花费不超过 cash。
     */
    TransactionPlan allocateCash(BigDecimal cash,
                                 Map<String, BigDecimal> prices,
                                 TargetAllocation allocation,
                                 boolean fractionalShares);
}
