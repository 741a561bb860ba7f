package world.willfrog.backtestmicro.backtestservice.engine;

import org.springframework.stereotype.Component;
import world.willfrog.backtestmicro.backtestservice.config.BacktestProperties;
import world.willfrog.backtestmicro.backtestservice.model.BacktestMode;

import java.math.BigDecimal;

/**
 * 按回测模式选择调仓实现。REALISTIC 在佣金非零时叠加佣金。
 */
@Component
public class TransactionResolverFactory {

    private final TransactionResolver basicResolver = new TargetWeightTransactionResolver();
    private final TransactionResolver realisticResolver;

    public TransactionResolverFactory(BacktestProperties properties) {
        BigDecimal commission = properties.getRealistic().getCommissionPerTrade();
        this.realisticResolver = commission == null || commission.signum() == 0
                ? basicResolver
                : new CommissionTransactionResolver(basicResolver, commission);
    }

    public TransactionResolver forMode(BacktestMode mode) {
        return mode == BacktestMode.REALISTIC ? realisticResolver : basicResolver;
    }
}
