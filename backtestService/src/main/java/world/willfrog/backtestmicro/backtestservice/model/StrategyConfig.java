package world.willfrog.backtestmicro.backtestservice.model;

import lombok.Builder;
import lombok.Value;

/**
 * 校验阶段即完全确定的策略参数，引擎内不再有缺省值判断。
 */
@Value
@Builder
public class StrategyConfig {
    BacktestMode mode;
    boolean fractionalShares;
    boolean reinvestDividends;
    Frequency rebalanceFrequency;
}
