package world.willfrog.backtestmicro.backtestservice.model;

public enum BacktestMode {
    /**
     * 理想化模拟：强制小数份额、分红再投资
     */
    BASIC,
    /**
     * 按请求的份额与分红策略模拟，可配置交易佣金
     */
    REALISTIC;
}
