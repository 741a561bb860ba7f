package world.willfrog.backtestmicro.backtestservice.model;

public enum GapFillPolicy {
    /**
     * 缺价即失败
     */
    FAIL,
    /**
     * 沿用最近一个已知价格，不使用未来价格
     */
    CARRY_FORWARD;
}
