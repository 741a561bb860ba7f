package world.willfrog.backtestmicro.backtestservice.model;

public enum TradeReason {
    FUNDING,
    REBALANCE,
    CONTRIBUTION,
    DIVIDEND;
}
