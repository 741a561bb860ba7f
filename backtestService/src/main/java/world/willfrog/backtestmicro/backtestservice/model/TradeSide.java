package world.willfrog.backtestmicro.backtestservice.model;

public enum TradeSide {
    BUY,
    SELL,
    REINVEST;
}
