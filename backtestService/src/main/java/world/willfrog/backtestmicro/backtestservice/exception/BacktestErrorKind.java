package world.willfrog.backtestmicro.backtestservice.exception;

public enum BacktestErrorKind {
    CONFIGURATION,
    MISSING_PRICE_DATA,
    COMPUTATION,
    UNEXPECTED;
}
