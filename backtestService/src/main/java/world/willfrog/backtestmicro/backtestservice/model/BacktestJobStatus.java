package world.willfrog.backtestmicro.backtestservice.model;

public enum BacktestJobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
