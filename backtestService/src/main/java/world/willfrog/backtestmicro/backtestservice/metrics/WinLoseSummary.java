package world.willfrog.backtestmicro.backtestservice.metrics;

public record WinLoseSummary(int win, int loss, double rate) {
}
