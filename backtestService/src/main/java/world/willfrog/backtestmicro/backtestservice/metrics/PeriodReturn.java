package world.willfrog.backtestmicro.backtestservice.metrics;

import java.time.LocalDate;

public record PeriodReturn(PeriodGranularity granularity, String period, LocalDate periodStart, double value) {
}
