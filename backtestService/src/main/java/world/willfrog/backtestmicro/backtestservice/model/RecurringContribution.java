package world.willfrog.backtestmicro.backtestservice.model;

import java.math.BigDecimal;

public record RecurringContribution(BigDecimal amount, Frequency frequency) {
}
