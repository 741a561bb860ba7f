package world.willfrog.backtestmicro.backtestservice.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DividendEvent(String ticker, LocalDate date, BigDecimal amountPerShare) {
}
