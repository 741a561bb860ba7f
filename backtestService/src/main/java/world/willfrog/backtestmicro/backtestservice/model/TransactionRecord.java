package world.willfrog.backtestmicro.backtestservice.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class TransactionRecord {
    LocalDate date;
    String ticker;
    TradeSide side;
    /**
     * 成交份额，恒为正
     */
    BigDecimal shares;
    BigDecimal price;
    BigDecimal value;
    TradeReason reason;
}
