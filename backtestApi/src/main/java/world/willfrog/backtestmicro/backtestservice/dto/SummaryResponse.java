package world.willfrog.backtestmicro.backtestservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SummaryResponse {
    private String startDate;
    private String endDate;
    private int tradingDays;
    private String mode;
    private String baseCurrency;
    private boolean fractionalShares;
    private boolean reinvestDividends;
    private String rebalanceFrequency;
    private int tradeCount;
    private BigDecimal dividendIncome;
}
