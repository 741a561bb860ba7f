package world.willfrog.backtestmicro.backtestservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MetricsResponse {
    private BigDecimal finalValue;
    private BigDecimal cumulativeReturn;
    private BigDecimal cumulativeGain;
    private BigDecimal totalContributions;
    private BigDecimal cagr;
    private BigDecimal volatility;
    private BigDecimal sharpe;
}
