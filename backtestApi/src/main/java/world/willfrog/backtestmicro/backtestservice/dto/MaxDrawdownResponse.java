package world.willfrog.backtestmicro.backtestservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MaxDrawdownResponse {
    private BigDecimal maxDrawdown;
    private String peakDate;
    private String troughDate;
    /**
     * 未回到前高时为 null
     */
    private String recoveryDate;
    private long durationDays;
}
