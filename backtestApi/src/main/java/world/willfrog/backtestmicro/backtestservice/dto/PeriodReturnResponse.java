package world.willfrog.backtestmicro.backtestservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PeriodReturnResponse {
    /**
     * 仅出现在 best/worst 列表中：daily / weekly / monthly / quarterly / yearly
     */
    private String aggregation;
    private String period;
    private String periodStart;
    @JsonProperty("return")
    private BigDecimal returnValue;
}
