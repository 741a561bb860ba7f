package world.willfrog.backtestmicro.backtestservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PriceSeriesInfoResponse {
    private String ticker;
    private String currency;
    private String firstDate;
    private String lastDate;
    private int priceCount;
    private int dividendCount;
}
