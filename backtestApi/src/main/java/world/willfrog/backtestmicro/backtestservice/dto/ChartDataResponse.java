package world.willfrog.backtestmicro.backtestservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChartDataResponse {
    private List<GrowthPoint> portfolioGrowth;
    private List<BalancePoint> portfolioBalance;
    /**
     * key: daily / weekly / monthly / quarterly / yearly
     */
    private Map<String, List<PeriodReturnResponse>> returns;
    private List<HistogramBucket> monthlyReturnsHistogram;

    @Data
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class GrowthPoint {
        private String date;
        private BigDecimal value;
        private BigDecimal contributions;
    }

    @Data
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class BalancePoint {
        private String date;
        private BigDecimal cash;
        private List<HoldingWeight> holdings;
    }

    @Data
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class HoldingWeight {
        private String ticker;
        private BigDecimal shares;
        private BigDecimal value;
        private BigDecimal weight;
    }

    @Data
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class HistogramBucket {
        private String bucket;
        private int count;
    }
}
