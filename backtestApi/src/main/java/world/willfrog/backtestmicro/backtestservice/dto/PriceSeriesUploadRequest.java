package world.willfrog.backtestmicro.backtestservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 上游行情模块推送的单个标的复权价格与分红序列。
 * <p>trade_date 支持 yyyyMMdd 与 yyyy-MM-dd 两种写法。</p>
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PriceSeriesUploadRequest {
    @NotBlank
    @Size(max = 64)
    private String ticker;

    @Size(max = 16)
    private String currency;

    @NotEmpty
    @Valid
    private List<PricePoint> prices = new ArrayList<>();

    @Valid
    private List<DividendPoint> dividends = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class PricePoint {
        @NotBlank
        private String tradeDate;

        @NotNull
        @DecimalMin(value = "0.00", inclusive = false)
        private BigDecimal adjustedClose;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class DividendPoint {
        @NotBlank
        private String tradeDate;

        @NotNull
        @DecimalMin(value = "0.00", inclusive = false)
        private BigDecimal amount;
    }
}
