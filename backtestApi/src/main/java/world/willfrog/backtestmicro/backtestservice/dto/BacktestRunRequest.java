package world.willfrog.backtestmicro.backtestservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BacktestRunRequest {
    @NotNull
    private LocalDate startDate;

    @NotNull
    private LocalDate endDate;

    @Size(max = 16)
    private String baseCurrency;

    @NotNull
    @DecimalMin(value = "0.00", inclusive = false)
    private BigDecimal initialInvestment;

    @NotEmpty
    private Map<String, BigDecimal> targetWeights = new LinkedHashMap<>();

    @Valid
    private RecurringInvestmentRequest recurringInvestment;

    @Valid
    private StrategyRequest strategy;

    /**
     * basic / realistic，缺省为 basic
     */
    @Size(max = 16)
    private String mode;

    private BigDecimal riskFreeRate;

    /**
     * fail / carry_forward，缺省取服务配置
     */
    @Size(max = 32)
    private String gapFillPolicy;
}
