package world.willfrog.backtestmicro.backtestservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BacktestResultResponse {
    private SummaryResponse summary;
    private MetricsResponse metrics;
    private MaxDrawdownResponse maxDrawdown;
    private List<PeriodReturnResponse> bestPeriods;
    private List<PeriodReturnResponse> worstPeriods;
    private WinLoseResponse monthlyWinLoseAnalysis;
    private ChartDataResponse chartData;
}
