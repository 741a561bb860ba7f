package world.willfrog.backtestmicro.backtestservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BacktestJobResponse {
    private String jobId;
    private String status;
    private OffsetDateTime submittedAt;
    private OffsetDateTime startedAt;
    private OffsetDateTime finishedAt;
    private String errorKind;
    private String errorMessage;
    private BacktestResultResponse result;
}
