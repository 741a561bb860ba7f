package world.willfrog.backtestmicro.backtestservice.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import world.willfrog.backtestmicro.backtestservice.dto.BacktestResultResponse;
import world.willfrog.backtestmicro.backtestservice.exception.BacktestErrorKind;

import java.time.OffsetDateTime;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BacktestJob {
    private String jobId;
    private BacktestJobStatus status;
    private OffsetDateTime submittedAt;
    private OffsetDateTime startedAt;
    private OffsetDateTime finishedAt;
    private BacktestErrorKind errorKind;
    private String errorMessage;
    private BacktestResultResponse result;
}
