package world.willfrog.backtestmicro.backtestservice.job;

import world.willfrog.backtestmicro.backtestservice.dto.BacktestResultResponse;
import world.willfrog.backtestmicro.backtestservice.exception.BacktestErrorKind;
import world.willfrog.backtestmicro.backtestservice.model.BacktestJob;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * 回测任务存储。引擎只向其中写入一次终态结果。
 */
public interface BacktestJobRepository {

    void save(BacktestJob job);

    Optional<BacktestJob> findById(String jobId);

    /**
     * 仅 PENDING 的任务可以进入 RUNNING
     *
     * @return 是否更新成功
     */
    boolean markRunning(String jobId, OffsetDateTime startedAt);

    boolean markCompleted(String jobId, BacktestResultResponse result, OffsetDateTime finishedAt);

    boolean markFailed(String jobId, BacktestErrorKind kind, String message, OffsetDateTime finishedAt);
}
