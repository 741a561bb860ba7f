package world.willfrog.backtestmicro.backtestservice.job;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import world.willfrog.backtestmicro.backtestservice.config.BacktestProperties;
import world.willfrog.backtestmicro.backtestservice.dto.BacktestResultResponse;
import world.willfrog.backtestmicro.backtestservice.exception.BacktestErrorKind;
import world.willfrog.backtestmicro.backtestservice.model.BacktestJob;
import world.willfrog.backtestmicro.backtestservice.model.BacktestJobStatus;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * 内存任务表。已结束的任务按保留时长和数量上限清理，未结束的任务不会被清理。
 */
@Slf4j
@Repository
public class InMemoryBacktestJobRepository implements BacktestJobRepository {

    private final Map<String, BacktestJob> jobs = new ConcurrentHashMap<>();
    private final long retentionSeconds;
    private final int maxFinishedJobs;

    public InMemoryBacktestJobRepository(BacktestProperties properties) {
        this.retentionSeconds = properties.getJob().getRetentionSeconds();
        this.maxFinishedJobs = properties.getJob().getMaxFinishedJobs();
    }

    @Override
    public void save(BacktestJob job) {
        jobs.put(job.getJobId(), job.toBuilder().build());
        evictFinished();
    }

    @Override
    public Optional<BacktestJob> findById(String jobId) {
        BacktestJob job = jobs.get(jobId);
        return job == null ? Optional.empty() : Optional.of(job.toBuilder().build());
    }

    @Override
    public boolean markRunning(String jobId, OffsetDateTime startedAt) {
        return transition(jobId, BacktestJobStatus.PENDING,
                job -> job.toBuilder().status(BacktestJobStatus.RUNNING).startedAt(startedAt).build());
    }

    @Override
    public boolean markCompleted(String jobId, BacktestResultResponse result, OffsetDateTime finishedAt) {
        return finish(jobId,
                job -> job.toBuilder().status(BacktestJobStatus.COMPLETED).result(result).finishedAt(finishedAt).build());
    }

    @Override
    public boolean markFailed(String jobId, BacktestErrorKind kind, String message, OffsetDateTime finishedAt) {
        return finish(jobId,
                job -> job.toBuilder()
                        .status(BacktestJobStatus.FAILED)
                        .errorKind(kind)
                        .errorMessage(message)
                        .finishedAt(finishedAt)
                        .build());
    }

    /**
     * 清理过期的已结束任务，再按结束时间从早到晚清理超出上限的部分
     *
     * @return 清理的任务数
     */
    public int evictFinished() {
        List<BacktestJob> finished = jobs.values().stream()
                .filter(job -> job.getStatus().isTerminal())
                .sorted(Comparator.comparing(BacktestJob::getFinishedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
        int excess = maxFinishedJobs > 0 ? Math.max(0, finished.size() - maxFinishedJobs) : 0;
        OffsetDateTime cutoff = retentionSeconds > 0 ? OffsetDateTime.now().minusSeconds(retentionSeconds) : null;
        int evicted = 0;
        for (BacktestJob job : finished) {
            boolean expired = cutoff != null && job.getFinishedAt() != null && job.getFinishedAt().isBefore(cutoff);
            if (evicted >= excess && !expired) {
                continue;
            }
            if (jobs.remove(job.getJobId(), job)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Finished backtest jobs evicted: count={}, remaining={}", evicted, jobs.size());
        }
        return evicted;
    }

    private boolean finish(String jobId, UnaryOperator<BacktestJob> update) {
        boolean updated = transition(jobId, BacktestJobStatus.RUNNING, update);
        if (updated) {
            evictFinished();
        }
        return updated;
    }

    private boolean transition(String jobId, BacktestJobStatus expected, UnaryOperator<BacktestJob> update) {
        boolean[] updated = {false};
        jobs.computeIfPresent(jobId, (id, job) -> {
            if (job.getStatus() != expected) {
                return job;
            }
            updated[0] = true;
            return update.apply(job);
        });
        return updated[0];
    }
}
