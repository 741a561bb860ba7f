package world.willfrog.backtestmicro.backtestservice.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import world.willfrog.backtestmicro.backtestservice.constants.BacktestConstants;
import world.willfrog.backtestmicro.backtestservice.dto.BacktestJobResponse;
import world.willfrog.backtestmicro.backtestservice.dto.BacktestResultResponse;
import world.willfrog.backtestmicro.backtestservice.dto.BacktestRunRequest;
import world.willfrog.backtestmicro.backtestservice.exception.BacktestErrorKind;
import world.willfrog.backtestmicro.backtestservice.exception.BacktestException;
import world.willfrog.backtestmicro.backtestservice.exception.BizException;
import world.willfrog.backtestmicro.backtestservice.job.BacktestJobRepository;
import world.willfrog.backtestmicro.backtestservice.model.BacktestJob;
import world.willfrog.backtestmicro.backtestservice.model.BacktestJobStatus;
import world.willfrog.backtestmicro.backtestservice.service.BacktestJobService;
import world.willfrog.backtestmicro.backtestservice.service.BacktestService;
import world.willfrog.backtestmicro.common.dto.ResponseCode;

import java.time.OffsetDateTime;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@Slf4j
@Service
public class BacktestJobServiceImpl implements BacktestJobService {

    private final BacktestService backtestService;
    private final BacktestJobRepository jobRepository;
    private final Executor backtestExecutor;

    public BacktestJobServiceImpl(BacktestService backtestService,
                                  BacktestJobRepository jobRepository,
                                  @Qualifier("backtestExecutor") Executor backtestExecutor) {
        this.backtestService = backtestService;
        this.jobRepository = jobRepository;
        this.backtestExecutor = backtestExecutor;
    }

    @Override
    public BacktestJobResponse submit(BacktestRunRequest request) {
        if (request == null) {
            throw new BizException(ResponseCode.PARAM_ERROR, "回测参数不能为空");
        }
        String jobId = UUID.randomUUID().toString();
        jobRepository.save(BacktestJob.builder()
                .jobId(jobId)
                .status(BacktestJobStatus.PENDING)
                .submittedAt(OffsetDateTime.now())
                .build());
        try {
            backtestExecutor.execute(() -> execute(jobId, request));
        } catch (RejectedExecutionException e) {
            log.error("Backtest job rejected, jobId={}", jobId, e);
            jobRepository.markRunning(jobId, OffsetDateTime.now());
            markFailed(jobId, BacktestErrorKind.UNEXPECTED, "回测任务队列已满");
        }
        log.info("Backtest job submitted, jobId={}", jobId);
        return get(jobId);
    }

    @Override
    public BacktestJobResponse get(String jobId) {
        return jobRepository.findById(jobId)
                .map(this::toResponse)
                .orElseThrow(() -> new BizException(ResponseCode.DATA_NOT_FOUND, "回测任务不存在"));
    }

    void execute(String jobId, BacktestRunRequest request) {
        // 只允许 pending 的任务进入执行
        if (!jobRepository.markRunning(jobId, OffsetDateTime.now())) {
            log.info("Backtest job already handled, skip jobId={}", jobId);
            return;
        }
        try {
            BacktestResultResponse result = backtestService.run(request);
            jobRepository.markCompleted(jobId, result, OffsetDateTime.now());
            log.info("Backtest job completed, jobId={}", jobId);
        } catch (BacktestException e) {
            log.warn("Backtest job failed, jobId={}, kind={}, message={}", jobId, e.getKind(), e.getMessage());
            markFailed(jobId, e.getKind(), e.getMessage());
        } catch (Exception e) {
            log.error("Backtest job failed unexpectedly, jobId={}", jobId, e);
            markFailed(jobId, BacktestErrorKind.UNEXPECTED, e.getMessage());
        }
    }

    private void markFailed(String jobId, BacktestErrorKind kind, String message) {
        jobRepository.markFailed(jobId, kind,
                StringUtils.abbreviate(StringUtils.defaultIfBlank(message, "回测失败"), BacktestConstants.MAX_ERROR_LENGTH),
                OffsetDateTime.now());
    }

    private BacktestJobResponse toResponse(BacktestJob job) {
        return BacktestJobResponse.builder()
                .jobId(job.getJobId())
                .status(job.getStatus().name())
                .submittedAt(job.getSubmittedAt())
                .startedAt(job.getStartedAt())
                .finishedAt(job.getFinishedAt())
                .errorKind(job.getErrorKind() == null ? null : job.getErrorKind().name())
                .errorMessage(job.getErrorMessage())
                .result(job.getResult())
                .build();
    }
}
