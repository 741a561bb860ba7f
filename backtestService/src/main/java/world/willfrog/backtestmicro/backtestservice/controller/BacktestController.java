package world.willfrog.backtestmicro.backtestservice.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import world.willfrog.backtestmicro.backtestservice.dto.BacktestJobResponse;
import world.willfrog.backtestmicro.backtestservice.dto.BacktestResultResponse;
import world.willfrog.backtestmicro.backtestservice.dto.BacktestRunRequest;
import world.willfrog.backtestmicro.backtestservice.service.BacktestJobService;
import world.willfrog.backtestmicro.backtestservice.service.BacktestService;
import world.willfrog.backtestmicro.common.dto.ResponseWrapper;

@RestController
@RequestMapping("/api/backtests")
@RequiredArgsConstructor
public class BacktestController {

    private final BacktestService backtestService;
    private final BacktestJobService backtestJobService;

    /**
     * 同步执行回测
     */
    @PostMapping("/run")
    public ResponseWrapper<BacktestResultResponse> run(@Valid @RequestBody BacktestRunRequest request) {
        return ResponseWrapper.success(backtestService.run(request));
    }

    @PostMapping
    public ResponseWrapper<BacktestJobResponse> submit(@Valid @RequestBody BacktestRunRequest request) {
        return ResponseWrapper.success(backtestJobService.submit(request));
    }

    @GetMapping("/{jobId}")
    public ResponseWrapper<BacktestJobResponse> get(@PathVariable("jobId") String jobId) {
        return ResponseWrapper.success(backtestJobService.get(jobId));
    }
}
