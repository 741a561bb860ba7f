package world.willfrog.backtestmicro.backtestservice.service;

import world.willfrog.backtestmicro.backtestservice.dto.BacktestResultResponse;
import world.willfrog.backtestmicro.backtestservice.dto.BacktestRunRequest;

public interface BacktestService {

    BacktestResultResponse run(BacktestRunRequest request);
}
