package world.willfrog.backtestmicro.backtestservice.service;

import world.willfrog.backtestmicro.backtestservice.dto.BacktestJobResponse;
import world.willfrog.backtestmicro.backtestservice.dto.BacktestRunRequest;

public interface BacktestJobService {

    BacktestJobResponse submit(BacktestRunRequest request);

    BacktestJobResponse get(String jobId);
}
