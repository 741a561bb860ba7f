package world.willfrog.backtestmicro.backtestservice.exception;

import world.willfrog.backtestmicro.common.dto.ResponseCode;

/**
 * 数值退化（除零、非正价格等），正常情况下应已被参数校验拦截。
 */
public class ComputationException extends BacktestException {

    public ComputationException(String message) {
        super(BacktestErrorKind.COMPUTATION, ResponseCode.BUSINESS_ERROR, message);
    }
}
