package world.willfrog.backtestmicro.backtestservice.exception;

import lombok.Getter;
import world.willfrog.backtestmicro.common.dto.ResponseCode;

/**
 * 回测运行失败。任何子类抛出后整次运行作废，不返回部分结果。
 */
@Getter
public abstract class BacktestException extends BizException {
    private final BacktestErrorKind kind;

    protected BacktestException(BacktestErrorKind kind, ResponseCode code, String message) {
        super(code, message);
        this.kind = kind;
    }
}
