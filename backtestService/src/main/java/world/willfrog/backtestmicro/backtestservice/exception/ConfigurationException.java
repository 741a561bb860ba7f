package world.willfrog.backtestmicro.backtestservice.exception;

import world.willfrog.backtestmicro.common.dto.ResponseCode;

/**
 * 回测参数非法，在模拟开始前检出。
 */
public class ConfigurationException extends BacktestException {

    public ConfigurationException(String message) {
        super(BacktestErrorKind.CONFIGURATION, ResponseCode.PARAM_ERROR, message);
    }
}
