package world.willfrog.backtestmicro.backtestservice.handler;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import world.willfrog.backtestmicro.backtestservice.exception.BacktestException;
import world.willfrog.backtestmicro.backtestservice.exception.BizException;
import world.willfrog.backtestmicro.common.dto.ResponseCode;
import world.willfrog.backtestmicro.common.dto.ResponseWrapper;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * 回测失败不返回部分结果，按错误类型映射响应码
     */
    @ExceptionHandler(BacktestException.class)
    public ResponseWrapper<Void> handleBacktestException(BacktestException ex) {
        log.warn("Backtest rejected: kind={}, code={}, message={}", ex.getKind(), ex.getCode(), ex.getMessage());
        return ResponseWrapper.error(ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(BizException.class)
    public ResponseWrapper<Void> handleBizException(BizException ex) {
        return ResponseWrapper.error(ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class, HttpMessageNotReadableException.class})
    public ResponseWrapper<Void> handleValidations(Exception ex) {
        return ResponseWrapper.error(ResponseCode.PARAM_ERROR, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseWrapper<Void> handleOther(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseWrapper.error(ResponseCode.SYSTEM_ERROR, "系统异常，请稍后再试");
    }
}
