package world.willfrog.backtestmicro.backtestservice.exception;

import lombok.Getter;
import world.willfrog.backtestmicro.common.dto.ResponseCode;

import java.time.LocalDate;

/**
 * 持仓或待配置标的在所需交易日缺少价格。引擎不做补数，补数由上游数据模块负责。
 */
@Getter
public class MissingPriceDataException extends BacktestException {
    private final String ticker;
    private final LocalDate date;

    public MissingPriceDataException(String ticker, LocalDate date) {
        super(BacktestErrorKind.MISSING_PRICE_DATA, ResponseCode.DATA_NOT_FOUND,
                "Missing price for ticker " + ticker + " on " + date);
        this.ticker = ticker;
        this.date = date;
    }

    public MissingPriceDataException(String message) {
        super(BacktestErrorKind.MISSING_PRICE_DATA, ResponseCode.DATA_NOT_FOUND, message);
        this.ticker = null;
        this.date = null;
    }
}
