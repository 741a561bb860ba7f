package world.willfrog.backtestmicro.backtestservice.util;

import org.apache.commons.lang3.StringUtils;
import world.willfrog.backtestmicro.backtestservice.constants.BacktestConstants;
import world.willfrog.backtestmicro.backtestservice.dto.PriceSeriesInfoResponse;
import world.willfrog.backtestmicro.backtestservice.dto.PriceSeriesUploadRequest;
import world.willfrog.backtestmicro.backtestservice.exception.BizException;
import world.willfrog.backtestmicro.backtestservice.model.AssetPrice;
import world.willfrog.backtestmicro.backtestservice.model.DividendEvent;
import world.willfrog.backtestmicro.backtestservice.model.TargetAllocation;
import world.willfrog.backtestmicro.backtestservice.model.TickerSeries;
import world.willfrog.backtestmicro.common.dto.ResponseCode;
import world.willfrog.backtestmicro.common.utils.DateConvertUtils;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

public final class PriceSeriesConverter {
    private PriceSeriesConverter() {}

    public static TickerSeries toTickerSeries(PriceSeriesUploadRequest request, String defaultCurrency) {
        String ticker = TargetAllocation.normalizeTicker(request.getTicker());
        if (StringUtils.isBlank(ticker)) {
            throw new BizException(ResponseCode.PARAM_ERROR, "ticker 不能为空");
        }
        String currency = StringUtils.upperCase(StringUtils.defaultIfBlank(request.getCurrency(), defaultCurrency));

        List<AssetPrice> prices = new ArrayList<>();
        if (request.getPrices() != null) {
            for (PriceSeriesUploadRequest.PricePoint point : request.getPrices()) {
                if (point.getAdjustedClose() == null || point.getAdjustedClose().signum() <= 0) {
                    throw new BizException(ResponseCode.PARAM_ERROR, "adjusted_close 必须为正数: " + point.getTradeDate());
                }
                prices.add(new AssetPrice(ticker, parseTradeDate(point.getTradeDate()), point.getAdjustedClose()));
            }
        }
        if (prices.isEmpty()) {
            throw new BizException(ResponseCode.PARAM_ERROR, "prices 不能为空");
        }
        List<DividendEvent> dividends = new ArrayList<>();
        if (request.getDividends() != null) {
            for (PriceSeriesUploadRequest.DividendPoint point : request.getDividends()) {
                dividends.add(new DividendEvent(ticker, parseTradeDate(point.getTradeDate()), point.getAmount()));
            }
        }
        return TickerSeries.of(ticker, currency, prices, dividends);
    }

    public static PriceSeriesInfoResponse toInfo(TickerSeries series) {
        return PriceSeriesInfoResponse.builder()
                .ticker(series.getTicker())
                .currency(series.getCurrency())
                .firstDate(DateConvertUtils.convertLocalDateToString(series.firstDate(), BacktestConstants.ISO_DATE))
                .lastDate(DateConvertUtils.convertLocalDateToString(series.lastDate(), BacktestConstants.ISO_DATE))
                .priceCount(series.getPrices().size())
                .dividendCount(series.getDividends().size())
                .build();
    }

    // 兼容 yyyyMMdd 与 yyyy-MM-dd
    static LocalDate parseTradeDate(String tradeDate) {
        String text = StringUtils.trim(tradeDate);
        if (StringUtils.isBlank(text)) {
            throw new BizException(ResponseCode.PARAM_ERROR, "trade_date 不能为空");
        }
        try {
            String format = text.length() == 8 && StringUtils.isNumeric(text)
                    ? BacktestConstants.COMPACT_DATE
                    : BacktestConstants.ISO_DATE;
            return DateConvertUtils.convertDateStrToLocalDate(text, format);
        } catch (DateTimeParseException e) {
            throw new BizException(ResponseCode.PARAM_ERROR, "无法解析日期: " + tradeDate, e);
        }
    }
}
