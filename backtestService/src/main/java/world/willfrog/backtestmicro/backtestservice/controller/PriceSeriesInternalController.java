package world.willfrog.backtestmicro.backtestservice.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import world.willfrog.backtestmicro.backtestservice.config.BacktestProperties;
import world.willfrog.backtestmicro.backtestservice.dto.PriceSeriesInfoResponse;
import world.willfrog.backtestmicro.backtestservice.dto.PriceSeriesUploadRequest;
import world.willfrog.backtestmicro.backtestservice.model.TickerSeries;
import world.willfrog.backtestmicro.backtestservice.service.PriceSeriesProvider;
import world.willfrog.backtestmicro.backtestservice.util.PriceSeriesConverter;
import world.willfrog.backtestmicro.common.dto.ResponseWrapper;

import java.util.List;

/**
 * 行情数据写入入口，供上游数据模块调用
 */
@RestController
@RequestMapping("/api/internal/price-series")
@RequiredArgsConstructor
public class PriceSeriesInternalController {

    private final PriceSeriesProvider priceSeriesProvider;
    private final BacktestProperties properties;

    @PostMapping
    public ResponseWrapper<PriceSeriesInfoResponse> register(@Valid @RequestBody PriceSeriesUploadRequest request) {
        TickerSeries series = PriceSeriesConverter.toTickerSeries(request, properties.getDefaultBaseCurrency());
        priceSeriesProvider.register(series);
        return ResponseWrapper.success(PriceSeriesConverter.toInfo(series));
    }

    @GetMapping
    public ResponseWrapper<List<PriceSeriesInfoResponse>> list() {
        return ResponseWrapper.success(priceSeriesProvider.listSeries().stream()
                .map(PriceSeriesConverter::toInfo)
                .toList());
    }
}
