package world.willfrog.backtestmicro.backtestservice.util;

import org.junit.jupiter.api.Test;
import world.willfrog.backtestmicro.backtestservice.dto.PriceSeriesInfoResponse;
import world.willfrog.backtestmicro.backtestservice.dto.PriceSeriesUploadRequest;
import world.willfrog.backtestmicro.backtestservice.exception.BizException;
import world.willfrog.backtestmicro.backtestservice.model.TickerSeries;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PriceSeriesConverterTest {

    @Test
    void toTickerSeries_shouldAcceptBothDateFormats() {
        // Arrange
        PriceSeriesUploadRequest request = new PriceSeriesUploadRequest();
        request.setTicker(" vusa ");
        request.setCurrency("gbp");
        request.setPrices(List.of(
                new PriceSeriesUploadRequest.PricePoint("20200102", new BigDecimal("50.1")),
                new PriceSeriesUploadRequest.PricePoint("2020-01-03", new BigDecimal("50.4"))));
        request.setDividends(List.of(new PriceSeriesUploadRequest.DividendPoint("20200103", new BigDecimal("0.2"))));

        // Act
        TickerSeries series = PriceSeriesConverter.toTickerSeries(request, "USD");
        PriceSeriesInfoResponse info = PriceSeriesConverter.toInfo(series);

        // Assert
        assertThat(series.getTicker()).isEqualTo("VUSA");
        assertThat(series.getCurrency()).isEqualTo("GBP");
        assertThat(series.priceOn(LocalDate.of(2020, 1, 3))).isEqualByComparingTo("50.4");
        assertThat(series.dividendOn(LocalDate.of(2020, 1, 3))).isEqualByComparingTo("0.2");
        assertThat(info.getFirstDate()).isEqualTo("2020-01-02");
        assertThat(info.getPriceCount()).isEqualTo(2);
        assertThat(info.getDividendCount()).isEqualTo(1);
    }

    @Test
    void toTickerSeries_missingCurrency_shouldUseDefault() {
        PriceSeriesUploadRequest request = new PriceSeriesUploadRequest();
        request.setTicker("SPY");
        request.setPrices(List.of(new PriceSeriesUploadRequest.PricePoint("2020-01-02", new BigDecimal("300"))));

        assertThat(PriceSeriesConverter.toTickerSeries(request, "USD").getCurrency()).isEqualTo("USD");
    }

    @Test
    void toTickerSeries_badDate_shouldRaiseParamError() {
        PriceSeriesUploadRequest request = new PriceSeriesUploadRequest();
        request.setTicker("SPY");
        request.setPrices(List.of(new PriceSeriesUploadRequest.PricePoint("2020/01/02", new BigDecimal("300"))));

        assertThatThrownBy(() -> PriceSeriesConverter.toTickerSeries(request, "USD"))
                .isInstanceOf(BizException.class)
                .hasMessageContaining("2020/01/02");
    }
}
