package world.willfrog.backtestmicro.backtestservice.service.impl;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import world.willfrog.backtestmicro.backtestservice.config.BacktestProperties;
import world.willfrog.backtestmicro.backtestservice.constants.BacktestConstants;
import world.willfrog.backtestmicro.backtestservice.exception.ConfigurationException;
import world.willfrog.backtestmicro.backtestservice.service.CurrencyRateProvider;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * 读取 backtest.currency.rates 中的固定汇率，不区分日期。yml 中 key 需写成 "[USD_GBP]" 以保留下划线。
 * 缺少正向汇率时尝试使用反向汇率的倒数。
 */
@Service
public class ConfiguredCurrencyRateProvider implements CurrencyRateProvider {

    private final BacktestProperties properties;

    public ConfiguredCurrencyRateProvider(BacktestProperties properties) {
        this.properties = properties;
    }

    @Override
    public BigDecimal rate(String from, String to, LocalDate date) {
        if (StringUtils.isBlank(from) || StringUtils.isBlank(to) || StringUtils.equalsIgnoreCase(from, to)) {
            return BigDecimal.ONE;
        }
        Map<String, BigDecimal> rates = new HashMap<>();
        properties.getCurrency().getRates().forEach((pair, rate) -> rates.put(StringUtils.upperCase(pair), rate));
        String source = StringUtils.upperCase(from);
        String target = StringUtils.upperCase(to);
        BigDecimal direct = rates.get(source + "_" + target);
        if (direct != null) {
            return direct;
        }
        BigDecimal inverse = rates.get(target + "_" + source);
        if (inverse != null && inverse.signum() > 0) {
            return BigDecimal.ONE.divide(inverse, BacktestConstants.CALC_SCALE, RoundingMode.HALF_UP);
        }
        throw new ConfigurationException("no exchange rate configured for " + source + " -> " + target);
    }
}
