package world.willfrog.backtestmicro.backtestservice.service;

import java.math.BigDecimal;
import java.time.LocalDate;

public interface CurrencyRateProvider {

    /**
     * 1 单位 from 货币在 date 当日可兑换的 to 货币数量
     */
    BigDecimal rate(String from, String to, LocalDate date);
}
