package world.willfrog.backtestmicro.backtestservice.model;

import java.math.BigDecimal;

/**
 * weight 为该持仓市值占组合总值（含现金）的比例
 */
public record HoldingSnapshot(String ticker, BigDecimal shares, BigDecimal price, BigDecimal value, BigDecimal weight) {
}
