package world.willfrog.backtestmicro.backtestservice.model;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class SimulationResult {
    BacktestConfig config;
    List<EquityCurvePoint> equityCurve;
    List<TransactionRecord> transactions;

    public BigDecimal totalDividendIncome() {
        return equityCurve.stream()
                .map(EquityCurvePoint::getDividendIncome)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public EquityCurvePoint lastPoint() {
        return equityCurve.get(equityCurve.size() - 1);
    }
}
