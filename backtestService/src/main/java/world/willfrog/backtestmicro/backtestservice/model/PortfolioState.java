package world.willfrog.backtestmicro.backtestservice.model;

import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次回测唯一的可变状态，按交易日逐日推进，不在线程间共享。
 */
@Getter
public class PortfolioState {
    private LocalDate date;
    private BigDecimal cashBalance = BigDecimal.ZERO;
    private BigDecimal cumulativeContributions = BigDecimal.ZERO;
    private final Map<String, BigDecimal> holdings = new LinkedHashMap<>();

    private BigDecimal cashInflow = BigDecimal.ZERO;
    private BigDecimal dividendIncome = BigDecimal.ZERO;
    private boolean rebalanced;

    public void beginDay(LocalDate date) {
        this.date = date;
        this.cashInflow = BigDecimal.ZERO;
        this.dividendIncome = BigDecimal.ZERO;
        this.rebalanced = false;
    }

    /**
     * 外部资金流入，计入累计投入
     */
    public void deposit(BigDecimal amount) {
        cashBalance = cashBalance.add(amount);
        cashInflow = cashInflow.add(amount);
        cumulativeContributions = cumulativeContributions.add(amount);
    }

    public void receiveDividend(BigDecimal amount) {
        cashBalance = cashBalance.add(amount);
        dividendIncome = dividendIncome.add(amount);
    }

    /**
     * 以 cost 现金买入 shares 份
     */
    public void buy(String ticker, BigDecimal shares, BigDecimal cost) {
        adjustShares(ticker, shares);
        cashBalance = cashBalance.subtract(cost);
    }

    public void applyPlan(TransactionPlan plan) {
        plan.getDeltas().forEach(this::adjustShares);
        cashBalance = plan.getLeftoverCash();
    }

    public void markRebalanced() {
        this.rebalanced = true;
    }

    public BigDecimal sharesOf(String ticker) {
        return holdings.getOrDefault(ticker, BigDecimal.ZERO);
    }

    public Map<String, BigDecimal> holdingsView() {
        return Collections.unmodifiableMap(holdings);
    }

    private void adjustShares(String ticker, BigDecimal delta) {
        BigDecimal updated = sharesOf(ticker).add(delta);
        if (updated.signum() == 0) {
            holdings.remove(ticker);
        } else {
            holdings.put(ticker, updated);
        }
    }
}
