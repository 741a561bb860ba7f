package world.willfrog.backtestmicro.backtestservice.engine;

import world.willfrog.backtestmicro.backtestservice.constants.BacktestConstants;
import world.willfrog.backtestmicro.backtestservice.exception.ComputationException;
import world.willfrog.backtestmicro.backtestservice.model.TargetAllocation;
import world.willfrog.backtestmicro.backtestservice.model.TransactionPlan;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

public class TargetWeightTransactionResolver implements TransactionResolver {

    @Override
    public TransactionPlan resolve(BigDecimal cash,
                                   Map<String, BigDecimal> holdings,
                                   Map<String, BigDecimal> prices,
                                   TargetAllocation allocation,
                                   boolean fractionalShares) {
        BigDecimal total = cash;
        for (Map.Entry<String, BigDecimal> holding : holdings.entrySet()) {
            total = total.add(holding.getValue().multiply(requirePrice(prices, holding.getKey())));
        }
        if (total.signum() < 0) {
            throw new ComputationException("investable value is negative: " + total.toPlainString());
        }

        Set<String> tickers = new LinkedHashSet<>(allocation.tickers());
        tickers.addAll(holdings.keySet());

        Map<String, BigDecimal> targetShares = new LinkedHashMap<>();
        Map<String, BigDecimal> deltas = new LinkedHashMap<>();
        BigDecimal invested = BigDecimal.ZERO;
        for (String ticker : tickers) {
            BigDecimal target = BigDecimal.ZERO;
            if (allocation.isPositive(ticker)) {
                BigDecimal price = requirePrice(prices, ticker);
                target = shares(total.multiply(allocation.weightOf(ticker)), price, fractionalShares);
                invested = invested.add(target.multiply(price));
            }
            targetShares.put(ticker, target);
            BigDecimal delta = target.subtract(holdings.getOrDefault(ticker, BigDecimal.ZERO));
            if (delta.signum() != 0) {
                deltas.put(ticker, delta);
            }
        }
        return TransactionPlan.builder()
                .totalInvestable(total)
                .targetShares(targetShares)
                .deltas(deltas)
                .leftoverCash(total.subtract(invested))
                .build();
    }

    @Override
    public TransactionPlan allocateCash(BigDecimal cash,
                                        Map<String, BigDecimal> prices,
                                        TargetAllocation allocation,
                                        boolean fractionalShares) {
        Map<String, BigDecimal> bought = new LinkedHashMap<>();
        Map<String, BigDecimal> deltas = new LinkedHashMap<>();
        BigDecimal spent = BigDecimal.ZERO;
        if (cash.signum() > 0) {
            for (String ticker : allocation.tickers()) {
                if (!allocation.isPositive(ticker)) {
                    continue;
                }
                BigDecimal price = requirePrice(prices, ticker);
                BigDecimal shares = shares(cash.multiply(allocation.weightOf(ticker)), price, fractionalShares);
                bought.put(ticker, shares);
                if (shares.signum() > 0) {
                    deltas.put(ticker, shares);
                    spent = spent.add(shares.multiply(price));
                }
            }
        }
        return TransactionPlan.builder()
                .totalInvestable(cash)
                .targetShares(bought)
                .deltas(deltas)
                .leftoverCash(cash.subtract(spent))
                .build();
    }

    /**
     * 按价格折算份额。小数份额向下截断到计算精度，保证花费不超过目标金额；整数份额向下取整。
     */
    static BigDecimal shares(BigDecimal value, BigDecimal price, boolean fractionalShares) {
        if (value.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        if (fractionalShares) {
            return value.divide(price, BacktestConstants.CALC_SCALE, RoundingMode.DOWN);
        }
        return value.divide(price, 0, RoundingMode.FLOOR);
    }

    static BigDecimal requirePrice(Map<String, BigDecimal> prices, String ticker) {
        BigDecimal price = prices.get(ticker);
        if (price == null) {
            throw new ComputationException("no price supplied for " + ticker);
        }
        if (price.signum() <= 0) {
            throw new ComputationException("non-positive price " + price.toPlainString() + " for " + ticker);
        }
        return price;
    }
}
