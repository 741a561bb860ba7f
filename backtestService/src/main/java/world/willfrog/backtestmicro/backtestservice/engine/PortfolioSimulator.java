package world.willfrog.backtestmicro.backtestservice.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.backtestmicro.backtestservice.constants.BacktestConstants;
import world.willfrog.backtestmicro.backtestservice.exception.ConfigurationException;
import world.willfrog.backtestmicro.backtestservice.exception.MissingPriceDataException;
import world.willfrog.backtestmicro.backtestservice.model.BacktestConfig;
import world.willfrog.backtestmicro.backtestservice.model.EquityCurvePoint;
import world.willfrog.backtestmicro.backtestservice.model.GapFillPolicy;
import world.willfrog.backtestmicro.backtestservice.model.HoldingSnapshot;
import world.willfrog.backtestmicro.backtestservice.model.PortfolioState;
import world.willfrog.backtestmicro.backtestservice.model.PriceSeriesSnapshot;
import world.willfrog.backtestmicro.backtestservice.model.RecurringContribution;
import world.willfrog.backtestmicro.backtestservice.model.SimulationResult;
import world.willfrog.backtestmicro.backtestservice.model.StrategyConfig;
import world.willfrog.backtestmicro.backtestservice.model.TargetAllocation;
import world.willfrog.backtestmicro.backtestservice.model.TickerSeries;
import world.willfrog.backtestmicro.backtestservice.model.TradeReason;
import world.willfrog.backtestmicro.backtestservice.model.TradeSide;
import world.willfrog.backtestmicro.backtestservice.model.TradingDay;
import world.willfrog.backtestmicro.backtestservice.model.TransactionPlan;
import world.willfrog.backtestmicro.backtestservice.model.TransactionRecord;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 组合状态机：按交易日推进，每日顺序固定为
 * 取价 → 分红 → 定投入金 → 建仓/再平衡（或定投买入）→ 记录净值点。
 * 任一步骤失败即中止，不返回部分曲线。
 */
@Slf4j
@Component
public class PortfolioSimulator {

    private final TransactionResolverFactory resolverFactory;

    public PortfolioSimulator(TransactionResolverFactory resolverFactory) {
        this.resolverFactory = resolverFactory;
    }

    public SimulationResult simulate(BacktestConfig config, PriceSeriesSnapshot snapshot, List<TradingDay> calendar) {
        if (calendar == null || calendar.isEmpty()) {
            throw new ConfigurationException("trading calendar is empty");
        }
        StrategyConfig strategy = config.getStrategy();
        TargetAllocation allocation = config.getTargetAllocation();
        RecurringContribution contribution = config.getRecurringContribution();
        TransactionResolver resolver = resolverFactory.forMode(strategy.getMode());
        PriceBook priceBook = new PriceBook(snapshot, config.getGapFillPolicy());

        log.info("Simulation started: start={}, end={}, tradingDays={}, mode={}, rebalance={}, fractional={}, reinvest={}",
                config.getStartDate(), config.getEndDate(), calendar.size(), strategy.getMode(),
                strategy.getRebalanceFrequency(), strategy.isFractionalShares(), strategy.isReinvestDividends());

        PortfolioState state = new PortfolioState();
        List<EquityCurvePoint> curve = new ArrayList<>(calendar.size());
        List<TransactionRecord> transactions = new ArrayList<>();

        for (TradingDay day : calendar) {
            LocalDate date = day.date();
            state.beginDay(date);

            Map<String, BigDecimal> prices = new LinkedHashMap<>();
            for (String ticker : state.getHoldings().keySet()) {
                prices.put(ticker, priceBook.price(ticker, date));
            }

            applyDividends(state, priceBook, prices, strategy, transactions);

            if (day.fundingDay()) {
                state.deposit(config.getInitialInvestment());
            } else if (day.contributionDay() && contribution != null) {
                state.deposit(contribution.amount());
            }

            boolean fullAllocation = day.fundingDay() || day.rebalanceDay();
            boolean investContribution = !fullAllocation && day.contributionDay() && contribution != null;
            if (fullAllocation || investContribution) {
                for (String ticker : allocation.tickers()) {
                    if (allocation.isPositive(ticker) && !prices.containsKey(ticker)) {
                        prices.put(ticker, priceBook.price(ticker, date));
                    }
                }
            }

            if (fullAllocation) {
                TransactionPlan plan = resolver.resolve(state.getCashBalance(), state.holdingsView(), prices,
                        allocation, strategy.isFractionalShares());
                record(transactions, date, plan, prices, day.fundingDay() ? TradeReason.FUNDING : TradeReason.REBALANCE);
                state.applyPlan(plan);
                state.markRebalanced();
            } else if (investContribution) {
                TransactionPlan plan = resolver.allocateCash(state.getCashBalance(), prices,
                        allocation, strategy.isFractionalShares());
                record(transactions, date, plan, prices, TradeReason.CONTRIBUTION);
                state.applyPlan(plan);
            }

            EquityCurvePoint point = snapshotOf(state, prices);
            curve.add(point);
            log.debug("Day simulated: date={}, value={}, cash={}, inflow={}, dividends={}, rebalanced={}",
                    date, point.getTotalValue(), point.getCashBalance(), point.getCashInflow(),
                    point.getDividendIncome(), point.isRebalanced());
        }

        EquityCurvePoint last = curve.get(curve.size() - 1);
        log.info("Simulation finished: finalValue={}, contributions={}, trades={}",
                last.getTotalValue().setScale(BacktestConstants.MONEY_SCALE, RoundingMode.HALF_UP),
                last.getCumulativeContributions(), transactions.size());
        return new SimulationResult(config, List.copyOf(curve), List.copyOf(transactions));
    }

    private void applyDividends(PortfolioState state,
                                PriceBook priceBook,
                                Map<String, BigDecimal> prices,
                                StrategyConfig strategy,
                                List<TransactionRecord> transactions) {
        LocalDate date = state.getDate();
        for (String ticker : new ArrayList<>(state.getHoldings().keySet())) {
            BigDecimal amountPerShare = priceBook.dividend(ticker, date);
            if (amountPerShare == null || amountPerShare.signum() <= 0) {
                continue;
            }
            BigDecimal cash = state.sharesOf(ticker).multiply(amountPerShare);
            state.receiveDividend(cash);
            if (!strategy.isReinvestDividends()) {
                continue;
            }
            BigDecimal price = prices.get(ticker);
            BigDecimal shares = TargetWeightTransactionResolver.shares(cash, price, strategy.isFractionalShares());
            if (shares.signum() > 0) {
                BigDecimal cost = shares.multiply(price);
                state.buy(ticker, shares, cost);
                transactions.add(TransactionRecord.builder()
                        .date(date)
                        .ticker(ticker)
                        .side(TradeSide.REINVEST)
                        .shares(shares)
                        .price(price)
                        .value(cost)
                        .reason(TradeReason.DIVIDEND)
                        .build());
            }
        }
    }

    private void record(List<TransactionRecord> transactions,
                        LocalDate date,
                        TransactionPlan plan,
                        Map<String, BigDecimal> prices,
                        TradeReason reason) {
        plan.getDeltas().forEach((ticker, delta) -> {
            BigDecimal price = prices.get(ticker);
            BigDecimal shares = delta.abs();
            transactions.add(TransactionRecord.builder()
                    .date(date)
                    .ticker(ticker)
                    .side(delta.signum() > 0 ? TradeSide.BUY : TradeSide.SELL)
                    .shares(shares)
                    .price(price)
                    .value(shares.multiply(price))
                    .reason(reason)
                    .build());
        });
    }

    private EquityCurvePoint snapshotOf(PortfolioState state, Map<String, BigDecimal> prices) {
        BigDecimal total = state.getCashBalance();
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        for (Map.Entry<String, BigDecimal> holding : state.getHoldings().entrySet()) {
            BigDecimal value = holding.getValue().multiply(prices.get(holding.getKey()));
            values.put(holding.getKey(), value);
            total = total.add(value);
        }
        List<HoldingSnapshot> holdings = new ArrayList<>(values.size());
        for (Map.Entry<String, BigDecimal> entry : values.entrySet()) {
            String ticker = entry.getKey();
            BigDecimal weight = total.signum() == 0
                    ? BigDecimal.ZERO
                    : entry.getValue().divide(total, BacktestConstants.CALC_SCALE, RoundingMode.HALF_UP);
            holdings.add(new HoldingSnapshot(ticker, state.sharesOf(ticker), prices.get(ticker), entry.getValue(), weight));
        }
        return EquityCurvePoint.builder()
                .date(state.getDate())
                .cashBalance(state.getCashBalance())
                .totalValue(total)
                .cashInflow(state.getCashInflow())
                .cumulativeContributions(state.getCumulativeContributions())
                .dividendIncome(state.getDividendIncome())
                .rebalanced(state.isRebalanced())
                .holdings(List.copyOf(holdings))
                .build();
    }

    /**
     * 按缺价策略取价。CARRY_FORWARD 只回看快照内已出现的价格。
     */
    private static final class PriceBook {
        private final PriceSeriesSnapshot snapshot;
        private final GapFillPolicy policy;

        private PriceBook(PriceSeriesSnapshot snapshot, GapFillPolicy policy) {
            this.snapshot = snapshot;
            this.policy = policy == null ? GapFillPolicy.FAIL : policy;
        }

        BigDecimal price(String ticker, LocalDate date) {
            TickerSeries series = snapshot.get(ticker);
            if (series == null) {
                throw new MissingPriceDataException(ticker, date);
            }
            BigDecimal price = series.priceOn(date);
            if (price == null && policy == GapFillPolicy.CARRY_FORWARD) {
                price = series.lastPriceOnOrBefore(date);
            }
            if (price == null) {
                throw new MissingPriceDataException(ticker, date);
            }
            return price;
        }

        BigDecimal dividend(String ticker, LocalDate date) {
            TickerSeries series = snapshot.get(ticker);
            return series == null ? null : series.dividendOn(date);
        }
    }
}
