package world.willfrog.backtestmicro.backtestservice.engine;

import org.junit.jupiter.api.Test;
import world.willfrog.backtestmicro.backtestservice.config.BacktestProperties;
import world.willfrog.backtestmicro.backtestservice.model.BacktestMode;
import world.willfrog.backtestmicro.backtestservice.model.TargetAllocation;
import world.willfrog.backtestmicro.backtestservice.model.TransactionPlan;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static world.willfrog.backtestmicro.backtestservice.support.BacktestFixtures.allocation;
import static world.willfrog.backtestmicro.backtestservice.support.BacktestFixtures.bd;

class CommissionTransactionResolverTest {

    private final CommissionTransactionResolver resolver =
            new CommissionTransactionResolver(new TargetWeightTransactionResolver(), bd("1"));

    @Test
    void resolve_shouldChargePerTradeAndConserveValue() {
        // Arrange
        TargetAllocation target = allocation("A", "0.5", "B", "0.5");
        Map<String, BigDecimal> prices = Map.of("A", bd("10"), "B", bd("20"));

        // Act
        TransactionPlan plan = resolver.resolve(bd("1000"), Map.of(), prices, target, true);

        // Assert
        assertThat(plan.getCommissions()).isEqualByComparingTo("2");
        assertThat(plan.getTotalInvestable()).isEqualByComparingTo("1000");
        BigDecimal invested = plan.getTargetShares().get("A").multiply(bd("10"))
                .add(plan.getTargetShares().get("B").multiply(bd("20")));
        assertThat(invested.add(plan.getLeftoverCash()).add(plan.getCommissions())).isEqualByComparingTo("1000");
        assertThat(plan.getLeftoverCash()).isGreaterThanOrEqualTo(BigDecimal.ZERO);
    }

    @Test
    void allocateCash_wholeShares_shouldReserveCommissionBeforeBuying() {
        TargetAllocation target = allocation("A", "1");

        TransactionPlan plan = resolver.allocateCash(bd("100"), Map.of("A", bd("10")), target, false);

        assertThat(plan.getDeltas().get("A")).isEqualByComparingTo("9");
        assertThat(plan.getCommissions()).isEqualByComparingTo("1");
        assertThat(plan.getLeftoverCash()).isEqualByComparingTo("9");
    }

    @Test
    void allocateCash_contributionBelowReservedCommissions_shouldKeepCashAndSkipTrades() {
        // Arrange
        CommissionTransactionResolver expensive =
                new CommissionTransactionResolver(new TargetWeightTransactionResolver(), bd("10"));
        TargetAllocation target = allocation("A", "0.5", "B", "0.5");

        // Act
        TransactionPlan plan = expensive.allocateCash(bd("15"), Map.of("A", bd("1"), "B", bd("1")), target, false);

        // Assert
        assertThat(plan.getDeltas()).isEmpty();
        assertThat(plan.getCommissions()).isEqualByComparingTo("0");
        assertThat(plan.getLeftoverCash()).isEqualByComparingTo("15");
    }

    @Test
    void allocateCash_shouldNeverReturnMoreCashThanSupplied() {
        CommissionTransactionResolver expensive =
                new CommissionTransactionResolver(new TargetWeightTransactionResolver(), bd("10"));
        TargetAllocation target = allocation("A", "0.5", "B", "0.5");
        Map<String, BigDecimal> prices = Map.of("A", bd("3"), "B", bd("7"));

        TransactionPlan plan = expensive.allocateCash(bd("45"), prices, target, false);

        BigDecimal spent = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> delta : plan.getDeltas().entrySet()) {
            spent = spent.add(delta.getValue().multiply(prices.get(delta.getKey())));
        }
        assertThat(spent.add(plan.getLeftoverCash()).add(plan.getCommissions())).isEqualByComparingTo("45");
        assertThat(plan.getLeftoverCash()).isBetween(BigDecimal.ZERO, bd("45"));
        assertThat(plan.getCommissions()).isEqualByComparingTo(bd("10").multiply(BigDecimal.valueOf(plan.tradeCount())));
    }

    @Test
    void resolve_tradeCountGrowingOverSeveralReservations_shouldStillSettle() {
        // Arrange: 每多预留一笔佣金，就多一个持仓跌破目标整数份额
        TargetAllocation target = allocation("A", "0.25", "B", "0.25", "C", "0.25", "D", "0.25");
        Map<String, BigDecimal> prices = Map.of("A", bd("1"), "B", bd("100"), "C", bd("99.97"), "D", bd("99.94"));
        Map<String, BigDecimal> holdings = Map.of("A", bd("990"), "B", bd("10"), "C", bd("10"), "D", bd("10"));

        // Act
        TransactionPlan plan = resolver.resolve(bd("10.9"), holdings, prices, target, false);

        // Assert
        assertThat(plan.getDeltas()).containsOnlyKeys("A", "B", "C", "D");
        assertThat(plan.getDeltas().get("A")).isEqualByComparingTo("9");
        assertThat(plan.getDeltas().get("D")).isEqualByComparingTo("-1");
        assertThat(plan.getCommissions()).isEqualByComparingTo("4");
        assertThat(plan.getTotalInvestable()).isEqualByComparingTo("4000");
        assertThat(plan.getLeftoverCash()).isEqualByComparingTo("297.81");
    }

    @Test
    void resolve_holdingsWorthLessThanOneCommission_shouldNotTrade() {
        CommissionTransactionResolver expensive =
                new CommissionTransactionResolver(new TargetWeightTransactionResolver(), bd("50"));

        TransactionPlan plan = expensive.resolve(bd("5"), Map.of("A", bd("2")), Map.of("A", bd("10"), "B", bd("10")),
                allocation("A", "0.5", "B", "0.5"), false);

        assertThat(plan.getDeltas()).isEmpty();
        assertThat(plan.getLeftoverCash()).isEqualByComparingTo("5");
        assertThat(plan.getTargetShares()).containsEntry("A", bd("2"));
    }

    @Test
    void factory_shouldOnlyDecorateRealisticModeWhenCommissionConfigured() {
        BacktestProperties properties = new BacktestProperties();
        assertThat(new TransactionResolverFactory(properties).forMode(BacktestMode.REALISTIC))
                .isInstanceOf(TargetWeightTransactionResolver.class);

        properties.getRealistic().setCommissionPerTrade(bd("2.5"));
        TransactionResolverFactory factory = new TransactionResolverFactory(properties);

        assertThat(factory.forMode(BacktestMode.REALISTIC)).isInstanceOf(CommissionTransactionResolver.class);
        assertThat(factory.forMode(BacktestMode.BASIC)).isInstanceOf(TargetWeightTransactionResolver.class);
    }
}
