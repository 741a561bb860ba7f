package world.willfrog.backtestmicro.backtestservice.engine;

import org.junit.jupiter.api.Test;
import world.willfrog.backtestmicro.backtestservice.exception.ComputationException;
import world.willfrog.backtestmicro.backtestservice.model.TargetAllocation;
import world.willfrog.backtestmicro.backtestservice.model.TransactionPlan;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static world.willfrog.backtestmicro.backtestservice.support.BacktestFixtures.allocation;
import static world.willfrog.backtestmicro.backtestservice.support.BacktestFixtures.bd;

class TargetWeightTransactionResolverTest {

    private final TargetWeightTransactionResolver resolver = new TargetWeightTransactionResolver();

    @Test
    void resolve_fractional_shouldHitTargetValues() {
        // Arrange
        TargetAllocation target = allocation("AAPL", "0.6", "GOOG", "0.4");
        Map<String, BigDecimal> prices = Map.of("AAPL", bd("100"), "GOOG", bd("50"));

        // Act
        TransactionPlan plan = resolver.resolve(bd("10000"), Map.of(), prices, target, true);

        // Assert
        assertThat(plan.getTotalInvestable()).isEqualByComparingTo("10000");
        assertThat(plan.getTargetShares().get("AAPL")).isEqualByComparingTo("60");
        assertThat(plan.getTargetShares().get("GOOG")).isEqualByComparingTo("80");
        assertThat(plan.getLeftoverCash()).isEqualByComparingTo("0");
        assertThat(plan.tradeCount()).isEqualTo(2);
    }

    @Test
    void resolve_wholeShares_shouldFloorAndKeepRemainderAsCash() {
        TargetAllocation target = allocation("SPY", "1");

        TransactionPlan plan = resolver.resolve(bd("1000"), Map.of(), Map.of("SPY", bd("300")), target, false);

        assertThat(plan.getTargetShares().get("SPY")).isEqualByComparingTo("3");
        assertThat(plan.getLeftoverCash()).isEqualByComparingTo("100");
    }

    @Test
    void resolve_shouldConserveInvestableValue() {
        // Arrange
        TargetAllocation target = allocation("A", "0.33", "B", "0.33", "C", "0.34");
        Map<String, BigDecimal> holdings = Map.of("A", bd("7"), "D", bd("3.5"));
        Map<String, BigDecimal> prices = Map.of("A", bd("13.37"), "B", bd("7.77"), "C", bd("101.01"), "D", bd("42.42"));

        // Act
        TransactionPlan plan = resolver.resolve(bd("1234.56"), holdings, prices, target, false);

        // Assert
        BigDecimal invested = plan.getTargetShares().entrySet().stream()
                .map(entry -> entry.getValue().multiply(prices.get(entry.getKey())))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(invested.add(plan.getLeftoverCash())).isEqualByComparingTo(plan.getTotalInvestable());
        assertThat(plan.getLeftoverCash()).isGreaterThanOrEqualTo(BigDecimal.ZERO);
    }

    @Test
    void resolve_holdingOutsideTarget_shouldBeSold() {
        TargetAllocation target = allocation("A", "1");

        TransactionPlan plan = resolver.resolve(BigDecimal.ZERO, Map.of("OLD", bd("10")),
                Map.of("A", bd("10"), "OLD", bd("20")), target, true);

        assertThat(plan.getTargetShares().get("OLD")).isEqualByComparingTo("0");
        assertThat(plan.getDeltas().get("OLD")).isEqualByComparingTo("-10");
        assertThat(plan.getTargetShares().get("A")).isEqualByComparingTo("20");
    }

    @Test
    void resolve_zeroWeightTickerWithoutPrice_shouldBeIgnored() {
        TargetAllocation target = allocation("A", "1", "B", "0");

        TransactionPlan plan = resolver.resolve(bd("100"), Map.of(), Map.of("A", bd("10")), target, true);

        assertThat(plan.getDeltas()).containsOnlyKeys("A");
    }

    @Test
    void resolve_nonPositivePrice_shouldFail() {
        TargetAllocation target = allocation("A", "1");

        assertThatThrownBy(() -> resolver.resolve(bd("100"), Map.of(), Map.of("A", bd("0")), target, true))
                .isInstanceOf(ComputationException.class);
    }

    @Test
    void allocateCash_shouldOnlyBuy() {
        // Arrange
        TargetAllocation target = allocation("A", "0.5", "B", "0.5");

        // Act
        TransactionPlan plan = resolver.allocateCash(bd("500"), Map.of("A", bd("100"), "B", bd("30")), target, false);

        // Assert
        assertThat(plan.getDeltas()).containsEntry("A", bd("2")).containsEntry("B", bd("8"));
        assertThat(plan.getDeltas().values()).allMatch(delta -> delta.signum() > 0);
        assertThat(plan.getLeftoverCash()).isEqualByComparingTo("60");
    }

    @Test
    void allocateCash_tooLittleCash_shouldKeepEverythingAsCash() {
        TargetAllocation target = allocation("A", "1");

        TransactionPlan plan = resolver.allocateCash(bd("50"), Map.of("A", bd("100")), target, false);

        assertThat(plan.getDeltas()).isEmpty();
        assertThat(plan.getLeftoverCash()).isEqualByComparingTo("50");
    }
}
