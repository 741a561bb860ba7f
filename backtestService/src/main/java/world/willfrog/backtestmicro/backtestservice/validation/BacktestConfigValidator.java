package world.willfrog.backtestmicro.backtestservice.validation;

import org.apache.commons.lang3.EnumUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import world.willfrog.backtestmicro.backtestservice.config.BacktestProperties;
import world.willfrog.backtestmicro.backtestservice.dto.BacktestRunRequest;
import world.willfrog.backtestmicro.backtestservice.dto.RecurringInvestmentRequest;
import world.willfrog.backtestmicro.backtestservice.dto.StrategyRequest;
import world.willfrog.backtestmicro.backtestservice.exception.ConfigurationException;
import world.willfrog.backtestmicro.backtestservice.model.BacktestConfig;
import world.willfrog.backtestmicro.backtestservice.model.BacktestMode;
import world.willfrog.backtestmicro.backtestservice.model.Frequency;
import world.willfrog.backtestmicro.backtestservice.model.GapFillPolicy;
import world.willfrog.backtestmicro.backtestservice.model.RecurringContribution;
import world.willfrog.backtestmicro.backtestservice.model.StrategyConfig;
import world.willfrog.backtestmicro.backtestservice.model.TargetAllocation;

import java.math.BigDecimal;

/**
 * 把请求转换为完全确定的 {@link BacktestConfig}，所有缺省值在这里落定。
 */
@Component
public class BacktestConfigValidator {

    private final BacktestProperties properties;

    public BacktestConfigValidator(BacktestProperties properties) {
        this.properties = properties;
    }

    public BacktestConfig validate(BacktestRunRequest request) {
        if (request == null) {
            throw new ConfigurationException("backtest request is required");
        }
        if (request.getStartDate() == null || request.getEndDate() == null) {
            throw new ConfigurationException("start_date and end_date are required");
        }
        if (!request.getStartDate().isBefore(request.getEndDate())) {
            throw new ConfigurationException("start_date must be before end_date");
        }
        BigDecimal initialInvestment = request.getInitialInvestment();
        if (initialInvestment == null || initialInvestment.signum() <= 0) {
            throw new ConfigurationException("initial_investment must be positive");
        }
        String baseCurrency = StringUtils.defaultIfBlank(StringUtils.trim(request.getBaseCurrency()),
                properties.getDefaultBaseCurrency());

        return BacktestConfig.builder()
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .baseCurrency(StringUtils.upperCase(baseCurrency))
                .initialInvestment(initialInvestment)
                .targetAllocation(TargetAllocation.of(request.getTargetWeights(), properties.getWeightTolerance()))
                .recurringContribution(toContribution(request.getRecurringInvestment()))
                .strategy(toStrategy(request.getMode(), request.getStrategy()))
                .riskFreeRate(request.getRiskFreeRate() == null ? properties.getRiskFreeRate() : request.getRiskFreeRate())
                .gapFillPolicy(StringUtils.isBlank(request.getGapFillPolicy())
                        ? properties.getGapFillPolicy()
                        : parseEnum(GapFillPolicy.class, request.getGapFillPolicy(), "gap_fill_policy"))
                .build();
    }

    /**
     * BASIC 强制小数份额与分红再投资；REALISTIC 取请求值，缺省为整数份额、分红再投资。
     */
    StrategyConfig toStrategy(String modeText, StrategyRequest strategy) {
        BacktestMode mode = StringUtils.isBlank(modeText)
                ? BacktestMode.BASIC
                : parseEnum(BacktestMode.class, modeText, "mode");
        Frequency rebalance = strategy == null || StringUtils.isBlank(strategy.getRebalanceFrequency())
                ? Frequency.NEVER
                : parseEnum(Frequency.class, strategy.getRebalanceFrequency(), "rebalance_frequency");

        if (mode == BacktestMode.BASIC) {
            return StrategyConfig.builder()
                    .mode(mode)
                    .fractionalShares(true)
                    .reinvestDividends(true)
                    .rebalanceFrequency(rebalance)
                    .build();
        }
        boolean fractional = strategy != null && Boolean.TRUE.equals(strategy.getFractionalShares());
        boolean reinvest = strategy == null || !Boolean.FALSE.equals(strategy.getReinvestDividends());
        return StrategyConfig.builder()
                .mode(mode)
                .fractionalShares(fractional)
                .reinvestDividends(reinvest)
                .rebalanceFrequency(rebalance)
                .build();
    }

    private RecurringContribution toContribution(RecurringInvestmentRequest recurring) {
        if (recurring == null) {
            return null;
        }
        if (recurring.getAmount() == null || recurring.getAmount().signum() <= 0) {
            throw new ConfigurationException("recurring_investment.amount must be positive");
        }
        Frequency frequency = parseEnum(Frequency.class, recurring.getFrequency(), "recurring_investment.frequency");
        if (frequency == Frequency.NEVER) {
            throw new ConfigurationException("recurring_investment.frequency must not be NEVER");
        }
        return new RecurringContribution(recurring.getAmount(), frequency);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String text, String field) {
        E value = EnumUtils.getEnumIgnoreCase(type, StringUtils.trim(text));
        if (value == null) {
            throw new ConfigurationException("unsupported " + field + ": " + text);
        }
        return value;
    }
}
