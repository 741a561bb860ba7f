package world.willfrog.backtestmicro.backtestservice.model;

import org.apache.commons.lang3.StringUtils;
import world.willfrog.backtestmicro.backtestservice.constants.BacktestConstants;
import world.willfrog.backtestmicro.backtestservice.exception.ConfigurationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 目标权重。构造时校验并归一化，归一化后权重之和精确为 1，保持输入顺序。
 */
public final class TargetAllocation {
    private final Map<String, BigDecimal> weights;

    private TargetAllocation(Map<String, BigDecimal> weights) {
        this.weights = Collections.unmodifiableMap(weights);
    }

    public static TargetAllocation of(Map<String, BigDecimal> rawWeights, BigDecimal tolerance) {
        if (rawWeights == null || rawWeights.isEmpty()) {
            throw new ConfigurationException("target allocation must not be empty");
        }
        Map<String, BigDecimal> cleaned = new LinkedHashMap<>();
        BigDecimal sum = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> entry : rawWeights.entrySet()) {
            String ticker = normalizeTicker(entry.getKey());
            if (StringUtils.isBlank(ticker)) {
                throw new ConfigurationException("target allocation contains a blank ticker");
            }
            BigDecimal weight = entry.getValue();
            if (weight == null || weight.signum() < 0) {
                throw new ConfigurationException("weight of " + ticker + " must be non-negative");
            }
            if (cleaned.put(ticker, weight) != null) {
                throw new ConfigurationException("duplicate ticker in target allocation: " + ticker);
            }
            sum = sum.add(weight);
        }
        if (sum.signum() <= 0) {
            throw new ConfigurationException("target allocation needs at least one positive weight");
        }
        if (sum.subtract(BigDecimal.ONE).abs().compareTo(tolerance) > 0) {
            throw new ConfigurationException("target weights sum to " + sum.stripTrailingZeros().toPlainString()
                    + ", expected 1 within " + tolerance.toPlainString());
        }
        return new TargetAllocation(normalize(cleaned, sum));
    }

    // 最后一个正权重取 1 减去其余之和，保证合计精确为 1
    private static Map<String, BigDecimal> normalize(Map<String, BigDecimal> cleaned, BigDecimal sum) {
        List<String> positive = new ArrayList<>();
        cleaned.forEach((ticker, weight) -> {
            if (weight.signum() > 0) {
                positive.add(ticker);
            }
        });
        String last = positive.get(positive.size() - 1);
        Map<String, BigDecimal> normalized = new LinkedHashMap<>();
        BigDecimal allocated = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> entry : cleaned.entrySet()) {
            if (entry.getKey().equals(last)) {
                normalized.put(entry.getKey(), null);
                continue;
            }
            BigDecimal weight = entry.getValue().signum() == 0
                    ? BigDecimal.ZERO
                    : entry.getValue().divide(sum, BacktestConstants.CALC_SCALE, RoundingMode.DOWN);
            normalized.put(entry.getKey(), weight);
            allocated = allocated.add(weight);
        }
        normalized.put(last, BigDecimal.ONE.subtract(allocated));
        return normalized;
    }

    public static String normalizeTicker(String ticker) {
        return StringUtils.upperCase(StringUtils.trim(ticker));
    }

    public Set<String> tickers() {
        return weights.keySet();
    }

    /**
     * 正权重标的，保持输入顺序
     */
    public List<String> positiveTickers() {
        List<String> positive = new ArrayList<>();
        weights.forEach((ticker, weight) -> {
            if (weight.signum() > 0) {
                positive.add(ticker);
            }
        });
        return positive;
    }

    public Map<String, BigDecimal> weights() {
        return weights;
    }

    public BigDecimal weightOf(String ticker) {
        return weights.getOrDefault(ticker, BigDecimal.ZERO);
    }

    public boolean isPositive(String ticker) {
        return weightOf(ticker).signum() > 0;
    }
}
