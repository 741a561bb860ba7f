package world.willfrog.backtestmicro.backtestservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import world.willfrog.backtestmicro.backtestservice.model.GapFillPolicy;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 回测引擎配置属性
 */
@Data
@ConfigurationProperties(prefix = "backtest")
public class BacktestProperties {

    /**
     * 请求未指定时使用的基准货币
     */
    private String defaultBaseCurrency = "USD";

    /**
     * 目标权重之和与 1 的允许偏差
     */
    private BigDecimal weightTolerance = new BigDecimal("0.0001");

    /**
     * 年化无风险利率，请求未指定时使用
     */
    private BigDecimal riskFreeRate = BigDecimal.ZERO;

    private int tradingDaysPerYear = 252;

    /**
     * 缺价处理策略，默认直接失败
     */
    private GapFillPolicy gapFillPolicy = GapFillPolicy.FAIL;

    private Realistic realistic = new Realistic();

    private Currency currency = new Currency();

    private Job job = new Job();

    @Data
    public static class Realistic {
        /**
         * REALISTIC 模式下每笔成交的固定佣金（基准货币）
         */
        private BigDecimal commissionPerTrade = BigDecimal.ZERO;
    }

    @Data
    public static class Currency {
        /**
         * 固定汇率表，key 形如 USD_GBP，表示 1 USD 兑换的 GBP
         */
        private Map<String, BigDecimal> rates = new LinkedHashMap<>();
    }

    @Data
    public static class Job {
        /**
         * 已结束任务（COMPLETED / FAILED）的保留时长，小于等于 0 表示不按时间清理
         */
        private long retentionSeconds = 3600;

        /**
         * 最多保留的已结束任务数，超出时先清理结束最早的
         */
        private int maxFinishedJobs = 1000;
    }
}
