package world.willfrog.backtestmicro.backtestservice.metrics;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class DrawdownSummary {
    /**
     * 最大回撤，非正数
     */
    double maxDrawdown;
    LocalDate peakDate;
    LocalDate troughDate;
    /**
     * 首次回到峰值的日期，未修复为 null
     */
    LocalDate recoveryDate;
    long durationDays;

    public static DrawdownSummary none() {
        return DrawdownSummary.builder().maxDrawdown(0d).durationDays(0L).build();
    }
}
