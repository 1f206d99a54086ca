package cn.clazs.redislimiter.quota;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Duration;
import java.util.Objects;

/**
 * 限流配额（不可变值对象）
 *
 * <p>语义：每个 {@code period} 内最多放行 {@code rate} 次
 * <p>突发容量 {@code burst} 恒等于 {@code rate}，不单独对外暴露配置
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode
public final class Quota {

    private static final Duration MIN_PERIOD = Duration.ofMillis(1);

    /**
     * 时间窗口内最大放行次数
     */
    private final int rate;

    /**
     * 突发容量
     */
    private final int burst;

    /**
     * 时间窗口长度
     */
    private final Duration period;

    private Quota(int rate, Duration period) {
        Objects.requireNonNull(period, "period cannot be null");
        if (rate <= 0) {
            throw new IllegalArgumentException("rate must be > 0, got: " + rate);
        }
        // 存储按毫秒计时，不足 1ms 的窗口会被截断为 0
        if (period.compareTo(MIN_PERIOD) < 0) {
            throw new IllegalArgumentException("period must be >= 1ms, got: " + period);
        }
        this.rate = rate;
        this.burst = rate;
        this.period = period;
    }

    /**
     * 创建配额
     *
     * @param rate 时间窗口内最大放行次数
     * @param period 时间窗口长度
     * @return 配额
     */
    public static Quota of(int rate, Duration period) {
        return new Quota(rate, period);
    }

    public static Quota perSecond(int rate) {
        return new Quota(rate, Duration.ofSeconds(1));
    }

    public static Quota perMinute(int rate) {
        return new Quota(rate, Duration.ofMinutes(1));
    }

    public static Quota perHour(int rate) {
        return new Quota(rate, Duration.ofHours(1));
    }

    @Override
    public String toString() {
        return rate + "/" + period.toMillis() + "ms";
    }
}
