package cn.clazs.redislimiter.core;

import cn.clazs.redislimiter.exception.IntervalServerException;
import cn.clazs.redislimiter.exception.QuotaStoreException;
import cn.clazs.redislimiter.quota.Quota;
import cn.clazs.redislimiter.quota.QuotaResult;
import cn.clazs.redislimiter.quota.QuotaStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 单配额限流器
 *
 * <p>绑定一个配额、一个限流键、一个取消上下文和一个配额存储。
 * {@link #take()} 轮询存储，被限流时按存储给出的 retryAfter 退避后重新查询，直到放行
 *
 * <p>失败语义：
 * <ul>
 *     <li>存储异常：包装为 {@link QuotaStoreException} 立即抛出，不重试</li>
 *     <li>存储返回 null：抛出 {@link IntervalServerException}，不重试</li>
 *     <li>被限流但没有等待提示（retryAfter &lt;= 0）：直接放行</li>
 *     <li><b>取消上下文在等待期间被取消：直接放行，不抛异常</b></li>
 * </ul>
 *
 * <p>存储由调用方持有，限流器不会关闭它
 *
 * <p>使用示例：
 * <pre>{@code
 * Limiter perSecond = QuotaLimiter.builder(store, "sms:per_second", 10)
 *         .per(Duration.ofSeconds(1))
 *         .build();
 * perSecond.take();
 * }</pre>
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
@Getter
public class QuotaLimiter implements Limiter {

    private final QuotaStore quotaStore;
    private final String key;
    private final Quota quota;
    private final CancellationContext cancellation;
    private final Clock clock;

    private QuotaLimiter(Builder builder) {
        this.quotaStore = builder.quotaStore;
        this.key = builder.key;
        this.quota = Quota.of(builder.rate, builder.period);
        this.cancellation = builder.cancellation;
        this.clock = builder.clock;
    }

    @Override
    public Instant take() {
        while (true) {
            Instant now = clock.instant();

            QuotaResult result;
            try {
                result = quotaStore.allow(key, quota);
            } catch (RuntimeException e) {
                log.warn("配额存储调用失败：key={}, quota={}, error={}", key, quota, e.toString());
                throw new QuotaStoreException(key, clock.instant(), e);
            }

            if (result == null) {
                throw new IntervalServerException(key, clock.instant());
            }
            if (result.isAllowed()) {
                return now;
            }

            Duration retryAfter = result.getRetryAfter();
            if (retryAfter.isZero() || retryAfter.isNegative()) {
                // 存储拒绝却没有给出等待时间，放行
                log.debug("限流响应缺少等待提示，直接放行：key={}, result={}", key, result);
                return now;
            }

            log.debug("限流触发，等待 {}ms 后重试：key={}, quota={}", retryAfter.toMillis(), key, quota);
            if (awaitCancellation(retryAfter)) {
                log.debug("等待期间取消上下文被取消，直接放行：key={}", key);
                return clock.instant();
            }
        }
    }

    /**
     * @return true-取消上下文先结束（或线程被中断）, false-等待自然结束
     */
    private boolean awaitCancellation(Duration retryAfter) {
        try {
            return cancellation.await(retryAfter);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    @Override
    public String toString() {
        return "QuotaLimiter{key='" + key + "', quota=" + quota + "}";
    }

    /**
     * 构建器
     *
     * @param quotaStore 配额存储
     * @param key 限流键
     * @param rate 时间窗口内最大放行次数
     * @return 构建器（默认时间窗口 1 秒，永不取消）
     */
    public static Builder builder(QuotaStore quotaStore, String key, int rate) {
        return new Builder(quotaStore, key, rate);
    }

    /**
     * Builder 类
     */
    public static class Builder {
        private final QuotaStore quotaStore;
        private final String key;
        private final int rate;
        private Duration period = Duration.ofSeconds(1);
        private CancellationContext cancellation = CancellationContext.never();
        private Clock clock = Clock.systemUTC();

        private Builder(QuotaStore quotaStore, String key, int rate) {
            this.quotaStore = Objects.requireNonNull(quotaStore, "quotaStore cannot be null");
            if (key == null || key.trim().isEmpty()) {
                throw new IllegalArgumentException("限流Key不能为空");
            }
            this.key = key;
            this.rate = rate;
        }

        /**
         * 时间窗口长度
         */
        public Builder per(Duration period) {
            this.period = Objects.requireNonNull(period, "period cannot be null");
            return this;
        }

        /**
         * 退避等待期间使用的取消上下文
         */
        public Builder cancellation(CancellationContext cancellation) {
            this.cancellation = Objects.requireNonNull(cancellation, "cancellation cannot be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock cannot be null");
            return this;
        }

        /**
         * @throws IllegalArgumentException rate 或 period 不合法
         */
        public QuotaLimiter build() {
            return new QuotaLimiter(this);
        }
    }
}
