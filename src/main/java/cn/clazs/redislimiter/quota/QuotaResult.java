package cn.clazs.redislimiter.quota;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 配额存储的单次判定结果
 *
 * <p>{@code retryAfter} 为负数表示"无需等待"或"存储未给出等待提示"
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@ToString
public final class QuotaResult {

    private static final Duration NO_WAIT = Duration.ofMillis(-1);

    /**
     * 本次实际放行的单位数（0 表示被限流）
     */
    private final int allowed;

    /**
     * 当前窗口剩余可用次数
     */
    private final int remaining;

    /**
     * 距离下一次可能放行的等待时间
     */
    private final Duration retryAfter;

    /**
     * 距离窗口重置的时间
     */
    private final Duration resetAfter;

    public QuotaResult(int allowed, int remaining, Duration retryAfter, Duration resetAfter) {
        this.allowed = allowed;
        this.remaining = remaining;
        this.retryAfter = retryAfter != null ? retryAfter : NO_WAIT;
        this.resetAfter = resetAfter != null ? resetAfter : NO_WAIT;
    }

    public static QuotaResult allowed(int allowed, int remaining, Duration resetAfter) {
        return new QuotaResult(allowed, remaining, NO_WAIT, resetAfter);
    }

    public static QuotaResult denied(int remaining, Duration retryAfter, Duration resetAfter) {
        return new QuotaResult(0, remaining, retryAfter, resetAfter);
    }

    public boolean isAllowed() {
        return allowed > 0;
    }
}
