package cn.clazs.redislimiter.exception;

import lombok.Getter;

import java.time.Instant;

/**
 * 限流异常
 * 限流器无法给出可靠判定时抛出此异常（被限流本身不是异常，限流器会阻塞等待）
 *
 * <p>使用示例：
 * <pre>
 * try {
 *     limiter.take();
 * } catch (RateLimitException e) {
 *     log.warn("限流存储异常，放行请求：{}", e.getMessage());
 * }
 * </pre>
 *
 * @author clazs
 * @since 1.0
 */
public class RateLimitException extends RuntimeException {

    /**
     * 限流的 Key
     */
    @Getter
    private final String limitKey;

    /**
     * 异常发生时刻
     */
    @Getter
    private final Instant occurredAt;

    /**
     * @param limitKey 限流的 Key
     * @param occurredAt 异常发生时刻
     * @param message 错误提示信息
     */
    public RateLimitException(String limitKey, Instant occurredAt, String message) {
        super(message);
        this.limitKey = limitKey;
        this.occurredAt = occurredAt;
    }

    /**
     * @param limitKey 限流的 Key
     * @param occurredAt 异常发生时刻
     * @param message 错误提示信息
     * @param cause 原始异常
     */
    public RateLimitException(String limitKey, Instant occurredAt, String message, Throwable cause) {
        super(message, cause);
        this.limitKey = limitKey;
        this.occurredAt = occurredAt;
    }

    @Override
    public String toString() {
        return String.format("%s{limitKey='%s', occurredAt=%s, message='%s'}",
                getClass().getSimpleName(), limitKey, occurredAt, getMessage());
    }
}
