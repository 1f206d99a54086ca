package cn.clazs.redislimiter.exception;

import java.time.Instant;

/**
 * 存储既没有返回结果也没有报错（违反存储契约，视为装配错误）
 *
 * @author clazs
 * @since 1.0.0
 */
public class IntervalServerException extends RateLimitException {

    public static final String MESSAGE = "rate limit interval server error";

    public IntervalServerException(String limitKey, Instant occurredAt) {
        super(limitKey, occurredAt, MESSAGE);
    }
}
