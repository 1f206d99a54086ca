package cn.clazs.redislimiter.exception;

import java.time.Instant;

/**
 * 配额存储异常（连接失败、超时、协议错误）
 *
 * <p>原始异常通过 {@link #getCause()} 原样保留，限流器不会重试
 *
 * @author clazs
 * @since 1.0.0
 */
public class QuotaStoreException extends RateLimitException {

    public QuotaStoreException(String limitKey, Instant occurredAt, Throwable cause) {
        super(limitKey, occurredAt, "quota store failure: " + cause.getMessage(), cause);
    }
}
