package cn.clazs.redislimiter.annotation;

import java.lang.reflect.Method;

/**
 * 限流 Key 的作用范围，决定业务 Key 是否拼接方法签名
 *
 * @author clazs
 * @since 1.0
 */
public enum RateLimitScope {

    /**
     * 方法级（默认）：{@code 全限定类名.方法名:业务Key}，
     * 例如 {@code cn.clazs.controller.SmsController.send:13800000000}
     */
    METHOD {
        @Override
        public String resolveKey(Method method, String bizKey) {
            return method.getDeclaringClass().getName() + "." + method.getName() + ":" + bizKey;
        }
    },

    /**
     * 全局：直接使用业务 Key。
     * 不同方法只要业务 Key 和档位相同就共用一份配额，配合 Redis 存储时跨实例共用
     *
     * <pre>{@code
     * // 同一个手机号，验证码和语音通知合计每分钟最多 5 条
     * @DoRateLimit(key = "'sms:' + #phone", scope = RateLimitScope.GLOBAL,
     *         limits = @QuotaLimit(freq = 5, interval = 60000))
     * public void sendCode(String phone) {}
     *
     * @DoRateLimit(key = "'sms:' + #phone", scope = RateLimitScope.GLOBAL,
     *         limits = @QuotaLimit(freq = 5, interval = 60000))
     * public void sendVoice(String phone) {}
     * }</pre>
     */
    GLOBAL {
        @Override
        public String resolveKey(Method method, String bizKey) {
            return bizKey;
        }
    };

    /**
     * 生成交给注册中心的限流 Key
     *
     * @param method 被拦截的方法
     * @param bizKey SpEL 解析出的业务 Key
     * @return 限流 Key
     */
    public abstract String resolveKey(Method method, String bizKey);
}
