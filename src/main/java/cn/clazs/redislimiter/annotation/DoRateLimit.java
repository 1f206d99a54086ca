package cn.clazs.redislimiter.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 限流注解
 * 用于标记需要进行限流的方法，超出配额时调用线程会阻塞等待，而不是直接拒绝
 *
 * <p>使用示例：
 * <pre>{@code
 * // 1. 使用全局配置
 * @DoRateLimit(key = "#userId")
 * public String getUserInfo(String userId) {
 *     return "info";
 * }
 *
 * // 2. 多档配额：每秒 1 次，同时每分钟 10 次
 * @DoRateLimit(key = "#phone", limits = {
 *         @QuotaLimit(freq = 1, interval = 1000),
 *         @QuotaLimit(freq = 10, interval = 60000)
 * })
 * public void sendSms(String phone) {
 * }
 *
 * // 3. 存储不可用时拒绝请求（默认放行）
 * @DoRateLimit(key = "'payment'", failOpen = false)
 * public void pay() {
 * }
 * }</pre>
 *
 * @author clazs
 * @since 1.0
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface DoRateLimit {

    /**
     * 限流Key（支持SpEL表达式）
     *
     * <p>SpEL 表达式示例：
     * <ul>
     *     <li>{@code #userId} - 获取方法参数 userId 的值</li>
     *     <li>{@code #user.id} - 获取方法参数 user 对象的 id 属性</li>
     *     <li>{@code 'constant_key'} - 使用常量字符串（注意单引号）</li>
     * </ul>
     *
     * @return SpEL 表达式或常量字符串
     */
    String key();

    /**
     * 限流范围策略（默认：方法级隔离）
     *
     * @return 限流范围策略
     */
    RateLimitScope scope() default RateLimitScope.METHOD;

    /**
     * 配额档位（可选，默认使用全局配置的一档）
     * 所有档位都放行后才执行目标方法
     */
    QuotaLimit[] limits() default {};

    /**
     * 配额存储异常时是否放行（默认：放行）
     *
     * <p>为 false 时异常会继续抛出，由 {@code DefaultRateLimitExceptionHandler} 转换为 503
     */
    boolean failOpen() default true;
}
