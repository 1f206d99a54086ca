package cn.clazs.redislimiter.annotation;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 一档配额，只能在 {@link DoRateLimit#limits()} 中使用
 *
 * @author clazs
 * @since 1.0.0
 */
@Target({})
@Retention(RetentionPolicy.RUNTIME)
public @interface QuotaLimit {

    /**
     * 时间窗口内最大放行次数
     */
    int freq();

    /**
     * 时间窗口长度，单位：毫秒（默认：1000ms）
     */
    long interval() default 1000L;
}
