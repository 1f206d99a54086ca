package cn.clazs.redislimiter.core;

import java.time.Instant;

/**
 * 阻塞式限流器统一接口
 *
 * <p>{@link #take()} 在配额允许之前会一直阻塞调用线程，被限流不会抛出异常
 * <p>组合限流器本身也实现此接口，因此可以任意嵌套
 *
 * @author clazs
 * @since 1.0.0
 */
public interface Limiter {

    /**
     * 获取一次许可，必要时阻塞等待
     *
     * <p>注意：限流器的取消上下文被取消时，等待会提前结束并<b>正常返回</b>（视为放行），
     * 调用方不能依赖取消来得到一个异常
     *
     * @return 放行时刻
     * @throws cn.clazs.redislimiter.exception.RateLimitException 存储异常或存储返回了非法结果
     */
    Instant take();
}
