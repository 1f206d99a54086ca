package cn.clazs.redislimiter.core;

/**
 * 组合限流器：只有所有成员限流器都放行时才放行
 *
 * <p><b>非原子性：</b>成员按顺序逐个检查，而不是在同一时刻联合校验。
 * 检查第 i 个成员和第 i+1 个成员之间，其他调用方可能已经消耗了第 i 个成员的配额。
 * 组合限流器保证的是"每个配额在被检查的那一刻都满足"，
 * 而不是"所有配额在某一时刻同时满足"。对于相互独立的配额（如同一资源的每秒 + 每分钟两档）这是可接受的。
 *
 * @author clazs
 * @since 1.0.0
 */
public interface CompositeLimiter extends Limiter {

    /**
     * 追加一个必须同时通过的限流器
     *
     * <p>只对追加完成之后才开始的 {@link #take()} 调用生效
     *
     * @param limiter 成员限流器
     */
    void addLimiter(Limiter limiter);

    /**
     * 当前成员数量
     *
     * @return 成员数量
     */
    int size();
}
