package cn.clazs.redislimiter.quota;

/**
 * 配额存储接口
 *
 * <p>对计数算法的抽象，限流器只负责编排调用，计数完全由存储决定
 *
 * <p>设计原则：
 * <ul>
 *   <li>原子性：同一个 key 的扣减必须由存储串行化</li>
 *   <li>线程安全：实现类可被多个限流器并发共享</li>
 *   <li>无缓存：每次调用都以存储中的状态为准</li>
 * </ul>
 *
 * @author clazs
 * @since 1.0.0
 */
public interface QuotaStore {

    /**
     * 尝试在 key 上扣减 n 个单位
     *
     * @param key 限流键
     * @param quota 配额
     * @param n 扣减数量
     * @return 判定结果
     * @throws RuntimeException 存储不可达或协议错误
     */
    QuotaResult allowN(String key, Quota quota, int n);

    /**
     * 尝试在 key 上扣减 1 个单位
     *
     * @param key 限流键
     * @param quota 配额
     * @return 判定结果
     */
    default QuotaResult allow(String key, Quota quota) {
        return allowN(key, quota, 1);
    }

    /**
     * 重置指定 key 的限流状态
     *
     * @param key 限流键
     */
    void reset(String key);
}
