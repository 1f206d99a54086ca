package cn.clazs.redislimiter.registry;

import cn.clazs.redislimiter.core.CancellationContext;
import cn.clazs.redislimiter.core.CompositeLimiter;
import cn.clazs.redislimiter.core.DefaultCompositeLimiter;
import cn.clazs.redislimiter.core.QuotaLimiter;
import cn.clazs.redislimiter.factory.QuotaStoreFactory;
import cn.clazs.redislimiter.properties.RateLimiterProperties;
import cn.clazs.redislimiter.quota.Quota;
import cn.clazs.redislimiter.quota.QuotaStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * 限流器注册中心
 * 使用 Caffeine 缓存管理所有限流器实例，自动清理不活跃对象
 *
 * <p>核心功能：
 * <ul>
 *     <li>管理 Map&lt;Key, QuotaLimiter&gt; 和 Map&lt;Key, CompositeLimiter&gt;</li>
 *     <li>自动清理不活跃对象（防止内存泄漏）</li>
 *     <li>所有限流器共享同一个配额存储和同一个取消上下文</li>
 *     <li>{@link #close()} 时取消上下文，释放所有正在退避等待的线程</li>
 * </ul>
 *
 * <p>使用示例：
 * <pre>
 * LimiterRegistry registry = new LimiterRegistry(properties, storeFactory);
 *
 * // 同时限制每秒 10 次、每分钟 100 次
 * CompositeLimiter limiter = registry.getComposite("sms:13800000000",
 *         Arrays.asList(Quota.perSecond(10), Quota.perMinute(100)));
 * limiter.take();
 * </pre>
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class LimiterRegistry implements AutoCloseable {

    private static final char COMPOSITE_SEPARATOR = '|';

    private static final Pattern TIER_SUFFIX = Pattern.compile("\\d+/\\d+ms");

    /**
     * Caffeine 缓存：存储 Key -> QuotaLimiter 的映射
     */
    private final Cache<String, QuotaLimiter> limiterCache;

    /**
     * Caffeine 缓存：存储 Key -> CompositeLimiter 的映射
     */
    private final Cache<String, CompositeLimiter> compositeCache;

    /**
     * 全局默认配置
     */
    @Getter
    private final RateLimiterProperties properties;

    /**
     * 所有限流器共享的配额存储
     */
    @Getter
    private final QuotaStore quotaStore;

    /**
     * 所有限流器共享的取消上下文
     */
    private final CancellationContext cancellation = CancellationContext.create();

    /**
     * 统计信息：创建的限流器总数
     */
    private final AtomicLong totalCreatedLimiters = new AtomicLong(0);

    /**
     * 根据配置创建注册中心
     *
     * @param properties 限流器配置
     * @param storeFactory 配额存储工厂
     */
    public LimiterRegistry(RateLimiterProperties properties, QuotaStoreFactory storeFactory) {
        if (properties == null || storeFactory == null) {
            throw new IllegalArgumentException("LimiterRegistry 需要 properties 和 storeFactory");
        }
        properties.validate();

        this.properties = properties;
        this.quotaStore = storeFactory.getStore(properties.getStorage());

        log.info("初始化 LimiterRegistry，配置：{}", properties.getSummary());

        this.limiterCache = Caffeine.newBuilder()
                .expireAfterAccess(properties.getCache().getExpireAfterAccessMinutes(), TimeUnit.MINUTES)
                .maximumSize(properties.getCache().getMaximumSize())
                .recordStats()
                .removalListener((String key, QuotaLimiter limiter, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        log.debug("闲置限流器被淘汰：key={}, cause={}", key, cause);
                    }
                })
                .build();

        this.compositeCache = Caffeine.newBuilder()
                .expireAfterAccess(properties.getCache().getExpireAfterAccessMinutes(), TimeUnit.MINUTES)
                .maximumSize(properties.getCache().getMaximumSize())
                .build();

        log.info("LimiterRegistry 初始化完成");
    }

    /**
     * 使用yml默认配置获取指定key的限流器
     * 如果缓存中存在，直接返回；如果不存在，自动创建并放入缓存
     *
     * @param key 限流键
     * @return 限流器实例
     */
    public QuotaLimiter getLimiter(String key) {
        checkKey(key);

        return limiterCache.get(key, k -> {
            log.debug("按默认配额创建限流器：key={}", k);
            return createLimiter(k, properties.toDefaultQuota());
        });
    }

    /**
     * 使用自定义配置获取或创建限流器
     *
     * <p>存储中的键会拼接档位信息（{@code key:freq/intervalms}），不同档位互不共享计数
     *
     * @param key      限流Key
     * @param freq     时间窗口内最大放行次数
     * @param interval 时间窗口长度（毫秒）
     * @return 限流器实例
     */
    public QuotaLimiter getLimiter(String key, int freq, long interval) {
        checkKey(key);

        if (freq <= 0 || interval <= 0) {
            throw new IllegalArgumentException("档位配置非法: " + tierKey(key, freq, interval));
        }

        return limiterCache.get(tierKey(key, freq, interval), cacheKey -> {
            log.debug("创建新的限流器（自定义配置）：key={}, freq={}, interval={}ms", cacheKey, freq, interval);
            return createLimiter(cacheKey, Quota.of(freq, Duration.ofMillis(interval)));
        });
    }

    /**
     * 获取或创建组合限流器，每个配额对应一个成员
     * 配额列表为空时使用全局默认配置
     *
     * <p>缓存键由 key 和全部档位组成（{@code key|1/1000ms,10/60000ms}），
     * 同一个 key 的不同档位组合、以及 {@link #getComposite(String)} 创建的空组合限流器互不复用
     *
     * @param key    限流Key
     * @param quotas 配额列表
     * @return 组合限流器
     */
    public CompositeLimiter getComposite(String key, List<Quota> quotas) {
        checkKey(key);

        List<Quota> tiers = quotas == null ? Collections.emptyList() : quotas;
        // 使用全局默认配置时档位部分为空：key|
        StringBuilder cacheKey = new StringBuilder(key).append(COMPOSITE_SEPARATOR);
        for (int i = 0; i < tiers.size(); i++) {
            if (i > 0) {
                cacheKey.append(',');
            }
            cacheKey.append(tiers.get(i));
        }

        return compositeCache.get(cacheKey.toString(), ck -> {
            DefaultCompositeLimiter composite = new DefaultCompositeLimiter();
            if (tiers.isEmpty()) {
                composite.addLimiter(getLimiter(key));
            } else {
                for (Quota quota : tiers) {
                    composite.addLimiter(getLimiter(key, quota.getRate(), quota.getPeriod().toMillis()));
                }
            }
            log.debug("创建新的组合限流器：cacheKey={}", ck);
            return composite;
        });
    }

    /**
     * 获取或创建一个空的组合限流器，调用方可以在运行时通过 addLimiter 追加成员
     *
     * @param key 限流Key
     * @return 组合限流器
     */
    public CompositeLimiter getComposite(String key) {
        checkKey(key);

        return compositeCache.get(key, k -> {
            log.debug("创建新的空组合限流器：key={}", k);
            return new DefaultCompositeLimiter();
        });
    }

    /**
     * 是否已经缓存了这个限流 Key（带档位的 Key 需要写全，例如 {@code sms:1/1000ms}），不会触发创建
     */
    public boolean hasLimiter(String key) {
        return key != null && limiterCache.getIfPresent(key) != null;
    }

    /**
     * 丢弃 key 对应的组合限流器、默认限流器以及它的所有档位限流器
     *
     * <p>只丢弃客户端实例，存储里已经计入的次数不受影响
     *
     * @param key 限流Key
     */
    public void removeLimiter(String key) {
        if (key == null || key.trim().isEmpty()) {
            return;
        }
        compositeCache.invalidate(key);
        compositeCache.asMap().keySet().removeIf(cached -> cached.startsWith(key + COMPOSITE_SEPARATOR));
        limiterCache.asMap().keySet().removeIf(cached -> cached.equals(key) || isTierOf(cached, key));
        log.debug("移除限流器：key={}", key);
    }

    /**
     * 清空所有缓存的限流器
     */
    public void clearAll() {
        log.info("清空注册中心：限流器 {} 个，组合限流器 {} 个",
                limiterCache.estimatedSize(), compositeCache.estimatedSize());
        limiterCache.invalidateAll();
        compositeCache.invalidateAll();
    }

    public long getCurrentCacheSize() {
        return limiterCache.estimatedSize();
    }

    /**
     * 关闭注册中心：取消共享的取消上下文并清空缓存
     *
     * <p>正在退避等待的线程会立即放行；之后创建的限流器也不会再阻塞
     */
    @Override
    public void close() {
        log.info("关闭 LimiterRegistry，释放所有等待中的限流器");
        cancellation.cancel();
        clearAll();
    }

    public boolean isClosed() {
        return cancellation.isCancelled();
    }

    private QuotaLimiter createLimiter(String key, Quota quota) {
        totalCreatedLimiters.incrementAndGet();
        return QuotaLimiter.builder(quotaStore, key, quota.getRate())
                .per(quota.getPeriod())
                .cancellation(cancellation)
                .build();
    }

    private static String tierKey(String key, int freq, long interval) {
        return key + ":" + freq + "/" + interval + "ms";
    }

    private static boolean isTierOf(String cachedKey, String key) {
        return cachedKey.startsWith(key + ":") && TIER_SUFFIX.matcher(cachedKey.substring(key.length() + 1)).matches();
    }

    private static void checkKey(String key) {
        if (key == null || key.trim().isEmpty()) {
            throw new IllegalArgumentException("限流Key不能为空");
        }
    }

    /**
     * 当前状态快照，用于日志和监控
     */
    public RegistryStats getStats() {
        CacheStats stats = limiterCache.stats();
        return new RegistryStats(
                totalCreatedLimiters.get(),
                limiterCache.estimatedSize(),
                compositeCache.estimatedSize(),
                stats.hitRate(),
                stats.evictionCount(),
                isClosed());
    }

    public long getTotalCreatedLimiters() {
        return totalCreatedLimiters.get();
    }

    @Value
    public static class RegistryStats {
        long totalCreated;
        long limiters;
        long composites;

        /**
         * 限流器缓存命中率，没有请求时为 1.0
         */
        double hitRate;
        long evictions;
        boolean closed;
    }
}
