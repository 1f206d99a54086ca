package cn.clazs.redislimiter.factory;

import cn.clazs.redislimiter.enums.QuotaStorage;
import cn.clazs.redislimiter.properties.RateLimiterProperties;
import cn.clazs.redislimiter.quota.QuotaStore;
import cn.clazs.redislimiter.store.local.LocalQuotaStore;
import cn.clazs.redislimiter.store.redis.RedisQuotaStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 配额存储工厂
 *
 * <p>根据存储类型创建对应的配额存储实例
 * <p>每种存储类型只创建一次，所有限流器共享同一个存储实例
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class QuotaStoreFactory {

    /**
     * 存储缓存：key = 存储类型，value = QuotaStore
     */
    private final Map<QuotaStorage, QuotaStore> storeCache = new ConcurrentHashMap<>();

    /**
     * Redis 模板（可选，仅在 storage=REDIS 时使用）
     */
    private volatile StringRedisTemplate redisTemplate;

    private final String redisKeyPrefix;
    private final long cacheExpireAfterAccessMinutes;
    private final long cacheMaximumSize;

    /**
     * 默认构造函数
     */
    public QuotaStoreFactory() {
        this(new RateLimiterProperties());
    }

    /**
     * 构造函数（通过配置初始化）
     *
     * @param properties 配置属性
     */
    public QuotaStoreFactory(RateLimiterProperties properties) {
        Objects.requireNonNull(properties, "properties cannot be null");
        properties.validate();
        this.redisKeyPrefix = properties.getRedis().getKeyPrefix();
        this.cacheExpireAfterAccessMinutes = properties.getCache().getExpireAfterAccessMinutes();
        this.cacheMaximumSize = properties.getCache().getMaximumSize();
    }

    /**
     * 设置 Redis 模板（由自动配置注入）
     *
     * @param redisTemplate Redis 模板
     */
    public void setRedisTemplate(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        log.debug("Redis 模板已注入: {}", redisTemplate != null ? redisTemplate.getClass().getName() : "null");
    }

    /**
     * 获取存储实例（带缓存）
     *
     * @param storage 存储类型
     * @return 存储实例
     */
    public QuotaStore getStore(QuotaStorage storage) {
        Objects.requireNonNull(storage, "storage cannot be null");

        return storeCache.computeIfAbsent(storage, s -> {
            log.info("创建配额存储: storage={}, 跨实例共享={}", s, s.isDistributed());
            return doCreateStore(s);
        });
    }

    private QuotaStore doCreateStore(QuotaStorage storage) {
        switch (storage) {
            case LOCAL:
                return new LocalQuotaStore(Clock.systemUTC(), cacheExpireAfterAccessMinutes, cacheMaximumSize);

            case REDIS:
                if (redisTemplate == null) {
                    throw new IllegalStateException(
                            "Redis storage is not available. Please configure a StringRedisTemplate bean."
                    );
                }
                return new RedisQuotaStore(redisTemplate, redisKeyPrefix);

            default:
                throw new UnsupportedOperationException("Unsupported storage: " + storage);
        }
    }

    /**
     * 清空存储缓存
     */
    public void clearCache() {
        log.info("清空配额存储缓存");
        storeCache.clear();
    }

    /**
     * 获取缓存的存储数量
     *
     * @return 缓存大小
     */
    public int getCacheSize() {
        return storeCache.size();
    }
}
