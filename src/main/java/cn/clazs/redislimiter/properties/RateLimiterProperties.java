package cn.clazs.redislimiter.properties;

import cn.clazs.redislimiter.enums.QuotaStorage;
import cn.clazs.redislimiter.quota.Quota;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * {@code clazs.redislimiter.*} 配置
 *
 * <pre>
 * clazs:
 *   redislimiter:
 *     freq: 100            # 未声明档位时的默认配额
 *     interval: 60000
 *     storage: redis
 *     cache:
 *       expire-after-access-minutes: 1440
 *       maximum-size: 10000
 *     redis:
 *       key-prefix: "redislimiter:"
 * </pre>
 *
 * @author clazs
 * @since 1.0.0
 */
@Data
@ConfigurationProperties(prefix = "clazs.redislimiter")
public class RateLimiterProperties {

    private boolean enabled = true;

    /**
     * 默认配额：每个窗口放行次数
     */
    private int freq = 100;

    /**
     * 默认配额：窗口长度（毫秒）
     */
    private long interval = 60000L;

    private QuotaStorage storage = QuotaStorage.LOCAL;

    private CacheConfig cache = new CacheConfig();

    private RedisConfig redis = new RedisConfig();

    /**
     * 启动时校验，任何一项不合法都拒绝启动
     *
     * @throws IllegalArgumentException 配置不合法
     */
    public void validate() {
        if (freq <= 0) {
            throw new IllegalArgumentException("配置错误：freq 必须大于 0，当前值：" + freq);
        }
        if (interval <= 0) {
            throw new IllegalArgumentException("配置错误：interval 必须大于 0，当前值：" + interval);
        }
        if (storage == null) {
            throw new IllegalArgumentException("配置错误：storage 不能为空");
        }
        if (cache == null || cache.getExpireAfterAccessMinutes() <= 0 || cache.getMaximumSize() <= 0) {
            throw new IllegalArgumentException("配置错误：cache.expire-after-access-minutes 和 cache.maximum-size 必须大于 0");
        }
        if (redis == null || redis.getKeyPrefix() == null) {
            throw new IllegalArgumentException("配置错误：redis.key-prefix 不能为空");
        }
    }

    /**
     * 未声明档位时使用的配额
     */
    public Quota toDefaultQuota() {
        return Quota.of(freq, Duration.ofMillis(interval));
    }

    public String getSummary() {
        return "RateLimiterProperties{defaultQuota=" + freq + "/" + interval + "ms"
                + ", storage=" + storage
                + ", cache=" + cache.getMaximumSize() + "@" + cache.getExpireAfterAccessMinutes() + "min"
                + ", keyPrefix='" + redis.getKeyPrefix() + "'}";
    }

    @Data
    public static class CacheConfig {

        /**
         * 限流器闲置多久后从注册中心清除（分钟）
         */
        private long expireAfterAccessMinutes = 1440L;

        private long maximumSize = 10000L;
    }

    @Data
    public static class RedisConfig {

        private String keyPrefix = "redislimiter:";
    }
}
