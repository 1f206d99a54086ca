package cn.clazs.redislimiter.store.redis;

import cn.clazs.redislimiter.quota.Quota;
import cn.clazs.redislimiter.quota.QuotaResult;
import cn.clazs.redislimiter.quota.QuotaStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.scripting.support.ResourceScriptSource;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Redis 固定窗口配额存储
 *
 * <p>计数器存放在 String 类型的键中，窗口长度即键的过期时间
 * <p>使用 Lua 脚本保证"读取-判断-扣减-设置过期"的原子性，多个实例共享同一个键即共享配额
 * <p>被限流时以键的剩余存活时间（PTTL）作为 retryAfter
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
public class RedisQuotaStore implements QuotaStore {

    /**
     * Redis 键默认前缀
     */
    public static final String DEFAULT_KEY_PREFIX = "redislimiter:";

    /**
     * Lua 脚本路径
     */
    private static final String SCRIPT_PATH = "redis/fixed_window.lua";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<List> fixedWindowScript;
    private final String keyPrefix;

    /**
     * @param redisTemplate Redis 模板
     */
    public RedisQuotaStore(StringRedisTemplate redisTemplate) {
        this(redisTemplate, DEFAULT_KEY_PREFIX);
    }

    /**
     * @param redisTemplate Redis 模板
     * @param keyPrefix Redis 键前缀
     */
    public RedisQuotaStore(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate cannot be null");
        this.keyPrefix = keyPrefix != null ? keyPrefix : DEFAULT_KEY_PREFIX;

        // 加载 Lua 脚本
        this.fixedWindowScript = new DefaultRedisScript<>();
        this.fixedWindowScript.setScriptSource(new ResourceScriptSource(new ClassPathResource(SCRIPT_PATH)));
        this.fixedWindowScript.setResultType(List.class);
    }

    @Override
    public QuotaResult allowN(String key, Quota quota, int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be > 0, got: " + n);
        }

        List<String> keys = Collections.singletonList(buildRedisKey(key));
        List<?> result = redisTemplate.execute(
                fixedWindowScript,
                keys,
                String.valueOf(quota.getBurst()),             // ARGV[1]: 窗口内最大放行次数
                String.valueOf(quota.getPeriod().toMillis()), // ARGV[2]: 窗口长度（毫秒）
                String.valueOf(n)                             // ARGV[3]: 扣减数量
        );

        if (result == null || result.size() < 4) {
            log.debug("Lua 脚本返回了空结果：key={}, result={}", key, result);
            return null;
        }

        int allowed = toLong(result.get(0)).intValue();
        int remaining = toLong(result.get(1)).intValue();
        Duration retryAfter = Duration.ofMillis(toLong(result.get(2)));
        Duration resetAfter = Duration.ofMillis(toLong(result.get(3)));
        return new QuotaResult(allowed, remaining, retryAfter, resetAfter);
    }

    @Override
    public void reset(String key) {
        redisTemplate.delete(buildRedisKey(key));
    }

    /**
     * 构建 Redis 键
     *
     * @param key 原始键
     * @return Redis 键
     */
    private String buildRedisKey(String key) {
        return keyPrefix + "fixed_window:" + key;
    }

    private static Long toLong(Object value) {
        if (value instanceof Long) {
            return (Long) value;
        }
        return Long.valueOf(String.valueOf(value));
    }
}
