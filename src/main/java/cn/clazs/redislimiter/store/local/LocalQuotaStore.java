package cn.clazs.redislimiter.store.local;

import cn.clazs.redislimiter.quota.Quota;
import cn.clazs.redislimiter.quota.QuotaResult;
import cn.clazs.redislimiter.quota.QuotaStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 本地固定窗口配额存储
 *
 * <p>窗口在第一次放行时开启，窗口内计数达到上限后拒绝，并返回窗口剩余时长作为 retryAfter
 * <p>线程安全：每个 key 一把 ReentrantLock
 * <p>只在单个 JVM 内生效，分布式场景请使用 Redis 存储
 *
 * @author clazs
 * @since 1.0.0
 */
public class LocalQuotaStore implements QuotaStore {

    /**
     * 单个 key 的窗口状态
     */
    private static class Window {
        /** 窗口开始时间（毫秒），-1 表示尚未开启 */
        long start = -1L;

        /** 窗口内已放行次数 */
        int count;

        final ReentrantLock lock = new ReentrantLock();
    }

    /**
     * 默认缓存过期时间（分钟）
     */
    private static final long DEFAULT_CACHE_EXPIRE_AFTER_ACCESS_MINUTES = 30;

    /**
     * 默认缓存最大容量
     */
    private static final long DEFAULT_CACHE_MAXIMUM_SIZE = 10_000;

    private final Cache<String, Window> windows;
    private final Clock clock;

    public LocalQuotaStore() {
        this(Clock.systemUTC());
    }

    public LocalQuotaStore(Clock clock) {
        this(clock, DEFAULT_CACHE_EXPIRE_AFTER_ACCESS_MINUTES, DEFAULT_CACHE_MAXIMUM_SIZE);
    }

    /**
     * @param clock 时钟
     * @param expireAfterAccessMinutes 缓存过期时间（分钟）
     * @param maximumSize 缓存最大容量
     */
    public LocalQuotaStore(Clock clock, long expireAfterAccessMinutes, long maximumSize) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.windows = Caffeine.newBuilder()
                .expireAfterAccess(expireAfterAccessMinutes, TimeUnit.MINUTES)
                .maximumSize(maximumSize)
                .build();
    }

    @Override
    public QuotaResult allowN(String key, Quota quota, int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be > 0, got: " + n);
        }

        Window window = windows.get(key, k -> new Window());
        long period = quota.getPeriod().toMillis();
        int limit = quota.getBurst();

        window.lock.lock();
        try {
            long now = clock.millis();

            // 窗口过期，重新开始计数
            if (window.start < 0 || now - window.start >= period) {
                window.start = now;
                window.count = 0;
            }

            Duration resetAfter = Duration.ofMillis(window.start + period - now);
            if (window.count + n <= limit) {
                window.count += n;
                return QuotaResult.allowed(n, limit - window.count, resetAfter);
            }
            return QuotaResult.denied(Math.max(limit - window.count, 0), resetAfter, resetAfter);
        } finally {
            window.lock.unlock();
        }
    }

    @Override
    public void reset(String key) {
        windows.invalidate(key);
    }

    /**
     * 获取当前窗口内已放行次数（用于监控和测试）
     *
     * @param key 限流键
     * @return 已放行次数，key 不存在时返回 0
     */
    public int getCurrentCount(String key) {
        Window window = windows.getIfPresent(key);
        if (window == null) {
            return 0;
        }

        window.lock.lock();
        try {
            return window.count;
        } finally {
            window.lock.unlock();
        }
    }
}
