package cn.clazs.redislimiter.core;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 默认组合限流器
 *
 * <p>成员列表由读写锁保护：{@link #addLimiter} 持有写锁追加，{@link #take()} 持有读锁复制快照。
 * 成员的阻塞等待发生在锁外，不会阻塞追加操作
 *
 * <p>任一成员抛出异常时立即中止并原样抛出，剩余成员不再检查
 *
 * <p>使用示例（同时限制每秒和每分钟）：
 * <pre>{@code
 * Limiter perSecond = QuotaLimiter.builder(store, "aggregate_per_second", 10).per(Duration.ofSeconds(1)).build();
 * Limiter perMinute = QuotaLimiter.builder(store, "aggregate_per_minute", 100).per(Duration.ofMinutes(1)).build();
 * CompositeLimiter composite = DefaultCompositeLimiter.of(perSecond, perMinute);
 * composite.take(); // 两个配额都放行后才返回
 * }</pre>
 *
 * @author clazs
 * @since 1.0.0
 * @see CompositeLimiter 非原子性说明
 */
@Slf4j
public class DefaultCompositeLimiter implements CompositeLimiter {

    private final List<Limiter> limiters;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    public DefaultCompositeLimiter() {
        this(Clock.systemUTC());
    }

    public DefaultCompositeLimiter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.limiters = new ArrayList<>();
    }

    public DefaultCompositeLimiter(List<? extends Limiter> limiters) {
        this();
        for (Limiter limiter : limiters) {
            this.limiters.add(Objects.requireNonNull(limiter, "limiter cannot be null"));
        }
    }

    public static DefaultCompositeLimiter of(Limiter... limiters) {
        return new DefaultCompositeLimiter(Arrays.asList(limiters));
    }

    @Override
    public void addLimiter(Limiter limiter) {
        Objects.requireNonNull(limiter, "limiter cannot be null");
        lock.writeLock().lock();
        try {
            limiters.add(limiter);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Instant take() {
        List<Limiter> snapshot = snapshot();

        // 没有成员时不做任何限制
        if (snapshot.isEmpty()) {
            return clock.instant();
        }

        // 逐个阻塞获取许可，返回最后一个成员的放行时刻
        Instant lastGrant = null;
        for (Limiter limiter : snapshot) {
            lastGrant = limiter.take();
        }
        return lastGrant;
    }

    @Override
    public int size() {
        return snapshot().size();
    }

    private List<Limiter> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(limiters);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "DefaultCompositeLimiter" + snapshot();
    }
}
