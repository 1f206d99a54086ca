package cn.clazs.redislimiter.core;

import cn.clazs.redislimiter.exception.IntervalServerException;
import cn.clazs.redislimiter.exception.QuotaStoreException;
import cn.clazs.redislimiter.exception.RateLimitException;
import cn.clazs.redislimiter.quota.Quota;
import cn.clazs.redislimiter.quota.QuotaResult;
import cn.clazs.redislimiter.quota.QuotaStore;
import cn.clazs.redislimiter.support.MutableClock;
import cn.clazs.redislimiter.support.ScriptedQuotaStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QuotaLimiter 测试类
 * 使用脚本化的配额存储验证重试循环、异常转换和取消语义
 */
@DisplayName("QuotaLimiter 单配额限流器测试")
class QuotaLimiterTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private MutableClock clock;
    private ScriptedQuotaStore store;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new ScriptedQuotaStore();
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private QuotaLimiter limiter(CancellationContext cancellation) {
        return QuotaLimiter.builder(store, "user:1001", 2)
                .per(Duration.ofSeconds(1))
                .cancellation(cancellation)
                .clock(clock)
                .build();
    }

    private static QuotaResult deny(long retryAfterMillis) {
        return QuotaResult.denied(0, Duration.ofMillis(retryAfterMillis), Duration.ofMillis(retryAfterMillis));
    }

    // ==================== 放行与重试 ====================

    @Test
    @DisplayName("放行：存储直接放行时返回当前时刻且只调用一次")
    void testImmediateGrant() {
        Instant grantedAt = limiter(CancellationContext.never()).take();

        assertEquals(START, grantedAt);
        assertEquals(1, store.getCalls());
    }

    @Test
    @DisplayName("重试：被拒绝后等待提示时长再次询问存储")
    void testRetryAfterDenial() {
        store.thenReturn(deny(30)).thenReturn(deny(30));

        long begin = System.nanoTime();
        Instant grantedAt = limiter(CancellationContext.never()).take();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);

        assertEquals(3, store.getCalls(), "两次拒绝后第三次放行");
        assertEquals(START, grantedAt);
        assertTrue(elapsedMillis >= 50, "至少等待了两次提示时长，实际：" + elapsedMillis);
    }

    @Test
    @DisplayName("放行时刻：取的是放行那次询问开始时的时钟")
    void testGrantInstantComesFromSuccessfulAttempt() {
        QuotaStore advancingStore = new QuotaStore() {
            private int calls;

            @Override
            public QuotaResult allowN(String key, Quota quota, int n) {
                calls++;
                if (calls == 1) {
                    clock.advance(Duration.ofMillis(500));
                    return deny(1);
                }
                return QuotaResult.allowed(1, 0, Duration.ofMillis(500));
            }

            @Override
            public void reset(String key) {
            }
        };

        QuotaLimiter limiter = QuotaLimiter.builder(advancingStore, "k", 1).clock(clock).build();

        assertEquals(START.plusMillis(500), limiter.take());
    }

    @Test
    @DisplayName("降级：拒绝但没有等待提示时直接放行")
    void testDenialWithoutRetryHintFailsOpen() {
        store.thenReturn(QuotaResult.denied(0, Duration.ZERO, Duration.ZERO));

        Instant grantedAt = limiter(CancellationContext.never()).take();

        assertEquals(START, grantedAt);
        assertEquals(1, store.getCalls());
    }

    @Test
    @DisplayName("降级：等待提示为负数时直接放行")
    void testDenialWithNegativeRetryHintFailsOpen() {
        store.thenReturn(QuotaResult.denied(0, null, null));

        assertEquals(START, limiter(CancellationContext.never()).take());
    }

    // ==================== 异常 ====================

    @Test
    @DisplayName("异常：存储抛出异常时包装为 QuotaStoreException 并保留原因")
    void testStoreFailureIsWrapped() {
        IllegalStateException cause = new IllegalStateException("connection refused");
        store.thenThrow(cause);

        QuotaStoreException exception = assertThrows(QuotaStoreException.class,
                () -> limiter(CancellationContext.never()).take());

        assertSame(cause, exception.getCause());
        assertEquals("user:1001", exception.getLimitKey());
        assertEquals(START, exception.getOccurredAt());
        assertTrue(exception.getMessage().contains("connection refused"));
        assertEquals(1, store.getCalls(), "存储异常不应重试");
    }

    @Test
    @DisplayName("异常：存储返回空结果时抛出 IntervalServerException")
    void testNullResultRaisesIntervalServerError() {
        store.thenReturn(null);

        IntervalServerException exception = assertThrows(IntervalServerException.class,
                () -> limiter(CancellationContext.never()).take());

        assertEquals("rate limit interval server error", exception.getMessage());
        assertEquals(START, exception.getOccurredAt());
        assertTrue(exception instanceof RateLimitException);
    }

    // ==================== 取消 ====================

    @Test
    @DisplayName("取消：上下文已取消时被拒绝的请求立即放行")
    void testAlreadyCancelledContextReturnsImmediately() {
        store.thenReturn(deny(60_000));
        CancellationContext cancellation = CancellationContext.create();
        cancellation.cancel();

        long begin = System.nanoTime();
        Instant grantedAt = limiter(cancellation).take();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);

        assertEquals(START, grantedAt);
        assertEquals(1, store.getCalls(), "取消后不再询问存储");
        assertTrue(elapsedMillis < 1000, "不应等待提示时长，实际：" + elapsedMillis);
    }

    @Test
    @DisplayName("取消：等待过程中取消立即唤醒并放行")
    void testCancelWhileWaiting() throws Exception {
        store.thenReturn(deny(60_000));
        CancellationContext cancellation = CancellationContext.create();
        QuotaLimiter limiter = limiter(cancellation);

        Future<Instant> future = executor.submit(limiter::take);
        Thread.sleep(100);
        assertFalse(future.isDone(), "取消前应处于等待状态");

        cancellation.cancel();

        assertEquals(START, future.get(2, TimeUnit.SECONDS));
        assertEquals(1, store.getCalls());
    }

    @Test
    @DisplayName("取消：超时上下文到期后放行")
    void testTimeoutContext() {
        store.thenReturn(deny(60_000));

        long begin = System.nanoTime();
        limiter(CancellationContext.withTimeout(Duration.ofMillis(100))).take();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);

        assertTrue(elapsedMillis >= 80, "应等待到超时，实际：" + elapsedMillis);
        assertTrue(elapsedMillis < 5000, "不应等待提示时长，实际：" + elapsedMillis);
    }

    @Test
    @DisplayName("中断：等待中的线程被中断时放行并保留中断标记")
    void testInterruptWhileWaiting() throws Exception {
        store.thenReturn(deny(60_000));
        QuotaLimiter limiter = limiter(CancellationContext.never());
        CountDownLatch started = new CountDownLatch(1);

        Future<Boolean> future = executor.submit(() -> {
            started.countDown();
            limiter.take();
            return Thread.currentThread().isInterrupted();
        });
        assertTrue(started.await(1, TimeUnit.SECONDS));
        Thread.sleep(100);

        executor.shutdownNow();

        assertTrue(future.get(2, TimeUnit.SECONDS), "中断标记应被恢复");
    }

    // ==================== 构建参数 ====================

    @Test
    @DisplayName("构建：默认时间窗口为 1 秒")
    void testDefaultPeriod() {
        QuotaLimiter limiter = QuotaLimiter.builder(store, "k", 10).build();

        assertEquals(Quota.of(10, Duration.ofSeconds(1)), limiter.getQuota());
        assertEquals(10, limiter.getQuota().getBurst());
        assertSame(CancellationContext.never(), limiter.getCancellation());
    }

    @Test
    @DisplayName("构建：非法参数应该抛出异常")
    void testInvalidArguments() {
        assertThrows(NullPointerException.class, () -> QuotaLimiter.builder(null, "k", 1));
        assertThrows(IllegalArgumentException.class, () -> QuotaLimiter.builder(store, " ", 1));
        assertThrows(IllegalArgumentException.class, () -> QuotaLimiter.builder(store, "k", 0).build());
        assertThrows(IllegalArgumentException.class,
                () -> QuotaLimiter.builder(store, "k", 1).per(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> QuotaLimiter.builder(store, "k", 1).per(Duration.ofNanos(500_000)).build());
    }
}
