package cn.clazs.redislimiter.core;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 取消上下文
 *
 * <p>限流器在退避等待期间与此上下文赛跑：上下文先被取消（或到达截止时间）则提前结束等待
 * <p>线程安全，可以被任意多个限流器共享
 *
 * @author clazs
 * @since 1.0.0
 */
public final class CancellationContext {

    private static final CancellationContext NEVER = new CancellationContext(false, 0L, false);

    /**
     * 超时上限，保证按差值比较 nanoTime 时不会溢出
     */
    private static final long MAX_TIMEOUT_NANOS = Long.MAX_VALUE >> 1;

    private final CountDownLatch cancelled = new CountDownLatch(1);

    private final boolean hasDeadline;

    /**
     * 截止时间（System.nanoTime 基准，可能为负数，只能按差值比较）
     */
    private final long deadlineNanos;

    private final boolean cancellable;

    private CancellationContext(boolean hasDeadline, long deadlineNanos, boolean cancellable) {
        this.hasDeadline = hasDeadline;
        this.deadlineNanos = deadlineNanos;
        this.cancellable = cancellable;
    }

    /**
     * 永不取消的上下文（限流器默认值）
     */
    public static CancellationContext never() {
        return NEVER;
    }

    /**
     * 可手动取消的上下文
     */
    public static CancellationContext create() {
        return new CancellationContext(false, 0L, true);
    }

    /**
     * 到达指定时长后自动视为已取消的上下文，也可以提前手动取消
     *
     * @param timeout 超时时长
     */
    public static CancellationContext withTimeout(Duration timeout) {
        return withTimeout(timeout, System.nanoTime());
    }

    static CancellationContext withTimeout(Duration timeout, long nowNanos) {
        long nanos = timeout.compareTo(Duration.ofNanos(MAX_TIMEOUT_NANOS)) > 0
                ? MAX_TIMEOUT_NANOS
                : Math.max(timeout.toNanos(), 0L);
        return new CancellationContext(true, nowNanos + nanos, true);
    }

    boolean hasDeadline() {
        return hasDeadline;
    }

    long getDeadlineNanos() {
        return deadlineNanos;
    }

    /**
     * 取消上下文，唤醒所有正在等待的限流器
     *
     * @throws UnsupportedOperationException 对 {@link #never()} 调用时
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("the never-cancelled context cannot be cancelled");
        }
        cancelled.countDown();
    }

    public boolean isCancelled() {
        if (cancelled.getCount() == 0) {
            return true;
        }
        return hasDeadline && System.nanoTime() - deadlineNanos >= 0;
    }

    /**
     * 等待指定时长，或直到上下文被取消
     *
     * @param timeout 等待时长
     * @return true-上下文先被取消, false-等待自然结束
     * @throws InterruptedException 等待期间线程被中断
     */
    public boolean await(Duration timeout) throws InterruptedException {
        long waitNanos = timeout.toNanos();
        boolean hitsDeadline = false;
        if (hasDeadline) {
            long untilDeadline = deadlineNanos - System.nanoTime();
            if (untilDeadline <= waitNanos) {
                waitNanos = untilDeadline;
                hitsDeadline = true;
            }
        }
        if (waitNanos <= 0) {
            return hitsDeadline || isCancelled();
        }
        return cancelled.await(waitNanos, TimeUnit.NANOSECONDS) || hitsDeadline;
    }
}
