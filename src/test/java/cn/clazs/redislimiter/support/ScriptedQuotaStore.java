package cn.clazs.redislimiter.support;

import cn.clazs.redislimiter.quota.Quota;
import cn.clazs.redislimiter.quota.QuotaResult;
import cn.clazs.redislimiter.quota.QuotaStore;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 按预设脚本依次返回结果的配额存储（测试用）
 *
 * <p>脚本用完后一直返回"放行"
 */
public class ScriptedQuotaStore implements QuotaStore {

    private final Deque<Supplier<QuotaResult>> script = new ArrayDeque<>();
    private final AtomicInteger calls = new AtomicInteger();

    public synchronized ScriptedQuotaStore thenReturn(QuotaResult result) {
        script.addLast(() -> result);
        return this;
    }

    public synchronized ScriptedQuotaStore thenThrow(RuntimeException error) {
        script.addLast(() -> {
            throw error;
        });
        return this;
    }

    @Override
    public QuotaResult allowN(String key, Quota quota, int n) {
        calls.incrementAndGet();
        Supplier<QuotaResult> next;
        synchronized (this) {
            next = script.pollFirst();
        }
        if (next == null) {
            return QuotaResult.allowed(n, quota.getBurst() - n, quota.getPeriod());
        }
        return next.get();
    }

    @Override
    public void reset(String key) {
    }

    public int getCalls() {
        return calls.get();
    }
}
