package cn.clazs.redislimiter.properties;

import cn.clazs.redislimiter.enums.QuotaStorage;
import cn.clazs.redislimiter.quota.Quota;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RateLimiterProperties 测试类
 */
@DisplayName("RateLimiterProperties 配置测试")
class RateLimiterPropertiesTest {

    private RateLimiterProperties properties;

    @BeforeEach
    void setUp() {
        properties = new RateLimiterProperties();
    }

    @Test
    @DisplayName("默认值：应该正确")
    void testDefaults() {
        assertTrue(properties.isEnabled());
        assertEquals(100, properties.getFreq());
        assertEquals(60000L, properties.getInterval());
        assertEquals(1440L, properties.getCache().getExpireAfterAccessMinutes());
        assertEquals(10000L, properties.getCache().getMaximumSize());
        assertEquals(QuotaStorage.LOCAL, properties.getStorage());
        assertEquals("redislimiter:", properties.getRedis().getKeyPrefix());
        assertDoesNotThrow(properties::validate);
    }

    @Test
    @DisplayName("默认配额：由 freq 和 interval 组成")
    void testDefaultQuota() {
        properties.setFreq(5);
        properties.setInterval(2000L);

        assertEquals(Quota.of(5, Duration.ofSeconds(2)), properties.toDefaultQuota());
    }

    @Test
    @DisplayName("验证：非正数的频率和时间窗口应该被拒绝")
    void testInvalidFreqAndInterval() {
        properties.setFreq(0);
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, properties::validate);
        assertTrue(exception.getMessage().contains("freq"));

        properties.setFreq(10);
        properties.setInterval(-1L);
        exception = assertThrows(IllegalArgumentException.class, properties::validate);
        assertTrue(exception.getMessage().contains("interval"));
    }

    @Test
    @DisplayName("验证：缓存参数、存储类型和 Redis 前缀")
    void testInvalidCacheStorageAndPrefix() {
        properties.getCache().setMaximumSize(0L);
        assertThrows(IllegalArgumentException.class, properties::validate);

        properties.getCache().setMaximumSize(10L);
        properties.getCache().setExpireAfterAccessMinutes(0L);
        assertThrows(IllegalArgumentException.class, properties::validate);

        properties.getCache().setExpireAfterAccessMinutes(1L);
        properties.setStorage(null);
        assertThrows(IllegalArgumentException.class, properties::validate);

        properties.setStorage(QuotaStorage.REDIS);
        properties.getRedis().setKeyPrefix(null);
        assertThrows(IllegalArgumentException.class, properties::validate);
    }

    @Test
    @DisplayName("摘要：包含关键配置")
    void testSummary() {
        properties.setStorage(QuotaStorage.REDIS);
        properties.setFreq(5);

        String summary = properties.getSummary();

        assertTrue(summary.contains("defaultQuota=5/60000ms"));
        assertTrue(summary.contains("storage=REDIS"));
    }

    @Test
    @DisplayName("存储类型：按代码解析，只有 Redis 跨实例共享")
    void testStorageFromCode() {
        assertEquals(QuotaStorage.REDIS, QuotaStorage.fromCode("redis"));
        assertEquals(QuotaStorage.LOCAL, QuotaStorage.fromCode("LOCAL"));
        assertThrows(IllegalArgumentException.class, () -> QuotaStorage.fromCode("memcached"));
        assertTrue(QuotaStorage.REDIS.isDistributed());
        assertFalse(QuotaStorage.LOCAL.isDistributed());
    }
}
