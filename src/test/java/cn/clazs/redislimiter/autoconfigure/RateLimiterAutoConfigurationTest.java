package cn.clazs.redislimiter.autoconfigure;

import cn.clazs.redislimiter.aspect.RateLimitAspect;
import cn.clazs.redislimiter.exception.DefaultRateLimitExceptionHandler;
import cn.clazs.redislimiter.factory.QuotaStoreFactory;
import cn.clazs.redislimiter.properties.RateLimiterProperties;
import cn.clazs.redislimiter.registry.LimiterRegistry;
import cn.clazs.redislimiter.store.local.LocalQuotaStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.support.PropertiesLoaderUtils;

import java.io.IOException;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RateLimiterAutoConfiguration 测试
 *
 * <p>测试内容：
 * <ul>
 *     <li>spring.factories 是否注册了自动配置类</li>
 *     <li>默认配置下注册的 Bean</li>
 *     <li>enabled=false 时关闭自动配置</li>
 *     <li>用户自定义 Bean 覆盖</li>
 * </ul>
 */
@DisplayName("RateLimiterAutoConfiguration 测试")
class RateLimiterAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(RateLimiterAutoConfiguration.class));

    @Test
    @DisplayName("spring.factories：注册了自动配置类")
    void testSpringFactories() throws IOException {
        Properties factories = PropertiesLoaderUtils.loadProperties(
                new ClassPathResource("META-INF/spring.factories"));

        String autoConfigurations = factories.getProperty(
                "org.springframework.boot.autoconfigure.EnableAutoConfiguration");

        assertNotNull(autoConfigurations);
        assertTrue(autoConfigurations.contains(RateLimiterAutoConfiguration.class.getName()));
    }

    @Test
    @DisplayName("默认配置：注册工厂、注册中心和切面")
    void testDefaultBeans() {
        contextRunner.run(context -> {
            assertEquals(1, context.getBeansOfType(QuotaStoreFactory.class).size());
            assertEquals(1, context.getBeansOfType(LimiterRegistry.class).size());
            assertEquals(1, context.getBeansOfType(RateLimitAspect.class).size());
            assertTrue(context.getBeansOfType(DefaultRateLimitExceptionHandler.class).isEmpty(),
                    "非 Web 环境不注册异常处理器");

            LimiterRegistry registry = context.getBean(LimiterRegistry.class);
            assertTrue(registry.getQuotaStore() instanceof LocalQuotaStore);
            assertEquals(100, registry.getProperties().getFreq());
        });
    }

    @Test
    @DisplayName("配置绑定：clazs.redislimiter 前缀的属性生效")
    void testPropertyBinding() {
        contextRunner
                .withPropertyValues(
                        "clazs.redislimiter.freq=5",
                        "clazs.redislimiter.interval=2000",
                        "clazs.redislimiter.cache.maximum-size=50",
                        "clazs.redislimiter.redis.key-prefix=app:")
                .run(context -> {
                    RateLimiterProperties properties = context.getBean(RateLimiterProperties.class);
                    assertEquals(5, properties.getFreq());
                    assertEquals(2000L, properties.getInterval());
                    assertEquals(50L, properties.getCache().getMaximumSize());
                    assertEquals("app:", properties.getRedis().getKeyPrefix());
                });
    }

    @Test
    @DisplayName("关闭：enabled=false 时不注册任何 Bean")
    void testDisabled() {
        contextRunner
                .withPropertyValues("clazs.redislimiter.enabled=false")
                .run(context -> {
                    assertTrue(context.getBeansOfType(LimiterRegistry.class).isEmpty());
                    assertTrue(context.getBeansOfType(RateLimitAspect.class).isEmpty());
                });
    }

    @Test
    @DisplayName("Redis 存储：缺少 StringRedisTemplate 时启动失败")
    void testRedisStorageWithoutTemplate() {
        contextRunner
                .withPropertyValues("clazs.redislimiter.storage=redis")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    @DisplayName("非法配置：启动时校验失败")
    void testInvalidProperties() {
        contextRunner
                .withPropertyValues("clazs.redislimiter.freq=0")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    @DisplayName("覆盖：用户自定义的注册中心优先")
    void testUserDefinedRegistry() {
        contextRunner
                .withUserConfiguration(CustomRegistryConfiguration.class)
                .run(context -> {
                    LimiterRegistry registry = context.getBean(LimiterRegistry.class);
                    assertEquals(7, registry.getProperties().getFreq());
                });
    }

    @Test
    @DisplayName("Web 环境：注册默认异常处理器")
    void testWebExceptionHandler() {
        new WebApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(RateLimiterAutoConfiguration.class))
                .run(context -> assertEquals(1,
                        context.getBeansOfType(DefaultRateLimitExceptionHandler.class).size()));
    }

    @Test
    @DisplayName("关闭容器：注册中心随容器一起关闭")
    void testRegistryClosedWithContext() {
        LimiterRegistry[] holder = new LimiterRegistry[1];
        contextRunner.run(context -> holder[0] = context.getBean(LimiterRegistry.class));

        assertTrue(holder[0].isClosed());
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomRegistryConfiguration {

        @Bean
        LimiterRegistry limiterRegistry() {
            RateLimiterProperties properties = new RateLimiterProperties();
            properties.setFreq(7);
            return new LimiterRegistry(properties, new QuotaStoreFactory(properties));
        }
    }
}
