package cn.clazs.redislimiter.autoconfigure;

import cn.clazs.redislimiter.aspect.RateLimitAspect;
import cn.clazs.redislimiter.exception.DefaultRateLimitExceptionHandler;
import cn.clazs.redislimiter.factory.QuotaStoreFactory;
import cn.clazs.redislimiter.properties.RateLimiterProperties;
import cn.clazs.redislimiter.registry.LimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 限流器自动配置类
 *
 * <p>自动配置的功能：
 * <ul>
 *     <li>自动注册 {@link QuotaStoreFactory} 配额存储工厂 Bean（存在 StringRedisTemplate 时自动注入）</li>
 *     <li>自动注册 {@link LimiterRegistry} 限流器注册中心 Bean（容器关闭时调用 close 释放等待线程）</li>
 *     <li>自动注册 {@link RateLimitAspect} AOP 切面 Bean</li>
 *     <li>Servlet Web 环境下注册 {@link DefaultRateLimitExceptionHandler}</li>
 *     <li>支持通过 {@code clazs.redislimiter.enabled=false} 关闭自动配置</li>
 *     <li>支持用户自定义 Bean 覆盖（@ConditionalOnMissingBean）</li>
 * </ul>
 *
 * <p>使用示例：
 * <pre>{@code
 * // 1. 配置 application.yml
 * clazs:
 *   redislimiter:
 *     storage: redis
 *     freq: 100
 *     interval: 60000
 *
 * // 2. 直接使用注解
 * @RestController
 * public class SmsController {
 *     @DoRateLimit(key = "#phone", limits = @QuotaLimit(freq = 1, interval = 1000))
 *     @PostMapping("/sms")
 *     public void send(String phone) {
 *     }
 * }
 * }</pre>
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RateLimiterProperties.class)
@ConditionalOnProperty(prefix = "clazs.redislimiter", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RateLimiterAutoConfiguration {

    /**
     * 注册配额存储工厂 Bean
     *
     * @param properties 从 application.yml 读取的配置属性
     * @param redisTemplateProvider Redis 模板（可选）
     * @return 配额存储工厂
     */
    @Bean
    @ConditionalOnMissingBean
    public QuotaStoreFactory quotaStoreFactory(RateLimiterProperties properties,
                                               ObjectProvider<StringRedisTemplate> redisTemplateProvider) {
        log.info("初始化 QuotaStoreFactory Bean，配置：{}", properties.getSummary());

        QuotaStoreFactory factory = new QuotaStoreFactory(properties);

        StringRedisTemplate redisTemplate = redisTemplateProvider.getIfAvailable();
        if (redisTemplate != null) {
            factory.setRedisTemplate(redisTemplate);
            log.info("Redis 模板已注入到配额存储工厂");
        } else {
            log.info("未检测到 Redis 模板，限流器将仅支持本地存储");
        }
        return factory;
    }

    /**
     * 注册限流器注册中心 Bean
     *
     * @param properties 从 application.yml 读取的配置属性
     * @param storeFactory 配额存储工厂
     * @return 限流器注册中心
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public LimiterRegistry limiterRegistry(RateLimiterProperties properties, QuotaStoreFactory storeFactory) {
        log.info("初始化 LimiterRegistry Bean");
        return new LimiterRegistry(properties, storeFactory);
    }

    /**
     * 注册限流切面 Bean
     *
     * @param registry 限流器注册中心
     * @return 限流切面
     */
    @Bean
    @ConditionalOnMissingBean
    public RateLimitAspect rateLimitAspect(LimiterRegistry registry) {
        log.info("初始化 RateLimitAspect Bean");
        return new RateLimitAspect(registry);
    }

    /**
     * Servlet Web 环境下的异常处理器
     */
    @Configuration
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(name = "org.springframework.web.servlet.DispatcherServlet")
    static class WebExceptionHandlerConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public DefaultRateLimitExceptionHandler defaultRateLimitExceptionHandler() {
            log.info("初始化 DefaultRateLimitExceptionHandler Bean");
            return new DefaultRateLimitExceptionHandler();
        }
    }
}
