package cn.clazs.redislimiter.aspect;

import cn.clazs.redislimiter.annotation.DoRateLimit;
import cn.clazs.redislimiter.annotation.QuotaLimit;
import cn.clazs.redislimiter.core.CompositeLimiter;
import cn.clazs.redislimiter.exception.RateLimitException;
import cn.clazs.redislimiter.quota.Quota;
import cn.clazs.redislimiter.registry.LimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.context.expression.MethodBasedEvaluationContext;
import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;

import java.lang.reflect.Method;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 限流切面
 * 拦截标注了 @DoRateLimit 注解的方法，在配额允许之前阻塞调用线程
 *
 * <p>核心功能：
 * <ul>
 *     <li>解析 SpEL 表达式获取限流 Key</li>
 *     <li>生成复合Key（全限定类名.方法名:业务Key）实现方法级别隔离</li>
 *     <li>按注解中的档位从注册中心获取组合限流器</li>
 *     <li>配额存储异常时按 failOpen 决定放行还是抛出 RateLimitException</li>
 * </ul>
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
@Aspect
public class RateLimitAspect {

    /**
     * 限流器注册中心
     */
    private final LimiterRegistry limiterRegistry;

    private final ExpressionParser parser = new SpelExpressionParser();

    private final ParameterNameDiscoverer nameDiscoverer = new DefaultParameterNameDiscoverer();

    /**
     * 解析过的 SpEL 表达式，同一个注解只解析一次
     */
    private final Map<String, Expression> expressionCache = new ConcurrentHashMap<>();

    public RateLimitAspect(LimiterRegistry limiterRegistry) {
        this.limiterRegistry = limiterRegistry;
    }

    /**
     * 环绕通知：拦截`@DoRateLimit`注解的方法
     *
     * @param joinPoint AOP连接点
     * @param doRateLimit 限流注解
     * @throws Throwable 目标方法异常，或 failOpen=false 时的限流异常
     */
    @Around("@annotation(doRateLimit)")
    public Object around(ProceedingJoinPoint joinPoint, DoRateLimit doRateLimit) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();

        String bizKey = parseKey(doRateLimit.key(), method, joinPoint.getArgs());
        String finalKey = doRateLimit.scope().resolveKey(method, bizKey);

        CompositeLimiter limiter = limiterRegistry.getComposite(finalKey, toQuotas(doRateLimit.limits()));

        try {
            Instant grantedAt = limiter.take();
            if (log.isDebugEnabled()) {
                log.debug("限流放行：finalKey={}, method={}, grantedAt={}", finalKey, method.getName(), grantedAt);
            }
        } catch (RateLimitException e) {
            if (!doRateLimit.failOpen()) {
                log.warn("限流存储异常，拒绝请求：finalKey={}, method={}, error={}",
                        finalKey, method.getName(), e.getMessage());
                throw e;
            }
            log.warn("限流存储异常，放行请求：finalKey={}, method={}, error={}",
                    finalKey, method.getName(), e.getMessage());
        }

        return joinPoint.proceed();
    }

    private List<Quota> toQuotas(QuotaLimit[] limits) {
        List<Quota> quotas = new ArrayList<>(limits.length);
        for (QuotaLimit limit : limits) {
            quotas.add(Quota.of(limit.freq(), Duration.ofMillis(limit.interval())));
        }
        return quotas;
    }

    /**
     * 解析限流 Key：不含 {@code #} 和 {@code '} 的按常量处理，其余按 SpEL 在方法参数上求值，
     * 例如 {@code #userId}、{@code #user.id}、{@code 'sms:' + #phone}
     *
     * @throws IllegalArgumentException 表达式求值结果为 null
     */
    private String parseKey(String keyExpression, Method method, Object[] args) {
        if (!keyExpression.contains("#") && !keyExpression.contains("'")) {
            return keyExpression;
        }

        EvaluationContext context = new MethodBasedEvaluationContext(null, method, args, nameDiscoverer);
        Expression expression = expressionCache.computeIfAbsent(keyExpression, parser::parseExpression);
        Object value = expression.getValue(context);

        if (value == null) {
            throw new IllegalArgumentException("限流 Key 解析结果为 null，SpEL 表达式: " + keyExpression
                    + "，方法: " + method.getName());
        }
        return value.toString();
    }
}
