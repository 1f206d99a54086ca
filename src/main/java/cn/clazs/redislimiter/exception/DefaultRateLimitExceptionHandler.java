package cn.clazs.redislimiter.exception;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 把逃逸到 MVC 层的 {@link RateLimitException} 转成 503
 *
 * <p>限流器在配额不足时只会阻塞，不会抛异常；能走到这里的只有
 * {@code @DoRateLimit(failOpen = false)} 方法上的存储故障，此时服务无法判定配额，返回 503 而不是 429。
 * 由 {@code RateLimiterAutoConfiguration} 在 Servlet 环境下注册。
 *
 * @author clazs
 * @since 1.0.0
 */
@Slf4j
@RestControllerAdvice
public class DefaultRateLimitExceptionHandler {

    @ExceptionHandler(RateLimitException.class)
    public ResponseEntity<ErrorResponse> handleRateLimitException(RateLimitException e) {
        // 不打印堆栈，存储故障的细节在 QuotaLimiter 里已经记录过
        log.warn("限流判定失败，返回 503：key={}, type={}, message={}",
                e.getLimitKey(), e.getClass().getSimpleName(), e.getMessage());

        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorResponse.of(e));
    }

    /**
     * 503 响应体
     */
    @Getter
    @AllArgsConstructor
    public static class ErrorResponse {
        private final int status;

        /**
         * QUOTA_STORE_UNAVAILABLE：存储调用失败；QUOTA_STORE_EMPTY_RESULT：存储没有返回结果
         */
        private final String error;
        private final String message;
        private final String limitKey;
        private final long occurredAt;

        static ErrorResponse of(RateLimitException e) {
            String error = e instanceof IntervalServerException
                    ? "QUOTA_STORE_EMPTY_RESULT"
                    : "QUOTA_STORE_UNAVAILABLE";
            long occurredAt = e.getOccurredAt() != null ? e.getOccurredAt().toEpochMilli() : System.currentTimeMillis();
            return new ErrorResponse(HttpStatus.SERVICE_UNAVAILABLE.value(), error, e.getMessage(),
                    e.getLimitKey(), occurredAt);
        }
    }
}
