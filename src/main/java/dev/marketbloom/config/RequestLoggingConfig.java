package dev.marketbloom.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.server.WebFilter;

import java.time.Duration;
import java.time.Instant;

/**
 * One log line per request. Runs ahead of the security chain so gate rejections
 * are logged too.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class RequestLoggingConfig {

    @Bean
    @Order(Ordered.HIGHEST_PRECEDENCE + 1)
    public WebFilter requestLoggingFilter() {
        return (exchange, chain) -> {
            Instant start = Instant.now();
            String method = exchange.getRequest().getMethod().name();
            String path = exchange.getRequest().getPath().value();
            String clientIp = getClientIp(exchange.getRequest());
            String rawRequestId = exchange.getRequest().getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER);
            final String requestId = rawRequestId != null ? rawRequestId : "-";

            return chain.filter(exchange)
                    .doOnSuccess(aVoid -> {
                        Duration duration = Duration.between(start, Instant.now());
                        HttpStatusCode status = exchange.getResponse().getStatusCode();
                        logRequest(requestId, method, path, clientIp, status != null ? status.value() : 200, duration);
                    })
                    .doOnError(error -> {
                        Duration duration = Duration.between(start, Instant.now());
                        log.error("[{}] {} {} from {} - ERROR {} in {}ms",
                                requestId, method, path, clientIp, error.getMessage(), duration.toMillis());
                    });
        };
    }

    private void logRequest(String requestId, String method, String path, String clientIp, int status, Duration duration) {
        if (path.startsWith("/actuator") || path.startsWith("/v3/api-docs") || path.equals("/api/health")) {
            log.trace("[{}] {} {} from {} - {} in {}ms", requestId, method, path, clientIp, status, duration.toMillis());
        } else if (status >= 400) {
            log.warn("[{}] {} {} from {} - {} in {}ms", requestId, method, path, clientIp, status, duration.toMillis());
        } else {
            log.info("[{}] {} {} from {} - {} in {}ms", requestId, method, path, clientIp, status, duration.toMillis());
        }
    }

    private String getClientIp(ServerHttpRequest request) {
        String forwardedFor = request.getHeaders().getFirst("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isEmpty()) {
            return sanitizeHeaderValue(forwardedFor.split(",")[0].trim());
        }
        if (request.getRemoteAddress() != null && request.getRemoteAddress().getAddress() != null) {
            return request.getRemoteAddress().getAddress().getHostAddress();
        }
        return "unknown";
    }

    /** Strip newlines and non-printable chars to prevent log injection */
    private String sanitizeHeaderValue(String value) {
        return value.replaceAll("[\\r\\n]", "").replaceAll("[^\\x20-\\x7E]", "");
    }
}
