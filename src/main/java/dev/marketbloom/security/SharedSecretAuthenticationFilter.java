package dev.marketbloom.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.marketbloom.exception.ErrorResponse;
import dev.marketbloom.metrics.LeadMetrics;
import dev.marketbloom.util.DigestUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.Nullable;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.web.server.util.matcher.ServerWebExchangeMatcher;
import org.springframework.security.web.server.util.matcher.ServerWebExchangeMatchers;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Rejects requests on the matched routes unless they carry a credential equal to a
 * configured shared secret. A missing credential yields 401, a wrong one 403, both
 * with the {@link ErrorResponse} envelope.
 *
 * <p>Instances are created through {@link #apiKeyGate} and {@link #adminBearerGate} and
 * added to the security chain directly. They are not Spring beans, otherwise WebFlux
 * would also register them as plain web filters.</p>
 */
@Slf4j
public class SharedSecretAuthenticationFilter implements WebFilter {

    public static final String API_KEY_HEADER = "x-api-key";
    public static final String API_KEY_QUERY_PARAM = "apiKey";
    public static final String ADMIN_PRINCIPAL = "admin";

    private static final String BEARER_PREFIX = "Bearer ";

    /**
     * Pulls the presented credential out of a request.
     */
    @FunctionalInterface
    public interface CredentialExtractor {

        /**
         * @return the presented credential, or {@code null} when none was presented
         */
        @Nullable
        String extract(ServerHttpRequest request);
    }

    private final String gate;
    private final ServerWebExchangeMatcher matcher;
    private final CredentialExtractor extractor;
    private final String expectedSecret;
    private final String missingMessage;
    private final String invalidMessage;
    @Nullable
    private final String grantedRole;
    private final ObjectMapper objectMapper;
    private final LeadMetrics metrics;

    SharedSecretAuthenticationFilter(String gate,
                                     ServerWebExchangeMatcher matcher,
                                     CredentialExtractor extractor,
                                     String expectedSecret,
                                     String missingMessage,
                                     String invalidMessage,
                                     @Nullable String grantedRole,
                                     ObjectMapper objectMapper,
                                     LeadMetrics metrics) {
        this.gate = gate;
        this.matcher = matcher;
        this.extractor = extractor;
        this.expectedSecret = expectedSecret;
        this.missingMessage = missingMessage;
        this.invalidMessage = invalidMessage;
        this.grantedRole = grantedRole;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * Gate for the public write endpoints: contact submission and admin login.
     */
    public static SharedSecretAuthenticationFilter apiKeyGate(String apiKey, ObjectMapper objectMapper, LeadMetrics metrics) {
        return new SharedSecretAuthenticationFilter(
                LeadMetrics.GATE_API_KEY,
                ServerWebExchangeMatchers.pathMatchers(HttpMethod.POST, "/api/contact", "/api/admin/login"),
                SharedSecretAuthenticationFilter::extractApiKey,
                apiKey,
                "API key required",
                "Invalid API key",
                null,
                objectMapper,
                metrics);
    }

    /**
     * Gate for submission management. A passing request is authenticated as
     * {@value #ADMIN_PRINCIPAL} with {@code ROLE_ADMIN}.
     */
    public static SharedSecretAuthenticationFilter adminBearerGate(String adminSecret, ObjectMapper objectMapper, LeadMetrics metrics) {
        return new SharedSecretAuthenticationFilter(
                LeadMetrics.GATE_ADMIN,
                ServerWebExchangeMatchers.pathMatchers("/api/submissions", "/api/submissions/*"),
                SharedSecretAuthenticationFilter::extractBearerToken,
                adminSecret,
                "Admin authentication required",
                "Invalid admin credentials",
                "ROLE_ADMIN",
                objectMapper,
                metrics);
    }

    /** Header first, then query parameter. Empty values count as absent. */
    static String extractApiKey(ServerHttpRequest request) {
        String header = request.getHeaders().getFirst(API_KEY_HEADER);
        if (StringUtils.hasLength(header)) {
            return header;
        }
        String query = request.getQueryParams().getFirst(API_KEY_QUERY_PARAM);
        return StringUtils.hasLength(query) ? query : null;
    }

    /** A bearer header with an empty token is presented, just wrong. */
    static String extractBearerToken(ServerHttpRequest request) {
        String authorization = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length());
        }
        return null;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        return matcher.matches(exchange)
                .flatMap(result -> result.isMatch()
                        ? authenticate(exchange, chain)
                        : chain.filter(exchange));
    }

    private Mono<Void> authenticate(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        String credential = extractor.extract(exchange.getRequest());

        if (credential == null) {
            log.warn("Access denied by {} gate: no credential for {}", gate, path);
            metrics.recordAuthRejected(gate, LeadMetrics.REASON_MISSING);
            return reject(exchange, HttpStatus.UNAUTHORIZED, missingMessage);
        }
        if (!DigestUtils.constantTimeEquals(credential, expectedSecret)) {
            log.warn("Access denied by {} gate: invalid credential for {}", gate, path);
            metrics.recordAuthRejected(gate, LeadMetrics.REASON_INVALID);
            return reject(exchange, HttpStatus.FORBIDDEN, invalidMessage);
        }

        log.debug("{} gate passed for {}", gate, path);
        if (grantedRole == null) {
            return chain.filter(exchange);
        }
        var auth = new UsernamePasswordAuthenticationToken(
                ADMIN_PRINCIPAL, null, List.of(new SimpleGrantedAuthority(grantedRole)));
        return chain.filter(exchange)
                .contextWrite(ReactiveSecurityContextHolder.withAuthentication(auth));
    }

    private Mono<Void> reject(ServerWebExchange exchange, HttpStatus status, String message) {
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(ErrorResponse.of(message));
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
        exchange.getResponse().setStatusCode(status);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        DataBuffer buffer = exchange.getResponse().bufferFactory().wrap(body);
        return exchange.getResponse().writeWith(Mono.just(buffer));
    }
}
