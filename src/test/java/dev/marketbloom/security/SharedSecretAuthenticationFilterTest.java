package dev.marketbloom.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.marketbloom.metrics.LeadMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SharedSecretAuthenticationFilter")
class SharedSecretAuthenticationFilterTest {

    private static final String API_KEY = "k-123";
    private static final String ADMIN_SECRET = "s3cret";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SimpleMeterRegistry meterRegistry;
    private LeadMetrics metrics;
    private AtomicBoolean chainCalled;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new LeadMetrics(meterRegistry);
        metrics.init();
        chainCalled = new AtomicBoolean(false);
    }

    private WebFilterChain recordingChain() {
        return exchange -> {
            chainCalled.set(true);
            return Mono.empty();
        };
    }

    /**
     * Captures the SecurityContext propagated through the Reactor context.
     */
    private WebFilterChain capturingChain(SecurityContext[] holder) {
        return exchange -> {
            chainCalled.set(true);
            return ReactiveSecurityContextHolder.getContext()
                    .doOnNext(ctx -> holder[0] = ctx)
                    .then();
        };
    }

    private double rejected(String gate, String reason) {
        return meterRegistry.counter("leads.auth.rejected", "gate", gate, "reason", reason).count();
    }

    @Nested
    @DisplayName("API key gate")
    class ApiKeyGate {

        private SharedSecretAuthenticationFilter filter;

        @BeforeEach
        void setUp() {
            filter = SharedSecretAuthenticationFilter.apiKeyGate(API_KEY, objectMapper, metrics);
        }

        @Test
        @DisplayName("should reject with 401 when no key is presented")
        void shouldReject401_WhenKeyMissing() {
            MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/contact"));

            StepVerifier.create(filter.filter(exchange, recordingChain())).verifyComplete();

            assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
            assertThat(exchange.getResponse().getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
            assertThat(exchange.getResponse().getBodyAsString().block())
                    .isEqualTo("{\"success\":false,\"message\":\"API key required\"}");
            assertThat(chainCalled).isFalse();
            assertThat(rejected(LeadMetrics.GATE_API_KEY, LeadMetrics.REASON_MISSING)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should treat an empty header and query value as missing")
        void shouldReject401_WhenKeyEmpty() {
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.post("/api/contact?apiKey=").header("x-api-key", ""));

            StepVerifier.create(filter.filter(exchange, recordingChain())).verifyComplete();

            assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
            assertThat(chainCalled).isFalse();
        }

        @Test
        @DisplayName("should reject with 403 when the header key is wrong")
        void shouldReject403_WhenKeyWrong() {
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.post("/api/admin/login").header("x-api-key", "nope"));

            StepVerifier.create(filter.filter(exchange, recordingChain())).verifyComplete();

            assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
            assertThat(exchange.getResponse().getBodyAsString().block())
                    .isEqualTo("{\"success\":false,\"message\":\"Invalid API key\"}");
            assertThat(chainCalled).isFalse();
            assertThat(rejected(LeadMetrics.GATE_API_KEY, LeadMetrics.REASON_INVALID)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should pass when the header key matches")
        void shouldPass_WhenHeaderKeyMatches() {
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.post("/api/contact").header("x-api-key", API_KEY));

            StepVerifier.create(filter.filter(exchange, recordingChain())).verifyComplete();

            assertThat(chainCalled).isTrue();
            assertThat(exchange.getResponse().getStatusCode()).isNull();
        }

        @Test
        @DisplayName("should accept the key from the query parameter")
        void shouldPass_WhenQueryKeyMatches() {
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.post("/api/contact?apiKey=" + API_KEY));

            StepVerifier.create(filter.filter(exchange, recordingChain())).verifyComplete();

            assertThat(chainCalled).isTrue();
        }

        @Test
        @DisplayName("should prefer the header over the query parameter")
        void shouldPreferHeader_OverQuery() {
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.post("/api/contact?apiKey=" + API_KEY).header("x-api-key", "wrong"));

            StepVerifier.create(filter.filter(exchange, recordingChain())).verifyComplete();

            assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
            assertThat(chainCalled).isFalse();
        }

        @Test
        @DisplayName("should ignore routes it does not guard")
        void shouldIgnoreUnguardedRoutes() {
            MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/health"));

            StepVerifier.create(filter.filter(exchange, recordingChain())).verifyComplete();

            assertThat(chainCalled).isTrue();
            assertThat(rejected(LeadMetrics.GATE_API_KEY, LeadMetrics.REASON_MISSING)).isZero();
        }
    }

    @Nested
    @DisplayName("Admin bearer gate")
    class AdminBearerGate {

        private SharedSecretAuthenticationFilter filter;

        @BeforeEach
        void setUp() {
            filter = SharedSecretAuthenticationFilter.adminBearerGate(ADMIN_SECRET, objectMapper, metrics);
        }

        @Test
        @DisplayName("should reject with 401 when the Authorization header is absent")
        void shouldReject401_WhenHeaderMissing() {
            MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/submissions"));

            StepVerifier.create(filter.filter(exchange, recordingChain())).verifyComplete();

            assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
            assertThat(exchange.getResponse().getBodyAsString().block())
                    .isEqualTo("{\"success\":false,\"message\":\"Admin authentication required\"}");
            assertThat(chainCalled).isFalse();
            assertThat(rejected(LeadMetrics.GATE_ADMIN, LeadMetrics.REASON_MISSING)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should reject with 401 when the scheme is not Bearer")
        void shouldReject401_WhenSchemeNotBearer() {
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.delete("/api/submissions/5").header(HttpHeaders.AUTHORIZATION, "Basic " + ADMIN_SECRET));

            StepVerifier.create(filter.filter(exchange, recordingChain())).verifyComplete();

            assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
            assertThat(chainCalled).isFalse();
        }

        @Test
        @DisplayName("should reject with 403 when the token is wrong")
        void shouldReject403_WhenTokenWrong() {
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.get("/api/submissions").header(HttpHeaders.AUTHORIZATION, "Bearer nope"));

            StepVerifier.create(filter.filter(exchange, recordingChain())).verifyComplete();

            assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
            assertThat(exchange.getResponse().getBodyAsString().block())
                    .isEqualTo("{\"success\":false,\"message\":\"Invalid admin credentials\"}");
            assertThat(rejected(LeadMetrics.GATE_ADMIN, LeadMetrics.REASON_INVALID)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should reject an empty bearer token with 403")
        void shouldReject403_WhenTokenEmpty() {
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.get("/api/submissions").header(HttpHeaders.AUTHORIZATION, "Bearer "));

            StepVerifier.create(filter.filter(exchange, recordingChain())).verifyComplete();

            assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        }

        @Test
        @DisplayName("should authenticate the admin principal when the token matches")
        void shouldAuthenticateAdmin_WhenTokenMatches() {
            SecurityContext[] holder = new SecurityContext[1];
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.delete("/api/submissions/7").header(HttpHeaders.AUTHORIZATION, "Bearer " + ADMIN_SECRET));

            StepVerifier.create(filter.filter(exchange, capturingChain(holder))).verifyComplete();

            assertThat(chainCalled).isTrue();
            assertThat(holder[0]).isNotNull();
            assertThat(holder[0].getAuthentication().getName()).isEqualTo(SharedSecretAuthenticationFilter.ADMIN_PRINCIPAL);
            assertThat(holder[0].getAuthentication().getAuthorities())
                    .extracting(GrantedAuthority::getAuthority)
                    .containsExactly("ROLE_ADMIN");
        }

        @Test
        @DisplayName("should not guard the contact route")
        void shouldIgnoreContactRoute() {
            MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/contact"));

            StepVerifier.create(filter.filter(exchange, recordingChain())).verifyComplete();

            assertThat(chainCalled).isTrue();
        }
    }

    @Nested
    @DisplayName("credential extraction")
    class Extraction {

        @Test
        @DisplayName("bearer extraction should return null without the Bearer prefix")
        void bearerWithoutPrefix() {
            assertThat(SharedSecretAuthenticationFilter.extractBearerToken(
                    MockServerHttpRequest.get("/").header(HttpHeaders.AUTHORIZATION, "Token abc").build())).isNull();
            assertThat(SharedSecretAuthenticationFilter.extractBearerToken(
                    MockServerHttpRequest.get("/").header(HttpHeaders.AUTHORIZATION, "Bearer abc").build())).isEqualTo("abc");
        }

        @Test
        @DisplayName("api key extraction should fall back to the query parameter")
        void apiKeyFallsBackToQuery() {
            assertThat(SharedSecretAuthenticationFilter.extractApiKey(
                    MockServerHttpRequest.get("/?apiKey=q").build())).isEqualTo("q");
            assertThat(SharedSecretAuthenticationFilter.extractApiKey(
                    MockServerHttpRequest.get("/").build())).isNull();
        }
    }
}
