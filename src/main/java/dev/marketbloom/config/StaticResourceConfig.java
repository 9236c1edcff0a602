package dev.marketbloom.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.web.reactive.function.server.RequestPredicate;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.reactive.function.server.support.RouterFunctionMapping;
import reactor.core.publisher.Mono;

/**
 * Serves the bundled front-end. {@code /admin} returns the admin page; any other request,
 * whatever its method, returns the matching asset or the entry document so that
 * client-side routes survive a reload.
 * <p>
 * The router is registered in its own mapping at the lowest order rather than as a
 * {@link RouterFunction} bean, so every annotated controller and actuator endpoint is
 * matched before it. Boot's default {@code /**} resource mapping is switched off
 * ({@code spring.web.resources.add-mappings=false}) for the same reason.
 */
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
public class StaticResourceConfig {

    private final FrontendResources frontendResources;

    @Bean
    public RouterFunctionMapping frontendFallbackMapping(ServerCodecConfigurer serverCodecConfigurer) {
        RouterFunctionMapping mapping = new RouterFunctionMapping(frontendRouter());
        mapping.setMessageReaders(serverCodecConfigurer.getReaders());
        mapping.setOrder(Ordered.LOWEST_PRECEDENCE);
        return mapping;
    }

    RouterFunction<ServerResponse> frontendRouter() {
        return RouterFunctions.route()
                .route(readRequest().and(RequestPredicates.path("/admin")),
                        request -> serve(frontendResources.adminPage()))
                .route(RequestPredicates.all(),
                        request -> serve(frontendResources.resolve(request.path())))
                .build();
    }

    private static RequestPredicate readRequest() {
        return request -> HttpMethod.GET.equals(request.method()) || HttpMethod.HEAD.equals(request.method());
    }

    private static Mono<ServerResponse> serve(Resource resource) {
        if (!resource.exists()) {
            return ServerResponse.notFound().build();
        }
        MediaType mediaType = FrontendResources.mediaTypeOf(resource);
        return ServerResponse.ok()
                .contentType(mediaType)
                .cacheControl(FrontendResources.cacheControlFor(mediaType))
                .bodyValue(resource);
    }
}
