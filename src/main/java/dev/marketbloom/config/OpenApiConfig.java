package dev.marketbloom.config;

import dev.marketbloom.security.SharedSecretAuthenticationFilter;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration(proxyBeanMethods = false)
public class OpenApiConfig {

    public static final String API_KEY_SCHEME = "apiKey";
    public static final String ADMIN_BEARER_SCHEME = "adminBearer";

    @Value("${app.version:1.0.0}")
    private String appVersion;

    @Value("${server.port:5000}")
    private String serverPort;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("MarketBloom Lead Capture API")
                        .description("""
                                Contact form intake and lead management.

                                ## Authentication
                                Contact submission and admin login require the shared API key, either as the
                                `x-api-key` header or the `apiKey` query parameter.

                                Submission listing and deletion require the admin token returned by
                                `/api/admin/login`:
                                `Authorization: Bearer <token>`
                                """)
                        .version(appVersion))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Development Server")))
                .components(new Components()
                        .addSecuritySchemes(API_KEY_SCHEME,
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.APIKEY)
                                        .in(SecurityScheme.In.HEADER)
                                        .name(SharedSecretAuthenticationFilter.API_KEY_HEADER)
                                        .description("Shared API key for public write endpoints"))
                        .addSecuritySchemes(ADMIN_BEARER_SCHEME,
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .description("Admin token. Obtain via /api/admin/login")));
    }
}
