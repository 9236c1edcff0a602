package dev.marketbloom.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Application settings, bound once at startup from {@code app.*} and passed to the
 * gates and services that need them. Nothing reads the environment at request time.
 */
@ConfigurationProperties(prefix = "app")
@Validated
public record LeadCaptureProperties(
        @Valid @NotNull Security security,
        @Valid @DefaultValue Notification notification,
        @Valid @DefaultValue Frontend frontend,
        @Valid @DefaultValue Cors cors
) {

    /**
     * Shared secrets. The admin password doubles as the bearer token handed out by login.
     */
    public record Security(
            @NotBlank(message = "app.security.api-key must be configured") String apiKey,
            @NotBlank(message = "app.security.admin-password must be configured") String adminPassword
    ) {
        @Override
        public String toString() {
            return "Security[apiKey=****, adminPassword=****]";
        }
    }

    /**
     * Lead notification email. An empty recipient falls back to the SMTP username.
     */
    public record Notification(
            String recipient,
            @DefaultValue("MarketBloom Studio") String brandName,
            @DefaultValue("Asia/Kolkata") String timeZone,
            @DefaultValue("en-IN") String locale
    ) {}

    /**
     * Bundled front-end. Requests no API route claims get an asset under {@code location},
     * or {@code indexDocument}.
     */
    public record Frontend(
            @DefaultValue("classpath:/static/") String location,
            @DefaultValue("index.html") String indexDocument,
            @DefaultValue("classpath:/admin/admin.html") String adminPage
    ) {}

    public record Cors(
            @DefaultValue("*") List<String> allowedOrigins
    ) {}
}
