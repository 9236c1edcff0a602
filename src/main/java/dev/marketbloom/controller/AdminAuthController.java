package dev.marketbloom.controller;

import dev.marketbloom.config.OpenApiConfig;
import dev.marketbloom.dto.LoginRequest;
import dev.marketbloom.dto.TokenResponse;
import dev.marketbloom.service.AdminAuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/admin")
@Tag(name = "Admin - Auth", description = "Admin login")
@SecurityRequirement(name = OpenApiConfig.API_KEY_SCHEME)
@RequiredArgsConstructor
public class AdminAuthController {

    private final AdminAuthService adminAuthService;

    @PostMapping("/login")
    @Operation(summary = "Admin login", description = "Exchanges the admin password for the bearer token used by the submission endpoints")
    public Mono<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        return adminAuthService.login(request);
    }
}
