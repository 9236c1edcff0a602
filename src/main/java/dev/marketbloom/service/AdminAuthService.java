package dev.marketbloom.service;

import dev.marketbloom.config.LeadCaptureProperties;
import dev.marketbloom.dto.LoginRequest;
import dev.marketbloom.dto.TokenResponse;
import dev.marketbloom.exception.InvalidCredentialsException;
import dev.marketbloom.util.DigestUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Single-account admin login. The token handed back is the admin secret itself, so there
 * is nothing to store, expire or revoke; rotating the secret logs every client out.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminAuthService {

    private final LeadCaptureProperties properties;

    public Mono<TokenResponse> login(LoginRequest request) {
        String adminSecret = properties.security().adminPassword();
        if (!DigestUtils.constantTimeEquals(request.getPassword(), adminSecret)) {
            log.warn("Admin login failed: invalid password");
            return Mono.error(new InvalidCredentialsException("Invalid password"));
        }
        log.info("Admin login successful");
        return Mono.just(TokenResponse.builder().token(adminSecret).build());
    }
}
