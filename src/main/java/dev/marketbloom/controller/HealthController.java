package dev.marketbloom.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Liveness probe for load balancers. Touches neither the store nor the mailer;
 * dependency health is under {@code /actuator/health}.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    static final Map<String, String> RUNNING = Map.of("status", "Server is running!");

    @GetMapping
    public Mono<Map<String, String>> health() {
        return Mono.just(RUNNING);
    }
}
