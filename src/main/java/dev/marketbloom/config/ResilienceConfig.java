package dev.marketbloom.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralised timeouts for calls that leave the process.
 * Failures are never retried here; the client owns retries.
 *
 * <pre>
 * return submissionRepository.findAllByOrderByTimestampDescIdDesc()
 *         .timeout(resilience.getDatabaseTimeout());
 * </pre>
 */
@Component
@Getter
@Slf4j
public class ResilienceConfig {

    private final Duration databaseTimeout;
    private final Duration externalTimeout;

    public ResilienceConfig(
            @Value("${resilience.database.timeout-seconds:10}") int databaseTimeoutSeconds,
            @Value("${resilience.external.timeout-seconds:30}") int externalTimeoutSeconds
    ) {
        this.databaseTimeout = Duration.ofSeconds(databaseTimeoutSeconds);
        this.externalTimeout = Duration.ofSeconds(externalTimeoutSeconds);
        log.info("Resilience configuration initialized (database timeout {}s, external timeout {}s)",
                databaseTimeoutSeconds, externalTimeoutSeconds);
    }
}
