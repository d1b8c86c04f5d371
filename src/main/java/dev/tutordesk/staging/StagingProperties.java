package dev.tutordesk.staging;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the staging cache, bound from {@code tutordesk.staging.*}.
 *
 * <p>{@code ttl-seconds} is reported to callers as {@code expires_in_seconds}. The cache itself
 * does not expire entries.
 */
@Configuration
@ConfigurationProperties(prefix = "tutordesk.staging")
public class StagingProperties {

    private int ttlSeconds = 300;

    @PostConstruct
    void validate() {
        if (ttlSeconds < 1) {
            throw new IllegalStateException(
                    "tutordesk.staging.ttl-seconds must be positive, got: " + ttlSeconds);
        }
    }

    public int getTtlSeconds() {
        return ttlSeconds;
    }

    public void setTtlSeconds(int ttlSeconds) {
        this.ttlSeconds = ttlSeconds;
    }
}
