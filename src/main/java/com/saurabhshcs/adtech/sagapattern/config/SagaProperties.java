package com.saurabhshcs.adtech.sagapattern.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the saga demo, bound from the {@code saga} prefix in
 * {@code application.yml}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "saga")
public class SagaProperties {

    @Valid
    private Session session = new Session();

    @Valid
    private Shipping shipping = new Shipping();

    @Valid
    private Simulation simulation = new Simulation();

    @Valid
    private Executor executor = new Executor();

    public enum StoreType {
        MEMORY, REDIS
    }

    @Data
    public static class Session {

        /**
         * Backing storage for sessions.
         */
        @NotNull
        private StoreType store = StoreType.MEMORY;

        /**
         * Inactivity period after which a session and all its data are discarded.
         */
        @NotNull
        private Duration timeout = Duration.ofHours(1);

        /**
         * Cookie carrying the session identifier.
         */
        @NotBlank
        private String cookieName = "session_id";

        /**
         * How often idle in-memory sessions are swept.
         */
        @NotNull
        private Duration reapInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class Shipping {

        /**
         * Orders from this user always fail at shipment. Blank disables the rule.
         */
        private String faultUserId = "user_3";
    }

    @Data
    public static class Simulation {

        /**
         * Simulated processing time of each step action.
         */
        @NotNull
        private Duration stepLatency = Duration.ZERO;
    }

    @Data
    public static class Executor {

        @Min(1)
        private int corePoolSize = 4;

        @Min(1)
        private int maxPoolSize = 16;

        private String threadNamePrefix = "saga-";
    }
}
