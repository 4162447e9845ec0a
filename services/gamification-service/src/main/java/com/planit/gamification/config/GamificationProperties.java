package com.planit.gamification.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Gamification service settings, bound from {@code gamification.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "gamification")
public class GamificationProperties {

    /**
     * Zone the monthly leaderboard period key is computed in. Every client must use the
     * same value.
     */
    @NotBlank
    private String periodZone = "UTC";

    /**
     * Length of the rolling window behind weekly XP.
     */
    @NotNull
    private Duration weeklyWindow = Duration.ofDays(7);

    /**
     * Number of events returned by the recent-activity feed.
     */
    @Min(1)
    private int recentEventsLimit = 10;

    @Valid
    private Store store = new Store();

    @Valid
    private Award award = new Award();

    @Valid
    private Leaderboard leaderboard = new Leaderboard();

    @Valid
    private Reconciliation reconciliation = new Reconciliation();

    @Valid
    private Session session = new Session();

    @Valid
    private Topics topics = new Topics();

    @Data
    public static class Store {
        /**
         * {@code memory} or {@code mongo}.
         */
        @NotBlank
        private String type = "memory";
    }

    @Data
    public static class Award {
        /**
         * Attempts per award covering conflicts and transient store failures.
         */
        @Min(1)
        private int maxAttempts = 5;

        @NotNull
        private Duration initialBackoff = Duration.ofMillis(100);

        private double backoffMultiplier = 2.0;

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(2);
    }

    @Data
    public static class Leaderboard {
        /**
         * Upper bound of ids per membership query.
         */
        @Min(1)
        private int batchSize = 10;

        @Min(1)
        private int defaultLimit = 50;
    }

    @Data
    public static class Reconciliation {
        @NotNull
        private Duration interval = Duration.ofSeconds(30);

        @NotNull
        private Duration initialBackoff = Duration.ofSeconds(30);

        @NotNull
        private Duration maxBackoff = Duration.ofMinutes(30);

        /**
         * Failed attempts after which a pending repair is logged at error level. The repair
         * itself stays queued.
         */
        @Min(1)
        private int alertAfterAttempts = 5;
    }

    @Data
    public static class Session {
        /**
         * Sessions without activity for this long are closed by the eviction pass.
         */
        @NotNull
        private Duration idleTimeout = Duration.ofMinutes(15);

        @NotNull
        private Duration evictionInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class Topics {
        private String xpGained = "gamification.xp-gained";
        private String levelUp = "gamification.level-up";
        private String milestone = "gamification.milestone";
        private String awardFailed = "gamification.award-failed";
    }
}
