package com.musictracker.sync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "library-sync")
@Data
public class LibrarySyncProperties {

    private Discogs discogs = new Discogs();
    private LastFm lastfm = new LastFm();
    private Resilience resilience = new Resilience();
    private Sync sync = new Sync();
    private Scheduling scheduling = new Scheduling();
    private Output output = new Output();

    @Data
    public static class Discogs {
        private String baseUrl = "https://api.discogs.com";
        private String token;
        private String username;
        private String userAgent = "MusicTrackerApp/4.0";
        private int pageSize = 100;
        private Duration rateLimitDelay = Duration.ofMillis(500);
    }

    @Data
    public static class LastFm {
        private String baseUrl = "https://ws.audioscrobbler.com/2.0/";
        private String apiKey;
        private String username;
        /** Provider maximum is 200 */
        private int pageSize = 200;
        private Duration rateLimitDelay = Duration.ofSeconds(1);
    }

    @Data
    public static class Resilience {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(15);
        private Breaker breaker = new Breaker();
        private Retry retry = new Retry();

        /** Per-dependency overrides, keyed by dependency name (discogs, lastfm). */
        private Map<String, Breaker> breakers = new HashMap<>();

        public Breaker breakerFor(String dependency) {
            return breakers.getOrDefault(dependency, breaker);
        }

        @Data
        public static class Breaker {
            private int failureThreshold = 5;
            private int successThreshold = 2;
            private Duration recoveryTimeout = Duration.ofMinutes(5);
        }

        @Data
        public static class Retry {
            private int maxAttempts = 3;
            private Duration initialDelay = Duration.ofSeconds(2);
            private Duration maxDelay = Duration.ofSeconds(10);
            private double backoffMultiplier = 2.0;
        }
    }

    @Data
    public static class Sync {
        private int catalogCheckpointSize = 5;
        private int historyCheckpointSize = 50;
        private Duration dedupWindow = Duration.ofSeconds(600);
    }

    @Data
    public static class Scheduling {
        private boolean enabled = true;
        private String catalogCron = "0 0 4 * * ?";
        private String historyCron = "0 0 5 * * ?";
        private boolean runOnStartup = false;
    }

    @Data
    public static class Output {
        private RunReportMode mode = RunReportMode.DATABASE;
        private String reportDir = "/data/sync-reports";

        public enum RunReportMode {
            DATABASE, CSV, BOTH
        }
    }
}
