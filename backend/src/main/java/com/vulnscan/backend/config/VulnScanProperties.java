package com.vulnscan.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "vulnscan")
@Validated
@Data
public class VulnScanProperties {

    private Scheduler scheduler = new Scheduler();
    private Dispatcher dispatcher = new Dispatcher();
    private Engine engine = new Engine();
    private Webhooks webhooks = new Webhooks();
    private Notifications notifications = new Notifications();
    private Sweeper sweeper = new Sweeper();
    private Websocket websocket = new Websocket();

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private long tickIntervalMs = 60_000;
    }

    @Data
    public static class Dispatcher {
        @Min(1)
        @Max(64)
        private int concurrency = 5;
        private boolean pollingEnabled = true;
        private long pollIntervalMs = 1_000;
        @Min(1)
        private int maxAttempts = 3;
        private long retryBaseDelaySeconds = 30;
        private long retryMaxDelaySeconds = 900;
    }

    @Data
    public static class Engine {
        private String taskChannel = "scanner:tasks";
        private String resultChannel = "scanner:results";
    }

    @Data
    public static class Webhooks {
        private long timeoutMs = 10_000;
        private String userAgent = "VulnScan-Webhook/1.0";
        private int maxPerOrganization = 20;
    }

    @Data
    public static class Notifications {
        private boolean realtimeEnabled = true;
        private Email email = new Email();
    }

    @Data
    public static class Email {
        private boolean enabled = false;
        private String from = "VulnScan <noreply@vulnscan.io>";
        private String appBaseUrl = "http://localhost:3000";
    }

    @Data
    public static class Sweeper {
        private boolean enabled = true;
        private long intervalMs = 300_000;
        private long queuedTimeoutMinutes = 30;
        private long runningTimeoutMinutes = 180;
    }

    @Data
    public static class Websocket {
        private List<String> allowedOrigins = new ArrayList<>();
    }
}
