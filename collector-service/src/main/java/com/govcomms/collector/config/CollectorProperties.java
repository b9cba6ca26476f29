package com.govcomms.collector.config;

import com.govcomms.collector.service.fetch.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Collector pipeline settings bound from {@code collector.*}.
 */
@Data
@ConfigurationProperties(prefix = "collector")
public class CollectorProperties {

    private Fetch fetch = new Fetch();
    private Blog blog = new Blog();
    private Video video = new Video();
    private Render render = new Render();
    private Assets assets = new Assets();
    private Executor executor = new Executor();
    private Scheduling scheduling = new Scheduling();
    private Cycles cycles = new Cycles();

    public RetryPolicy toRetryPolicy() {
        return new RetryPolicy(
                fetch.getMaxAttempts(),
                fetch.getBackoff(),
                fetch.getJitter(),
                fetch.getSleep());
    }

    @Data
    public static class Fetch {
        private String userAgent = "GovComms-Collector/1.0";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        /** Attempts per page request, the first one included. */
        private int maxAttempts = 3;
        private Duration backoff = Duration.ofSeconds(5);
        private Duration jitter = Duration.ZERO;
        /** Delay between successive page requests of one source. */
        private Duration sleep = Duration.ofMillis(500);
        /** 0 = unlimited */
        private int maxItems = 0;
    }

    @Data
    public static class Blog {
        private boolean enabled = true;
    }

    @Data
    public static class Video {
        private boolean enabled = true;
        private String apiKey;
        private String apiBaseUrl = "https://www.googleapis.com/youtube/v3";
        private boolean uploadsOnly = false;
        private int pageSize = 50;
    }

    @Data
    public static class Render {
        private int rollingDays = 90;
        private int maxWords = 200;
        private boolean chartsEnabled = true;
        private boolean catchUpMissing = false;
        private List<String> extraStopwords = new ArrayList<>();
    }

    @Data
    public static class Assets {
        private String baseDir = "./assets";
    }

    @Data
    public static class Executor {
        private int corePoolSize = 4;
        private int maxPoolSize = 4;
        private int queueCapacity = 100;
    }

    @Data
    public static class Scheduling {
        private boolean enabled = true;
        private String cron = "0 0 * * * *";
        private boolean renderGlobal = true;
    }

    @Data
    public static class Cycles {
        private int retentionDays = 30;
    }
}
