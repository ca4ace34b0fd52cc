package com.nomadtap.tap.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "tap-nomad")
@Data
public class TapNomadProperties {

    private String version = "dev";
    private Api api = new Api();
    private Retry retry = new Retry();
    private Sync sync = new Sync();
    private Output output = new Output();

    @Data
    public static class Api {
        private String baseUrl = "http://127.0.0.1:4646";
        private String token;
        private String namespace = "*";
        private String region;
        private int pageSize = 100;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private Duration requestDelay = Duration.ZERO;
        /** Send a ModifyIndex filter expression; needs a Nomad version whose filter syntax supports it. */
        private boolean serverSideFilter = false;
    }

    @Data
    public static class Retry {
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(60);
    }

    @Data
    public static class Sync {
        /** Inclusive ModifyIndex floor for incremental streams that have no bookmark yet. */
        private long startIndex = 0;
        private boolean failOnStreamError = false;
        private Duration shutdownGracePeriod = Duration.ofSeconds(30);
    }

    @Data
    public static class Output {
        /** Messages go to stdout when unset. */
        private String path;
    }
}
