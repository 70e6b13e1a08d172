package com.eyelevel.mediadownloader.config;

import com.eyelevel.mediadownloader.model.RemuxRetryMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Binds application properties under the "app.download" prefix to a strongly-typed
 * configuration object. This is the whole configuration surface the host has to supply.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.download")
public class DownloadProperties {

    @NotBlank
    private String outputDirectory = "downloads";
    @Min(1)
    private int concurrency = 5;
    @Min(1)
    private int queueCapacity = 50;
    private boolean skipExisting = true;
    private boolean overwrite = false;
    @NotBlank
    private String userAgent = "media-downloader/1.0";
    /**
     * Aggregate transfer limit, e.g. {@code 2M} or {@code unbounded}.
     */
    @NotBlank
    private String rateLimit = "unbounded";
    /**
     * How long a cancelled run waits for its workers to unwind.
     */
    @NotNull
    private Duration shutdownGrace = Duration.ofSeconds(10);

    // Single-item entry; when url is set the application downloads it and exits.
    private String url;
    private String referer;

    @Valid
    private Retry retry = new Retry();
    @Valid
    private Cadence cadence = new Cadence();
    @Valid
    private Remux remux = new Remux();
    @Valid
    private Http http = new Http();

    @Data
    public static class Retry {
        @Min(0)
        private int budget = 3;
        @Min(0)
        private long initialDelayMs = 1000;
        @DecimalMin("1.0")
        private double multiplier = 2.0;
        @Min(0)
        private long maxDelayMs = 30_000;
    }

    @Data
    public static class Cadence {
        /**
         * Requests allowed between pauses; 0 disables pausing.
         */
        @Min(0)
        private int threshold = 20;
        @NotNull
        private Duration pause = Duration.ofSeconds(15);
    }

    @Data
    public static class Remux {
        private boolean enabled = true;
        @NotBlank
        private String ffmpegPath = "ffmpeg";
        @Min(1)
        private long timeoutMinutes = 30;
        @NotNull
        private RemuxRetryMode retryMode = RemuxRetryMode.REMUX_ONLY;
    }

    @Data
    public static class Http {
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration responseTimeout = Duration.ofSeconds(30);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(60);
    }

    public Path outputRoot() {
        return Path.of(outputDirectory).toAbsolutePath().normalize();
    }
}
