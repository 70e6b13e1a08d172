package com.eyelevel.mediadownloader;

import com.eyelevel.mediadownloader.config.DownloadProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;

/**
 * The main entry point for the Media Downloader Spring Boot application.
 * <p>
 * Runs as a command-line process without a web server:
 * <ul>
 *     <li>{@link SpringBootApplication}: enables auto-configuration, component scanning, and property support.</li>
 *     <li>{@link EnableConfigurationProperties}: binds properties prefixed with "app.download" to
 *     {@link DownloadProperties}.</li>
 * </ul>
 * The process exits with the status reported by the runners once they finish.
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(value = DownloadProperties.class)
public class MediaDownloaderApplication {

    /**
     * Launches the application and exits with the status of the download run.
     *
     * @param args Command-line arguments passed to the application.
     */
    public static void main(final String[] args) {
        log.info("Starting MediaDownloaderApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(MediaDownloaderApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' finished.", env.getProperty("spring.application.name", "media-downloader"));
        log.info("  - Output:     {}", env.getProperty("app.download.output-directory", "downloads"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");

        System.exit(SpringApplication.exit(context));
    }
}
