package com.eyelevel.mediadownloader.config;

import com.eyelevel.mediadownloader.common.ratelimit.RateLimitParser;
import com.eyelevel.mediadownloader.service.throttle.RateGovernor;
import com.eyelevel.mediadownloader.service.throttle.RequestCadenceGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

/**
 * Creates the limiters shared by every concurrent download of the process.
 */
@Slf4j
@Configuration
public class DownloadThrottleConfiguration {

    /**
     * The sleeper behind retry backoff, cadence pauses and rate-limited reads. All of them
     * end early when the sleeping thread is interrupted.
     */
    @Bean
    public Sleeper downloadSleeper() {
        return new ThreadWaitSleeper();
    }

    @Bean
    public RateGovernor rateGovernor(DownloadProperties properties, Sleeper downloadSleeper) {
        long bytesPerSecond = RateLimitParser.parse(properties.getRateLimit());
        if (bytesPerSecond == RateLimitParser.UNBOUNDED) {
            log.info("Aggregate transfer rate is unbounded.");
            return RateGovernor.unbounded();
        }
        log.info("Aggregate transfer rate limited to {} ({} bytes/s).", properties.getRateLimit(), bytesPerSecond);
        return new RateGovernor(bytesPerSecond, System::nanoTime, downloadSleeper);
    }

    @Bean
    public RequestCadenceGuard requestCadenceGuard(DownloadProperties properties, Sleeper downloadSleeper) {
        DownloadProperties.Cadence cadence = properties.getCadence();
        log.info("Request cadence: pause {} after every {} requests.", cadence.getPause(), cadence.getThreshold());
        return new RequestCadenceGuard(cadence.getThreshold(), cadence.getPause(), downloadSleeper);
    }
}
