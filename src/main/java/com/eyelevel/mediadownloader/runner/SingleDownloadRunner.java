package com.eyelevel.mediadownloader.runner;

import com.eyelevel.mediadownloader.config.DownloadProperties;
import com.eyelevel.mediadownloader.model.RunResult;
import com.eyelevel.mediadownloader.service.job.DownloadOrchestrationService;
import com.eyelevel.mediadownloader.service.scheduler.DownloadRunContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Downloads the item given by {@code app.download.url} and reports the run's exit status.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.download", name = "url")
public class SingleDownloadRunner implements ApplicationRunner, ExitCodeGenerator {

    private final DownloadOrchestrationService orchestrationService;
    private final DownloadProperties properties;
    private volatile int exitCode;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        DownloadRunContext context = orchestrationService.openRun();
        RunResult result = orchestrationService.downloadSingle(properties.getUrl(), properties.getReferer(), context);
        result.getOutcomes().stream()
                .filter(outcome -> outcome.outputPath() != null)
                .forEach(outcome -> log.info("Saved to {}", outcome.outputPath()));
        log.info("Done. {}", result.summary());
        exitCode = result.exitCode();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
