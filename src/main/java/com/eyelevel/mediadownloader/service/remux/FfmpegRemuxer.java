package com.eyelevel.mediadownloader.service.remux;

import com.eyelevel.mediadownloader.common.processexec.ProcessExecutor;
import com.eyelevel.mediadownloader.common.processexec.ProcessExecutor.ProcessResult;
import com.eyelevel.mediadownloader.config.DownloadProperties;
import com.eyelevel.mediadownloader.exception.DownloadCancelledException;
import com.eyelevel.mediadownloader.exception.RemuxException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Remuxes MPEG transport streams into MP4 with ffmpeg, copying the streams as they are.
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class FfmpegRemuxer implements MediaRemuxer {

    private final DownloadProperties properties;
    private final ProcessExecutor processExecutor;

    @Override
    public void remux(Path input, Path output, String contextInfo) {
        DownloadProperties.Remux remux = properties.getRemux();
        log.info("[{}] Remuxing '{}' to MP4 (Timeout: {}m).", contextInfo, input.getFileName(),
                remux.getTimeoutMinutes());

        try {
            ProcessResult result = processExecutor.execute(buildCommand(remux.getFfmpegPath(), input, output),
                    contextInfo, remux.getTimeoutMinutes(), "ffmpeg");
            if (result.exitCode() != 0) {
                throw new RemuxException(String.format("ffmpeg exited with code %d for '%s'. Error: %s",
                        result.exitCode(), input.getFileName(), result.stderr()));
            }
            if (!Files.isRegularFile(output) || Files.size(output) == 0) {
                throw new RemuxException("ffmpeg produced no output for: " + input.getFileName());
            }
            log.debug("[{}] Remux finished ({} bytes).", contextInfo, Files.size(output));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DownloadCancelledException("Remux interrupted for: " + input.getFileName(), e);
        } catch (IOException e) {
            throw new RemuxException("Remux process failed for: " + input.getFileName(), e);
        }
    }

    List<String> buildCommand(String ffmpegPath, Path input, Path output) {
        return List.of(ffmpegPath, "-y", "-loglevel", "error",
                "-i", input.toAbsolutePath().toString(),
                "-c", "copy", "-bsf:a", "aac_adtstoasc",
                "-f", "mp4", output.toAbsolutePath().toString());
    }
}
