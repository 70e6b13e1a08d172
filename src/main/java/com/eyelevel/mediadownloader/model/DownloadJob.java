package com.eyelevel.mediadownloader.model;

import lombok.Builder;
import lombok.Singular;
import org.apache.commons.io.FilenameUtils;

import java.net.URI;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * One unit of work: fetch {@code sourceUrl} and place the result at {@code outputPath}.
 * <p>
 * Jobs are immutable once built. The output path is fully resolved by whoever creates the job;
 * the only adjustment made later is swapping the extension when the downloaded stream ends up
 * in a different {@link MediaContainer}.
 *
 * @param sourceUrl    The remote media locator.
 * @param referer      Referer to send with the request, or {@code null}.
 * @param headers      Additional request headers.
 * @param outputPath   Final location of the downloaded file.
 * @param skipIfExists Skip without network activity when the output already exists.
 * @param retryBudget  Number of retries after the first attempt.
 * @param overwrite    Whether an existing file at the final path may be replaced.
 */
@Builder(toBuilder = true)
public record DownloadJob(URI sourceUrl,
                          String referer,
                          @Singular Map<String, String> headers,
                          Path outputPath,
                          boolean skipIfExists,
                          int retryBudget,
                          boolean overwrite) {

    public DownloadJob {
        Objects.requireNonNull(sourceUrl, "sourceUrl must not be null");
        Objects.requireNonNull(outputPath, "outputPath must not be null");
        if (outputPath.getFileName() == null) {
            throw new IllegalArgumentException("outputPath must name a file: " + outputPath);
        }
        if (retryBudget < 0) {
            throw new IllegalArgumentException("retryBudget must not be negative: " + retryBudget);
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /**
     * The output file name without any container extension this downloader produces. This is the
     * name checked against already-present output.
     */
    public String logicalName() {
        String fileName = outputPath.getFileName().toString();
        return MediaContainer.fromExtension(FilenameUtils.getExtension(fileName))
                .map(container -> FilenameUtils.removeExtension(fileName))
                .orElse(fileName);
    }

    /**
     * Resolves the final path for the given container, keeping the directory and logical name.
     */
    public Path outputPathFor(MediaContainer container) {
        return outputPath.resolveSibling(logicalName() + container.suffix());
    }

    public int maxAttempts() {
        return retryBudget + 1;
    }

    /**
     * Short identifier used as the context prefix of log lines.
     */
    public String label() {
        return logicalName();
    }
}
