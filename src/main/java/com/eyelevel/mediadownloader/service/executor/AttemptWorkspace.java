package com.eyelevel.mediadownloader.service.executor;

import com.eyelevel.mediadownloader.model.DownloadJob;
import com.eyelevel.mediadownloader.service.content.MediaContent;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Temporary files of one job, created next to the job's final output so that publishing is a
 * rename within one file system. Hidden {@code .part} names keep them out of the output index.
 * <p>
 * Confined to the worker thread executing the job.
 */
@Slf4j
class AttemptWorkspace {

    private static final String PART_SUFFIX = ".part";

    private final DownloadJob job;
    private final Path directory;
    private Path rawFile;
    private Path remuxFile;
    private MediaContent rawContent;

    AttemptWorkspace(DownloadJob job) {
        this.job = job;
        this.directory = job.outputPath().toAbsolutePath().getParent();
    }

    /**
     * Replaces any previous raw download with a fresh, empty temporary file.
     */
    Path newRawFile() throws IOException {
        discardRaw();
        Files.createDirectories(directory);
        rawFile = Files.createTempFile(directory, "." + job.logicalName() + "-", PART_SUFFIX);
        return rawFile;
    }

    Path newRemuxFile() throws IOException {
        deleteQuietly(remuxFile);
        remuxFile = Files.createTempFile(directory, "." + job.logicalName() + "-", ".mp4" + PART_SUFFIX);
        return remuxFile;
    }

    /**
     * Marks the raw file as a complete download of the given kind.
     */
    void rawDownloaded(MediaContent content) {
        this.rawContent = content;
    }

    boolean hasRawDownload() {
        return rawContent != null;
    }

    MediaContent getRawContent() {
        return rawContent;
    }

    Path getRawFile() {
        return rawFile;
    }

    void discardRaw() {
        deleteQuietly(rawFile);
        rawFile = null;
        rawContent = null;
    }

    /**
     * Deletes whatever temporary files remain. Files already published no longer exist under
     * their temporary names and are left alone.
     */
    void cleanup() {
        deleteQuietly(rawFile);
        deleteQuietly(remuxFile);
        rawFile = null;
        remuxFile = null;
        rawContent = null;
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("[{}] Failed to delete temporary file: {}", job.label(), file);
        }
    }
}
