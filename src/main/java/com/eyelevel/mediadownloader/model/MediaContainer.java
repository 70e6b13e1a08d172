package com.eyelevel.mediadownloader.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The container formats this downloader can leave on disk.
 */
public enum MediaContainer {
    /**
     * Playable container produced directly or by remuxing a segmented stream.
     */
    MP4("mp4"),
    /**
     * Raw MPEG transport stream, kept as-is when remuxing is disabled.
     */
    MPEG_TS("ts");

    private final String extension;

    MediaContainer(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * @return the file name suffix including the leading dot, e.g. {@code ".mp4"}.
     */
    public String suffix() {
        return "." + extension;
    }

    public static Optional<MediaContainer> fromExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String normalized = extension.toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(c -> c.extension.equals(normalized)).findFirst();
    }
}
