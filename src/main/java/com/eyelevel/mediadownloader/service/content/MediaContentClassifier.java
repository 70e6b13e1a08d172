package com.eyelevel.mediadownloader.service.content;

import com.eyelevel.mediadownloader.exception.UnsupportedContentException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Locale;
import java.util.Set;

/**
 * Decides from the declared content type and the source path whether a response is media and
 * whether it needs remuxing.
 * <p>
 * Origins that put a challenge or error page in front of their media answer with HTML, JSON or
 * plain text and a success status. Those responses, and HLS playlists which would need a segment
 * fetcher, are rejected as unsupported.
 */
@Slf4j
@Component
public class MediaContentClassifier {

    private static final MediaType MPEG_TS = MediaType.parseMediaType("video/mp2t");
    private static final Set<String> PLAYLIST_TYPES = Set.of(
            "application/vnd.apple.mpegurl", "application/x-mpegurl", "audio/mpegurl", "audio/x-mpegurl");
    private static final Set<MediaType> DOCUMENT_TYPES = Set.of(
            MediaType.APPLICATION_JSON, MediaType.APPLICATION_XHTML_XML, MediaType.APPLICATION_XML,
            MediaType.APPLICATION_PROBLEM_JSON);

    /**
     * @param contentType Declared content type, or {@code null}.
     * @param source      The requested locator.
     * @return how the body should be handled.
     * @throws UnsupportedContentException if the response is not downloadable media.
     */
    public MediaContent classify(MediaType contentType, URI source) {
        String extension = extensionOf(source);

        if ("m3u8".equals(extension) || (contentType != null && isPlaylist(contentType))) {
            throw new UnsupportedContentException("HLS playlists are not supported: " + source);
        }
        if (contentType != null) {
            if ("text".equalsIgnoreCase(contentType.getType()) || isDocument(contentType)) {
                throw new UnsupportedContentException(
                        String.format("Expected media but received '%s' from %s", contentType, source));
            }
            if (MPEG_TS.equalsTypeAndSubtype(contentType)) {
                return MediaContent.SEGMENTED;
            }
        }
        return "ts".equals(extension) ? MediaContent.SEGMENTED : MediaContent.DIRECT;
    }

    private boolean isPlaylist(MediaType contentType) {
        String type = (contentType.getType() + "/" + contentType.getSubtype()).toLowerCase(Locale.ROOT);
        return PLAYLIST_TYPES.contains(type);
    }

    private boolean isDocument(MediaType contentType) {
        return DOCUMENT_TYPES.stream().anyMatch(type -> type.equalsTypeAndSubtype(contentType));
    }

    private String extensionOf(URI source) {
        String path = source.getPath();
        return path == null ? "" : FilenameUtils.getExtension(path).toLowerCase(Locale.ROOT);
    }
}
