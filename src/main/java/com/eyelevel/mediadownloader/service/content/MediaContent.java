package com.eyelevel.mediadownloader.service.content;

/**
 * How a fetched body has to be treated before it becomes final output.
 */
public enum MediaContent {
    /**
     * A playable file; written as-is.
     */
    DIRECT,
    /**
     * An MPEG transport stream; remuxed into an MP4 container when remuxing is enabled.
     */
    SEGMENTED
}
