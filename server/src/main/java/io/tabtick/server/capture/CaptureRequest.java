package io.tabtick.server.capture;

import io.tabtick.core.CollectionMetadata;

/**
 * Input of {@link SnapshotBuilder#capture}.
 *
 * @param keepActive bind the new collection to the window (default true).
 */
public record CaptureRequest(int windowId, CollectionMetadata metadata, Boolean keepActive) {
    public CaptureRequest {
        keepActive = keepActive == null ? Boolean.TRUE : keepActive;
    }

    public static CaptureRequest of(int windowId, String name) {
        return new CaptureRequest(windowId, CollectionMetadata.named(name), true);
    }
}
