package io.tabtick.core;

import java.util.Objects;

/**
 * Durable snapshot of one page.
 * <p>
 * {@code liveTabId} is the ephemeral id of the live counterpart. It is only
 * meaningful while that live tab exists and is null otherwise.
 */
public record TabRecord(
        String id,
        String folderId,
        String url,
        String title,
        String favicon,
        int position,
        boolean pinned,
        Integer liveTabId
) {
    public TabRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(folderId, "folderId");
        Objects.requireNonNull(url, "url");
        if (position < 0) {
            throw new IllegalArgumentException("position must be >= 0, got: " + position);
        }
    }

    public TabRecord withLiveTabId(Integer newLiveTabId) {
        return new TabRecord(id, folderId, url, title, favicon, position, pinned, newLiveTabId);
    }
}
