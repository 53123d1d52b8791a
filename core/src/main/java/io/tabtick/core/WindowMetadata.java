package io.tabtick.core;

import java.util.Objects;

/**
 * Display properties of a window captured just before a window snooze closes it,
 * keyed by the generated snooze id.
 */
public record WindowMetadata(
        String snoozeId,
        int windowId,
        Integer left,
        Integer top,
        Integer width,
        Integer height,
        WindowState state,
        long wakeAt,
        long createdAt
) {
    public WindowMetadata {
        Objects.requireNonNull(snoozeId, "snoozeId");
        state = state == null ? WindowState.NORMAL : state;
    }

    /** Defaults used when an item list outlived its metadata. */
    public static WindowMetadata fallback(String snoozeId, int windowId, long wakeAt, long now) {
        return new WindowMetadata(snoozeId, windowId, null, null, null, null, WindowState.NORMAL, wakeAt, now);
    }
}
