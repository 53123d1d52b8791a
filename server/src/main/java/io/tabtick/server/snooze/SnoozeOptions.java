package io.tabtick.server.snooze;

import io.tabtick.core.RestorationMode;

/**
 * Options of a snooze.
 *
 * @param restorationMode where the tabs come back (default original).
 * @param reason          free text, "manual" by default.
 * @param windowSnoozeId  set when the tabs belong to a window snooze.
 * @param sourceWindowId  overrides the window recorded for each tab.
 */
public record SnoozeOptions(
        RestorationMode restorationMode,
        String reason,
        String windowSnoozeId,
        Integer sourceWindowId
) {
    public static final String DEFAULT_REASON = "manual";

    public SnoozeOptions {
        restorationMode = restorationMode == null ? RestorationMode.ORIGINAL : restorationMode;
        reason = reason == null || reason.isBlank() ? DEFAULT_REASON : reason;
    }

    public static SnoozeOptions defaults() {
        return new SnoozeOptions(RestorationMode.ORIGINAL, DEFAULT_REASON, null, null);
    }

    public static SnoozeOptions withMode(RestorationMode mode) {
        return new SnoozeOptions(mode, DEFAULT_REASON, null, null);
    }

    SnoozeOptions forWindow(String snoozeId, int windowId) {
        return new SnoozeOptions(restorationMode, reason, snoozeId, windowId);
    }
}
