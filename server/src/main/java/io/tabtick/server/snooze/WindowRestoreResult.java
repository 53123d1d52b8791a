package io.tabtick.server.snooze;

import io.tabtick.core.WindowMetadata;

import java.util.List;

/**
 * @param tabCount number of tabs actually recreated; items that failed stay snoozed.
 */
public record WindowRestoreResult(
        String snoozeId,
        int windowId,
        int tabCount,
        WindowMetadata metadata,
        List<String> warnings
) {
    public WindowRestoreResult {
        warnings = List.copyOf(warnings);
    }
}
