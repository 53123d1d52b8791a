package io.tabtick.core;

import java.util.Objects;

/**
 * Durable record of a closed tab waiting to be woken.
 * <p>
 * Lifecycle:
 *  - created by a snooze,
 *  - changed only by {@link #rescheduled(long)} (wakeAt is the only mutable field),
 *  - removed by wake or delete.
 * <p>
 * windowSnoozeId groups the items of one window snooze; it is null for items
 * snoozed individually. originalTabId is the live tab that was closed by the
 * snooze; tabRecordId is the durable tab that live tab stood in for, if any.
 */
public record SnoozedItem(
        String id,
        String url,
        String title,
        String favicon,
        boolean pinned,
        long wakeAt,
        Integer sourceWindowId,
        String windowSnoozeId,
        Integer originalGroupId,
        RestorationMode restorationMode,
        String reason,
        long createdAt,
        Integer originalTabId,
        String tabRecordId
) {
    public SnoozedItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(url, "url");
        restorationMode = restorationMode == null ? RestorationMode.ORIGINAL : restorationMode;
    }

    public SnoozedItem rescheduled(long newWakeAt) {
        return new SnoozedItem(id, url, title, favicon, pinned, newWakeAt, sourceWindowId, windowSnoozeId,
                originalGroupId, restorationMode, reason, createdAt, originalTabId, tabRecordId);
    }

    public boolean isDue(long nowMillis) {
        return wakeAt <= nowMillis;
    }
}
