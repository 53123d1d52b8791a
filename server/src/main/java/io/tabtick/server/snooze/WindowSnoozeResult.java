package io.tabtick.server.snooze;

import io.tabtick.core.SnoozedItem;
import io.tabtick.core.WindowMetadata;

import java.util.List;

public record WindowSnoozeResult(
        String snoozeId,
        long wakeAt,
        WindowMetadata metadata,
        int tabCount,
        List<SnoozedItem> items
) {}
