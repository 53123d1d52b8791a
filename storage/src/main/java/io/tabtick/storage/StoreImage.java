package io.tabtick.storage;

import io.tabtick.core.CollectionRecord;
import io.tabtick.core.FolderRecord;
import io.tabtick.core.SnoozedItem;
import io.tabtick.core.TabRecord;
import io.tabtick.core.WindowMetadata;

import java.util.List;

/** Full copy of the store contents, as written to and read from a snapshot. */
public record StoreImage(
        List<CollectionRecord> collections,
        List<FolderRecord> folders,
        List<TabRecord> tabs,
        List<SnoozedItem> snoozed,
        List<WindowMetadata> windowMetadata
) {
    public StoreImage {
        collections = collections == null ? List.of() : List.copyOf(collections);
        folders = folders == null ? List.of() : List.copyOf(folders);
        tabs = tabs == null ? List.of() : List.copyOf(tabs);
        snoozed = snoozed == null ? List.of() : List.copyOf(snoozed);
        windowMetadata = windowMetadata == null ? List.of() : List.copyOf(windowMetadata);
    }

    public static StoreImage empty() {
        return new StoreImage(List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
