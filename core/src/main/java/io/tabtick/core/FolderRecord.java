package io.tabtick.core;

import java.util.Objects;

/**
 * Durable snapshot of one tab group inside a collection.
 * <p>
 * The synthetic "Ungrouped" folder ({@code ungrouped == true}) holds tabs that
 * had no live group at capture time; it is never turned back into a live group.
 */
public record FolderRecord(
        String id,
        String collectionId,
        String name,
        String color,
        int position,
        boolean collapsed,
        boolean ungrouped
) {
    public static final String UNGROUPED_NAME = "Ungrouped";
    public static final String UNGROUPED_COLOR = "grey";

    public FolderRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(collectionId, "collectionId");
        if (position < 0) {
            throw new IllegalArgumentException("position must be >= 0, got: " + position);
        }
    }

    public static FolderRecord group(String collectionId, String name, String color, boolean collapsed, int position) {
        return new FolderRecord(Ids.newId(Ids.FOLDER), collectionId, name, color, position, collapsed, false);
    }

    public static FolderRecord ungrouped(String collectionId, int position) {
        return new FolderRecord(Ids.newId(Ids.FOLDER), collectionId, UNGROUPED_NAME, UNGROUPED_COLOR,
                position, false, true);
    }
}
