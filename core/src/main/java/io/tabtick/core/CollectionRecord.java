package io.tabtick.core;

import java.util.List;
import java.util.Objects;

/**
 * Durable snapshot of a browser window.
 * <p>
 * Fields:
 *  - id:           durable id, stable forever.
 *  - name, description, icon, color, tags: user metadata.
 *  - active:       true while bound to a live window.
 *  - windowId:     live window id while bound, null otherwise.
 *  - createdAt:    epoch millis, never changes after creation.
 *  - lastAccessed: epoch millis, bumped by every mutation.
 * <p>
 * Invariants:
 *  - active/windowId change only through {@link #bound(int, long)} and
 *    {@link #unbound(long)}; {@link #withMetadata} never touches them.
 *  - active == (windowId != null).
 */
public record CollectionRecord(
        String id,
        String name,
        String description,
        String icon,
        String color,
        List<String> tags,
        boolean active,
        Integer windowId,
        long createdAt,
        long lastAccessed
) {
    public CollectionRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        tags = tags == null ? List.of() : List.copyOf(tags);
        if (active != (windowId != null)) {
            throw new IllegalArgumentException("active flag and windowId disagree for collection " + id);
        }
    }

    /** New, unbound collection. */
    public static CollectionRecord create(CollectionMetadata metadata, long now) {
        return new CollectionRecord(
                Ids.newId(Ids.COLLECTION),
                metadata.name(),
                metadata.description(),
                metadata.icon(),
                metadata.color(),
                metadata.tags(),
                false,
                null,
                now,
                now
        );
    }

    public CollectionRecord bound(int liveWindowId, long now) {
        return new CollectionRecord(id, name, description, icon, color, tags, true, liveWindowId, createdAt, now);
    }

    public CollectionRecord unbound(long now) {
        return new CollectionRecord(id, name, description, icon, color, tags, false, null, createdAt, now);
    }

    public CollectionRecord withMetadata(CollectionMetadata metadata, long now) {
        return new CollectionRecord(
                id,
                metadata.name(),
                metadata.description(),
                metadata.icon(),
                metadata.color(),
                metadata.tags(),
                active,
                windowId,
                createdAt,
                now
        );
    }
}
