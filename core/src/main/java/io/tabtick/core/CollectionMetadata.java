package io.tabtick.core;

import java.util.List;

/** User-supplied metadata for a collection. Only {@code name} is required. */
public record CollectionMetadata(
        String name,
        String description,
        String icon,
        String color,
        List<String> tags
) {
    public CollectionMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static CollectionMetadata named(String name) {
        return new CollectionMetadata(name, null, null, null, List.of());
    }
}
