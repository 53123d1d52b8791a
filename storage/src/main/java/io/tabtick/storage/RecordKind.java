package io.tabtick.storage;

import io.tabtick.core.CollectionRecord;
import io.tabtick.core.FolderRecord;
import io.tabtick.core.SnoozedItem;
import io.tabtick.core.TabRecord;
import io.tabtick.core.WindowMetadata;

/** Entity families kept by the record store, with their on-disk tag. */
enum RecordKind {
    COLLECTION((byte) 1, CollectionRecord.class),
    FOLDER((byte) 2, FolderRecord.class),
    TAB((byte) 3, TabRecord.class),
    SNOOZED((byte) 4, SnoozedItem.class),
    WINDOW_METADATA((byte) 5, WindowMetadata.class);

    private final byte code;
    private final Class<?> type;

    RecordKind(byte code, Class<?> type) {
        this.code = code;
        this.type = type;
    }

    byte code() {
        return code;
    }

    Class<?> type() {
        return type;
    }

    static RecordKind fromCode(byte code) {
        for (RecordKind k : values()) {
            if (k.code == code) {
                return k;
            }
        }
        throw new IllegalStateException("Unknown record kind code: " + code);
    }
}
