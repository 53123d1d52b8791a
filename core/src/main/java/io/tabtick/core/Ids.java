package io.tabtick.core;

import java.util.UUID;

/** Durable id generation. Ids are opaque; the prefix only helps when reading logs. */
public final class Ids {
    public static final String COLLECTION = "col";
    public static final String FOLDER = "fld";
    public static final String TAB = "tab";
    public static final String SNOOZED = "snz";
    public static final String WINDOW_SNOOZE = "wsnz";

    private Ids() {
        // utility
    }

    public static String newId(String prefix) {
        return prefix + "_" + UUID.randomUUID();
    }
}
