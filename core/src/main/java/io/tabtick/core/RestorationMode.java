package io.tabtick.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where a woken tab goes.
 *
 * ORIGINAL:
 *   - the window it was snoozed from, if that window still exists,
 *   - otherwise the last-focused window.
 *
 * CURRENT:
 *   - always the last-focused window.
 *
 * NEW:
 *   - no destination; the browser allocates a new window.
 */
public enum RestorationMode {
    ORIGINAL,
    CURRENT,
    NEW;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RestorationMode fromWire(String value) {
        if (value == null || value.isBlank()) {
            return ORIGINAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("unknown restorationMode: " + value);
        }
    }
}
