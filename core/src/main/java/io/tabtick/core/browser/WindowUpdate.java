package io.tabtick.core.browser;

import io.tabtick.core.WindowState;

/** Partial window update; null fields are left unchanged. */
public record WindowUpdate(
        Boolean focused,
        WindowState state,
        Integer left,
        Integer top,
        Integer width,
        Integer height
) {
    public static WindowUpdate focus() {
        return new WindowUpdate(true, null, null, null, null, null);
    }
}
