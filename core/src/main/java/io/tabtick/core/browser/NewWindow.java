package io.tabtick.core.browser;

import io.tabtick.core.WindowState;

/** Properties of a window to create. Null bounds let the browser pick. */
public record NewWindow(
        boolean focused,
        WindowState state,
        Integer left,
        Integer top,
        Integer width,
        Integer height
) {
    public static NewWindow of(boolean focused, WindowState state) {
        return new NewWindow(focused, state, null, null, null, null);
    }
}
