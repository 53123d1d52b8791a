package io.tabtick.server.restore;

import io.tabtick.core.WindowState;

/**
 * How a collection is restored.
 *
 * @param createNewWindow open a fresh window (default true); otherwise restore into {@code windowId}.
 * @param windowId        target window when not creating one.
 * @param focused         focus the target window (default true).
 * @param windowState     state of a newly created window (default normal).
 */
public record RestoreOptions(Boolean createNewWindow, Integer windowId, Boolean focused, WindowState windowState) {
    public RestoreOptions {
        createNewWindow = createNewWindow == null ? Boolean.TRUE : createNewWindow;
        focused = focused == null ? Boolean.TRUE : focused;
        windowState = windowState == null ? WindowState.NORMAL : windowState;
    }

    public static RestoreOptions defaults() {
        return new RestoreOptions(true, null, true, WindowState.NORMAL);
    }

    public static RestoreOptions intoWindow(int windowId) {
        return new RestoreOptions(false, windowId, true, WindowState.NORMAL);
    }
}
