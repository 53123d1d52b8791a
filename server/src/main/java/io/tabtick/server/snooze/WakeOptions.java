package io.tabtick.server.snooze;

/**
 * @param makeActive     activate the first woken tab (default true).
 * @param targetWindowId overrides every item's restoration mode when set.
 */
public record WakeOptions(Boolean makeActive, Integer targetWindowId) {
    public WakeOptions {
        makeActive = makeActive == null ? Boolean.TRUE : makeActive;
    }

    public static WakeOptions defaults() {
        return new WakeOptions(true, null);
    }
}
