package io.tabtick.core.browser;

/**
 * Properties of a tab to create.
 *
 * @param windowId target window; null lets the browser open a new window for it.
 * @param index    position in the tab strip; null appends.
 */
public record NewTab(
        Integer windowId,
        String url,
        boolean pinned,
        boolean active,
        Integer index
) {
    public static NewTab in(Integer windowId, String url, boolean pinned, boolean active) {
        return new NewTab(windowId, url, pinned, active, null);
    }
}
