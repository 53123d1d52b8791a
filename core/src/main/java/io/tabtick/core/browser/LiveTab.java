package io.tabtick.core.browser;

/**
 * A tab as the browser reports it.
 *
 * @param groupId live group id, or {@link #NO_GROUP} when the tab is not grouped.
 */
public record LiveTab(
        int id,
        int windowId,
        int index,
        String url,
        String title,
        String favIconUrl,
        boolean pinned,
        boolean active,
        int groupId
) {
    public static final int NO_GROUP = -1;

    public boolean grouped() {
        return groupId != NO_GROUP;
    }
}
