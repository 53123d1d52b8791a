package io.tabtick.core.browser;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Control surface of the live browser.
 * <p>
 * Every call is asynchronous: the returned future completes when the browser
 * has applied the change. Callers that want several calls in flight at once
 * issue them first and join them together.
 * <p>
 * Failure contract:
 *  - a window, tab or group that does not exist completes exceptionally with
 *    {@link io.tabtick.core.NotFoundException},
 *  - any other rejection completes exceptionally with
 *    {@link io.tabtick.core.BrowserApiException}.
 * <p>
 * The surface has an implicit rate limit, which is why bulk creation is batched
 * by the caller.
 */
public interface BrowserControl {

    /** Tabs of one window, in tab-strip order; all tabs when {@code windowId} is null. */
    CompletableFuture<List<LiveTab>> queryTabs(Integer windowId);

    CompletableFuture<LiveTab> getTab(int tabId);

    CompletableFuture<List<LiveGroup>> queryGroups(int windowId);

    CompletableFuture<LiveGroup> getGroup(int groupId);

    CompletableFuture<LiveWindow> getWindow(int windowId);

    CompletableFuture<List<LiveWindow>> listWindows();

    /** The window that most recently had focus. */
    CompletableFuture<LiveWindow> lastFocusedWindow();

    /** Create a window. The browser opens it with at least one default tab. */
    CompletableFuture<LiveWindow> createWindow(NewWindow props);

    CompletableFuture<Void> removeWindow(int windowId);

    CompletableFuture<LiveTab> createTab(NewTab props);

    CompletableFuture<Void> removeTabs(List<Integer> tabIds);

    CompletableFuture<LiveTab> moveTab(int tabId, int windowId, int index);

    /**
     * Add tabs to a group.
     *
     * @param groupId existing group to join, or null to create a new group.
     * @return id of the group the tabs ended up in.
     */
    CompletableFuture<Integer> groupTabs(List<Integer> tabIds, Integer groupId);

    CompletableFuture<LiveGroup> updateGroup(int groupId, GroupUpdate props);

    CompletableFuture<LiveWindow> updateWindow(int windowId, WindowUpdate props);
}
