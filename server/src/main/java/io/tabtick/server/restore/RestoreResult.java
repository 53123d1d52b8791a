package io.tabtick.server.restore;

import java.util.List;

public record RestoreResult(String collectionId, int windowId, List<RestoredTab> tabs, RestoreStats stats) {

    /** A durable tab and the live tab now standing in for it. */
    public record RestoredTab(String tabId, int liveTabId, String url) {}

    public record RestoreStats(int tabsRestored, int tabsSkipped, int groupsRestored, List<String> warnings) {
        public RestoreStats {
            warnings = List.copyOf(warnings);
        }
    }
}
