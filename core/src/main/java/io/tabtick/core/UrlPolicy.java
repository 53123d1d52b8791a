package io.tabtick.core;

import java.util.List;

/**
 * Decides which URLs can be captured and later reopened.
 * <p>
 * Internal browser pages cannot be opened programmatically, so they are
 * skipped both when a window is captured and when a collection is restored.
 */
public final class UrlPolicy {

    static final List<String> SYSTEM_URL_PREFIXES = List.of(
            "chrome://",
            "chrome-extension://",
            "edge://",
            "about:",
            "view-source:"
    );

    /** Tab group colors understood by the browser. */
    public static final List<String> GROUP_COLORS = List.of(
            "grey", "blue", "red", "yellow", "green", "pink", "purple", "cyan", "orange"
    );

    private UrlPolicy() {
        // utility
    }

    public static boolean isSystemUrl(String url) {
        if (url == null) {
            return false;
        }
        for (String prefix : SYSTEM_URL_PREFIXES) {
            if (url.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /** Blank URLs are not capturable either: there is nothing to reopen. */
    public static boolean isCapturable(String url) {
        return url != null && !url.isBlank() && !isSystemUrl(url);
    }

    public static String normalizeGroupColor(String color) {
        return color != null && GROUP_COLORS.contains(color) ? color : "grey";
    }
}
