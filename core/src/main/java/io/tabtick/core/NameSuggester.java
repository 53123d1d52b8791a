package io.tabtick.core;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Suggests a collection name from the tabs of a window.
 * <p>
 * Rule: the most frequent hostname wins if it covers at least
 * max(2, ceil(30% of all tabs)); otherwise {@link #DEFAULT_NAME}.
 * Ties keep the hostname encountered first.
 */
public final class NameSuggester {

    public static final String DEFAULT_NAME = "New Collection";

    private NameSuggester() {
        // utility
    }

    public static String suggestName(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            return DEFAULT_NAME;
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String url : urls) {
            if (url == null || UrlPolicy.isSystemUrl(url)) {
                continue;
            }
            String host = hostOf(url);
            if (host != null) {
                counts.merge(host, 1, Integer::sum);
            }
        }

        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }

        if (best == null) {
            return DEFAULT_NAME;
        }

        int threshold = Math.max(2, (int) Math.ceil(urls.size() * 0.3));
        return bestCount >= threshold ? best : DEFAULT_NAME;
    }

    private static String hostOf(String url) {
        try {
            String host = new URI(url).getHost();
            return host == null || host.isBlank() ? null : host;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
