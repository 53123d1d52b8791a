package io.tabtick.server.dto;

import java.util.List;

/**
 * JSON body for POST /snoozed.
 * Example:
 *   {
 *     "tabIds": [101, 102],
 *     "wakeAt": 1767225600000,
 *     "restorationMode": "original",
 *     "reason": "after lunch"
 *   }
 */
public class SnoozeTabsRequest {
    public List<Integer> tabIds;
    public long wakeAt;              // epoch millis
    public String restorationMode;   // original | current | new (default original)
    public String reason;
}
