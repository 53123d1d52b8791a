package io.tabtick.server.dto;

/**
 * JSON body for POST /windows/{windowId}/snooze.
 * Example:
 *   {
 *     "durationMillis": 3600000,
 *     "restorationMode": "new"
 *   }
 */
public class SnoozeWindowRequest {
    public long durationMillis;
    public String restorationMode;
    public String reason;
}
