package io.tabtick.server.dto;

import java.util.List;

/**
 * JSON body for POST /snoozed/wake.
 * Example:
 *   {
 *     "ids": ["snz_..."],
 *     "makeActive": false,
 *     "targetWindowId": 7
 *   }
 */
public class WakeRequest {
    public List<String> ids;
    public Boolean makeActive;       // default true
    public Integer targetWindowId;   // overrides each item's restoration mode
}
