package io.tabtick.server.dto;

/** JSON body for PUT /snoozed/{id}: {"wakeAt": 1767225600000}. */
public class RescheduleRequest {
    public long wakeAt;
}
