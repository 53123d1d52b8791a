package io.tabtick.core;

/** A window, tab, group, collection or snoozed item does not exist. */
public class NotFoundException extends TabTickException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException window(int windowId) {
        return new NotFoundException("No window with id: " + windowId);
    }

    public static NotFoundException collection(String collectionId) {
        return new NotFoundException("Collection not found: " + collectionId);
    }
}
