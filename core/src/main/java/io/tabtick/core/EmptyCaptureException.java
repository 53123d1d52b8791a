package io.tabtick.core;

/** Every tab of the window was filtered out as non-capturable. */
public class EmptyCaptureException extends TabTickException {

    public EmptyCaptureException(int windowId, int skipped) {
        super("No capturable tabs in window " + windowId + " (" + skipped + " system tabs skipped)");
    }
}
