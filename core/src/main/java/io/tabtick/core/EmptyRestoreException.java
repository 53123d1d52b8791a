package io.tabtick.core;

/** Nothing restorable is left once non-capturable tabs are filtered out. */
public class EmptyRestoreException extends TabTickException {

    public EmptyRestoreException(String what) {
        super("No restorable tabs in " + what);
    }
}
