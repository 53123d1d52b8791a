package io.tabtick.core;

/**
 * Root of the engine's error taxonomy.
 * <p>
 * Only whole-operation failures are thrown. A failure of a single item inside a
 * batch (one tab of a restore, one item of a wake) is reported as a warning on
 * the operation's result instead.
 */
public abstract class TabTickException extends RuntimeException {

    protected TabTickException(String message) {
        super(message);
    }

    protected TabTickException(String message, Throwable cause) {
        super(message, cause);
    }
}
