package io.tabtick.core;

/** The browser control surface rejected a call. */
public class BrowserApiException extends TabTickException {

    public BrowserApiException(String message) {
        super(message);
    }

    public BrowserApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
