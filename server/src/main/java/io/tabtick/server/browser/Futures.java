package io.tabtick.server.browser;

import io.tabtick.core.BrowserApiException;
import io.tabtick.core.NotFoundException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for the engine's synchronous use of {@link io.tabtick.core.browser.BrowserControl}.
 * <p>
 * Browser calls complete exceptionally with the engine's own exceptions, but
 * {@link CompletableFuture#join()} wraps them; {@link #await} hands back the
 * original exception so callers can catch {@link NotFoundException} directly.
 */
public final class Futures {

    private Futures() {
        // utility
    }

    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            throw rethrowable(e);
        }
    }

    /** Strip CompletionException/ExecutionException wrappers. */
    public static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    public static boolean isNotFound(Throwable t) {
        return unwrap(t) instanceof NotFoundException;
    }

    /** Short human-readable reason for a failed browser call, used in warnings. */
    public static String describe(Throwable t) {
        Throwable cause = unwrap(t);
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static RuntimeException rethrowable(Throwable t) {
        Throwable cause = unwrap(t);
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new BrowserApiException(describe(cause), cause);
    }
}
