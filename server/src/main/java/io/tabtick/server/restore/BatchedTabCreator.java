package io.tabtick.server.restore;

import io.tabtick.core.browser.BrowserControl;
import io.tabtick.core.browser.LiveTab;
import io.tabtick.core.browser.NewTab;
import io.tabtick.server.browser.Futures;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates many tabs without tripping the browser's rate limit.
 * <p>
 * Requests are split into fixed-size batches. Within a batch every createTab
 * call is issued at once and the batch is awaited as a whole; a fixed delay
 * separates consecutive batches. A failed creation never affects its siblings.
 */
public final class BatchedTabCreator {
    private static final Logger log = Logger.getLogger(BatchedTabCreator.class.getName());

    /**
     * Result of one creation, in request order.
     *
     * @param tab   created tab, or null on failure.
     * @param error failure reason, or null on success.
     */
    public record Outcome(NewTab request, LiveTab tab, String error) {
        public boolean ok() {
            return tab != null;
        }
    }

    private final BrowserControl browser;
    private final int batchSize;
    private final Duration batchDelay;

    public BatchedTabCreator(BrowserControl browser, int batchSize, Duration batchDelay) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (batchDelay == null || batchDelay.isNegative()) {
            throw new IllegalArgumentException("batchDelay must be >= 0");
        }
        this.browser = Objects.requireNonNull(browser, "browser");
        this.batchSize = batchSize;
        this.batchDelay = batchDelay;
    }

    public List<Outcome> createAll(List<NewTab> requests) {
        List<Outcome> out = new ArrayList<>(requests.size());
        for (int start = 0; start < requests.size(); start += batchSize) {
            if (start > 0) {
                pause();
            }
            List<NewTab> batch = requests.subList(start, Math.min(start + batchSize, requests.size()));
            out.addAll(createBatch(batch));
        }
        return out;
    }

    public int batchSize() {
        return batchSize;
    }

    private List<Outcome> createBatch(List<NewTab> batch) {
        List<CompletableFuture<Outcome>> inFlight = new ArrayList<>(batch.size());
        for (NewTab req : batch) {
            CompletableFuture<LiveTab> call;
            try {
                call = browser.createTab(req);
            } catch (RuntimeException e) {
                call = CompletableFuture.failedFuture(e);
            }
            inFlight.add(call.handle((tab, err) -> {
                if (err != null) {
                    log.log(Level.WARNING, "Tab creation failed for {0}: {1}",
                            new Object[]{req.url(), Futures.describe(err)});
                    return new Outcome(req, null, Futures.describe(err));
                }
                return new Outcome(req, tab, null);
            }));
        }

        CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0])).join();

        List<Outcome> outcomes = new ArrayList<>(inFlight.size());
        for (CompletableFuture<Outcome> f : inFlight) {
            outcomes.add(f.join());
        }
        return outcomes;
    }

    private void pause() {
        if (batchDelay.isZero()) {
            return;
        }
        try {
            Thread.sleep(batchDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
