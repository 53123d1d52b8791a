package io.tabtick.server;

import io.tabtick.core.browser.BrowserControl;
import io.tabtick.server.binding.BindingCache;
import io.tabtick.server.binding.IdentityRemapper;
import io.tabtick.server.browser.HttpBrowserControl;
import io.tabtick.server.capture.SnapshotBuilder;
import io.tabtick.server.restore.BatchedTabCreator;
import io.tabtick.server.restore.RestorationEngine;
import io.tabtick.server.snooze.SnoozeScheduler;
import io.tabtick.server.snooze.WindowSnoozeService;
import io.tabtick.server.timer.ExecutorTimerService;
import io.tabtick.storage.DurableRecordStore;
import io.tabtick.storage.FileSnapshotter;
import io.tabtick.storage.FileWal;
import io.tabtick.storage.SnapshotPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for the TabTick engine.
 *
 * Responsibilities:
 *  - Parse configuration from CLI (and the optional engine config file).
 *  - Wire together storage components (WAL, snapshots, DurableRecordStore).
 *  - Wire the browser bridge client, timers and the five engine components.
 *  - Rehydrate snoozed items and the binding cache.
 *  - Start the HTTP API.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        configureLogging();
        var cfg = ServerConfig.fromArgs(args);
        EngineConfig engineCfg = cfg.engineConfigPath() != null && !cfg.engineConfigPath().isBlank()
                ? EngineConfig.fromJsonFile(Path.of(cfg.engineConfigPath()))
                : EngineConfig.defaults();
        Clock clock = Clock.systemUTC();

        // ------ Storage Layer -------
        Path data = Path.of(cfg.dataDir());
        var wal = new FileWal(data.resolve("wal"), engineCfg.walRotateBytes());
        var snaps = new FileSnapshotter(data.resolve("snap"));
        var store = new DurableRecordStore(wal, snaps, new SnapshotPolicy(engineCfg.snapshotEveryOps()));

        // ------ Browser + timers ------
        BrowserControl browser = new HttpBrowserControl(URI.create(cfg.bridgeUrl()), Duration.ofSeconds(10));
        var timers = new ExecutorTimerService(clock);

        // ------ Engine ------
        var remapper = new IdentityRemapper(store);
        var bindings = new BindingCache(store, browser, remapper, clock);
        var snapshotBuilder = new SnapshotBuilder(store, browser, bindings, remapper, clock);
        var creator = new BatchedTabCreator(browser, engineCfg.batchSize(), engineCfg.batchDelay());
        var restorer = new RestorationEngine(store, browser, creator, bindings, remapper);
        var snoozer = new SnoozeScheduler(store, browser, remapper, timers, clock, engineCfg.sweepInterval());
        var windowSnoozer = new WindowSnoozeService(snoozer, store, browser, creator, clock);

        snoozer.initialize();
        try {
            bindings.rebuild();
        } catch (RuntimeException e) {
            // Bridge not up yet: the cache fills lazily from the store.
            log.log(Level.WARNING, "Binding cache rebuild skipped: {0}", e.getMessage());
        }

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), snapshotBuilder, restorer, bindings, snoozer, windowSnoozer);
        web.start();
        log.log(Level.INFO, "TabTick listening on http://localhost:{0,number,#} (bridge {1}, data {2})",
                new Object[]{cfg.httpPort(), cfg.bridgeUrl(), data.toAbsolutePath()});

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            web.stop();
            timers.close();
            try {
                store.close();
            } catch (Exception e) {
                log.log(Level.WARNING, "Record store did not close cleanly", e);
            }
        }));
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }
}
