package io.tabtick.server.timer;

import io.tabtick.core.timer.TimerService;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TimerService backed by a single-threaded daemon scheduler.
 * <p>
 * Deliveries run one at a time on the "tabtick-timers" thread, so a listener
 * never observes two timers concurrently. A listener failure is logged and does
 * not cancel periodic timers.
 * <p>
 * Timers live in memory only; after a restart the owner re-arms them.
 */
public final class ExecutorTimerService implements TimerService, AutoCloseable {
    private static final Logger log = Logger.getLogger(ExecutorTimerService.class.getName());

    private record Entry(Alarm alarm, ScheduledFuture<?> future) {}

    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Map<String, Entry> armed = new ConcurrentHashMap<>();
    private volatile Listener listener;

    public ExecutorTimerService(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tabtick-timers");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public synchronized void arm(String name, long whenMillis) {
        Objects.requireNonNull(name, "name");
        cancel(name);
        long delay = Math.max(0L, whenMillis - clock.millis());
        Alarm alarm = new Alarm(name, whenMillis, 0L);
        // The entry is registered before the task can observe it: we hold the lock.
        ScheduledFuture<?> f = scheduler.schedule(() -> fireOnce(name, alarm), delay, TimeUnit.MILLISECONDS);
        armed.put(name, new Entry(alarm, f));
    }

    @Override
    public synchronized void armPeriodic(String name, Duration period) {
        Objects.requireNonNull(name, "name");
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be > 0");
        }
        cancel(name);
        long periodMs = period.toMillis();
        Alarm alarm = new Alarm(name, clock.millis() + periodMs, periodMs);
        ScheduledFuture<?> f = scheduler.scheduleWithFixedDelay(
                () -> deliver(name), periodMs, periodMs, TimeUnit.MILLISECONDS);
        armed.put(name, new Entry(alarm, f));
    }

    @Override
    public synchronized boolean cancel(String name) {
        Entry e = armed.remove(name);
        if (e == null) {
            return false;
        }
        e.future().cancel(false);
        return true;
    }

    @Override
    public Optional<Alarm> get(String name) {
        Entry e = armed.get(name);
        return e == null ? Optional.empty() : Optional.of(e.alarm());
    }

    @Override
    public void setListener(Listener listener) {
        this.listener = listener;
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        armed.clear();
    }

    // ---------- internals ----------

    private void fireOnce(String name, Alarm alarm) {
        synchronized (this) {
            Entry e = armed.get(name);
            if (e == null || e.alarm() != alarm) {
                // Re-armed or cancelled after this task was queued.
                return;
            }
            armed.remove(name);
        }
        deliver(name);
    }

    private void deliver(String name) {
        Listener l = listener;
        if (l == null) {
            log.log(Level.FINE, "Timer {0} fired with no listener", name);
            return;
        }
        try {
            l.onTimer(name);
        } catch (Exception e) {
            log.log(Level.WARNING, "Timer " + name + " listener failed", e);
        }
    }
}
