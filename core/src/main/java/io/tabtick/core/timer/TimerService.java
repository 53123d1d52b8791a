package io.tabtick.core.timer;

import java.time.Duration;
import java.util.Optional;

/**
 * Named one-shot and periodic timers.
 * <p>
 * Semantics:
 *  - Arming a name that is already armed replaces the previous timer.
 *  - Delivery is at most approximately once: a timer can be lost when the
 *    process restarts, so callers that need a guarantee must also sweep.
 *  - A one-shot timer is disarmed once it has been delivered.
 */
public interface TimerService {

    /** Arm a one-shot timer at the given epoch millis (past times fire promptly). */
    void arm(String name, long whenMillis);

    /** Arm a recurring timer; the first delivery happens one period from now. */
    void armPeriodic(String name, Duration period);

    /** Cancel a timer. Returns false if nothing was armed under that name. */
    boolean cancel(String name);

    Optional<Alarm> get(String name);

    /** Register the single receiver of timer deliveries. */
    void setListener(Listener listener);

    /**
     * An armed timer.
     *
     * @param periodMillis 0 for one-shot timers.
     */
    record Alarm(String name, long whenMillis, long periodMillis) {
        public boolean periodic() {
            return periodMillis > 0;
        }
    }

    @FunctionalInterface
    interface Listener {
        void onTimer(String name);
    }
}
