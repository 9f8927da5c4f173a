package me.golemcore.admission.testsupport;

import me.golemcore.admission.resilience.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sleeper that records requested delays and advances a {@link MutableClock}
 * instead of parking the thread.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private final MutableClock clock;
    private volatile boolean interrupting;

    public RecordingSleeper() {
        this(null);
    }

    public RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        sleeps.add(duration);
        if (interrupting) {
            throw new InterruptedException("interrupted in test");
        }
        if (clock != null) {
            clock.advance(duration);
        }
    }

    public void setInterrupting(boolean interrupting) {
        this.interrupting = interrupting;
    }

    public List<Duration> getSleeps() {
        return sleeps;
    }
}
