package com.storesync.common;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sleeper that records requested delays instead of waiting; optionally advances a {@link MutableClock}.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Long> delays = new CopyOnWriteArrayList<>();
    private final MutableClock clock;

    public RecordingSleeper() {
        this(null);
    }

    public RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public void sleep(long delayMs, CancellationToken token) {
        token.throwIfCancelled();
        delays.add(delayMs);
        if (clock != null) {
            clock.advance(delayMs);
        }
    }

    public List<Long> delays() {
        return List.copyOf(delays);
    }
}
