package io.ringbag.clock;

import java.time.Instant;

/**
 * Epoch nanoseconds that never run backwards: wall-clock time taken once at construction, advanced by
 * {@link System#nanoTime()}.
 */
public final class SystemBagClock implements BagClock {
    private final long epochNanosAtStart;
    private final long nanoTimeAtStart;

    public SystemBagClock() {
        final Instant now = Instant.now();
        this.nanoTimeAtStart = System.nanoTime();
        this.epochNanosAtStart = now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }

    @Override
    public long now() {
        return epochNanosAtStart + (System.nanoTime() - nanoTimeAtStart);
    }
}
