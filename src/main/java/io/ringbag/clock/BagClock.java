package io.ringbag.clock;

/**
 * Source of receive timestamps, in nanoseconds.
 */
@FunctionalInterface
public interface BagClock {

    long now();

    static BagClock system() {
        return new SystemBagClock();
    }
}
