package com.resolveai.entry.services;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Generates insert ids: unique, fixed-width strings whose lexical order matches the order they were generated in.
 *
 * <p>An id is 28 lowercase hex characters: 12 for the epoch milliseconds, 8 for a random salt chosen when the
 * generator is created and 8 for a counter that advances on every call. The millisecond part never moves backwards,
 * even if the clock does, and is bumped when the counter wraps. Ids from different processes differ in their salt.
 */
public class InsertIdGenerator {

    private static final long MAX_MILLIS = 0xFFFF_FFFF_FFFFL;
    private static final long MAX_COUNTER = 0xFFFF_FFFFL;

    private static final InsertIdGenerator DEFAULT = new InsertIdGenerator(Clock.systemUTC(), newSalt());

    private final Clock clock;
    private final int salt;

    private long lastMillis;
    private long counter;

    public InsertIdGenerator(Clock clock, int salt) {
        this.clock = clock;
        this.salt = salt;
    }

    /**
     * The process-wide generator used by entries that are not given one explicitly.
     */
    public static InsertIdGenerator getDefault() {
        return DEFAULT;
    }

    public synchronized String next() {
        long millis = Math.min(Math.max(lastMillis, clock.millis()), MAX_MILLIS);
        if (counter == MAX_COUNTER) {
            counter = 0;
            millis = Math.min(Math.max(millis, lastMillis + 1), MAX_MILLIS);
        } else {
            counter++;
        }
        lastMillis = millis;
        return String.format("%012x%08x%08x", millis, salt, counter);
    }

    private static int newSalt() {
        return new SecureRandom().nextInt();
    }
}
