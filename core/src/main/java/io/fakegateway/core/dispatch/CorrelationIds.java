package io.fakegateway.core.dispatch;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates request correlation ids in UUID layout. The first 16 hex digits are the current time
 * in milliseconds plus a process-wide counter, so ids never repeat within one JVM; the rest is
 * random.
 */
public final class CorrelationIds {

    private static final AtomicLong COUNTER = new AtomicLong();

    private CorrelationIds() {
        // utility class
    }

    /** Returns a fresh id such as {@code 18f3c2a9-b1e0-0001-7c3f-9a0e44b2d1c8}. */
    public static String next() {
        long millis = System.currentTimeMillis();
        long sequence = COUNTER.incrementAndGet() & 0xFFFFFL;
        String hex = String.format("%011x%05x%016x", millis, sequence, ThreadLocalRandom.current().nextLong());
        return hex.substring(0, 8) + '-'
                + hex.substring(8, 12) + '-'
                + hex.substring(12, 16) + '-'
                + hex.substring(16, 20) + '-'
                + hex.substring(20, 32);
    }
}
