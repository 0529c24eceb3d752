package io.fakegateway.core.worker;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Named daemon threads for stdio pumps and IPC exchanges. Daemon threads keep background worker
 * plumbing from holding the host JVM open.
 */
final class NamedThreadFactory implements ThreadFactory {

    private final String prefix;
    private final AtomicInteger index = new AtomicInteger(0);

    NamedThreadFactory(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r);
        t.setName(prefix + index.incrementAndGet());
        t.setDaemon(true);
        return t;
    }
}
