package io.chrono4j.internal;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

final class NamedDaemonThreadFactory implements ThreadFactory {

    private final String name;
    private final AtomicInteger seq = new AtomicInteger();

    NamedDaemonThreadFactory(String name) {
        this.name = name;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r);
        t.setName(name + "-" + seq.incrementAndGet());
        t.setDaemon(true);
        return t;
    }
}
