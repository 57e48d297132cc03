package com.example.parking.service.util;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic id source. Values are never reused for the lifetime of the instance,
 * independent of any table lock.
 */
public final class IdSequence {

    private final String prefix;
    private final AtomicLong counter;

    public IdSequence(String prefix) {
        this(prefix, 0);
    }

    public IdSequence(String prefix, long start) {
        this.prefix = prefix;
        this.counter = new AtomicLong(start);
    }

    public String next() {
        return prefix + counter.getAndIncrement();
    }
}
