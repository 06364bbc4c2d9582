package org.fpbjs.amlmapper.util;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic identifiers of the form {@code <prefix><n>}, starting at 1.
 */
public class SequentialIdGenerator implements IdGenerator {
    private final String prefix;
    private final AtomicLong counter = new AtomicLong();

    public SequentialIdGenerator(String prefix) {
        this.prefix = prefix;
    }

    public SequentialIdGenerator() {
        this("id-");
    }

    @Override
    public String nextId() {
        return prefix + counter.incrementAndGet();
    }
}
