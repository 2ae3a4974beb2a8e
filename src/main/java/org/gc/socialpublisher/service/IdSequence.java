package org.gc.socialpublisher.service;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Monotonic numeric ids for documents whose index has no sequence of its own. Seeded lazily from
 * the highest stored id.
 */
public class IdSequence {

    private final LongSupplier highestStoredId;
    private final AtomicLong last = new AtomicLong(-1);

    public IdSequence(LongSupplier highestStoredId) {
        this.highestStoredId = highestStoredId;
    }

    public long next() {
        if (last.get() < 0) {
            synchronized (this) {
                if (last.get() < 0) {
                    last.set(Math.max(0, highestStoredId.getAsLong()));
                }
            }
        }
        return last.incrementAndGet();
    }
}
