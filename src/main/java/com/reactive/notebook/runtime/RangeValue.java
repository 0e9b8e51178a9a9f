package com.reactive.notebook.runtime;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy integer range, so that {@code for i in range(10**9)} stays cancellable
 * without materializing a list.
 */
public record RangeValue(long start, long stop, long step) implements Iterable<Object> {

    public long size() {
        if (step > 0)
            return start >= stop ? 0 : (stop - start - 1) / step + 1;
        return start <= stop ? 0 : (start - stop - 1) / (-step) + 1;
    }

    public long get(long index) {
        return start + index * step;
    }

    @Override
    public Iterator<Object> iterator() {
        return new Iterator<>() {
            private long next = start;

            @Override
            public boolean hasNext() {
                return step > 0 ? next < stop : next > stop;
            }

            @Override
            public Object next() {
                if (!hasNext())
                    throw new NoSuchElementException();
                long v = next;
                next += step;
                return v;
            }
        };
    }
}
