package com.reactive.notebook.runtime;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The symbol table shared by all cells of a session.
 *
 * <p>
 * A run never touches the live map: it works on a deep-copied
 * {@link Snapshot} that is committed back only when the run succeeds. Names
 * removed while a snapshot is outstanding (cell deletion, reset) stay removed
 * at commit unless the run itself rebound them.
 */
public final class Namespace {
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Map<String, Long> removedAt = new HashMap<>();
    private long version;
    private int outstanding;

    /** A private working copy for one run. */
    public static final class Snapshot {
        private final Map<String, Object> working;
        private final Map<String, Object> initial;
        private final long version;

        private Snapshot(Map<String, Object> working, long version) {
            this.working = working;
            this.initial = new HashMap<>(working);
            this.version = version;
        }

        public Map<String, Object> values() {
            return working;
        }

        private boolean rebound(String name, Object value) {
            return !initial.containsKey(name) || initial.get(name) != value;
        }
    }

    public synchronized Snapshot snapshot() {
        outstanding++;
        return new Snapshot(ValueCopier.copyAll(values), version);
    }

    /** Publishes a successful run's bindings, including names it deleted. */
    public synchronized void commit(Snapshot snapshot) {
        try {
            for (String name : snapshot.initial.keySet()) {
                if (!snapshot.working.containsKey(name))
                    values.remove(name);
            }
            for (Map.Entry<String, Object> e : snapshot.working.entrySet()) {
                String name = e.getKey();
                Long removed = removedAt.get(name);
                if (removed != null && removed > snapshot.version && !snapshot.rebound(name, e.getValue()))
                    continue;
                values.put(name, e.getValue());
            }
        } finally {
            release();
        }
    }

    /** Drops a failed or cancelled run's working copy. */
    public synchronized void discard(Snapshot snapshot) {
        release();
    }

    private void release() {
        version++;
        if (--outstanding <= 0) {
            outstanding = 0;
            removedAt.clear();
        }
    }

    public synchronized void remove(Collection<String> names) {
        version++;
        for (String name : names) {
            values.remove(name);
            if (outstanding > 0)
                removedAt.put(name, version);
        }
    }

    public synchronized void clear() {
        remove(Set.copyOf(values.keySet()));
    }

    public synchronized boolean contains(String name) {
        return values.containsKey(name);
    }

    public synchronized Object get(String name) {
        return values.get(name);
    }

    public synchronized Set<String> names() {
        return new TreeSet<>(values.keySet());
    }

    public synchronized int size() {
        return values.size();
    }
}
