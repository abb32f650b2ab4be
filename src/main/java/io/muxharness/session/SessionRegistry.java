package io.muxharness.session;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Every session name the run may have created. Names are added before the target is
 * asked to create them and are only removed by {@link #drain()}, so the final sweep
 * covers sessions whose scenario failed half-way.
 */
public final class SessionRegistry {
    private final Set<String> names = new LinkedHashSet<>();

    public synchronized void register(String name) {
        if (name != null && !name.isBlank()) {
            names.add(name);
        }
    }

    public synchronized void registerAll(Collection<String> more) {
        if (more == null) {
            return;
        }
        for (String name : more) {
            register(name);
        }
    }

    public synchronized List<String> names() {
        return List.copyOf(names);
    }

    public synchronized List<String> drain() {
        List<String> out = List.copyOf(names);
        names.clear();
        return out;
    }

    public synchronized int size() {
        return names.size();
    }
}
