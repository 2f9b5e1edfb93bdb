package org.dxworks.mathrules.rules;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Named sets of strings consulted by {@code IsInDefinition} and {@code IsNode}.
 */
public final class Definitions {

    public static final Definitions EMPTY = new Definitions(Collections.emptyMap());

    private final Map<String, Set<String>> sets;

    public Definitions(Map<String, ? extends Collection<String>> sets) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        sets.forEach((name, values) -> copy.put(name, Collections.unmodifiableSet(new LinkedHashSet<>(values))));
        this.sets = Collections.unmodifiableMap(copy);
    }

    public boolean has(String name) {
        return sets.containsKey(name);
    }

    public Set<String> get(String name) {
        return sets.getOrDefault(name, Collections.emptySet());
    }

    public boolean contains(String name, String value) {
        return get(name).contains(value);
    }

    public Set<String> names() {
        return sets.keySet();
    }

    /**
     * Sets from {@code later} replace same-named sets of this instance.
     */
    public Definitions merge(Definitions later) {
        Map<String, Set<String>> merged = new LinkedHashMap<>(sets);
        merged.putAll(later.sets);
        return new Definitions(merged);
    }
}
