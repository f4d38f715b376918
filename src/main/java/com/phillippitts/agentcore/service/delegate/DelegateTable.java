package com.phillippitts.agentcore.service.delegate;

import com.phillippitts.agentcore.exception.DelegateNotFoundException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable name-to-delegate table, in registration order.
 */
public final class DelegateTable {

    private static final DelegateTable EMPTY = new DelegateTable(Map.of());

    private final Map<String, Delegate> delegates;

    private DelegateTable(Map<String, Delegate> delegates) {
        this.delegates = delegates;
    }

    public static DelegateTable empty() {
        return EMPTY;
    }

    /**
     * @throws IllegalArgumentException when two delegates share a name or a name is blank
     */
    public static DelegateTable of(List<? extends Delegate> delegates) {
        Objects.requireNonNull(delegates, "delegates");
        Map<String, Delegate> byName = new LinkedHashMap<>();
        for (Delegate d : delegates) {
            String name = Objects.requireNonNull(d, "delegate").name();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Delegate name must not be blank: " + d.getClass().getName());
            }
            if (byName.putIfAbsent(name, d) != null) {
                throw new IllegalArgumentException("Duplicate delegate name: " + name);
            }
        }
        return new DelegateTable(Collections.unmodifiableMap(byName));
    }

    public Optional<Delegate> find(String name) {
        return Optional.ofNullable(name == null ? null : delegates.get(name));
    }

    /**
     * @throws DelegateNotFoundException listing the available names
     */
    public Delegate require(String name) {
        return find(name).orElseThrow(() -> new DelegateNotFoundException(name, names()));
    }

    public List<String> names() {
        return List.copyOf(delegates.keySet());
    }

    /** Name to description, in registration order. */
    public Map<String, String> descriptions() {
        Map<String, String> out = new LinkedHashMap<>();
        delegates.forEach((name, d) -> out.put(name, d.description() == null ? "" : d.description()));
        return Collections.unmodifiableMap(out);
    }

    public int size() {
        return delegates.size();
    }

    public boolean isEmpty() {
        return delegates.isEmpty();
    }
}
