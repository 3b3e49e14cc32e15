package com.pavan.shardedcounter.counter;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Composite counter name made of an ordered tuple of components, e.g.
 * {@code CounterKey.of(userId, "followers")}. Equality and hashing are structural.
 * Counts never roll up across a prefix of the tuple; keep a separate counter per prefix
 * when a rolled-up total is needed.
 */
public final class CounterKey implements Comparable<CounterKey>, Serializable {

    private static final long serialVersionUID = 1L;

    private final List<Object> components;

    private CounterKey(List<Object> components) {
        this.components = components;
    }

    /**
     * Creates a key from its components.
     *
     * @throws IllegalArgumentException if there are no components, or a component is null
     *                                  or not serializable
     */
    public static CounterKey of(Object... components) {
        if (components == null || components.length == 0) {
            throw new IllegalArgumentException("Counter key needs at least one component");
        }
        List<Object> copy = new ArrayList<>(components.length);
        for (Object component : components) {
            if (component == null) {
                throw new IllegalArgumentException("Counter key components must not be null");
            }
            if (!(component instanceof Serializable)) {
                throw new IllegalArgumentException(
                    "Counter key component is not serializable: " + component.getClass().getName());
            }
            copy.add(component);
        }
        return new CounterKey(Collections.unmodifiableList(copy));
    }

    public List<Object> getComponents() {
        return components;
    }

    public Object get(int index) {
        return components.get(index);
    }

    public int size() {
        return components.size();
    }

    /**
     * Orders component by component. Components of the same comparable type use their natural
     * order; otherwise they fall back to class name, then string form. Shorter keys sort first
     * when one is a prefix of the other.
     */
    @Override
    @SuppressWarnings("unchecked")
    public int compareTo(CounterKey other) {
        int shared = Math.min(components.size(), other.components.size());
        for (int i = 0; i < shared; i++) {
            Object a = components.get(i);
            Object b = other.components.get(i);
            int cmp;
            if (a.getClass() == b.getClass() && a instanceof Comparable) {
                cmp = ((Comparable<Object>) a).compareTo(b);
            } else {
                cmp = a.getClass().getName().compareTo(b.getClass().getName());
                if (cmp == 0) {
                    cmp = a.toString().compareTo(b.toString());
                }
            }
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(components.size(), other.components.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CounterKey)) {
            return false;
        }
        return components.equals(((CounterKey) o).components);
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }

    @Override
    public String toString() {
        return Arrays.toString(components.toArray());
    }
}
