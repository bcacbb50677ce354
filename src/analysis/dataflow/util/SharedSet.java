package analysis.dataflow.util;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable set that may be shared between data-flow states. Operations that would not change the set return the
 * receiver (or the argument) instead of a copy, so states along a path without new facts share one instance.
 *
 * @param <T>
 *            type of the elements
 */
public final class SharedSet<T> implements Iterable<T> {

    @SuppressWarnings("rawtypes")
    private static final SharedSet EMPTY = new SharedSet<>(Collections.emptySet());

    private final Set<T> elements;

    private SharedSet(Set<T> elements) {
        this.elements = elements;
    }

    @SuppressWarnings("unchecked")
    public static <T> SharedSet<T> empty() {
        return EMPTY;
    }

    public static <T> SharedSet<T> of(Collection<? extends T> elements) {
        if (elements.isEmpty()) {
            return empty();
        }
        return new SharedSet<T>(Collections.unmodifiableSet(new LinkedHashSet<T>(elements)));
    }

    /**
     * @return this set if it already contains e, otherwise a new set with e added
     */
    public SharedSet<T> add(T e) {
        if (elements.contains(e)) {
            return this;
        }
        Set<T> copy = new LinkedHashSet<>(elements);
        copy.add(e);
        return new SharedSet<>(Collections.unmodifiableSet(copy));
    }

    /**
     * @return this set if it does not contain e, otherwise a new set without e
     */
    public SharedSet<T> remove(T e) {
        if (!elements.contains(e)) {
            return this;
        }
        Set<T> copy = new LinkedHashSet<>(elements);
        copy.remove(e);
        return copy.isEmpty() ? SharedSet.<T> empty() : new SharedSet<>(Collections.unmodifiableSet(copy));
    }

    /**
     * Union, returning one of the operands when it already contains the other
     */
    public SharedSet<T> union(SharedSet<T> other) {
        if (this.containsAll(other)) {
            return this;
        }
        if (other.containsAll(this)) {
            return other;
        }
        Set<T> copy = new LinkedHashSet<>(elements);
        copy.addAll(other.elements);
        return new SharedSet<>(Collections.unmodifiableSet(copy));
    }

    public boolean containsAll(SharedSet<T> other) {
        return other == this || elements.containsAll(other.elements);
    }

    public boolean contains(Object o) {
        return elements.contains(o);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * @return unmodifiable view of the elements
     */
    public Set<T> asSet() {
        return elements;
    }

    @Override
    public Iterator<T> iterator() {
        return elements.iterator();
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SharedSet)) {
            return false;
        }
        return elements.equals(((SharedSet<?>) obj).elements);
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
