package util;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;

/**
 * FIFO queue of pending work items. An item already waiting is not queued a second time, but an item may be queued
 * again once it has been polled.
 *
 * @param <T>
 *            type of the work items
 */
public class WorkQueue<T> {

    /**
     * Pending items in insertion order
     */
    private final LinkedHashSet<T> pending = new LinkedHashSet<>();

    public WorkQueue() {
        // empty queue
    }

    /**
     * @param initial
     *            items to queue, in iteration order
     */
    public WorkQueue(Collection<? extends T> initial) {
        addAll(initial);
    }

    /**
     * Queue an item unless it is already waiting
     *
     * @param item
     *            item to queue
     * @return whether the item was queued
     */
    public boolean add(T item) {
        return pending.add(item);
    }

    /**
     * @param items
     *            items to queue, in iteration order
     * @return whether at least one of them was queued
     */
    public boolean addAll(Collection<? extends T> items) {
        boolean changed = false;
        for (T item : items) {
            changed |= pending.add(item);
        }
        return changed;
    }

    /**
     * Remove the oldest pending item
     *
     * @return the item, or null if nothing is pending
     */
    public T poll() {
        Iterator<T> iter = pending.iterator();
        if (!iter.hasNext()) {
            return null;
        }
        T item = iter.next();
        iter.remove();
        return item;
    }

    public boolean contains(T item) {
        return pending.contains(item);
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    public int size() {
        return pending.size();
    }

    @Override
    public String toString() {
        return pending.toString();
    }
}
