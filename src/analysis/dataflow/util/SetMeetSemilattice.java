package analysis.dataflow.util;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Powerset of a fixed universe ordered by inclusion, meet is intersection. Used by must-analyses, where the universe
 * (the top element) stands for "no information yet".
 *
 * @param <T>
 *            type of the set elements
 */
public class SetMeetSemilattice<T> implements MeetSemilattice<Set<T>> {

    private final Set<T> universe;

    /**
     * @param universe
     *            every element that may appear in a state
     */
    public SetMeetSemilattice(Set<T> universe) {
        this.universe = Collections.unmodifiableSet(new LinkedHashSet<>(universe));
    }

    @Override
    public Set<T> top() {
        return universe;
    }

    @Override
    public Set<T> meet(Set<T> a, Set<T> b) {
        if (b.containsAll(a)) {
            return a;
        }
        if (a.containsAll(b)) {
            return b;
        }
        Set<T> intersection = new LinkedHashSet<>(a);
        intersection.retainAll(b);
        return Collections.unmodifiableSet(intersection);
    }

    @Override
    public boolean leq(Set<T> a, Set<T> b) {
        return b.containsAll(a);
    }
}
