package analysis.dataflow.util;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Powerset lattice ordered by inclusion, join is union
 *
 * @param <T>
 *            type of the set elements
 */
public class SetJoinSemilattice<T> implements JoinSemilattice<Set<T>> {

    @Override
    public Set<T> bottom() {
        return Collections.emptySet();
    }

    @Override
    public Set<T> join(Set<T> a, Set<T> b) {
        if (a.containsAll(b)) {
            return a;
        }
        if (b.containsAll(a)) {
            return b;
        }
        Set<T> union = new LinkedHashSet<>(a);
        union.addAll(b);
        return Collections.unmodifiableSet(union);
    }

    @Override
    public boolean leq(Set<T> a, Set<T> b) {
        return b.containsAll(a);
    }
}
