package analysis.dataflow.util;

/**
 * Powerset lattice over {@link SharedSet}s, join is union
 *
 * @param <T>
 *            type of the set elements
 */
public class SharedSetLattice<T> implements JoinSemilattice<SharedSet<T>> {

    @Override
    public SharedSet<T> bottom() {
        return SharedSet.empty();
    }

    @Override
    public SharedSet<T> join(SharedSet<T> a, SharedSet<T> b) {
        return a.union(b);
    }

    @Override
    public boolean leq(SharedSet<T> a, SharedSet<T> b) {
        return b.containsAll(a);
    }
}
