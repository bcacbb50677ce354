package analysis.dataflow.util;

/**
 * Widening lattice whose operations delegate to self-describing {@link AbstractValue} states
 *
 * @param <T>
 *            type of the abstract values
 */
public class AbstractValueLattice<T extends AbstractValue<T>> implements WideningLattice<T> {

    /**
     * Least element
     */
    private final T bottom;

    /**
     * @param bottom
     *            least element, {@link AbstractValue#isBottom()} must hold for it
     */
    public AbstractValueLattice(T bottom) {
        if (!bottom.isBottom()) {
            throw new IllegalArgumentException(bottom + " is not a bottom element");
        }
        this.bottom = bottom;
    }

    @Override
    public T bottom() {
        return bottom;
    }

    @Override
    public T join(T a, T b) {
        if (a.isBottom()) {
            return b;
        }
        if (b.isBottom()) {
            return a;
        }
        return a.join(b);
    }

    @Override
    public boolean leq(T a, T b) {
        return a.isBottom() || a.leq(b);
    }

    @Override
    public T widen(T oldState, T newState) {
        if (oldState.isBottom()) {
            return newState;
        }
        return oldState.widen(newState);
    }
}
