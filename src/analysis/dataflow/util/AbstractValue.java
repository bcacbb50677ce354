package analysis.dataflow.util;

/**
 * Data-flow state that carries its own lattice operations. Wrap the bottom value in an {@link AbstractValueLattice}
 * to hand such states to the solver.
 *
 * @param <T>
 *            the implementing class, e.g. {@code Taint implements AbstractValue<Taint>}
 */
public interface AbstractValue<T> {

    /**
     * @return whether this state is the least element
     */
    boolean isBottom();

    /**
     * Partial order check
     *
     * @param that
     *            state to compare against
     * @return whether this state is below or equal to that
     */
    boolean leq(T that);

    /**
     * Least upper bound
     *
     * @param that
     *            state to merge in
     * @return state above both this and that
     */
    T join(T that);

    /**
     * Extrapolate a growing state. Values with finite ascending chains can return {@code next}.
     *
     * @param next
     *            state computed after this one, above or equal to this
     * @return state above both, stabilizing after finitely many applications
     */
    T widen(T next);
}
