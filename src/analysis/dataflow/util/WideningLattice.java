package analysis.dataflow.util;

/**
 * Join semilattice with infinite ascending chains and a widening operator that forces them to stabilize. The solver
 * applies {@link #widen(Object, Object)} at loop headers.
 *
 * @param <S>
 *            type of the states
 */
public interface WideningLattice<S> extends JoinSemilattice<S> {

    /**
     * @param oldState
     *            state recorded before this visit
     * @param newState
     *            newly computed state, greater than or equal to oldState
     * @return state greater than or equal to both arguments, such that repeated widening reaches a fixed point in
     *         finitely many steps
     */
    S widen(S oldState, S newState);
}
