package analysis.dataflow.util;

/**
 * Partially ordered set of data-flow states
 *
 * @param <S>
 *            type of the states
 */
public interface Semilattice<S> {

    /**
     * Partial order of the lattice
     *
     * @param a
     *            first state
     * @param b
     *            second state
     * @return true if a is less than or equal to b
     */
    boolean leq(S a, S b);
}
