package analysis.dataflow.util;

/**
 * Semilattice with a least element and a least upper bound. Implementations must make {@link #join(Object, Object)}
 * commutative, associative and idempotent, and {@link #leq(Object, Object)} must agree with it: {@code leq(a, b)} iff
 * {@code join(a, b)} equals {@code b}.
 *
 * @param <S>
 *            type of the states
 */
public interface JoinSemilattice<S> extends Semilattice<S> {

    /**
     * @return the least element, the initial state of every basic block
     */
    S bottom();

    /**
     * @return least upper bound of a and b
     */
    S join(S a, S b);
}
