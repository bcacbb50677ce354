package analysis.dataflow.util;

/**
 * Semilattice with a greatest element and a greatest lower bound, for must-analyses
 *
 * @param <S>
 *            type of the states
 */
public interface MeetSemilattice<S> extends Semilattice<S> {

    S top();

    /**
     * @return greatest lower bound of a and b
     */
    S meet(S a, S b);
}
