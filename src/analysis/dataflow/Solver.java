package analysis.dataflow;

/**
 * Computes a data-flow fixpoint
 *
 * @param <S>
 *            type of the data-flow states
 */
public interface Solver<S> {

    /**
     * Run the analysis to a fixed point
     *
     * @return state of every block at the fixed point
     * @throws FixpointNotReachedException
     *             if the analysis did not stabilize within the solver's budget
     */
    AnalysisResult<S> solve();
}
