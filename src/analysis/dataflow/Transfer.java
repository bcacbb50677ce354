package analysis.dataflow;

import analysis.cfg.BasicBlock;
import ast.statements.Statement;

/**
 * Transfer function of a data-flow analysis. Implementations must be deterministic and monotone: a larger input never
 * produces a smaller output.
 *
 * @param <S>
 *            type of the data-flow states
 */
public interface Transfer<S> {

    /**
     * Compute the state after a statement
     *
     * @param in
     *            state before the statement (after it for a backward analysis)
     * @param bb
     *            basic block containing the statement
     * @param stmt
     *            statement to analyze
     * @return new state, <code>in</code> itself if the statement has no effect
     */
    S transfer(S in, BasicBlock bb, Statement stmt);
}
