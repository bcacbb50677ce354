package analysis.cfg;

/**
 * Role of a basic block in its control-flow graph
 */
public enum BasicBlockKind {
    /**
     * Straight-line statement
     */
    REGULAR,
    /**
     * Statement with more than one successor, e.g. a conditional
     */
    BRANCH,
    /**
     * Condition of a loop, the target of the loop's back edge
     */
    LOOP_HEADER,
    /**
     * Statement calling a function defined in the compilation unit
     */
    CALL,
    /**
     * Statement terminating the function
     */
    EXIT;
}
