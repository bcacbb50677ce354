package analysis.cfg;

/**
 * Kind of code a control-flow graph was built for
 */
public enum FunctionKind {
    /**
     * Free function
     */
    FUNCTION,
    /**
     * Contract method or contract initializer
     */
    METHOD,
    /**
     * Message receiver of a contract
     */
    RECEIVE;
}
