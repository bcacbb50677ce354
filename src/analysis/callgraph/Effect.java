package analysis.callgraph;

/**
 * Externally visible actions a function may perform, directly or through its callees
 */
public enum Effect {
    /**
     * Sends a message or funds
     */
    SEND,
    /**
     * Reads a contract field
     */
    STATE_READ,
    /**
     * Writes a contract field
     */
    STATE_WRITE,
    /**
     * Reads the current time
     */
    ACCESS_DATETIME,
    /**
     * Uses the pseudo-random generator
     */
    PRG_USE,
    /**
     * Initializes the seed of the pseudo-random generator
     */
    PRG_SEED_INIT;
}
