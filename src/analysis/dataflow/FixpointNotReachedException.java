package analysis.dataflow;

/**
 * Thrown when a solver exhausts its iteration budget before the states stabilize. This usually means the lattice has
 * infinite ascending chains or the transfer function is not monotone.
 */
public class FixpointNotReachedException extends RuntimeException {

    private static final long serialVersionUID = -3101455240212377946L;

    /**
     * Number of block visits performed before giving up
     */
    private final int visits;

    public FixpointNotReachedException(String message, int visits) {
        super(message);
        this.visits = visits;
    }

    public int getVisits() {
        return visits;
    }
}
