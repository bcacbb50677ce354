package analysis.interval;

/**
 * Thrown by interval arithmetic when an operation has no defined result, e.g. dividing by an interval containing zero
 * or adding opposite infinities
 */
public class IntervalArithmeticException extends ArithmeticException {

    private static final long serialVersionUID = 6013829617265531009L;

    public IntervalArithmeticException(String message) {
        super(message);
    }
}
