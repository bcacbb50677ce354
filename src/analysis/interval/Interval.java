package analysis.interval;

import java.math.BigInteger;

/**
 * Interval [low, high] of integers whose bounds may be infinite. Intervals are immutable; operations return new
 * intervals. Any interval containing no integer is {@link #EMPTY}, so a lower bound is never +inf and an upper bound
 * never -inf.
 */
public final class Interval {

    /**
     * (-inf, +inf), every integer
     */
    public static final Interval FULL = new Interval(Num.minusInf(), Num.plusInf());
    /**
     * Interval containing no number, represented as (+inf, -inf)
     */
    public static final Interval EMPTY = new Interval(Num.plusInf(), Num.minusInf());

    private final Num low;
    private final Num high;

    private Interval(Num low, Num high) {
        this.low = low;
        this.high = high;
    }

    /**
     * Interval between the two bounds (inclusive)
     *
     * @param low
     *            lower bound
     * @param high
     *            upper bound
     * @return the interval, {@link #EMPTY} if low is greater than high or both bounds are the same infinity
     */
    public static Interval of(Num low, Num high) {
        if (low.compareTo(high) > 0 || low.isPlusInf() || high.isMinusInf()) {
            return EMPTY;
        }
        if (low.isMinusInf() && high.isPlusInf()) {
            return FULL;
        }
        return new Interval(low, high);
    }

    public static Interval of(long low, long high) {
        return of(Num.ofInt(low), Num.ofInt(high));
    }

    /**
     * Singleton interval
     */
    public static Interval fromNum(long n) {
        Num num = Num.ofInt(n);
        return new Interval(num, num);
    }

    public static Interval fromNum(BigInteger n) {
        Num num = Num.ofInt(n);
        return new Interval(num, num);
    }

    public Num getLow() {
        return low;
    }

    public Num getHigh() {
        return high;
    }

    public boolean isFull() {
        return low.isMinusInf() && high.isPlusInf();
    }

    public boolean isEmpty() {
        return low.isPlusInf() && high.isMinusInf();
    }

    /**
     * @return whether this interval contains exactly one finite number
     */
    public boolean isSingleton() {
        return low.isFinite() && low.equals(high);
    }

    /**
     * Abstract {@code +}
     */
    public Interval plus(Interval other) {
        if (this.isEmpty() || other.isEmpty()) {
            return EMPTY;
        }
        return of(low.add(other.low), high.add(other.high));
    }

    /**
     * Abstract unary {@code -}
     */
    public Interval inv() {
        if (isEmpty()) {
            return EMPTY;
        }
        return of(high.negate(), low.negate());
    }

    /**
     * Abstract binary {@code -}
     */
    public Interval minus(Interval other) {
        return plus(other.inv());
    }

    /**
     * Abstract {@code *}
     */
    public Interval times(Interval other) {
        if (this.isEmpty() || other.isEmpty()) {
            return EMPTY;
        }
        Num a = low.multiply(other.low);
        Num b = low.multiply(other.high);
        Num c = high.multiply(other.low);
        Num d = high.multiply(other.high);
        return of(Num.min(a, b, c, d), Num.max(a, b, c, d));
    }

    /**
     * Abstract {@code /}
     *
     * @throws IntervalArithmeticException
     *             if other contains zero
     */
    public Interval div(Interval other) {
        if (other.containsZero()) {
            throw new IntervalArithmeticException("Division by interval containing zero: " + other);
        }
        if (this.isEmpty() || other.isEmpty()) {
            return EMPTY;
        }
        Num a = low.divide(other.low);
        Num b = low.divide(other.high);
        Num c = high.divide(other.low);
        Num d = high.divide(other.high);
        return of(Num.min(a, b, c, d), Num.max(a, b, c, d));
    }

    public boolean containsZero() {
        Num zero = Num.ofInt(0);
        return low.compareTo(zero) <= 0 && high.compareTo(zero) >= 0;
    }

    /**
     * @return whether every number of this interval is in other
     */
    public boolean isContainedIn(Interval other) {
        if (this.isEmpty()) {
            return true;
        }
        if (other.isEmpty()) {
            return false;
        }
        return other.low.compareTo(low) <= 0 && high.compareTo(other.high) <= 0;
    }

    /**
     * Abstract {@code ==}, with 1 standing for true and 0 for false
     *
     * @return {@link #FULL} if either side is full, [1,1] if both sides are the same singleton, [0,1] otherwise
     */
    public Interval equalsInterval(Interval other) {
        if (this.isFull() || other.isFull()) {
            return FULL;
        }
        if (this.isSingleton() && other.isSingleton() && low.equals(other.low)) {
            return fromNum(1);
        }
        return of(0, 1);
    }

    @Override
    public int hashCode() {
        return 31 * low.hashCode() + high.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Interval)) {
            return false;
        }
        Interval other = (Interval) obj;
        return low.equals(other.low) && high.equals(other.high);
    }

    @Override
    public String toString() {
        if (isFull()) {
            return "(-∞, +∞)";
        }
        if (isEmpty()) {
            return "∅";
        }
        if (low.equals(high)) {
            return low.toString();
        }
        return "(" + low + ", " + high + ")";
    }
}
