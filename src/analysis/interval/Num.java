package analysis.interval;

import java.math.BigInteger;

/**
 * Unbounded integer extended with positive and negative infinity, used as interval bounds
 */
public final class Num implements Comparable<Num> {

    private static enum Kind {
        MINUS_INF, INT, PLUS_INF
    }

    private static final Num PLUS_INF = new Num(Kind.PLUS_INF, null);
    private static final Num MINUS_INF = new Num(Kind.MINUS_INF, null);
    private static final Num ZERO = new Num(Kind.INT, BigInteger.ZERO);
    private static final Num ONE = new Num(Kind.INT, BigInteger.ONE);

    private final Kind kind;
    /**
     * Value of a finite number, null for the infinities
     */
    private final BigInteger value;

    private Num(Kind kind, BigInteger value) {
        this.kind = kind;
        this.value = value;
    }

    public static Num ofInt(BigInteger value) {
        return new Num(Kind.INT, value);
    }

    public static Num ofInt(long value) {
        return new Num(Kind.INT, BigInteger.valueOf(value));
    }

    public static Num plusInf() {
        return PLUS_INF;
    }

    public static Num minusInf() {
        return MINUS_INF;
    }

    public boolean isFinite() {
        return kind == Kind.INT;
    }

    public boolean isPlusInf() {
        return kind == Kind.PLUS_INF;
    }

    public boolean isMinusInf() {
        return kind == Kind.MINUS_INF;
    }

    public boolean isZero() {
        return kind == Kind.INT && value.signum() == 0;
    }

    /**
     * @return value of a finite number
     * @throws IllegalStateException
     *             if this number is infinite
     */
    public BigInteger getValue() {
        if (value == null) {
            throw new IllegalStateException("No finite value for " + this);
        }
        return value;
    }

    /**
     * -1, 0 or 1 depending on the sign of this number
     */
    private int signum() {
        switch (kind) {
        case PLUS_INF:
            return 1;
        case MINUS_INF:
            return -1;
        default:
            return value.signum();
        }
    }

    private static Num infinityWithSign(int sign) {
        return sign > 0 ? PLUS_INF : MINUS_INF;
    }

    /**
     * @throws IntervalArithmeticException
     *             when adding infinities of opposite signs
     */
    public Num add(Num that) {
        if (this.isFinite() && that.isFinite()) {
            return ofInt(this.value.add(that.value));
        }
        if ((this.isPlusInf() && that.isMinusInf()) || (this.isMinusInf() && that.isPlusInf())) {
            throw new IntervalArithmeticException("Cannot add +inf and -inf");
        }
        return this.isFinite() ? that : this;
    }

    public Num negate() {
        switch (kind) {
        case PLUS_INF:
            return MINUS_INF;
        case MINUS_INF:
            return PLUS_INF;
        default:
            return ofInt(value.negate());
        }
    }

    /**
     * Multiplication, zero times an infinity is zero
     */
    public Num multiply(Num that) {
        if (this.isFinite() && that.isFinite()) {
            return ofInt(this.value.multiply(that.value));
        }
        if (this.isZero() || that.isZero()) {
            return ZERO;
        }
        return infinityWithSign(this.signum() * that.signum());
    }

    /**
     * Division truncating toward zero. A finite number divided by an infinity is zero; an infinity divided by an
     * infinity is 1 when the signs agree and -1 otherwise.
     *
     * @throws IntervalArithmeticException
     *             when dividing by zero
     */
    public Num divide(Num that) {
        if (that.isZero()) {
            throw new IntervalArithmeticException("Division by zero");
        }
        if (this.isFinite() && that.isFinite()) {
            return ofInt(this.value.divide(that.value));
        }
        if (this.isFinite()) {
            return ZERO;
        }
        if (that.isFinite()) {
            return infinityWithSign(this.signum() * that.signum());
        }
        return this.kind == that.kind ? ONE : ofInt(-1);
    }

    @Override
    public int compareTo(Num that) {
        if (this.isFinite() && that.isFinite()) {
            return this.value.compareTo(that.value);
        }
        return Integer.compare(this.kind.ordinal(), that.kind.ordinal());
    }

    public static Num min(Num first, Num... rest) {
        Num min = first;
        for (Num n : rest) {
            if (n.compareTo(min) < 0) {
                min = n;
            }
        }
        return min;
    }

    public static Num max(Num first, Num... rest) {
        Num max = first;
        for (Num n : rest) {
            if (n.compareTo(max) > 0) {
                max = n;
            }
        }
        return max;
    }

    @Override
    public int hashCode() {
        return kind == Kind.INT ? value.hashCode() : kind.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Num)) {
            return false;
        }
        Num other = (Num) obj;
        if (kind != other.kind) {
            return false;
        }
        return kind != Kind.INT || value.equals(other.value);
    }

    @Override
    public String toString() {
        switch (kind) {
        case PLUS_INF:
            return "+inf";
        case MINUS_INF:
            return "-inf";
        default:
            return value.toString();
        }
    }
}
