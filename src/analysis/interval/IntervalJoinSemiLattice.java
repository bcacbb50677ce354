package analysis.interval;

import analysis.dataflow.util.WideningLattice;

/**
 * Lattice of integer intervals ordered by containment. The lattice has infinite ascending chains, so analyses over it
 * rely on {@link #widen(Interval, Interval)} to terminate.
 */
public class IntervalJoinSemiLattice implements WideningLattice<Interval> {

    @Override
    public Interval bottom() {
        return Interval.EMPTY;
    }

    public Interval top() {
        return Interval.FULL;
    }

    /**
     * Smallest interval containing both arguments
     */
    @Override
    public Interval join(Interval a, Interval b) {
        if (a.isFull() || b.isFull()) {
            return Interval.FULL;
        }
        if (a.isEmpty()) {
            return b;
        }
        if (b.isEmpty()) {
            return a;
        }
        return Interval.of(Num.min(a.getLow(), b.getLow()), Num.max(a.getHigh(), b.getHigh()));
    }

    @Override
    public boolean leq(Interval a, Interval b) {
        return a.isContainedIn(b);
    }

    /**
     * Keep every bound that did not move, send a decreasing lower bound to -inf and an increasing upper bound to +inf
     */
    @Override
    public Interval widen(Interval oldState, Interval newState) {
        if (oldState.isEmpty()) {
            return newState;
        }
        if (newState.isEmpty()) {
            return oldState;
        }
        Num low = newState.getLow().compareTo(oldState.getLow()) < 0 ? Num.minusInf() : oldState.getLow();
        Num high = newState.getHigh().compareTo(oldState.getHigh()) > 0 ? Num.plusInf() : oldState.getHigh();
        return Interval.of(low, high);
    }

    /**
     * Abstract {@code a > b}, with 1 standing for true and 0 for false
     *
     * @return {@link Interval#FULL} if either side is full, [1,1] if every value of a exceeds every value of b, [0,0]
     *         if no value of a exceeds a value of b, [0,1] otherwise
     */
    public Interval gt(Interval a, Interval b) {
        if (a.isFull() || b.isFull()) {
            return Interval.FULL;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return Interval.EMPTY;
        }
        if (a.getLow().compareTo(b.getHigh()) > 0) {
            return Interval.fromNum(1);
        }
        if (a.getHigh().compareTo(b.getLow()) <= 0) {
            return Interval.fromNum(0);
        }
        return Interval.of(0, 1);
    }
}
