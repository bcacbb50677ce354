package analysis.interval;

import java.math.BigInteger;

import junit.framework.TestCase;

/**
 * Arithmetic on possibly infinite integers
 */
public class TestNum extends TestCase {

    public void testAddFinite() {
        assertEquals(Num.ofInt(8), Num.ofInt(5).add(Num.ofInt(3)));
    }

    public void testAddInfinity() {
        assertEquals(Num.plusInf(), Num.ofInt(5).add(Num.plusInf()));
        assertEquals(Num.minusInf(), Num.minusInf().add(Num.ofInt(-7)));
        assertEquals(Num.plusInf(), Num.plusInf().add(Num.plusInf()));
    }

    public void testAddOppositeInfinities() {
        try {
            Num.plusInf().add(Num.minusInf());
        }
        catch (IntervalArithmeticException e) {
            return;
        }
        fail("Should have thrown exception");
    }

    public void testNegate() {
        assertEquals(Num.ofInt(-4), Num.ofInt(4).negate());
        assertEquals(Num.minusInf(), Num.plusInf().negate());
        assertEquals(Num.plusInf(), Num.minusInf().negate());
    }

    public void testMultiplyZeroByInfinity() {
        assertEquals(Num.ofInt(0), Num.ofInt(0).multiply(Num.plusInf()));
        assertEquals(Num.ofInt(0), Num.minusInf().multiply(Num.ofInt(0)));
    }

    public void testMultiplySigns() {
        assertEquals(Num.minusInf(), Num.ofInt(-2).multiply(Num.plusInf()));
        assertEquals(Num.plusInf(), Num.minusInf().multiply(Num.minusInf()));
        assertEquals(Num.ofInt(-6), Num.ofInt(-2).multiply(Num.ofInt(3)));
    }

    public void testDivideTruncates() {
        assertEquals(Num.ofInt(2), Num.ofInt(7).divide(Num.ofInt(3)));
        assertEquals(Num.ofInt(-2), Num.ofInt(-7).divide(Num.ofInt(3)));
    }

    public void testDivideByZero() {
        try {
            Num.ofInt(1).divide(Num.ofInt(0));
        }
        catch (ArithmeticException e) {
            assertTrue(e instanceof IntervalArithmeticException);
            return;
        }
        fail("Should have thrown exception");
    }

    public void testDivideWithInfinities() {
        assertEquals(Num.ofInt(0), Num.ofInt(1000).divide(Num.minusInf()));
        assertEquals(Num.ofInt(1), Num.plusInf().divide(Num.plusInf()));
        assertEquals(Num.ofInt(-1), Num.plusInf().divide(Num.minusInf()));
        assertEquals(Num.minusInf(), Num.plusInf().divide(Num.ofInt(-3)));
    }

    public void testOrder() {
        assertTrue(Num.minusInf().compareTo(Num.ofInt(Long.MIN_VALUE)) < 0);
        assertTrue(Num.plusInf().compareTo(Num.ofInt(Long.MAX_VALUE)) > 0);
        assertTrue(Num.ofInt(BigInteger.TEN.pow(30)).compareTo(Num.ofInt(Long.MAX_VALUE)) > 0);
        assertEquals(0, Num.plusInf().compareTo(Num.plusInf()));
        assertEquals(Num.minusInf(), Num.min(Num.ofInt(3), Num.minusInf(), Num.ofInt(-100)));
        assertEquals(Num.ofInt(3), Num.max(Num.ofInt(3), Num.ofInt(-100)));
    }

    public void testValueOfInfinity() {
        try {
            Num.plusInf().getValue();
        }
        catch (IllegalStateException e) {
            return;
        }
        fail("Should have thrown exception");
    }
}
