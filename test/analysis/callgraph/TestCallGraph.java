package analysis.callgraph;

import java.util.Arrays;
import java.util.EnumSet;

import junit.framework.TestCase;
import util.IdxGenerator;
import ast.SrcLoc;

public class TestCallGraph extends TestCase {

    private CallGraph cg;
    private CGNode a;
    private CGNode b;
    private CGNode c;

    @Override
    protected void setUp() {
        cg = new CallGraph(new IdxGenerator());
        a = cg.addNode("a", 1, SrcLoc.NONE);
        b = cg.addNode("b", 2, SrcLoc.NONE);
        c = cg.addNode("c", 3, SrcLoc.NONE);
        cg.addEdge(a.getIdx(), b.getIdx(), SrcLoc.NONE);
        cg.addEdge(b.getIdx(), c.getIdx(), SrcLoc.NONE);
    }

    public void testConnectivity() {
        assertTrue(cg.areConnected(a.getIdx(), b.getIdx()));
        assertTrue(cg.areConnected(a.getIdx(), c.getIdx()));
        assertFalse(cg.areConnected(c.getIdx(), a.getIdx()));
        assertFalse(cg.areConnected(b.getIdx(), a.getIdx()));
    }

    public void testNodeReachesItself() {
        assertTrue(cg.areConnected(c.getIdx(), c.getIdx()));
    }

    public void testCycleTerminates() {
        cg.addEdge(c.getIdx(), a.getIdx(), SrcLoc.NONE);
        assertTrue(cg.areConnected(c.getIdx(), b.getIdx()));
        assertTrue(cg.areConnected(b.getIdx(), a.getIdx()));
        CGNode d = cg.addNode("d", 4, SrcLoc.NONE);
        assertFalse(cg.areConnected(a.getIdx(), d.getIdx()));
    }

    public void testUnknownNodes() {
        assertFalse(cg.areConnected(a.getIdx(), 1000));
        assertFalse(cg.areConnected(1000, a.getIdx()));
        assertFalse(cg.areConnected(1000, 1000));
        assertNull(cg.getNode(1000));
        assertTrue(cg.getOutEdges(1000).isEmpty());
        try {
            cg.addEdge(a.getIdx(), 1000, SrcLoc.NONE);
            fail();
        }
        catch (IllegalArgumentException e) {
            // expected
        }
        try {
            cg.addEffect(1000, Effect.SEND);
            fail();
        }
        catch (IllegalArgumentException e) {
            // expected
        }
    }

    public void testDuplicateName() {
        try {
            cg.addNode("a", 9, SrcLoc.NONE);
            fail();
        }
        catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("a"));
        }
    }

    public void testFindOrAddNode() {
        assertSame(a, cg.findOrAddNode("a"));
        CGNode ext = cg.findOrAddNode("dump");
        assertFalse(ext.isDefined());
        assertTrue(a.isDefined());
        assertEquals(ext.getIdx(), cg.getNodeIdByName("dump").intValue());
        assertEquals(b.getIdx(), cg.getNodeIdByAstId(2).intValue());
        assertNull(cg.getNodeIdByAstId(42));
        assertEquals(4, cg.getNodes().size());
    }

    public void testEdges() {
        assertEquals(2, cg.getEdges().size());
        assertEquals(1, cg.getOutEdges(a.getIdx()).size());
        assertEquals(b.getIdx(), cg.getOutEdges(a.getIdx()).get(0).getDst());
        assertEquals(a.getIdx(), cg.getInEdges(b.getIdx()).get(0).getSrc());
        assertEquals(1, cg.getGraph().getSuccNodeCount(a));
    }

    public void testEffectsPropagateToCallers() {
        cg.addEffect(c.getIdx(), Effect.SEND);
        assertTrue(a.hasEffect(Effect.SEND));
        assertTrue(b.hasEffect(Effect.SEND));
        assertFalse(a.hasDirectEffect(Effect.SEND));
        assertTrue(c.hasDirectEffect(Effect.SEND));
        assertEquals(EnumSet.of(Effect.SEND), a.getEffects());

        // Summaries are recomputed after a change
        cg.addEffect(b.getIdx(), Effect.STATE_WRITE, Arrays.asList("owner"));
        assertTrue(a.hasEffect(Effect.STATE_WRITE));
        assertFalse(c.hasEffect(Effect.STATE_WRITE));
        assertTrue(a.hasAnyEffect(Effect.PRG_USE, Effect.STATE_WRITE));
        assertFalse(a.hasAnyEffect(Effect.PRG_USE, Effect.ACCESS_DATETIME));
        assertEquals(Arrays.asList("owner"), Arrays.asList(b.getFieldsWritten().toArray()));
        assertTrue(b.getFieldsRead().isEmpty());
    }

    public void testEffectsOnCycle() {
        cg.addEdge(c.getIdx(), a.getIdx(), SrcLoc.NONE);
        cg.addEffect(a.getIdx(), Effect.ACCESS_DATETIME);
        assertTrue(c.hasEffect(Effect.ACCESS_DATETIME));
        assertTrue(b.hasEffect(Effect.ACCESS_DATETIME));
        // New edges also invalidate summaries
        CGNode d = cg.addNode("d", 4, SrcLoc.NONE);
        assertFalse(d.hasEffect(Effect.ACCESS_DATETIME));
        cg.addEdge(d.getIdx(), b.getIdx(), SrcLoc.NONE);
        assertTrue(d.hasEffect(Effect.ACCESS_DATETIME));
    }

    public void testFieldsOnlyForStateAccess() {
        try {
            cg.addEffect(a.getIdx(), Effect.SEND, Arrays.asList("owner"));
            fail();
        }
        catch (IllegalArgumentException e) {
            // expected
        }
    }
}
