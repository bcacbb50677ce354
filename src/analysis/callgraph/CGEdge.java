package analysis.callgraph;

import ast.SrcLoc;

/**
 * Call from one call graph node to another. Every call site gets its own edge.
 */
public final class CGEdge {

    private final int idx;
    /**
     * Caller node
     */
    private final int src;
    /**
     * Callee node
     */
    private final int dst;
    /**
     * Location of the call expression
     */
    private final SrcLoc callSite;

    CGEdge(int idx, int src, int dst, SrcLoc callSite) {
        this.idx = idx;
        this.src = src;
        this.dst = dst;
        this.callSite = callSite == null ? SrcLoc.NONE : callSite;
    }

    public int getIdx() {
        return idx;
    }

    public int getSrc() {
        return src;
    }

    public int getDst() {
        return dst;
    }

    public SrcLoc getCallSite() {
        return callSite;
    }

    @Override
    public String toString() {
        return src + " -> " + dst + " at " + callSite;
    }
}
