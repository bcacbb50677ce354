package analysis.cfg;

/**
 * Possible flow of control from one basic block to another
 */
public final class CfgEdge {

    private final int idx;
    /**
     * Index of the source basic block
     */
    private final int src;
    /**
     * Index of the destination basic block
     */
    private final int dst;

    public CfgEdge(int idx, int src, int dst) {
        this.idx = idx;
        this.src = src;
        this.dst = dst;
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

    @Override
    public String toString() {
        return "BB" + src + " -> BB" + dst;
    }
}
