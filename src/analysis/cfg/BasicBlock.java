package analysis.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Basic block of a control-flow graph: a sequence of statements of one function, identified by their AST ids, with
 * one entry and one exit. Blocks are registered with exactly one {@link Cfg}, which fills in the edges when it is
 * constructed. A block does not change after that.
 */
public final class BasicBlock {

    /**
     * Unique index within the compilation unit
     */
    private final int idx;
    /**
     * AST identifiers of the statements in execution order
     */
    private final List<Integer> stmtIds;
    private final BasicBlockKind kind;
    /**
     * Indices of the control-flow graphs of the functions called from this block
     */
    private final Set<Integer> callees;
    /**
     * Indices of the incoming edges
     */
    private final Set<Integer> srcEdges = new LinkedHashSet<>();
    /**
     * Indices of the outgoing edges
     */
    private final Set<Integer> dstEdges = new LinkedHashSet<>();
    /**
     * Control-flow graph this block belongs to, set once by that graph
     */
    private Cfg owner;

    public BasicBlock(int idx, List<Integer> stmtIds, BasicBlockKind kind, Set<Integer> callees) {
        if (stmtIds.isEmpty()) {
            throw new IllegalArgumentException("Basic block BB" + idx + " has no statements");
        }
        this.idx = idx;
        this.stmtIds = Collections.unmodifiableList(new ArrayList<>(stmtIds));
        this.kind = kind;
        this.callees = Collections.unmodifiableSet(new LinkedHashSet<>(callees));
    }

    /**
     * Block holding a single statement and calling nothing
     */
    public BasicBlock(int idx, int stmtId, BasicBlockKind kind) {
        this(idx, Collections.singletonList(stmtId), kind, Collections.<Integer> emptySet());
    }

    public int getIdx() {
        return idx;
    }

    public List<Integer> getStmtIds() {
        return stmtIds;
    }

    public BasicBlockKind getKind() {
        return kind;
    }

    public Set<Integer> getCallees() {
        return callees;
    }

    public Set<Integer> getSrcEdges() {
        return Collections.unmodifiableSet(srcEdges);
    }

    public Set<Integer> getDstEdges() {
        return Collections.unmodifiableSet(dstEdges);
    }

    public boolean isExit() {
        return kind == BasicBlockKind.EXIT;
    }

    /**
     * Register this block with its control-flow graph
     */
    void setOwner(Cfg cfg) {
        if (owner != null && owner != cfg) {
            throw new IllegalArgumentException("BB" + idx + " already belongs to " + owner.getName());
        }
        owner = cfg;
    }

    void addSrcEdge(CfgEdge e) {
        srcEdges.add(e.getIdx());
    }

    void addDstEdge(CfgEdge e) {
        dstEdges.add(e.getIdx());
    }

    @Override
    public String toString() {
        return "BB" + idx + " " + kind + " " + stmtIds;
    }
}
