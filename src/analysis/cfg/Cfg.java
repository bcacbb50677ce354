package analysis.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ast.AstStore;
import ast.ItemOrigin;
import ast.SrcLoc;
import ast.statements.Statement;

import com.ibm.wala.util.graph.Graph;
import com.ibm.wala.util.graph.impl.SlowSparseNumberedGraph;

/**
 * Intraprocedural control-flow graph of one function, method, receiver or contract initializer. The first block is
 * the entry. The graph is read-only once constructed.
 */
public class Cfg {

    /**
     * Called for each statement of the graph together with the block containing it
     */
    public static interface BasicBlockCallback {
        void visit(Statement stmt, BasicBlock bb);
    }

    /**
     * Called for each edge of the graph
     */
    public static interface EdgeCallback {
        void visit(CfgEdge edge);
    }

    /**
     * Unique index within the compilation unit
     */
    private final int idx;
    /**
     * Name of the function; receivers and initializers get a generated name
     */
    private final String name;
    /**
     * AST identifier of the function definition
     */
    private final int astId;
    private final FunctionKind kind;
    private final ItemOrigin origin;
    private final SrcLoc loc;
    /**
     * Blocks by index in construction order
     */
    private final Map<Integer, BasicBlock> bbs = new LinkedHashMap<>();
    /**
     * Edges by index in construction order
     */
    private final Map<Integer, CfgEdge> edges = new LinkedHashMap<>();
    /**
     * Same graph as a WALA graph, used for traversals
     */
    private final SlowSparseNumberedGraph<BasicBlock> graph = SlowSparseNumberedGraph.make();

    /**
     * Create a control-flow graph
     *
     * @param idx
     *            unique index
     * @param name
     *            function name
     * @param astId
     *            AST identifier of the function definition
     * @param kind
     *            kind of function
     * @param origin
     *            user code or standard library
     * @param blocks
     *            basic blocks, the first is the entry
     * @param edges
     *            edges between the blocks
     * @param loc
     *            location of the function definition
     * @throws IllegalArgumentException
     *             if an edge refers to a block that is not in <code>blocks</code>, or an index is used twice
     */
    public Cfg(int idx, String name, int astId, FunctionKind kind, ItemOrigin origin, List<BasicBlock> blocks,
               List<CfgEdge> edges, SrcLoc loc) {
        this.idx = idx;
        this.name = name;
        this.astId = astId;
        this.kind = kind;
        this.origin = origin;
        this.loc = loc == null ? SrcLoc.NONE : loc;
        for (BasicBlock bb : blocks) {
            if (this.bbs.put(bb.getIdx(), bb) != null) {
                throw new IllegalArgumentException("Duplicate basic block BB" + bb.getIdx() + " in " + name);
            }
            bb.setOwner(this);
            graph.addNode(bb);
        }
        for (CfgEdge e : edges) {
            BasicBlock src = this.bbs.get(e.getSrc());
            BasicBlock dst = this.bbs.get(e.getDst());
            if (src == null || dst == null) {
                throw new IllegalArgumentException("Edge " + e + " of " + name + " refers to an unknown basic block");
            }
            if (this.edges.put(e.getIdx(), e) != null) {
                throw new IllegalArgumentException("Duplicate edge #" + e.getIdx() + " in " + name);
            }
            src.addDstEdge(e);
            dst.addSrcEdge(e);
            graph.addEdge(src, dst);
        }
    }

    public int getIdx() {
        return idx;
    }

    public String getName() {
        return name;
    }

    public int getAstId() {
        return astId;
    }

    public FunctionKind getKind() {
        return kind;
    }

    public ItemOrigin getOrigin() {
        return origin;
    }

    public SrcLoc getLoc() {
        return loc;
    }

    /**
     * @return the basic block with the given index or null if it is not in this graph
     */
    public BasicBlock getBasicBlock(int bbIdx) {
        return bbs.get(bbIdx);
    }

    /**
     * @return the edge with the given index or null if it is not in this graph
     */
    public CfgEdge getEdge(int edgeIdx) {
        return edges.get(edgeIdx);
    }

    /**
     * @return unmodifiable list of the blocks in construction order
     */
    public List<BasicBlock> getBasicBlocks() {
        return Collections.unmodifiableList(new ArrayList<>(bbs.values()));
    }

    /**
     * @return unmodifiable list of the edges in construction order
     */
    public List<CfgEdge> getEdges() {
        return Collections.unmodifiableList(new ArrayList<>(edges.values()));
    }

    public int getNumberOfBasicBlocks() {
        return bbs.size();
    }

    public boolean isEmpty() {
        return bbs.isEmpty();
    }

    /**
     * @return the first block, or null for a function without statements
     */
    public BasicBlock getEntry() {
        if (bbs.isEmpty()) {
            return null;
        }
        return bbs.values().iterator().next();
    }

    /**
     * Successors of a block in the order of the edges leaving it
     *
     * @param bbIdx
     *            block index
     * @return successor blocks, or null if the block is not in this graph
     */
    public List<BasicBlock> getSuccessors(int bbIdx) {
        BasicBlock bb = bbs.get(bbIdx);
        if (bb == null) {
            return null;
        }
        List<BasicBlock> succs = new ArrayList<>(bb.getDstEdges().size());
        for (int e : bb.getDstEdges()) {
            succs.add(bbs.get(edges.get(e).getDst()));
        }
        return succs;
    }

    /**
     * Predecessors of a block in the order of the edges entering it
     *
     * @param bbIdx
     *            block index
     * @return predecessor blocks, or null if the block is not in this graph
     */
    public List<BasicBlock> getPredecessors(int bbIdx) {
        BasicBlock bb = bbs.get(bbIdx);
        if (bb == null) {
            return null;
        }
        List<BasicBlock> preds = new ArrayList<>(bb.getSrcEdges().size());
        for (int e : bb.getSrcEdges()) {
            preds.add(bbs.get(edges.get(e).getSrc()));
        }
        return preds;
    }

    /**
     * @return blocks marked as exits or without successors, in construction order
     */
    public List<BasicBlock> getExitNodes() {
        List<BasicBlock> exits = new ArrayList<>();
        for (BasicBlock bb : bbs.values()) {
            if (bb.isExit() || bb.getDstEdges().isEmpty()) {
                exits.add(bb);
            }
        }
        return exits;
    }

    /**
     * Visit every statement of the graph, blocks in construction order and statements in block order
     *
     * @param astStore
     *            store holding the statements
     * @param callback
     *            called for every statement
     * @throws IllegalStateException
     *             if a statement is missing from the store
     */
    public void forEachBasicBlock(AstStore astStore, BasicBlockCallback callback) {
        for (BasicBlock bb : bbs.values()) {
            for (int stmtId : bb.getStmtIds()) {
                Statement stmt = astStore.getStatement(stmtId);
                if (stmt == null) {
                    throw new IllegalStateException("Cannot find statement #" + stmtId + " of BB" + bb.getIdx()
                            + " in " + name);
                }
                callback.visit(stmt, bb);
            }
        }
    }

    public void forEachEdge(EdgeCallback callback) {
        for (CfgEdge e : edges.values()) {
            callback.visit(e);
        }
    }

    /**
     * @return view of this control-flow graph as a WALA graph; must not be modified
     */
    public Graph<BasicBlock> getGraph() {
        return graph;
    }

    @Override
    public String toString() {
        return name + "#" + idx;
    }
}
