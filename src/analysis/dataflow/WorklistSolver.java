package analysis.dataflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import util.WorkQueue;
import analysis.cfg.BasicBlock;
import analysis.cfg.BasicBlockKind;
import analysis.cfg.Cfg;
import analysis.cfg.CompilationUnit;
import analysis.dataflow.AnalysisResult.AnalysisRecord;
import analysis.dataflow.util.JoinSemilattice;
import analysis.dataflow.util.WideningLattice;
import ast.statements.Statement;

import com.ibm.wala.util.graph.Graph;
import com.ibm.wala.util.graph.impl.InvertedGraph;

/**
 * Intra-procedural data-flow solver. Keeps a first-in first-out queue of blocks whose inputs may have changed and
 * re-analyzes them until no state grows any more.
 * <p>
 * When the lattice is a {@link WideningLattice} the states of loop headers are widened so that lattices with infinite
 * ascending chains (e.g. intervals) still terminate.
 *
 * @param <S>
 *            type of the data-flow states
 */
public class WorklistSolver<S> implements Solver<S> {

    /**
     * Budget value meaning "no limit"
     */
    public static final int UNBOUNDED = -1;

    private final CompilationUnit cu;
    private final Cfg cfg;
    private final Transfer<S> transfer;
    private final JoinSemilattice<S> lattice;
    private final AnalysisKind kind;
    /**
     * Maximum number of block visits, {@link #UNBOUNDED} for no limit
     */
    private int maxIterations = UNBOUNDED;

    public WorklistSolver(CompilationUnit cu, Cfg cfg, Transfer<S> transfer, JoinSemilattice<S> lattice,
                          AnalysisKind kind) {
        this.cu = cu;
        this.cfg = cfg;
        this.transfer = transfer;
        this.lattice = lattice;
        this.kind = kind;
    }

    /**
     * Limit the number of block visits performed by {@link #solve()}
     *
     * @param maxIterations
     *            maximum number of visits, or {@link #UNBOUNDED}
     * @return this solver
     */
    public WorklistSolver<S> setMaxIterations(int maxIterations) {
        if (maxIterations < 0 && maxIterations != UNBOUNDED) {
            throw new IllegalArgumentException("Negative iteration budget: " + maxIterations);
        }
        this.maxIterations = maxIterations;
        return this;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    @SuppressWarnings("unchecked")
    @Override
    public AnalysisResult<S> solve() {
        Graph<BasicBlock> flowGraph = cfg.getGraph();
        List<BasicBlock> order = new ArrayList<>(cfg.getBasicBlocks());
        if (kind == AnalysisKind.BACKWARD) {
            flowGraph = new InvertedGraph<>(flowGraph);
            Collections.reverse(order);
        }

        Map<BasicBlock, S> inStates = new HashMap<>();
        Map<BasicBlock, S> outStates = new HashMap<>();
        for (BasicBlock bb : order) {
            outStates.put(bb, lattice.bottom());
        }

        WorkQueue<BasicBlock> q = new WorkQueue<>(order);
        int visits = 0;
        BasicBlock current;
        while ((current = q.poll()) != null) {
            if (maxIterations != UNBOUNDED && visits >= maxIterations) {
                throw new FixpointNotReachedException("No fixed point after " + visits + " block visits in " + cfg,
                                                      visits);
            }
            visits++;

            S in = lattice.bottom();
            Iterator<BasicBlock> preds = flowGraph.getPredNodes(current);
            while (preds.hasNext()) {
                in = lattice.join(in, outStates.get(preds.next()));
            }
            inStates.put(current, in);

            S out = flowBlock(in, current);
            S old = outStates.get(current);
            if (current.getKind() == BasicBlockKind.LOOP_HEADER && lattice instanceof WideningLattice) {
                out = ((WideningLattice<S>) lattice).widen(old, lattice.join(old, out));
            }

            if (!lattice.leq(out, old)) {
                outStates.put(current, out);
                Iterator<BasicBlock> succs = flowGraph.getSuccNodes(current);
                while (succs.hasNext()) {
                    q.add(succs.next());
                }
            }
        }

        // Records in construction order
        Map<Integer, AnalysisRecord<S>> records = new LinkedHashMap<>();
        for (BasicBlock bb : cfg.getBasicBlocks()) {
            records.put(bb.getIdx(), new AnalysisRecord<>(inStates.get(bb), outStates.get(bb)));
        }
        return new AnalysisResult<>(records, visits);
    }

    /**
     * Apply the transfer function to the statements of a block, last to first for a backward analysis
     */
    private S flowBlock(S in, BasicBlock bb) {
        List<Integer> ids = bb.getStmtIds();
        if (kind == AnalysisKind.BACKWARD) {
            ids = new ArrayList<>(ids);
            Collections.reverse(ids);
        }
        S state = in;
        for (int id : ids) {
            Statement s = cu.getAst().getStatement(id);
            if (s == null) {
                throw new IllegalStateException("Cannot find statement #" + id + " of BB" + bb.getIdx() + " in "
                        + cfg);
            }
            state = transfer.transfer(state, bb, s);
        }
        return state;
    }
}
