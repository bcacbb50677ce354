package analysis.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import util.IdxGenerator;
import util.Logger;
import analysis.callgraph.CallGraph;
import analysis.callgraph.CallGraphBuilder;
import ast.AstStore;
import ast.AstUtil;
import ast.AstUtil.ExpressionCallback;
import ast.ContractDef;
import ast.FunctionDef;
import ast.ItemOrigin;
import ast.Stdlib;
import ast.expressions.Expression;
import ast.expressions.MethodCallExpr;
import ast.expressions.StaticCallExpr;
import ast.statements.ConditionStatement;
import ast.statements.LoopStatement;
import ast.statements.ReturnStatement;
import ast.statements.Statement;
import ast.statements.TryStatement;

/**
 * Builds the control-flow graphs and the call graph of a program and packs them into a {@link CompilationUnit}.
 * <p>
 * Every statement gets its own basic block. Conditionals branch into their bodies, loops get a back edge from the end
 * of the body to the loop header, and {@code return} ends the path. Blocks without successors are exits.
 */
public class IrBuilder {

    private static final String CFG_IDX = "cfg";
    private static final String BB_IDX = "cfg_bb";
    private static final String EDGE_IDX = "cfg_edge";
    private static final String CONTRACT_IDX = "contract";

    private final AstStore ast;
    private final IdxGenerator idxGen;
    private final Logger logger;
    /**
     * Index of the control-flow graph of each free function, by name
     */
    private final Map<String, Integer> functionIndexes = new HashMap<>();
    /**
     * For each contract, the index of the control-flow graph of each member by unique name
     */
    private final Map<String, Map<String, Integer>> methodIndexes = new HashMap<>();

    public IrBuilder(AstStore ast, IdxGenerator idxGen, Logger logger) {
        this.ast = ast;
        this.idxGen = idxGen;
        this.logger = logger;
    }

    /**
     * Build control-flow graphs for every function and contract member (standard library included) and the call
     * graph
     *
     * @return new compilation unit
     */
    public CompilationUnit build() {
        // Indices first so calls can be resolved while building blocks
        for (FunctionDef f : ast.getFunctions()) {
            functionIndexes.put(f.getUniqueName(), idxGen.next(CFG_IDX));
        }
        for (ContractDef c : ast.getContracts()) {
            Map<String, Integer> members = new HashMap<>();
            for (FunctionDef f : c.getDeclarations()) {
                members.put(f.getUniqueName(), idxGen.next(CFG_IDX));
            }
            methodIndexes.put(c.getName(), members);
        }

        Map<Integer, Cfg> functions = new LinkedHashMap<>();
        for (FunctionDef f : ast.getFunctions()) {
            int idx = functionIndexes.get(f.getUniqueName());
            functions.put(idx, createCfg(idx, f, FunctionKind.FUNCTION, f.getOrigin(), null));
        }
        Map<Integer, Contract> contracts = new LinkedHashMap<>();
        for (ContractDef c : ast.getContracts()) {
            Map<Integer, Cfg> methods = new LinkedHashMap<>();
            for (FunctionDef f : c.getDeclarations()) {
                int idx = methodIndexes.get(c.getName()).get(f.getUniqueName());
                FunctionKind kind = f.getKind() == FunctionDef.Kind.RECEIVER ? FunctionKind.RECEIVE
                        : FunctionKind.METHOD;
                methods.put(idx, createCfg(idx, f, kind, c.getOrigin(), c.getName()));
            }
            Contract contract = new Contract(idxGen.next(CONTRACT_IDX), c.getName(), c.getOrigin(), methods,
                                             c.getLoc());
            contracts.put(contract.getIdx(), contract);
        }

        CallGraph cg = new CallGraphBuilder(ast, idxGen, logger).build();
        logger.info("Built " + functions.size() + " function CFGs and " + contracts.size() + " contracts for "
                + ast.getProjectName());
        return new CompilationUnit(ast.getProjectName(), ast, functions, contracts, cg);
    }

    private Cfg createCfg(int idx, FunctionDef f, FunctionKind kind, ItemOrigin origin, String contractName) {
        CfgConstruction c = new CfgConstruction(contractName);
        if (f.hasBody()) {
            c.process(f.getStatements(), Collections.<Integer> emptyList());
        }
        Cfg cfg = new Cfg(idx, f.getUniqueName(), f.getId(), kind, origin, c.finish(), c.edges, f.getLoc());
        logger.debug("CFG " + cfg + ": " + cfg.getNumberOfBasicBlocks() + " blocks, " + c.edges.size() + " edges");
        return cfg;
    }

    /**
     * Blocks and edges of one control-flow graph under construction
     */
    private class CfgConstruction {

        /**
         * Enclosing contract, null for free functions
         */
        private final String contractName;
        private final List<Integer> bbIdxs = new ArrayList<>();
        private final Map<Integer, Statement> stmts = new HashMap<>();
        private final Map<Integer, BasicBlockKind> kinds = new HashMap<>();
        private final Map<Integer, Set<Integer>> callees = new HashMap<>();
        private final Map<Integer, Integer> numSuccs = new HashMap<>();
        private final List<CfgEdge> edges = new ArrayList<>();

        CfgConstruction(String contractName) {
            this.contractName = contractName;
        }

        /**
         * Add blocks for a list of statements
         *
         * @param statements
         *            statements executed in order
         * @param preds
         *            blocks from which control enters the first statement
         * @return blocks from which control leaves the list of statements, <code>preds</code> if the list is empty
         */
        List<Integer> process(List<Statement> statements, List<Integer> preds) {
            List<Integer> last = preds;
            for (Statement s : statements) {
                int bb = newBlock(s, last);
                if (s instanceof ConditionStatement) {
                    ConditionStatement cond = (ConditionStatement) s;
                    kinds.put(bb, BasicBlockKind.BRANCH);
                    List<Integer> exits = new ArrayList<>(process(cond.getTrueStatements(), single(bb)));
                    if (cond.getFalseStatements() != null) {
                        exits.addAll(process(cond.getFalseStatements(), single(bb)));
                    }
                    else {
                        exits.add(bb);
                    }
                    last = dedup(exits);
                }
                else if (s instanceof LoopStatement) {
                    kinds.put(bb, BasicBlockKind.LOOP_HEADER);
                    List<Statement> body = ((LoopStatement) s).getStatements();
                    if (!body.isEmpty()) {
                        for (int end : process(body, single(bb))) {
                            addEdge(end, bb);
                        }
                    }
                    last = single(bb);
                }
                else if (s instanceof TryStatement) {
                    TryStatement t = (TryStatement) s;
                    List<Integer> exits = new ArrayList<>(process(t.getStatements(), single(bb)));
                    if (t.hasCatch()) {
                        kinds.put(bb, BasicBlockKind.BRANCH);
                        exits.addAll(process(t.getCatchStatements(), single(bb)));
                    }
                    last = dedup(exits);
                }
                else if (s instanceof ReturnStatement) {
                    last = Collections.emptyList();
                }
                else {
                    last = single(bb);
                }
            }
            return last;
        }

        private int newBlock(Statement s, List<Integer> preds) {
            int bb = idxGen.next(BB_IDX);
            bbIdxs.add(bb);
            stmts.put(bb, s);
            kinds.put(bb, BasicBlockKind.REGULAR);
            callees.put(bb, collectCallees(s));
            numSuccs.put(bb, 0);
            for (int p : preds) {
                addEdge(p, bb);
            }
            return bb;
        }

        private void addEdge(int src, int dst) {
            edges.add(new CfgEdge(idxGen.next(EDGE_IDX), src, dst));
            numSuccs.put(src, numSuccs.get(src) + 1);
        }

        /**
         * Create the basic blocks once all edges are known
         */
        List<BasicBlock> finish() {
            List<BasicBlock> bbs = new ArrayList<>(bbIdxs.size());
            for (int idx : bbIdxs) {
                BasicBlockKind kind = kinds.get(idx);
                Set<Integer> called = callees.get(idx);
                if (numSuccs.get(idx) == 0) {
                    kind = BasicBlockKind.EXIT;
                }
                else if (kind == BasicBlockKind.REGULAR && !called.isEmpty()) {
                    kind = BasicBlockKind.CALL;
                }
                bbs.add(new BasicBlock(idx, Collections.singletonList(stmts.get(idx).getId()), kind, called));
            }
            return bbs;
        }

        /**
         * Indices of the control-flow graphs of the functions called directly by a statement (nested statements
         * excluded)
         */
        private Set<Integer> collectCallees(Statement s) {
            final Set<Integer> result = new LinkedHashSet<>();
            AstUtil.forEachExpression(s, false, new ExpressionCallback() {

                @Override
                public void visit(Expression e) {
                    Integer idx = resolveCall(e);
                    if (idx != null) {
                        result.add(idx);
                    }
                }
            });
            return result;
        }

        /**
         * @return index of the control-flow graph called by e, or null if e is not a call to a function defined in
         *         the program
         */
        private Integer resolveCall(Expression e) {
            if (e instanceof StaticCallExpr) {
                return functionIndexes.get(((StaticCallExpr) e).getFunction());
            }
            if (!(e instanceof MethodCallExpr)) {
                return null;
            }
            MethodCallExpr mc = (MethodCallExpr) e;
            if (!AstUtil.isSelf(mc.getSelf())) {
                logger.debug(e.getLoc() + ": Unsupported contract method access: " + mc.getSelf().kind());
                return null;
            }
            Map<String, Integer> members = contractName == null ? null : methodIndexes.get(contractName);
            if (members == null) {
                logger.debug(e.getLoc() + ": Accessing self outside of a contract");
                return null;
            }
            Integer idx = members.get(mc.getMethod());
            if (idx == null && !Stdlib.SEND_METHODS.contains(mc.getMethod())) {
                logger.warn(e.getLoc() + ": Calling an unknown contract method: " + mc.getMethod());
            }
            return idx;
        }
    }

    private static List<Integer> single(int bb) {
        return Collections.singletonList(bb);
    }

    private static List<Integer> dedup(List<Integer> bbs) {
        return new ArrayList<>(new LinkedHashSet<>(bbs));
    }
}
