package analysis.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import analysis.callgraph.CallGraph;
import ast.AstStore;
import ast.ItemOrigin;

/**
 * Everything known about one analyzed project: its syntax trees, the control-flow graphs of all functions and
 * contracts, and the call graph. Built once per analysis run and shared read-only by all detectors.
 */
public class CompilationUnit {

    /**
     * Called for each control-flow graph
     */
    public static interface CfgCallback {
        void visit(Cfg cfg);
    }

    /**
     * Combines an accumulated value with one control-flow graph
     *
     * @param <T>
     *            type of the accumulated value
     */
    public static interface CfgFolder<T> {
        T fold(T acc, Cfg cfg);
    }

    private final String projectName;
    private final AstStore ast;
    /**
     * Control-flow graphs of free functions by index
     */
    private final Map<Integer, Cfg> functions;
    /**
     * Contracts by index
     */
    private final Map<Integer, Contract> contracts;
    private final CallGraph callGraph;

    public CompilationUnit(String projectName, AstStore ast, Map<Integer, Cfg> functions,
                           Map<Integer, Contract> contracts, CallGraph callGraph) {
        this.projectName = projectName;
        this.ast = ast;
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        this.contracts = Collections.unmodifiableMap(new LinkedHashMap<>(contracts));
        this.callGraph = callGraph;
    }

    public String getProjectName() {
        return projectName;
    }

    public AstStore getAst() {
        return ast;
    }

    public Map<Integer, Cfg> getFunctions() {
        return functions;
    }

    public Map<Integer, Contract> getContracts() {
        return contracts;
    }

    public CallGraph getCallGraph() {
        return callGraph;
    }

    /**
     * Visit the control-flow graphs of all free functions, then those of every contract, in construction order
     *
     * @param callback
     *            called for each graph
     * @param includeStdlib
     *            whether to visit graphs of standard library code
     */
    public void forEachCFG(CfgCallback callback, boolean includeStdlib) {
        for (Cfg cfg : getAllCfgs(includeStdlib)) {
            callback.visit(cfg);
        }
    }

    /**
     * Visit the control-flow graphs of user code
     */
    public void forEachCFG(CfgCallback callback) {
        forEachCFG(callback, false);
    }

    /**
     * Fold over control-flow graphs in the order of {@link #forEachCFG(CfgCallback, boolean)}
     *
     * @param initial
     *            initial accumulated value
     * @param folder
     *            combines the accumulated value with each graph
     * @param includeStdlib
     *            whether to include graphs of standard library code
     * @return final accumulated value
     */
    public <T> T foldCFGs(T initial, CfgFolder<T> folder, boolean includeStdlib) {
        T acc = initial;
        for (Cfg cfg : getAllCfgs(includeStdlib)) {
            acc = folder.fold(acc, cfg);
        }
        return acc;
    }

    /**
     * @return every control-flow graph, free functions first
     */
    public List<Cfg> getAllCfgs(boolean includeStdlib) {
        List<Cfg> all = new ArrayList<>();
        for (Cfg cfg : functions.values()) {
            if (includeStdlib || cfg.getOrigin() != ItemOrigin.STDLIB) {
                all.add(cfg);
            }
        }
        for (Contract c : contracts.values()) {
            for (Cfg cfg : c.getMethods().values()) {
                if (includeStdlib || cfg.getOrigin() != ItemOrigin.STDLIB) {
                    all.add(cfg);
                }
            }
        }
        return all;
    }

    /**
     * @return the control-flow graph with the given index or null if there is none
     */
    public Cfg findCfgByIdx(int idx) {
        Cfg cfg = functions.get(idx);
        if (cfg != null) {
            return cfg;
        }
        for (Contract c : contracts.values()) {
            cfg = c.getMethods().get(idx);
            if (cfg != null) {
                return cfg;
            }
        }
        return null;
    }

    /**
     * @return control-flow graph of the free function with the given name or null if there is none
     */
    public Cfg findFunctionCfgByName(String name) {
        for (Cfg cfg : functions.values()) {
            if (cfg.getName().equals(name)) {
                return cfg;
            }
        }
        return null;
    }

    /**
     * @return control-flow graph of the given method or null if there is no such contract or method
     */
    public Cfg findMethodCfgByName(String contractName, String methodName) {
        Contract c = findContractByName(contractName);
        return c == null ? null : c.getMethodByName(methodName);
    }

    /**
     * @return the contract with the given name or null if there is none
     */
    public Contract findContractByName(String name) {
        for (Contract c : contracts.values()) {
            if (c.getName().equals(name)) {
                return c;
            }
        }
        return null;
    }

    /**
     * @return the contract declaring the control-flow graph or null for free functions
     */
    public Contract findContractOf(Cfg cfg) {
        for (Contract c : contracts.values()) {
            if (c.getMethods().get(cfg.getIdx()) == cfg) {
                return c;
            }
        }
        return null;
    }
}
