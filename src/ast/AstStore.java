package ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ast.statements.Statement;

/**
 * All syntax trees of one analyzed project, indexed by node identifier. Built once from the frontend output and not
 * modified afterwards.
 */
public class AstStore {

    /**
     * Name of the analyzed project
     */
    private final String projectName;
    /**
     * Free functions in definition order
     */
    private final List<FunctionDef> functions;
    /**
     * Contracts in definition order
     */
    private final List<ContractDef> contracts;
    /**
     * Every statement (including nested ones) by identifier
     */
    private final Map<Integer, Statement> statements = new LinkedHashMap<>();
    /**
     * Every function definition by identifier
     */
    private final Map<Integer, FunctionDef> functionsById = new LinkedHashMap<>();
    /**
     * Contract declaring each method, keyed by the identifier of the method
     */
    private final Map<Integer, ContractDef> declaringContract = new LinkedHashMap<>();

    /**
     * Index the given definitions
     *
     * @param projectName
     *            name of the analyzed project
     * @param functions
     *            free functions
     * @param contracts
     *            contracts
     * @throws IllegalArgumentException
     *             if two statements or two functions share an identifier
     */
    public AstStore(String projectName, List<FunctionDef> functions, List<ContractDef> contracts) {
        this.projectName = projectName;
        this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
        this.contracts = Collections.unmodifiableList(new ArrayList<>(contracts));
        for (FunctionDef f : functions) {
            register(f);
        }
        for (ContractDef c : contracts) {
            for (FunctionDef f : c.getDeclarations()) {
                register(f);
                declaringContract.put(f.getId(), c);
            }
        }
    }

    private void register(FunctionDef f) {
        if (functionsById.put(f.getId(), f) != null) {
            throw new IllegalArgumentException("Duplicate function id #" + f.getId() + " for " + f);
        }
        if (f.hasBody()) {
            registerStatements(f.getStatements());
        }
    }

    private void registerStatements(List<Statement> stmts) {
        for (Statement s : stmts) {
            if (statements.put(s.getId(), s) != null) {
                throw new IllegalArgumentException("Duplicate statement id #" + s.getId() + " at " + s.getLoc());
            }
            for (List<Statement> nested : s.getNestedBlocks()) {
                registerStatements(nested);
            }
        }
    }

    /**
     * @param id
     *            statement identifier
     * @return the statement, or null if there is no statement with that identifier
     */
    public Statement getStatement(int id) {
        return statements.get(id);
    }

    /**
     * @param id
     *            function identifier
     * @return the function, method, receiver or initializer, or null if there is none with that identifier
     */
    public FunctionDef getFunction(int id) {
        return functionsById.get(id);
    }

    /**
     * @param f
     *            function definition
     * @return contract the function is declared in, null for free functions
     */
    public ContractDef getDeclaringContract(FunctionDef f) {
        return declaringContract.get(f.getId());
    }

    public String getProjectName() {
        return projectName;
    }

    public List<FunctionDef> getFunctions() {
        return functions;
    }

    public List<ContractDef> getContracts() {
        return contracts;
    }

    /**
     * Every function definition, free functions first then contract declarations in order
     *
     * @param includeStdlib
     *            whether to include definitions from the standard library
     * @return function definitions
     */
    public List<FunctionDef> getAllFunctions(boolean includeStdlib) {
        List<FunctionDef> all = new ArrayList<>();
        for (FunctionDef f : functions) {
            if (includeStdlib || f.getOrigin() != ItemOrigin.STDLIB) {
                all.add(f);
            }
        }
        for (ContractDef c : contracts) {
            if (!includeStdlib && c.getOrigin() == ItemOrigin.STDLIB) {
                continue;
            }
            all.addAll(c.getDeclarations());
        }
        return all;
    }

    public int getNumberOfStatements() {
        return statements.size();
    }
}
