package ast;

import java.util.Collections;
import java.util.List;

import ast.statements.Statement;

/**
 * Definition of a free function, a contract method, a receiver, or a contract initializer
 */
public class FunctionDef extends AstNode {

    /**
     * Kinds of function definitions
     */
    public static enum Kind {
        FUNCTION("function_def"), CONTRACT_INIT("contract_init"), RECEIVER("receiver");

        private final String jsonName;

        private Kind(String jsonName) {
            this.jsonName = jsonName;
        }

        public String getJsonName() {
            return jsonName;
        }

        public static Kind fromJsonName(String name) {
            for (Kind k : values()) {
                if (k.jsonName.equals(name)) {
                    return k;
                }
            }
            return null;
        }
    }

    private final Kind kind;
    /**
     * Name of the function, for receivers the message selector (may be empty)
     */
    private final String name;
    private final List<String> params;
    /**
     * Body, null for native or abstract functions
     */
    private final List<Statement> statements;
    /**
     * Whether this is a getter, which must not change the contract's state
     */
    private final boolean getter;
    private final ItemOrigin origin;

    public FunctionDef(int id, SrcLoc loc, Kind kind, String name, List<String> params, List<Statement> statements,
                       boolean getter, ItemOrigin origin) {
        super(id, loc);
        this.kind = kind;
        this.name = name;
        this.params = Collections.unmodifiableList(params);
        this.statements = statements == null ? null : Collections.unmodifiableList(statements);
        this.getter = getter;
        this.origin = origin;
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public List<String> getParams() {
        return params;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public boolean hasBody() {
        return statements != null;
    }

    public boolean isGetter() {
        return getter;
    }

    public ItemOrigin getOrigin() {
        return origin;
    }

    /**
     * Name identifying this definition within its contract (or among free functions). Initializers and receivers get
     * a name built from their identifier.
     *
     * @return unique name
     */
    public String getUniqueName() {
        switch (kind) {
        case CONTRACT_INIT:
            return "init_" + getId();
        case RECEIVER:
            return "receive_" + getId();
        default:
            return name;
        }
    }

    /**
     * @param contractName
     *            name of the declaring contract, null for free functions
     * @return {@code Contract::name} for contract members, the unique name otherwise
     */
    public String getQualifiedName(String contractName) {
        return contractName == null ? getUniqueName() : contractName + "::" + getUniqueName();
    }

    @Override
    public String toString() {
        return kind.getJsonName() + " " + name + "(" + params + ")";
    }
}
