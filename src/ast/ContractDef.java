package ast;

import java.util.Collections;
import java.util.List;

/**
 * Contract declaration: persistent fields plus the functions, receivers and initializer operating on them
 */
public class ContractDef extends AstNode {

    private final String name;
    private final List<String> fields;
    private final List<FunctionDef> declarations;
    private final ItemOrigin origin;

    public ContractDef(int id, SrcLoc loc, String name, List<String> fields, List<FunctionDef> declarations,
                       ItemOrigin origin) {
        super(id, loc);
        this.name = name;
        this.fields = Collections.unmodifiableList(fields);
        this.declarations = Collections.unmodifiableList(declarations);
        this.origin = origin;
    }

    public String getName() {
        return name;
    }

    public List<String> getFields() {
        return fields;
    }

    public List<FunctionDef> getDeclarations() {
        return declarations;
    }

    public ItemOrigin getOrigin() {
        return origin;
    }
}
