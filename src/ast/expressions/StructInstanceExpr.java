package ast.expressions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import ast.SrcLoc;

/**
 * Struct or message literal, e.g. {@code SendParameters{to: sender(), value: 0}}
 */
public class StructInstanceExpr extends Expression {

    private final String type;
    /**
     * Field initializers in source order
     */
    private final Map<String, Expression> fields;

    public StructInstanceExpr(int id, SrcLoc loc, String type, LinkedHashMap<String, Expression> fields) {
        super(id, loc);
        this.type = type;
        this.fields = Collections.unmodifiableMap(fields);
    }

    public String getType() {
        return type;
    }

    public Map<String, Expression> getFields() {
        return fields;
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.STRUCT_INSTANCE;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> v) {
        return v.visitStructInstance(this);
    }
}
