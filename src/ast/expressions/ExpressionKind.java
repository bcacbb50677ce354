package ast.expressions;

/**
 * Closed set of expression shapes, named the way the frontend's interchange format names them
 */
public enum ExpressionKind {
    ID("id"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    STRING("string"),
    NULL("null"),
    OP_BINARY("op_binary"),
    OP_UNARY("op_unary"),
    FIELD_ACCESS("field_access"),
    STATIC_CALL("static_call"),
    METHOD_CALL("method_call"),
    CONDITIONAL("conditional"),
    STRUCT_INSTANCE("struct_instance"),
    INIT_OF("init_of");

    private final String jsonName;

    private ExpressionKind(String jsonName) {
        this.jsonName = jsonName;
    }

    public String getJsonName() {
        return jsonName;
    }

    /**
     * @param name
     *            kind tag from the interchange format
     * @return the matching kind, or null if the tag is unknown
     */
    public static ExpressionKind fromJsonName(String name) {
        for (ExpressionKind k : values()) {
            if (k.jsonName.equals(name)) {
                return k;
            }
        }
        return null;
    }
}
