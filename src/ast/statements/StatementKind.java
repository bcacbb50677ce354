package ast.statements;

/**
 * Closed set of statement shapes, named the way the frontend's interchange format names them
 */
public enum StatementKind {
    LET("statement_let"),
    ASSIGN("statement_assign"),
    AUGMENTED_ASSIGN("statement_augmentedassign"),
    EXPRESSION("statement_expression"),
    RETURN("statement_return"),
    CONDITION("statement_condition"),
    WHILE("statement_while"),
    UNTIL("statement_until"),
    REPEAT("statement_repeat"),
    FOREACH("statement_foreach"),
    TRY("statement_try");

    private final String jsonName;

    private StatementKind(String jsonName) {
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
    public static StatementKind fromJsonName(String name) {
        for (StatementKind k : values()) {
            if (k.jsonName.equals(name)) {
                return k;
            }
        }
        return null;
    }
}
