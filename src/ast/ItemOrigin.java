package ast;

/**
 * Where a top-level item was defined
 */
public enum ItemOrigin {
    /**
     * Code written by the user
     */
    USER("user"),
    /**
     * Code from the language's standard library
     */
    STDLIB("stdlib");

    private final String jsonName;

    private ItemOrigin(String jsonName) {
        this.jsonName = jsonName;
    }

    public String getJsonName() {
        return jsonName;
    }

    /**
     * Find the origin with the given name in the interchange format
     *
     * @param name
     *            "user" or "stdlib"
     * @return the matching origin, or null if there is none
     */
    public static ItemOrigin fromJsonName(String name) {
        for (ItemOrigin o : values()) {
            if (o.jsonName.equals(name)) {
                return o;
            }
        }
        return null;
    }
}
