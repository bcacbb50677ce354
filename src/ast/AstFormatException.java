package ast;

/**
 * Thrown when the frontend's AST document does not have the expected shape
 */
public class AstFormatException extends RuntimeException {

    private static final long serialVersionUID = -3150227341526004361L;

    public AstFormatException(String message) {
        super(message);
    }

    public AstFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
