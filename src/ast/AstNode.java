package ast;

/**
 * Node of the syntax tree supplied by the compiler frontend. Every node carries an identifier that is unique within
 * one {@link AstStore} and a source location.
 */
public abstract class AstNode {

    /**
     * Unique identifier of this node
     */
    private final int id;
    /**
     * Position in the source code
     */
    private final SrcLoc loc;

    protected AstNode(int id, SrcLoc loc) {
        this.id = id;
        this.loc = loc == null ? SrcLoc.NONE : loc;
    }

    public final int getId() {
        return id;
    }

    public final SrcLoc getLoc() {
        return loc;
    }
}
