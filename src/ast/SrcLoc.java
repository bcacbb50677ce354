package ast;

/**
 * Position of an AST node in a source file, used when reporting warnings
 */
public final class SrcLoc {

    /**
     * Location used for nodes the frontend did not attach a position to
     */
    public static final SrcLoc NONE = new SrcLoc(null, 0, 0);

    /**
     * Source file, null if unknown
     */
    private final String file;
    private final int line;
    private final int column;

    public SrcLoc(String file, int line, int column) {
        this.file = file;
        this.line = line;
        this.column = column;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        if (this == NONE) {
            return "<unknown>";
        }
        return (file == null ? "" : file + ":") + line + ":" + column;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + column;
        result = prime * result + ((file == null) ? 0 : file.hashCode());
        result = prime * result + line;
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null) {
            return false;
        }
        if (getClass() != obj.getClass()) {
            return false;
        }
        SrcLoc other = (SrcLoc) obj;
        if (column != other.column || line != other.line) {
            return false;
        }
        if (file == null) {
            return other.file == null;
        }
        return file.equals(other.file);
    }
}
