package ctxform.parser;

/**
 * This error means the user typed a formula that is not well formed.
 */
public final class ErrorSyntax extends Exception {

    private static final long serialVersionUID = 0;

    /** Column of the offending character, starting at 1. */
    public final int          column;

    public ErrorSyntax(int column, String msg) {
        super(msg);
        this.column = column;
    }

    @Override
    public String toString() {
        return "Syntax error at column " + column + ":\n" + getMessage();
    }
}
