package net.littleredcomputer.propcheck;

public class SyntaxException extends IllegalArgumentException {
    private final int lineNumber;
    private final String text;

    SyntaxException(String text) {
        this(0, text);
    }

    SyntaxException(String text, Throwable cause) {
        this(0, text, cause);
    }

    SyntaxException(int lineNumber, String text) {
        this(lineNumber, text, null);
    }

    private SyntaxException(int lineNumber, String text, Throwable cause) {
        super(lineNumber > 0 ? "syntax error at line " + lineNumber + ": " + text : "syntax error: " + text, cause);
        this.lineNumber = lineNumber;
        this.text = text;
    }

    SyntaxException atLine(int lineNumber) {
        return new SyntaxException(lineNumber, text, getCause());
    }

    /** 1-based line number in the source file, or 0 if the text did not come from a file. */
    public int getLineNumber() { return lineNumber; }

    public String getText() { return text; }
}
