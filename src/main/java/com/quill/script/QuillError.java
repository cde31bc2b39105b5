package com.quill.script;

/**
 * A fatal, non-resumable program error. Once raised the run is over: nothing in the
 * language can catch it, and the engine only rethrows it to the host.
 */
public class QuillError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ErrorType type;
    private final int line;
    private final String detail;
    private String function;

    public QuillError(ErrorType type, int line, String detail) {
        super(format(type, line, detail));
        this.type = type;
        this.line = line;
        this.detail = detail;
    }

    public QuillError(ErrorType type, String detail) {
        this(type, -1, detail);
    }

    public ErrorType type() { return type; }

    /** Source line of the offending node, or -1 when unknown. */
    public int line() { return line; }

    /** Message without the type/line prefix. */
    public String detail() { return detail; }

    /** Innermost user function that was running when the error was raised, or null. */
    public String function() { return function; }

    /** Records the running function; only the innermost (first) call sticks. */
    public QuillError attachFunction(String name) {
        if (function == null) function = name;
        return this;
    }

    private static String format(ErrorType type, int line, String detail) {
        String where = (line > 0) ? " [line " + line + "]" : "";
        return type + where + ": " + detail;
    }
}
