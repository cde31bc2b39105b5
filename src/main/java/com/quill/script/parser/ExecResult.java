package com.quill.script.parser;

/** Outcome of executing one statement: keep going, or unwind to the caller with a value. */
public final class ExecResult {

    public enum ExecStatus { CONTINUE, RETURN }

    public static final ExecResult CONTINUE = new ExecResult(ExecStatus.CONTINUE, Value.nil());

    public final ExecStatus status;
    public final Value value;

    private ExecResult(ExecStatus status, Value value) {
        this.status = status;
        this.value = value;
    }

    public static ExecResult returning(Value value) {
        return new ExecResult(ExecStatus.RETURN, value);
    }

    public boolean isReturn() {
        return status == ExecStatus.RETURN;
    }
}
