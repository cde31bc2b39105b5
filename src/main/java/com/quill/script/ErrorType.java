package com.quill.script;

/** Categories of fatal program errors. */
public enum ErrorType {
    /** Unresolved function, variable or field; arity mismatch; duplicate definition. */
    NAME_ERROR,
    /** Incompatible operand, argument, return or declared type. */
    TYPE_ERROR,
    /** Dereferencing through nil, division by zero, integer overflow. */
    FAULT_ERROR,
    /** Lexer/parser rejected the source text. */
    SYNTAX_ERROR
}
