package com.quill.script.parser;

public enum TokenType {
    // Single-character tokens
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE,
    COMMA, COLON, DOT, SEMICOLON,
    PLUS, MINUS, STAR, SLASH,

    // One or two character tokens
    BANG, BANG_EQUAL,
    EQUAL, EQUAL_EQUAL,
    GREATER, GREATER_EQUAL,
    LESS, LESS_EQUAL,
    AND_AND, OR_OR,

    // Literals
    IDENTIFIER, STRING, INT,

    // Keywords
    STRUCT, FUNC, VAR, IF, ELSE, FOR, RETURN, NEW, TRUE, FALSE, NIL,

    EOF
}
