package com.quill.script.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    final Object literal;
    public final int line;

    public Token(TokenType type, String lexeme, Object literal, int line) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
    }

    /** Synthetic identifier token, used when the host calls a function by name (e.g. main). */
    public static Token identifier(String name) {
        return new Token(TokenType.IDENTIFIER, name, null, -1);
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' (line " + line + ")";
    }
}
