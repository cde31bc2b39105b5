package com.quill.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.quill.script.ErrorType;
import com.quill.script.QuillError;
import com.quill.script.parser.Declaration.FunctionDecl;
import com.quill.script.parser.Declaration.StructDecl;
import com.quill.script.parser.Declaration.TypedName;
import com.quill.script.parser.Expr.Binary;
import com.quill.script.parser.Expr.Call;
import com.quill.script.parser.Expr.FieldAccess;
import com.quill.script.parser.Expr.Literal;
import com.quill.script.parser.Expr.NewExpr;
import com.quill.script.parser.Expr.Unary;
import com.quill.script.parser.Expr.Variable;
import com.quill.script.parser.Statement.Assign;
import com.quill.script.parser.Statement.ExprStmt;
import com.quill.script.parser.Statement.For;
import com.quill.script.parser.Statement.If;
import com.quill.script.parser.Statement.ReturnStmt;
import com.quill.script.parser.Statement.Stmt;
import com.quill.script.parser.Statement.VarDef;

public class Parser {
    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public Program parse() {
        List<StructDecl> structs = new ArrayList<>();
        List<FunctionDecl> functions = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.STRUCT)) structs.add(structDeclaration());
            else if (match(TokenType.FUNC)) functions.add(functionDeclaration());
            else throw error(peek(), "Expect 'struct' or 'func' at top level.");
        }
        return new Program(structs, functions);
    }

    private StructDecl structDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect struct name.");
        consume(TokenType.LEFT_BRACE, "Expect '{' after struct name.");

        List<TypedName> fields = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            match(TokenType.VAR); // 'var' is optional in field declarations
            fields.add(typedName("field"));
            consume(TokenType.SEMICOLON, "Expect ';' after field declaration.");
        }

        consume(TokenType.RIGHT_BRACE, "Expect '}' after struct body.");
        return new StructDecl(name, fields);
    }

    private FunctionDecl functionDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect function name.");
        consume(TokenType.LEFT_PAREN, "Expect '(' after function name.");

        List<TypedName> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                params.add(typedName("parameter"));
            } while (match(TokenType.COMMA));
        }

        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");
        consume(TokenType.COLON, "Expect ':' before return type.");
        Token returnType = consume(TokenType.IDENTIFIER, "Expect return type.");
        consume(TokenType.LEFT_BRACE, "Expect '{' before function body.");

        List<Stmt> body = block();
        return new FunctionDecl(name, params, returnType, body);
    }

    private TypedName typedName(String kind) {
        Token name = consume(TokenType.IDENTIFIER, "Expect " + kind + " name.");
        consume(TokenType.COLON, "Expect ':' after " + kind + " name.");
        Token type = consume(TokenType.IDENTIFIER, "Expect type for " + kind + " '" + name.lexeme + "'.");
        return new TypedName(name, type);
    }

    private List<Stmt> block() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(statement());
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after block.");
        return statements;
    }

    private Stmt statement() {
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.FOR)) return forStatement();
        if (match(TokenType.RETURN)) return returnStatement();

        Stmt simple = simpleStatement();
        consume(TokenType.SEMICOLON, "Expect ';' after statement.");
        return simple;
    }

    // var definition, assignment or call. Also the only forms allowed in for(init; ; update).
    private Stmt simpleStatement() {
        if (match(TokenType.VAR)) {
            Token name = consume(TokenType.IDENTIFIER, "Expect variable name.");
            consume(TokenType.COLON, "Expect ':' after variable name.");
            Token type = consume(TokenType.IDENTIFIER, "Expect type for variable '" + name.lexeme + "'.");
            return new VarDef(name, type);
        }

        Token name = consume(TokenType.IDENTIFIER, "Expect statement.");

        if (match(TokenType.LEFT_PAREN)) {
            return new ExprStmt(finishCall(name));
        }

        List<Token> path = fieldPath();
        consume(TokenType.EQUAL, "Expect '=' in assignment to '" + name.lexeme + "'.");
        Expr.ExprInterface value = expression();
        return new Assign(name, path, value);
    }

    private Stmt ifStatement() {
        Token keyword = previous();
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'if'.");
        Expr.ExprInterface condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after if condition.");
        consume(TokenType.LEFT_BRACE, "Expect '{' after if condition.");
        List<Stmt> thenBranch = block();
        List<Stmt> elseBranch = null;
        if (match(TokenType.ELSE)) {
            consume(TokenType.LEFT_BRACE, "Expect '{' after 'else'.");
            elseBranch = block();
        }
        return new If(keyword, condition, thenBranch, elseBranch);
    }

    // for (init; condition; update) { body }
    private Stmt forStatement() {
        Token keyword = previous();
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'for'.");
        Stmt init = simpleStatement();
        consume(TokenType.SEMICOLON, "Expect ';' after loop initializer.");
        Expr.ExprInterface condition = expression();
        consume(TokenType.SEMICOLON, "Expect ';' after loop condition.");
        Stmt update = simpleStatement();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after for clauses.");
        consume(TokenType.LEFT_BRACE, "Expect '{' before loop body.");
        List<Stmt> body = block();
        return new For(keyword, init, condition, update, body);
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        Expr.ExprInterface value = null;
        if (!check(TokenType.SEMICOLON)) {
            value = expression();
        }
        consume(TokenType.SEMICOLON, "Expect ';' after return value.");
        return new ReturnStmt(keyword, value);
    }

    private Expr.ExprInterface expression() { return or(); }

    private Expr.ExprInterface or() {
        Expr.ExprInterface expr = and();
        while (match(TokenType.OR_OR)) {
            Token op = previous();
            Expr.ExprInterface right = and();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface and() {
        Expr.ExprInterface expr = equality();
        while (match(TokenType.AND_AND)) {
            Token op = previous();
            Expr.ExprInterface right = equality();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface equality() {
        Expr.ExprInterface expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = comparison();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = term();
        while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = term();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.BANG, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            return new Unary(op, right);
        }
        return primary();
    }

    private Call finishCall(Token name) {
        List<Expr.ExprInterface> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return new Call(name, arguments);
    }

    private List<Token> fieldPath() {
        List<Token> path = new ArrayList<>();
        while (match(TokenType.DOT)) {
            path.add(consume(TokenType.IDENTIFIER, "Expect field name after '.'."));
        }
        return path;
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Boolean.FALSE, previous().line);
        if (match(TokenType.TRUE)) return new Literal(Boolean.TRUE, previous().line);
        if (match(TokenType.NIL)) return new Literal(null, previous().line);
        if (match(TokenType.INT)) return new Literal(previous().literal, previous().line);
        if (match(TokenType.STRING)) return new Literal(previous().literal, previous().line);

        if (match(TokenType.NEW)) {
            Token keyword = previous();
            Token name = consume(TokenType.IDENTIFIER, "Expect struct name after 'new'.");
            return new NewExpr(keyword, name);
        }

        if (match(TokenType.IDENTIFIER)) {
            Token name = previous();
            if (match(TokenType.LEFT_PAREN)) return finishCall(name);
            List<Token> path = fieldPath();
            return path.isEmpty() ? new Variable(name) : new FieldAccess(name, path);
        }

        if (match(TokenType.LEFT_PAREN)) {
            Expr.ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }

        throw error(peek(), "Expect expression.");
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private QuillError error(Token token, String message) {
        String at = (token.type == TokenType.EOF) ? " at end" : " at '" + token.lexeme + "'";
        return new QuillError(ErrorType.SYNTAX_ERROR, token.line, message + at);
    }
}
