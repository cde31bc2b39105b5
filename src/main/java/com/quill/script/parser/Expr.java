package com.quill.script.parser;

import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
        int line();
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitVariableExpr(Variable expr);
        R visitFieldAccessExpr(FieldAccess expr);
        R visitUnaryExpr(Unary expr);
        R visitBinaryExpr(Binary expr);
        R visitNewExpr(NewExpr expr);
        R visitCallExpr(Call expr);
    }

    // -------------------------
    // Leaves
    // -------------------------

    /** int (Long), string (String), bool (Boolean) or nil (null) literal. */
    public static final class Literal implements ExprInterface {
        public final Object value;
        private final int line;

        public Literal(Object value, int line) {
            this.value = value;
            this.line = line;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }

        @Override
        public int line() { return line; }
    }

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }

        @Override
        public int line() { return name.line; }
    }

    /**
     * base.f1.f2...fn, decomposed once by the parser. {@code path} is never empty.
     */
    public static final class FieldAccess implements ExprInterface {
        public final Token base;
        public final List<Token> path;

        public FieldAccess(Token base, List<Token> path) {
            this.base = base;
            this.path = List.copyOf(path);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFieldAccessExpr(this);
        }

        @Override
        public int line() { return base.line; }

        public String dotted() {
            StringBuilder sb = new StringBuilder(base.lexeme);
            for (Token t : path) sb.append('.').append(t.lexeme);
            return sb.toString();
        }
    }

    // -------------------------
    // Operators
    // -------------------------

    /** Negation ('-') or logical not ('!'). */
    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface op1;

        public Unary(Token operator, ExprInterface op1) {
            this.operator = operator;
            this.op1 = op1;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }

        @Override
        public int line() { return operator.line; }
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface op1;
        public final Token operator;
        public final ExprInterface op2;

        public Binary(ExprInterface op1, Token operator, ExprInterface op2) {
            this.op1 = op1;
            this.operator = operator;
            this.op2 = op2;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }

        @Override
        public int line() { return operator.line; }
    }

    // -------------------------
    // Allocation / calls
    // -------------------------

    public static final class NewExpr implements ExprInterface {
        public final Token keyword;
        public final Token structName;

        public NewExpr(Token keyword, Token structName) {
            this.keyword = keyword;
            this.structName = structName;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNewExpr(this);
        }

        @Override
        public int line() { return keyword.line; }
    }

    public static final class Call implements ExprInterface {
        public final Token name;
        public final List<ExprInterface> args;

        public Call(Token name, List<ExprInterface> args) {
            this.name = name;
            this.args = List.copyOf(args);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }

        @Override
        public int line() { return name.line; }
    }
}
