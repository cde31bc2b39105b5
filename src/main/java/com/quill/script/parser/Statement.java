package com.quill.script.parser;

import java.util.List;

public class Statement {

	public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);
        int line();
    }

    public interface StmtVisitor<R> {
        R visitVarDefStmt(VarDef stmt);
        R visitAssignStmt(Assign stmt);
        R visitExprStmt(ExprStmt stmt);
        R visitIfStmt(If stmt);
        R visitForStmt(For stmt);
        R visitReturnStmt(ReturnStmt stmt);
    }

    /** var name: type; */
    public static final class VarDef implements Stmt {
        public final Token name;
        public final Token varType; // may be null when built by a host without a type

        public VarDef(Token name, Token varType) {
            this.name = name;
            this.varType = varType;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitVarDefStmt(this); }
        public int line() { return name.line; }
    }

    /**
     * name = expression;  or  name.f1...fn = expression;
     * {@code path} is empty for a plain variable target.
     */
    public static final class Assign implements Stmt {
        public final Token name;
        public final List<Token> path;
        public final Expr.ExprInterface expression;

        public Assign(Token name, List<Token> path, Expr.ExprInterface expression) {
            this.name = name;
            this.path = List.copyOf(path);
            this.expression = expression;
        }

        public boolean isFieldTarget() { return !path.isEmpty(); }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAssignStmt(this); }
        public int line() { return name.line; }
    }

    /** A call used as a statement; its result is discarded. */
    public static final class ExprStmt implements Stmt {
        public final Expr.Call call;

        public ExprStmt(Expr.Call call) { this.call = call; }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitExprStmt(this); }
        public int line() { return call.line(); }
    }

    public static final class If implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface condition;
        public final List<Stmt> statements;
        public final List<Stmt> elseStatements; // null when there is no else arm

        public If(Token keyword, Expr.ExprInterface condition, List<Stmt> statements, List<Stmt> elseStatements) {
            this.keyword = keyword;
            this.condition = condition;
            this.statements = List.copyOf(statements);
            this.elseStatements = (elseStatements == null) ? null : List.copyOf(elseStatements);
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIfStmt(this); }
        public int line() { return keyword.line; }
    }

    public static final class For implements Stmt {
        public final Token keyword;
        public final Stmt init;
        public final Expr.ExprInterface condition;
        public final Stmt update;
        public final List<Stmt> statements;

        public For(Token keyword, Stmt init, Expr.ExprInterface condition, Stmt update, List<Stmt> statements) {
            this.keyword = keyword;
            this.init = init;
            this.condition = condition;
            this.update = update;
            this.statements = List.copyOf(statements);
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitForStmt(this); }
        public int line() { return keyword.line; }
    }

    public static final class ReturnStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface expression; // may be null

        public ReturnStmt(Token keyword, Expr.ExprInterface expression) {
            this.keyword = keyword;
            this.expression = expression;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitReturnStmt(this); }
        public int line() { return keyword.line; }
    }
}
