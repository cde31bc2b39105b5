package com.quill.script.parser;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quill.script.parser.Declaration.FunctionDecl;
import com.quill.script.parser.Declaration.StructDecl;
import com.quill.script.parser.Declaration.TypedName;
import com.quill.script.parser.Expr.Binary;
import com.quill.script.parser.Expr.Call;
import com.quill.script.parser.Expr.ExprInterface;
import com.quill.script.parser.Expr.ExprVisitor;
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
import com.quill.script.parser.Statement.StmtVisitor;
import com.quill.script.parser.Statement.VarDef;

/**
 * Renders a parsed program as a tree of JSON objects. Each node carries a "kind" tag
 * plus its named children (op1, op2, args, statements, ...).
 */
public final class AstJson implements ExprVisitor<JsonNode>, StmtVisitor<JsonNode> {

    private final ObjectMapper om;

    public AstJson() {
        this(new ObjectMapper());
    }

    public AstJson(ObjectMapper om) {
        this.om = om;
    }

    public ObjectNode toJson(Program program) {
        ObjectNode root = node("program");
        ArrayNode structs = root.putArray("structs");
        for (StructDecl s : program.structs) structs.add(struct(s));
        ArrayNode functions = root.putArray("functions");
        for (FunctionDecl f : program.functions) functions.add(function(f));
        return root;
    }

    public String toPrettyString(Program program) {
        return toJson(program).toPrettyString();
    }

    private ObjectNode node(String kind) {
        ObjectNode n = om.createObjectNode();
        n.put("kind", kind);
        return n;
    }

    private ObjectNode struct(StructDecl s) {
        ObjectNode n = node("struct");
        n.put("name", s.name.lexeme);
        ArrayNode fields = n.putArray("fields");
        for (TypedName f : s.fields) fields.add(typed("field", f));
        return n;
    }

    private ObjectNode function(FunctionDecl f) {
        ObjectNode n = node("func");
        n.put("name", f.name.lexeme);
        ArrayNode args = n.putArray("args");
        for (TypedName p : f.params) args.add(typed("arg", p));
        n.put("return_type", f.returnType == null ? null : f.returnType.lexeme);
        n.set("statements", statements(f.statements));
        return n;
    }

    private ObjectNode typed(String kind, TypedName t) {
        ObjectNode n = node(kind);
        n.put("name", t.name.lexeme);
        n.put("var_type", t.type == null ? null : t.type.lexeme);
        return n;
    }

    private ArrayNode statements(List<Stmt> stmts) {
        ArrayNode a = om.createArrayNode();
        for (Stmt s : stmts) a.add(s.accept(this));
        return a;
    }

    private JsonNode expr(ExprInterface e) {
        return (e == null) ? om.nullNode() : e.accept(this);
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public JsonNode visitVarDefStmt(VarDef stmt) {
        ObjectNode n = node("vardef");
        n.put("name", stmt.name.lexeme);
        n.put("var_type", stmt.varType == null ? null : stmt.varType.lexeme);
        return n;
    }

    @Override
    public JsonNode visitAssignStmt(Assign stmt) {
        ObjectNode n = node("=");
        StringBuilder target = new StringBuilder(stmt.name.lexeme);
        for (Token t : stmt.path) target.append('.').append(t.lexeme);
        n.put("name", target.toString());
        n.set("expression", expr(stmt.expression));
        return n;
    }

    @Override
    public JsonNode visitExprStmt(ExprStmt stmt) {
        return stmt.call.accept(this);
    }

    @Override
    public JsonNode visitIfStmt(If stmt) {
        ObjectNode n = node("if");
        n.set("condition", expr(stmt.condition));
        n.set("statements", statements(stmt.statements));
        n.set("else_statements", stmt.elseStatements == null ? om.nullNode() : statements(stmt.elseStatements));
        return n;
    }

    @Override
    public JsonNode visitForStmt(For stmt) {
        ObjectNode n = node("for");
        n.set("init", stmt.init.accept(this));
        n.set("condition", expr(stmt.condition));
        n.set("update", stmt.update.accept(this));
        n.set("statements", statements(stmt.statements));
        return n;
    }

    @Override
    public JsonNode visitReturnStmt(ReturnStmt stmt) {
        ObjectNode n = node("return");
        n.set("expression", expr(stmt.expression));
        return n;
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public JsonNode visitLiteralExpr(Literal expr) {
        Object v = expr.value;
        if (v == null) return node("nil");
        if (v instanceof Long) {
            ObjectNode n = node("int");
            n.put("val", (Long) v);
            return n;
        }
        if (v instanceof Boolean) {
            ObjectNode n = node("bool");
            n.put("val", (Boolean) v);
            return n;
        }
        ObjectNode n = node("string");
        n.put("val", String.valueOf(v));
        return n;
    }

    @Override
    public JsonNode visitVariableExpr(Variable expr) {
        ObjectNode n = node("var");
        n.put("name", expr.name.lexeme);
        return n;
    }

    @Override
    public JsonNode visitFieldAccessExpr(FieldAccess expr) {
        ObjectNode n = node("var");
        n.put("name", expr.dotted());
        return n;
    }

    @Override
    public JsonNode visitUnaryExpr(Unary expr) {
        ObjectNode n = node(expr.operator.type == TokenType.MINUS ? "neg" : "!");
        n.set("op1", expr(expr.op1));
        return n;
    }

    @Override
    public JsonNode visitBinaryExpr(Binary expr) {
        ObjectNode n = node(expr.operator.lexeme);
        n.set("op1", expr(expr.op1));
        n.set("op2", expr(expr.op2));
        return n;
    }

    @Override
    public JsonNode visitNewExpr(NewExpr expr) {
        ObjectNode n = node("new");
        n.put("var_type", expr.structName.lexeme);
        return n;
    }

    @Override
    public JsonNode visitCallExpr(Call expr) {
        ObjectNode n = node("fcall");
        n.put("name", expr.name.lexeme);
        ArrayNode args = n.putArray("args");
        for (ExprInterface a : expr.args) args.add(a.accept(this));
        return n;
    }
}
