package com.quill.script.parser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.quill.debug.Debug;
import com.quill.script.ErrorType;
import com.quill.script.QuillError;
import com.quill.script.QuillScript.InputSource;
import com.quill.script.QuillScript.OutputSink;
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
import com.quill.script.parser.Value.StructInstance;

public class Interpreter implements ExprVisitor<Value>, StmtVisitor<ExecResult> {
    private static final String TAG = "Interpreter";

    /** Built-ins see the raw argument expressions; they decide arity and evaluation order. */
    private interface Builtin {
        Value call(Token name, List<ExprInterface> args);
    }

    final Environment env;
    private final OutputSink out;
    private final InputSource in;
    private final boolean trace;
    private final Map<String, Builtin> builtins = new HashMap<>();

    private StructRegistry structs = new StructRegistry();
    private FunctionTable functions = new FunctionTable();

    public Interpreter(Environment env, OutputSink out, InputSource in, boolean trace) {
        this.env = env;
        this.out = out;
        this.in = in;
        this.trace = trace;

        builtins.put("print", this::callPrint);
        builtins.put("inputi", (name, args) -> {
            String line = readInput(name, args);
            try {
                return Value.integer(Long.parseLong(line.trim()));
            } catch (NumberFormatException e) {
                throw new QuillError(ErrorType.TYPE_ERROR, name.line, "inputi() read a non-integer value: '" + line + "'");
            }
        });
        builtins.put("inputs", (name, args) -> Value.string(readInput(name, args)));
    }

    // -------------------------
    // Program entry
    // -------------------------

    /** Loads struct and function declarations, then calls main() with no arguments. */
    public Value run(Program program) {
        structs = StructRegistry.load(program.structs);
        functions = FunctionTable.load(program.functions, structs);
        if (!functions.contains("main", 0)) {
            throw new QuillError(ErrorType.NAME_ERROR, "No main() function was found");
        }
        return invoke(Token.identifier("main"), List.of());
    }

    // -------------------------
    // Calls
    // -------------------------

    public Value invoke(Token name, List<ExprInterface> argExprs) {
        Builtin builtin = builtins.get(name.lexeme);
        if (builtin != null) return builtin.call(name, argExprs);

        UserFunction fn = functions.resolve(name, argExprs.size());

        // evaluated in the caller's frame, before the callee frame exists
        List<Value> args = new ArrayList<>(argExprs.size());
        for (int i = 0; i < argExprs.size(); i++) {
            args.add(fn.conformArgument(i, evaluate(argExprs.get(i)), name));
        }
        return fn.call(this, args, name);
    }

    private Value callPrint(Token name, List<ExprInterface> args) {
        StringBuilder sb = new StringBuilder();
        for (ExprInterface arg : args) {
            sb.append(printable(evaluate(arg), name));
        }
        out.println(sb.toString());
        return Value.voidValue();
    }

    private String readInput(Token name, List<ExprInterface> args) {
        if (args.size() > 1) {
            throw new QuillError(ErrorType.NAME_ERROR, name.line,
                    "No " + name.lexeme + "() function that takes " + args.size() + " parameters");
        }
        if (args.size() == 1) {
            out.println(printable(evaluate(args.get(0)), name));
        }
        String line = in.readLine();
        return (line == null) ? "" : line;
    }

    private static String printable(Value v, Token at) {
        switch (v.type) {
            case INT: return Long.toString(v.asInt());
            case STRING: return v.asString();
            case BOOL: return v.asBool() ? "true" : "false";
            case NIL: return "nil";
            default:
                throw new QuillError(ErrorType.TYPE_ERROR, at.line, "Cannot print a value of type " + v.typeName());
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    /** Runs {@code statements} in a fresh block, stopping at the first return. */
    public ExecResult runBlock(List<Stmt> statements) {
        env.pushBlock();
        try {
            for (Stmt s : statements) {
                ExecResult r = execute(s);
                if (r.isReturn()) return r;
            }
            return ExecResult.CONTINUE;
        } finally {
            env.popBlock();
        }
    }

    private ExecResult execute(Stmt stmt) {
        if (trace) {
            Debug.get().t(TAG, "line " + stmt.line() + ": " + stmt.getClass().getSimpleName()
                    + " in " + env.currentFunctionName());
        }
        return stmt.accept(this);
    }

    @Override
    public ExecResult visitVarDefStmt(VarDef stmt) {
        String type = (stmt.varType == null) ? null : stmt.varType.lexeme;
        if (type == null || !TypeRules.isValueType(type, structs)) {
            throw new QuillError(ErrorType.TYPE_ERROR, stmt.line(),
                    "Invalid type " + type + " for variable " + stmt.name.lexeme);
        }
        if (!env.define(stmt.name.lexeme, TypeRules.defaultValue(type))) {
            throw new QuillError(ErrorType.NAME_ERROR, stmt.line(),
                    "Duplicate definition for variable " + stmt.name.lexeme);
        }
        return ExecResult.CONTINUE;
    }

    @Override
    public ExecResult visitAssignStmt(Assign stmt) {
        Value value = evaluate(stmt.expression);

        if (stmt.isFieldTarget()) {
            List<Token> path = stmt.path;
            Token field = path.get(path.size() - 1);
            StructInstance owner = resolveOwner(stmt.name, path);
            String declared = owner.definition.fieldType(field.lexeme);
            Value conformed = TypeRules.conform(declared, value);
            if (conformed == null) {
                throw new QuillError(ErrorType.TYPE_ERROR, field.line, "Cannot assign " + value.typeName()
                        + " to field " + owner.definition.name + "." + field.lexeme + " of type " + declared);
            }
            owner.set(field.lexeme, conformed);
            return ExecResult.CONTINUE;
        }

        String name = stmt.name.lexeme;
        Value current = env.lookup(name);
        if (current == null) {
            throw new QuillError(ErrorType.NAME_ERROR, stmt.line(), "Undefined variable " + name + " in assignment");
        }
        String declared = TypeRules.slotType(current);
        Value conformed = TypeRules.conform(declared, value);
        if (conformed == null) {
            throw new QuillError(ErrorType.TYPE_ERROR, stmt.line(),
                    "Types " + declared + " and " + value.typeName() + " are incompatible for assignment to " + name);
        }
        env.assign(name, conformed);
        return ExecResult.CONTINUE;
    }

    @Override
    public ExecResult visitExprStmt(ExprStmt stmt) {
        invoke(stmt.call.name, stmt.call.args);
        return ExecResult.CONTINUE;
    }

    @Override
    public ExecResult visitIfStmt(If stmt) {
        if (condition(stmt.condition, stmt.keyword)) {
            return runBlock(stmt.statements);
        }
        if (stmt.elseStatements != null) {
            return runBlock(stmt.elseStatements);
        }
        return ExecResult.CONTINUE;
    }

    @Override
    public ExecResult visitForStmt(For stmt) {
        // init lives in the enclosing block so the counter survives iterations
        execute(stmt.init);
        while (condition(stmt.condition, stmt.keyword)) {
            ExecResult r = runBlock(stmt.statements);
            if (r.isReturn()) return r;
            execute(stmt.update);
        }
        return ExecResult.CONTINUE;
    }

    @Override
    public ExecResult visitReturnStmt(ReturnStmt stmt) {
        if (stmt.expression == null) return ExecResult.returning(Value.nil());
        return ExecResult.returning(evaluate(stmt.expression));
    }

    private boolean condition(ExprInterface expr, Token keyword) {
        Value raw = evaluate(expr);
        Value v = TypeRules.truthy(raw);
        if (v.type != Value.Type.BOOL) {
            throw new QuillError(ErrorType.TYPE_ERROR, keyword.line,
                    "Condition of '" + keyword.lexeme + "' must be bool, got " + raw.typeName());
        }
        return v.asBool();
    }

    // -------------------------
    // Expressions
    // -------------------------

    public Value evaluate(ExprInterface expr) {
        return expr.accept(this);
    }

    @Override
    public Value visitLiteralExpr(Literal expr) {
        Object v = expr.value;
        if (v == null) return Value.nil();
        if (v instanceof Long) return Value.integer((Long) v);
        if (v instanceof String) return Value.string((String) v);
        if (v instanceof Boolean) return Value.bool((Boolean) v);
        throw new IllegalStateException("Unsupported literal payload: " + v.getClass().getName());
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        Value v = env.lookup(expr.name.lexeme);
        if (v == null) {
            throw new QuillError(ErrorType.NAME_ERROR, expr.line(), "Variable " + expr.name.lexeme + " not found");
        }
        return v;
    }

    @Override
    public Value visitFieldAccessExpr(FieldAccess expr) {
        Token field = expr.path.get(expr.path.size() - 1);
        return resolveOwner(expr.base, expr.path).get(field.lexeme);
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        return Operators.unary(expr.operator, evaluate(expr.op1));
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = evaluate(expr.op1);
        Value right = evaluate(expr.op2);
        return Operators.binary(expr.operator, left, right);
    }

    @Override
    public Value visitNewExpr(NewExpr expr) {
        return Value.struct(structs.instantiate(expr.structName));
    }

    @Override
    public Value visitCallExpr(Call expr) {
        return invoke(expr.name, expr.args);
    }

    /**
     * Walks base.f1...fn and returns the instance owning fn, checking every hop:
     * undefined base (NAME), nil (FAULT), non-struct (TYPE), unknown field (NAME).
     */
    private StructInstance resolveOwner(Token base, List<Token> path) {
        Value current = env.lookup(base.lexeme);
        if (current == null) {
            throw new QuillError(ErrorType.NAME_ERROR, base.line, "Variable " + base.lexeme + " not found");
        }
        String reached = base.lexeme;
        StructInstance owner = null;
        for (Token field : path) {
            if (current.isNil()) {
                throw new QuillError(ErrorType.FAULT_ERROR, field.line, "Dereferencing nil through " + reached);
            }
            if (current.type != Value.Type.STRUCT) {
                throw new QuillError(ErrorType.TYPE_ERROR, field.line,
                        reached + " is of type " + current.typeName() + ", not a struct");
            }
            owner = current.asStruct();
            if (!owner.definition.hasField(field.lexeme)) {
                throw new QuillError(ErrorType.NAME_ERROR, field.line,
                        "Struct " + owner.definition.name + " has no field " + field.lexeme);
            }
            current = owner.get(field.lexeme);
            reached = reached + "." + field.lexeme;
        }
        return owner;
    }
}
