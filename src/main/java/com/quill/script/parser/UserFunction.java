package com.quill.script.parser;

import java.util.List;

import com.quill.script.ErrorType;
import com.quill.script.QuillError;
import com.quill.script.parser.Declaration.FunctionDecl;
import com.quill.script.parser.Declaration.TypedName;

public class UserFunction {
    final FunctionDecl decl;
    final String name;
    final String returnType;

    UserFunction(FunctionDecl decl) {
        this.decl = decl;
        this.name = decl.name.lexeme;
        this.returnType = decl.returnType.lexeme;
    }

    public int arity() { return decl.arity(); }

    /** Fits an already-evaluated argument to parameter {@code i}, or raises TYPE_ERROR. */
    Value conformArgument(int i, Value arg, Token callSite) {
        TypedName p = decl.params.get(i);
        Value v = TypeRules.conform(p.type.lexeme, arg);
        if (v == null) {
            throw new QuillError(ErrorType.TYPE_ERROR, callSite.line,
                    "Argument " + (i + 1) + " of " + name + "(): expected " + p.type.lexeme + ", got " + arg.typeName());
        }
        return v;
    }

    /**
     * Arguments must already be evaluated in the caller's frame and conformed.
     * The frame is popped on every exit path.
     */
    Value call(Interpreter interpreter, List<Value> args, Token callSite) {
        if (args.size() != decl.arity()) {
            throw new IllegalStateException(name + "() expects " + decl.arity() + " arguments, got " + args.size());
        }

        Environment env = interpreter.env;
        env.pushFrame(name);
        ExecResult result;
        try {
            for (int i = 0; i < args.size(); i++) {
                // parameter names were checked for duplicates at load time
                env.define(decl.params.get(i).name.lexeme, args.get(i));
            }
            result = interpreter.runBlock(decl.statements);
        } catch (QuillError e) {
            throw e.attachFunction(name);
        } finally {
            env.popFrame();
        }
        return returnValue(result, callSite);
    }

    private Value returnValue(ExecResult result, Token callSite) {
        if (TypeRules.VOID.equals(returnType)) {
            if (result.isReturn() && !result.value.isNil()) {
                throw new QuillError(ErrorType.TYPE_ERROR, callSite.line,
                        "Function " + name + " is void but returned " + result.value.typeName());
            }
            return Value.voidValue();
        }

        if (!result.isReturn()) return TypeRules.defaultValue(returnType);

        Value v = result.value;
        if (v.isNil() && TypeRules.isScalar(returnType)) return TypeRules.defaultValue(returnType);

        Value conformed = TypeRules.conform(returnType, v);
        if (conformed == null) {
            throw new QuillError(ErrorType.TYPE_ERROR, callSite.line,
                    "Function " + name + " must return " + returnType + ", got " + v.typeName());
        }
        return conformed;
    }
}
