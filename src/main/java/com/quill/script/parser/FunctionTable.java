package com.quill.script.parser;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.quill.debug.Debug;
import com.quill.script.ErrorType;
import com.quill.script.QuillError;
import com.quill.script.parser.Declaration.FunctionDecl;
import com.quill.script.parser.Declaration.TypedName;

/** User functions keyed by (name, arity). Built-ins are not stored here. */
public class FunctionTable {
    private static final String TAG = "FunctionTable";

    static final Set<String> BUILTINS = Set.of("print", "inputi", "inputs");

    private final Map<String, UserFunction> functions = new LinkedHashMap<>();

    private static String key(String name, int arity) {
        return name + "/" + arity;
    }

    public static FunctionTable load(List<FunctionDecl> decls, StructRegistry structs) {
        FunctionTable table = new FunctionTable();
        for (FunctionDecl decl : decls) {
            String name = decl.name.lexeme;
            int line = decl.name.line;

            if (decl.returnType == null) {
                throw new QuillError(ErrorType.TYPE_ERROR, line, "Function " + name + " has no return type");
            }
            String ret = decl.returnType.lexeme;
            if (!TypeRules.VOID.equals(ret) && !TypeRules.isValueType(ret, structs)) {
                throw new QuillError(ErrorType.TYPE_ERROR, decl.returnType.line,
                        "Invalid return type " + ret + " for function " + name);
            }

            Set<String> seen = new HashSet<>();
            for (TypedName p : decl.params) {
                String pType = (p.type == null) ? null : p.type.lexeme;
                if (pType == null || !TypeRules.isValueType(pType, structs)) {
                    throw new QuillError(ErrorType.TYPE_ERROR, p.name.line,
                            "Invalid type " + pType + " for parameter " + p.name.lexeme + " of " + name);
                }
                if (!seen.add(p.name.lexeme)) {
                    throw new QuillError(ErrorType.NAME_ERROR, p.name.line,
                            "Duplicate parameter " + p.name.lexeme + " in function " + name);
                }
            }

            String k = key(name, decl.arity());
            if (table.functions.containsKey(k)) {
                throw new QuillError(ErrorType.NAME_ERROR, line,
                        "Duplicate definition of function " + name + " with " + decl.arity() + " parameter(s)");
            }
            if (BUILTINS.contains(name)) {
                Debug.get().w(TAG, "function " + k + " is shadowed by the builtin " + name + " and can never be called");
            }
            table.functions.put(k, new UserFunction(decl));
            Debug.get().d(TAG, "func " + k + " : " + ret);
        }
        return table;
    }

    public UserFunction resolve(Token name, int arity) {
        UserFunction fn = functions.get(key(name.lexeme, arity));
        if (fn == null) {
            throw new QuillError(ErrorType.NAME_ERROR, name.line,
                    "No function " + name.lexeme + " taking " + arity + " argument(s)");
        }
        return fn;
    }

    public boolean contains(String name, int arity) {
        return functions.containsKey(key(name, arity));
    }
}
