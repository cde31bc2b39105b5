package com.quill.script.parser;

import java.util.List;

import com.quill.script.parser.Statement.Stmt;

/** Top-level declarations. These are loaded into tables before anything executes. */
public class Declaration {

    /** name: type, as used for struct fields and function parameters. */
    public static final class TypedName {
        public final Token name;
        public final Token type;

        public TypedName(Token name, Token type) {
            this.name = name;
            this.type = type;
        }
    }

    public static final class StructDecl {
        public final Token name;
        public final List<TypedName> fields;

        public StructDecl(Token name, List<TypedName> fields) {
            this.name = name;
            this.fields = List.copyOf(fields);
        }
    }

    public static final class FunctionDecl {
        public final Token name;
        public final List<TypedName> params;
        public final Token returnType; // null only for host-built trees, rejected at load
        public final List<Stmt> statements;

        public FunctionDecl(Token name, List<TypedName> params, Token returnType, List<Stmt> statements) {
            this.name = name;
            this.params = List.copyOf(params);
            this.returnType = returnType;
            this.statements = List.copyOf(statements);
        }

        public int arity() { return params.size(); }
    }
}
