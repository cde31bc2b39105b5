package com.quill.script.parser;

import java.util.List;

import com.quill.script.parser.Declaration.FunctionDecl;
import com.quill.script.parser.Declaration.StructDecl;

public class Program {
    public final List<StructDecl> structs;
    public final List<FunctionDecl> functions;

    public Program(List<StructDecl> structs, List<FunctionDecl> functions) {
        this.structs = List.copyOf(structs);
        this.functions = List.copyOf(functions);
    }
}
