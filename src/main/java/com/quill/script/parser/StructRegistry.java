package com.quill.script.parser;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.quill.debug.Debug;
import com.quill.script.ErrorType;
import com.quill.script.QuillError;
import com.quill.script.parser.Declaration.StructDecl;
import com.quill.script.parser.Declaration.TypedName;
import com.quill.script.parser.Value.StructDefinition;
import com.quill.script.parser.Value.StructInstance;

/**
 * Declared struct types of one program run. Fully built before anything executes, so
 * field types may reference structs declared later in the source.
 */
public class StructRegistry {
    private static final String TAG = "StructRegistry";

    private final Map<String, StructDefinition> structs = new LinkedHashMap<>();

    public static StructRegistry load(List<StructDecl> decls) {
        StructRegistry registry = new StructRegistry();

        // pass 1: names, so field types can be forward references
        Map<String, StructDecl> byName = new HashMap<>();
        for (StructDecl decl : decls) {
            String name = decl.name.lexeme;
            if (byName.containsKey(name)) {
                throw new QuillError(ErrorType.NAME_ERROR, decl.name.line, "Duplicate struct definition: " + name);
            }
            if (TypeRules.isScalar(name) || TypeRules.VOID.equals(name)) {
                throw new QuillError(ErrorType.NAME_ERROR, decl.name.line, "Struct name shadows builtin type: " + name);
            }
            byName.put(name, decl);
        }

        // pass 2: field schemas
        for (StructDecl decl : decls) {
            String name = decl.name.lexeme;
            LinkedHashMap<String, String> fields = new LinkedHashMap<>();
            for (TypedName f : decl.fields) {
                String fieldName = f.name.lexeme;
                if (fields.containsKey(fieldName)) {
                    throw new QuillError(ErrorType.NAME_ERROR, f.name.line,
                            "Duplicate field name " + fieldName + " in struct " + name);
                }
                String fieldType = (f.type == null) ? null : f.type.lexeme;
                if (fieldType == null || !(TypeRules.isScalar(fieldType) || byName.containsKey(fieldType))) {
                    throw new QuillError(ErrorType.TYPE_ERROR, f.name.line,
                            "Invalid type " + fieldType + " for field " + name + "." + fieldName);
                }
                fields.put(fieldName, fieldType);
            }
            registry.structs.put(name, new StructDefinition(name, fields));
            Debug.get().d(TAG, "struct " + name + " " + fields);
        }
        return registry;
    }

    public boolean contains(String name) {
        return name != null && structs.containsKey(name);
    }

    public StructDefinition get(String name) {
        return structs.get(name);
    }

    /** Fresh instance with its own field storage, every field at its type's default. */
    public StructInstance instantiate(Token structName) {
        StructDefinition def = structs.get(structName.lexeme);
        if (def == null) {
            throw new QuillError(ErrorType.TYPE_ERROR, structName.line, "Struct " + structName.lexeme + " not found");
        }
        LinkedHashMap<String, Value> fields = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : def.fieldTypes.entrySet()) {
            fields.put(e.getKey(), TypeRules.defaultValue(e.getValue()));
        }
        return new StructInstance(def, fields);
    }

    public int size() { return structs.size(); }
}
