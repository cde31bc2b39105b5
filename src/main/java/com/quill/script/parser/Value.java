package com.quill.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class Value {
    public enum Type { INT, STRING, BOOL, NIL, VOID, STRUCT }

    public final Type type;
    public final Object value;

    // STRUCT: the instance's struct name. NIL: the declared struct type of the slot it sits in, or null.
    private final String structName;

    private Value(Type type, Object value, String structName) {
        this.type = type;
        this.value = value;
        this.structName = structName;
    }

    private static final Value NIL = new Value(Type.NIL, null, null);
    private static final Value VOID = new Value(Type.VOID, null, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE, null);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE, null);

    public static Value integer(long l) { return new Value(Type.INT, l, null); }
    public static Value string(String s) { return new Value(Type.STRING, s, null); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value nil() { return NIL; }
    public static Value voidValue() { return VOID; }
    public static Value struct(StructInstance inst) { return new Value(Type.STRUCT, inst, inst.definition.name); }

    /** Nil held by a slot declared with struct type {@code structName}. */
    public static Value nil(String structName) {
        return (structName == null) ? NIL : new Value(Type.NIL, null, structName);
    }

    /** Ordered field schema of one declared struct. */
    public static final class StructDefinition {
        public final String name;
        // field name -> declared type name, in declaration order; read-only after load
        public final Map<String, String> fieldTypes;

        public StructDefinition(String name, Map<String, String> fieldTypes) {
            this.name = name;
            this.fieldTypes = Collections.unmodifiableMap(
                    (fieldTypes == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(fieldTypes));
        }

        public boolean hasField(String field) { return fieldTypes.containsKey(field); }

        public String fieldType(String field) { return fieldTypes.get(field); }
    }

    /**
     * One struct object. Field storage is owned by the instance; every holder of the
     * instance sees the same fields.
     */
    public static final class StructInstance {
        public final StructDefinition definition;
        private final Map<String, Value> fields;

        StructInstance(StructDefinition definition, Map<String, Value> fields) {
            this.definition = definition;
            this.fields = fields;
        }

        public Value get(String field) { return fields.get(field); }

        void set(String field, Value v) {
            if (!fields.containsKey(field)) {
                throw new IllegalStateException("No field " + field + " on " + definition.name);
            }
            fields.put(field, v);
        }

        public Map<String, Value> fieldsView() { return Collections.unmodifiableMap(fields); }
    }

    public Type getType() { return type; }

    public boolean isNil() { return type == Type.NIL; }

    /**
     * Struct type carried by this value: the instance's struct for STRUCT, the declared
     * struct for a typed nil, null otherwise.
     */
    public String structName() { return structName; }

    public long asInt() {
        if (type != Type.INT) throw new IllegalStateException("Expected int, got " + typeName());
        return (long) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + typeName());
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + typeName());
        return (String) value;
    }

    public StructInstance asStruct() {
        if (type != Type.STRUCT) throw new IllegalStateException("Expected struct instance, got " + typeName());
        return (StructInstance) value;
    }

    /** Type name as written in source ("int", "bool", ..., or the struct name). */
    public String typeName() {
        switch (type) {
            case INT: return TypeRules.INT;
            case STRING: return TypeRules.STRING;
            case BOOL: return TypeRules.BOOL;
            case VOID: return TypeRules.VOID;
            case STRUCT: return structName;
            default: return "nil";
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case INT:
                return Long.toString(asInt());
            case BOOL:
                return Boolean.toString(asBool());
            case STRING:
                return '"' + asString() + '"';
            case STRUCT:
                return structName + "@" + Integer.toHexString(System.identityHashCode(value));
            case VOID:
                return "void";
            default:
                return "nil";
        }
    }
}
