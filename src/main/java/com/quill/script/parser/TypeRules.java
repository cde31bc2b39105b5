package com.quill.script.parser;

/**
 * Declared-type rules shared by definitions, assignment, argument binding and returns.
 * Declared types are plain names: int, string, bool, void or a struct name.
 */
public final class TypeRules {

    public static final String INT = "int";
    public static final String STRING = "string";
    public static final String BOOL = "bool";
    public static final String VOID = "void";

    private TypeRules() {}

    public static boolean isScalar(String typeName) {
        return INT.equals(typeName) || STRING.equals(typeName) || BOOL.equals(typeName);
    }

    /** int, string, bool or a registered struct. Void is not a valid slot type. */
    public static boolean isValueType(String typeName, StructRegistry structs) {
        return isScalar(typeName) || structs.contains(typeName);
    }

    /** Value a freshly defined slot of this type holds. Struct types start out as nil. */
    public static Value defaultValue(String typeName) {
        switch (typeName) {
            case INT: return Value.integer(0);
            case STRING: return Value.string("");
            case BOOL: return Value.bool(false);
            case VOID: return Value.voidValue();
            default: return Value.nil(typeName);
        }
    }

    /** 0 -> false, anything else -> true. Only applied at coercion points. */
    public static Value coerceIntToBool(Value v) {
        return Value.bool(v.asInt() != 0);
    }

    /** Coerces an Int to Bool when it is one; any other value passes through untouched. */
    public static Value truthy(Value v) {
        return (v.type == Value.Type.INT) ? coerceIntToBool(v) : v;
    }

    /**
     * Fits {@code v} into a slot declared as {@code declaredType}, applying the Int->Bool
     * coercion point and the nil/struct rule. Returns null when the value does not fit.
     */
    public static Value conform(String declaredType, Value v) {
        if (declaredType == null) return null;
        switch (v.type) {
            case INT:
                if (BOOL.equals(declaredType)) return coerceIntToBool(v);
                return INT.equals(declaredType) ? v : null;
            case STRING:
                return STRING.equals(declaredType) ? v : null;
            case BOOL:
                return BOOL.equals(declaredType) ? v : null;
            case STRUCT:
                return declaredType.equals(v.structName()) ? v : null;
            case NIL:
                // nil only fits struct slots; it takes on the slot's struct type
                if (isScalar(declaredType) || VOID.equals(declaredType)) return null;
                return Value.nil(declaredType);
            default:
                return null;
        }
    }

    /** Declared type of the slot currently holding {@code current}. */
    public static String slotType(Value current) {
        if (current.type == Value.Type.NIL) {
            return (current.structName() == null) ? "nil" : current.structName();
        }
        return current.typeName();
    }
}
