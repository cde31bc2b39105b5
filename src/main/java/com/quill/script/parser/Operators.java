package com.quill.script.parser;

import com.quill.script.ErrorType;
import com.quill.script.QuillError;

/**
 * Unary and binary operator semantics. Every operator token is matched explicitly; any
 * (operator, left type, right type) combination not handled below is a TYPE_ERROR.
 */
public final class Operators {

    private Operators() {}

    public static Value unary(Token op, Value v) {
        switch (op.type) {
            case MINUS:
                requireInt(op, v, "Operand of unary '-'");
                try {
                    return Value.integer(Math.negateExact(v.asInt()));
                } catch (ArithmeticException e) {
                    throw new QuillError(ErrorType.FAULT_ERROR, op.line, "Integer overflow in unary '-'");
                }
            case BANG: {
                Value b = TypeRules.truthy(v);
                if (b.type != Value.Type.BOOL) {
                    throw new QuillError(ErrorType.TYPE_ERROR, op.line, "Operand of '!' must be bool, got " + v.typeName());
                }
                return Value.bool(!b.asBool());
            }
            default:
                throw new QuillError(ErrorType.TYPE_ERROR, op.line, "Unknown unary operator " + op.lexeme);
        }
    }

    public static Value binary(Token op, Value left, Value right) {
        if (left.type == Value.Type.VOID || right.type == Value.Type.VOID) {
            throw new QuillError(ErrorType.TYPE_ERROR, op.line,
                    "Void value used as operand of '" + op.lexeme + "'");
        }
        switch (op.type) {
            case PLUS:
                if (left.type == Value.Type.STRING && right.type == Value.Type.STRING) {
                    return Value.string(left.asString() + right.asString());
                }
                return arithmetic(op, left, right);
            case MINUS:
            case STAR:
            case SLASH:
                return arithmetic(op, left, right);
            case LESS:
            case LESS_EQUAL:
            case GREATER:
            case GREATER_EQUAL:
                return comparison(op, left, right);
            case EQUAL_EQUAL:
                return Value.bool(equal(op, left, right));
            case BANG_EQUAL:
                return Value.bool(!equal(op, left, right));
            case AND_AND:
            case OR_OR:
                return logical(op, left, right);
            default:
                throw new QuillError(ErrorType.TYPE_ERROR, op.line, "Unknown binary operator " + op.lexeme);
        }
    }

    private static Value arithmetic(Token op, Value left, Value right) {
        requireInts(op, left, right);
        long a = left.asInt();
        long b = right.asInt();
        try {
            switch (op.type) {
                case PLUS: return Value.integer(Math.addExact(a, b));
                case MINUS: return Value.integer(Math.subtractExact(a, b));
                case STAR: return Value.integer(Math.multiplyExact(a, b));
                case SLASH:
                    if (b == 0) throw new QuillError(ErrorType.FAULT_ERROR, op.line, "Division by zero");
                    if (a == Long.MIN_VALUE && b == -1) throw new ArithmeticException("long overflow");
                    return Value.integer(Math.floorDiv(a, b));
                default:
                    throw new QuillError(ErrorType.TYPE_ERROR, op.line, "Unknown arithmetic operator " + op.lexeme);
            }
        } catch (ArithmeticException e) {
            throw new QuillError(ErrorType.FAULT_ERROR, op.line, "Integer overflow in '" + op.lexeme + "'");
        }
    }

    private static Value comparison(Token op, Value left, Value right) {
        requireInts(op, left, right);
        long a = left.asInt();
        long b = right.asInt();
        switch (op.type) {
            case LESS: return Value.bool(a < b);
            case LESS_EQUAL: return Value.bool(a <= b);
            case GREATER: return Value.bool(a > b);
            case GREATER_EQUAL: return Value.bool(a >= b);
            default:
                throw new QuillError(ErrorType.TYPE_ERROR, op.line, "Unknown comparison operator " + op.lexeme);
        }
    }

    // Both sides are already evaluated; there is no short-circuit.
    private static Value logical(Token op, Value left, Value right) {
        Value a = TypeRules.truthy(left);
        Value b = TypeRules.truthy(right);
        if (a.type != Value.Type.BOOL || b.type != Value.Type.BOOL) {
            throw mismatch(op, left, right);
        }
        return (op.type == TokenType.AND_AND)
                ? Value.bool(a.asBool() && b.asBool())
                : Value.bool(a.asBool() || b.asBool());
    }

    static boolean equal(Token op, Value left, Value right) {
        boolean lnil = left.isNil();
        boolean rnil = right.isNil();
        if (lnil && rnil) return true;

        if (lnil || rnil) {
            Value other = lnil ? right : left;
            if (other.type != Value.Type.STRUCT) throw mismatch(op, left, right);
            return false;
        }

        Value a = left;
        Value b = right;
        if (a.type == Value.Type.BOOL && b.type == Value.Type.INT) b = TypeRules.coerceIntToBool(b);
        if (a.type == Value.Type.INT && b.type == Value.Type.BOOL) a = TypeRules.coerceIntToBool(a);

        if (a.type != b.type) return false;
        switch (a.type) {
            case INT: return a.asInt() == b.asInt();
            case STRING: return a.asString().equals(b.asString());
            case BOOL: return a.asBool() == b.asBool();
            case STRUCT: return a.asStruct() == b.asStruct();
            default: throw mismatch(op, left, right);
        }
    }

    private static void requireInt(Token op, Value v, String what) {
        if (v.type != Value.Type.INT) {
            throw new QuillError(ErrorType.TYPE_ERROR, op.line, what + " must be int, got " + v.typeName());
        }
    }

    private static void requireInts(Token op, Value left, Value right) {
        if (left.type != Value.Type.INT || right.type != Value.Type.INT) throw mismatch(op, left, right);
    }

    private static QuillError mismatch(Token op, Value left, Value right) {
        return new QuillError(ErrorType.TYPE_ERROR, op.line,
                "Operator '" + op.lexeme + "' not defined for " + left.typeName() + " and " + right.typeName());
    }
}
