import org.junit.jupiter.api.Test;

import com.quill.script.ErrorType;
import com.quill.script.QuillError;
import com.quill.script.QuillScript;
import com.quill.script.parser.Operators;
import com.quill.script.parser.StructRegistry;
import com.quill.script.parser.Token;
import com.quill.script.parser.TokenType;
import com.quill.script.parser.Value;

import static org.junit.jupiter.api.Assertions.*;

public class OperatorsTest {

    private static Token op(TokenType type, String lexeme) {
        return new Token(type, lexeme, null, 1);
    }

    private static final Token PLUS = op(TokenType.PLUS, "+");
    private static final Token SLASH = op(TokenType.SLASH, "/");
    private static final Token EQ = op(TokenType.EQUAL_EQUAL, "==");
    private static final Token NE = op(TokenType.BANG_EQUAL, "!=");
    private static final Token AND = op(TokenType.AND_AND, "&&");
    private static final Token LT = op(TokenType.LESS, "<");

    private static ErrorType error(Token op, Value a, Value b) {
        return assertThrows(QuillError.class, () -> Operators.binary(op, a, b)).type();
    }

    @Test
    void floorDivision() {
        long[][] cases = {
                {7, 2, 3}, {-7, 2, -4}, {7, -2, -4}, {-7, -2, 3}, {6, 3, 2}, {-6, 3, -2}, {0, -5, 0}
        };
        for (long[] c : cases) {
            Value r = Operators.binary(SLASH, Value.integer(c[0]), Value.integer(c[1]));
            assertEquals(c[2], r.asInt(), c[0] + " / " + c[1]);
        }
    }

    @Test
    void divisionEdgeCasesFault() {
        assertEquals(ErrorType.FAULT_ERROR, error(SLASH, Value.integer(1), Value.integer(0)));
        assertEquals(ErrorType.FAULT_ERROR, error(SLASH, Value.integer(Long.MIN_VALUE), Value.integer(-1)));
        assertEquals(ErrorType.FAULT_ERROR,
                assertThrows(QuillError.class,
                        () -> Operators.unary(op(TokenType.MINUS, "-"), Value.integer(Long.MIN_VALUE))).type());
    }

    @Test
    void plusConcatenatesStringsOnly() {
        assertEquals("ab", Operators.binary(PLUS, Value.string("a"), Value.string("b")).asString());
        assertEquals(5L, Operators.binary(PLUS, Value.integer(2), Value.integer(3)).asInt());
        assertEquals(ErrorType.TYPE_ERROR, error(PLUS, Value.string("a"), Value.integer(1)));
        assertEquals(ErrorType.TYPE_ERROR, error(PLUS, Value.bool(true), Value.bool(true)));
    }

    @Test
    void comparisonsRequireInts() {
        assertTrue(Operators.binary(LT, Value.integer(1), Value.integer(2)).asBool());
        assertEquals(ErrorType.TYPE_ERROR, error(LT, Value.bool(false), Value.integer(2)));
    }

    @Test
    void nilEquality() {
        assertTrue(Operators.binary(EQ, Value.nil(), Value.nil()).asBool());
        assertTrue(Operators.binary(EQ, Value.nil("Node"), Value.nil()).asBool());
        assertFalse(Operators.binary(NE, Value.nil(), Value.nil("Other")).asBool());
        assertEquals(ErrorType.TYPE_ERROR, error(EQ, Value.nil(), Value.integer(0)));
        assertEquals(ErrorType.TYPE_ERROR, error(NE, Value.bool(false), Value.nil()));
    }

    @Test
    void structEqualityIsIdentity() {
        StructRegistry reg = StructRegistry.load(
                new QuillScript().parse("struct A { x: int; } struct B { x: int; }").structs);
        Value a1 = Value.struct(reg.instantiate(Token.identifier("A")));
        Value a2 = Value.struct(reg.instantiate(Token.identifier("A")));
        Value b = Value.struct(reg.instantiate(Token.identifier("B")));

        assertTrue(Operators.binary(EQ, a1, a1).asBool());
        assertFalse(Operators.binary(EQ, a1, a2).asBool());
        assertFalse(Operators.binary(EQ, a1, b).asBool());
        assertTrue(Operators.binary(NE, a1, b).asBool());
        assertFalse(Operators.binary(EQ, a1, Value.nil()).asBool());
    }

    @Test
    void voidOperandIsAlwaysTypeError() {
        assertEquals(ErrorType.TYPE_ERROR, error(EQ, Value.voidValue(), Value.nil()));
        assertEquals(ErrorType.TYPE_ERROR, error(PLUS, Value.integer(1), Value.voidValue()));
    }

    @Test
    void logicalCoercesIntsAndEvaluatesBoth() {
        assertFalse(Operators.binary(AND, Value.integer(3), Value.integer(0)).asBool());
        assertTrue(Operators.binary(AND, Value.bool(true), Value.integer(-1)).asBool());
        assertEquals(ErrorType.TYPE_ERROR, error(AND, Value.bool(true), Value.string("x")));
    }

    @Test
    void unaryNot() {
        Token bang = op(TokenType.BANG, "!");
        assertTrue(Operators.unary(bang, Value.integer(0)).asBool());
        assertFalse(Operators.unary(bang, Value.bool(true)).asBool());
        assertThrows(QuillError.class, () -> Operators.unary(bang, Value.nil()));
    }

    @Test
    void nonOperatorTokenIsRejected() {
        assertEquals(ErrorType.TYPE_ERROR, error(op(TokenType.COMMA, ","), Value.integer(1), Value.integer(2)));
    }
}
