import org.junit.jupiter.api.Test;

import com.quill.script.ErrorType;
import com.quill.script.QuillError;
import com.quill.script.QuillScript;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class QuillScriptStructTest {

    private static final String NODE = "struct Node { var val: int; var next: Node; }";
    private static final String POINT = "struct Point { x: int; y: int; label: string; shown: bool; }";

    private static List<String> run(String... lines) {
        List<String> out = new ArrayList<>();
        QuillScript qs = new QuillScript();
        qs.setOutput(out::add);
        qs.setInput(() -> null);
        qs.run(String.join("\n", lines));
        return out;
    }

    private static ErrorType fail(String... lines) {
        return assertThrows(QuillError.class, () -> run(lines)).type();
    }

    @Test
    void structVariableStartsNil() {
        List<String> out = run(POINT,
                "func main(): void { var p: Point; print(p == nil, p != nil); }");
        assertEquals(List.of("truefalse"), out);
    }

    @Test
    void newInstanceHasFieldDefaults() {
        List<String> out = run(POINT,
                "func main(): void {",
                "  var p: Point;",
                "  p = new Point;",
                "  print(p.x, \",\", p.y, \",[\", p.label, \"],\", p.shown);",
                "}");
        assertEquals(List.of("0,0,[],false"), out);
    }

    @Test
    void fieldAssignmentAndRead() {
        List<String> out = run(POINT,
                "func main(): void {",
                "  var p: Point;",
                "  p = new Point;",
                "  p.x = 3; p.y = p.x * 2; p.label = \"pt\";",
                "  print(p.label, p.x + p.y);",
                "}");
        assertEquals(List.of("pt9"), out);
    }

    @Test
    void instancesAreSharedByReference() {
        List<String> out = run(POINT,
                "func bump(p: Point): void { p.x = p.x + 1; }",
                "func main(): void {",
                "  var a: Point; var b: Point;",
                "  a = new Point;",
                "  b = a;",
                "  b.x = 5;",
                "  bump(a);",
                "  print(a.x, b.x);",
                "}");
        assertEquals(List.of("66"), out);
    }

    @Test
    void separateInstancesNeverAlias() {
        List<String> out = run(POINT,
                "func main(): void {",
                "  var a: Point; var b: Point;",
                "  a = new Point; b = new Point;",
                "  a.x = 1;",
                "  print(a == b, a == a, a != b, b.x);",
                "}");
        assertEquals(List.of("falsetruetrue0"), out);
    }

    @Test
    void nestedFieldPaths() {
        List<String> out = run(NODE,
                "func main(): void {",
                "  var n: Node;",
                "  n = new Node;",
                "  n.next = new Node;",
                "  n.next.next = new Node;",
                "  n.next.next.val = 7;",
                "  print(n.next.next.val, n.next.next.next == nil);",
                "}");
        assertEquals(List.of("7true"), out);
    }

    @Test
    void linkedListTraversal() {
        List<String> out = run(NODE,
                "func push(head: Node, v: int): Node {",
                "  var n: Node;",
                "  n = new Node;",
                "  n.val = v;",
                "  n.next = head;",
                "  return n;",
                "}",
                "func main(): void {",
                "  var head: Node; var cur: Node; var sum: int;",
                "  for (var i: int; i < 4; i = i + 1) { head = push(head, i); }",
                "  for (cur = head; cur != nil; cur = cur.next) { sum = sum + cur.val; print(cur.val); }",
                "  print(sum);",
                "}");
        assertEquals(List.of("3", "2", "1", "0", "6"), out);
    }

    @Test
    void dereferencingNilIsFault() {
        assertEquals(ErrorType.FAULT_ERROR, fail(NODE,
                "func main(): void { var n: Node; print(n.val); }"));
        assertEquals(ErrorType.FAULT_ERROR, fail(NODE,
                "func main(): void { var n: Node; n.val = 1; }"));
        assertEquals(ErrorType.FAULT_ERROR, fail(NODE,
                "func main(): void { var n: Node; n = new Node; n.next.val = 1; }"));
    }

    @Test
    void unknownFieldIsNameError() {
        assertEquals(ErrorType.NAME_ERROR, fail(NODE,
                "func main(): void { var n: Node; n = new Node; print(n.foo); }"));
        assertEquals(ErrorType.NAME_ERROR, fail(NODE,
                "func main(): void { var n: Node; n = new Node; n.foo = 1; }"));
    }

    @Test
    void undefinedBaseIsNameError() {
        assertEquals(ErrorType.NAME_ERROR, fail(NODE,
                "func main(): void { print(missing.val); }"));
    }

    @Test
    void fieldAccessOnScalarIsTypeError() {
        assertEquals(ErrorType.TYPE_ERROR, fail(NODE,
                "func main(): void { var i: int; print(i.val); }"));
        assertEquals(ErrorType.TYPE_ERROR, fail(NODE,
                "func main(): void { var n: Node; n = new Node; print(n.val.x); }"));
    }

    @Test
    void fieldAssignmentIsTypeChecked() {
        assertEquals(ErrorType.TYPE_ERROR, fail(NODE,
                "func main(): void { var n: Node; n = new Node; n.val = \"s\"; }"));
        assertEquals(ErrorType.TYPE_ERROR, fail(NODE, POINT,
                "func main(): void { var n: Node; n = new Node; n.next = new Point; }"));
    }

    @Test
    void boolFieldCoercesInt() {
        List<String> out = run(POINT,
                "func main(): void { var p: Point; p = new Point; p.shown = 2; print(p.shown); p.shown = 0; print(p.shown); }");
        assertEquals(List.of("true", "false"), out);
    }

    @Test
    void structFieldAcceptsNil() {
        List<String> out = run(NODE,
                "func main(): void {",
                "  var n: Node;",
                "  n = new Node; n.next = new Node;",
                "  n.next = nil;",
                "  print(n.next == nil);",
                "}");
        assertEquals(List.of("true"), out);
    }

    @Test
    void nilSlotRemembersDeclaredStruct() {
        assertEquals(ErrorType.TYPE_ERROR, fail(NODE, POINT,
                "func main(): void { var n: Node; n = new Point; }"));
        assertEquals(ErrorType.TYPE_ERROR, fail(NODE, POINT,
                "func main(): void { var n: Node; n = new Node; n = nil; n = new Point; }"));
    }

    @Test
    void structParametersAndReturns() {
        List<String> out = run(NODE,
                "func isNil(n: Node): bool { return n == nil; }",
                "func none(): Node { return nil; }",
                "func fallThrough(): Node { }",
                "func main(): void {",
                "  var n: Node;",
                "  n = none();",
                "  print(isNil(nil), isNil(new Node), n == nil, fallThrough() == nil);",
                "}");
        assertEquals(List.of("truefalsetruetrue"), out);
    }

    @Test
    void structArgumentOfWrongTypeIsTypeError() {
        assertEquals(ErrorType.TYPE_ERROR, fail(NODE, POINT,
                "func f(n: Node): void { }",
                "func main(): void { f(new Point); }"));
        assertEquals(ErrorType.TYPE_ERROR, fail(NODE,
                "func f(n: Node): void { }",
                "func main(): void { f(3); }"));
    }

    @Test
    void differentStructTypesCompareUnequal() {
        List<String> out = run(NODE, POINT,
                "func main(): void { print(new Node == new Point, new Node != new Point); }");
        assertEquals(List.of("falsetrue"), out);
    }

    @Test
    void fieldTypesMayReferenceLaterStructs() {
        List<String> out = run(
                "struct A { b: B; }",
                "struct B { x: int; }",
                "func main(): void { var a: A; a = new A; a.b = new B; a.b.x = 4; print(a.b.x); }");
        assertEquals(List.of("4"), out);
    }

    @Test
    void declarationErrors() {
        assertEquals(ErrorType.NAME_ERROR, fail("struct A { x: int; }", "struct A { y: int; }",
                "func main(): void { }"));
        assertEquals(ErrorType.NAME_ERROR, fail("struct A { x: int; x: bool; }",
                "func main(): void { }"));
        assertEquals(ErrorType.TYPE_ERROR, fail("struct A { x: Missing; }",
                "func main(): void { }"));
        assertEquals(ErrorType.TYPE_ERROR, fail("struct A { x: void; }",
                "func main(): void { }"));
    }

    @Test
    void unknownStructUseIsTypeError() {
        assertEquals(ErrorType.TYPE_ERROR, fail("func main(): void { var m: Missing; }"));
        assertEquals(ErrorType.TYPE_ERROR, fail(NODE, "func main(): void { var n: Node; n = new Missing; }"));
    }

    @Test
    void printingAStructIsTypeError() {
        assertEquals(ErrorType.TYPE_ERROR, fail(NODE,
                "func main(): void { print(new Node); }"));
    }

    @Test
    void printingNilWritesPlaceholder() {
        List<String> out = run(NODE, "func main(): void { var n: Node; print(n); print(nil); }");
        assertEquals(List.of("nil", "nil"), out);
    }
}
