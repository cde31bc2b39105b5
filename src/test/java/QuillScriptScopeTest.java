import org.junit.jupiter.api.Test;

import com.quill.script.ErrorType;
import com.quill.script.QuillError;
import com.quill.script.QuillScript;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class QuillScriptScopeTest {

    private static List<String> run(List<String> out, String... lines) {
        QuillScript qs = new QuillScript();
        qs.setOutput(out::add);
        qs.setInput(() -> null);
        qs.run(String.join("\n", lines));
        return out;
    }

    private static List<String> run(String... lines) {
        return run(new ArrayList<>(), lines);
    }

    @Test
    void innerBlockShadowsOuterVariable() {
        List<String> out = run(
                "func main(): void {",
                "  var x: int;",
                "  x = 1;",
                "  if (true) {",
                "    var x: string;",
                "    x = \"inner\";",
                "    print(x);",
                "  }",
                "  print(x);",
                "}");
        assertEquals(List.of("inner", "1"), out);
    }

    @Test
    void assignmentReachesOuterBlock() {
        List<String> out = run(
                "func main(): void {",
                "  var x: int;",
                "  if (true) { if (true) { x = 5; } }",
                "  print(x);",
                "}");
        assertEquals(List.of("5"), out);
    }

    @Test
    void duplicateDefinitionInSameBlockIsNameError() {
        QuillError e = assertThrows(QuillError.class, () -> run(
                "func main(): void { var x: int; var x: int; }"));
        assertEquals(ErrorType.NAME_ERROR, e.type());
    }

    @Test
    void loopBodyVariableDoesNotOutliveIteration() {
        List<String> out = new ArrayList<>();
        QuillError e = assertThrows(QuillError.class, () -> run(out,
                "func main(): void {",
                "  for (var i: int; i < 3; i = i + 1) {",
                "    var t: int;",
                "    t = t + i;",
                "    print(t);",
                "  }",
                "  print(t);",
                "}"));
        assertEquals(ErrorType.NAME_ERROR, e.type());
        // t is fresh (0) each iteration, so no duplicate-definition error either
        assertEquals(List.of("0", "1", "2"), out);
    }

    @Test
    void ifArmVariableIsGoneAfterward() {
        QuillError e = assertThrows(QuillError.class, () -> run(
                "func main(): void {",
                "  if (true) { var y: int; } else { }",
                "  y = 1;",
                "}"));
        assertEquals(ErrorType.NAME_ERROR, e.type());
    }

    @Test
    void calleeCannotSeeCallerLocals() {
        QuillError e = assertThrows(QuillError.class, () -> run(
                "func peek(): int { return x; }",
                "func main(): void { var x: int; x = 3; print(peek()); }"));
        assertEquals(ErrorType.NAME_ERROR, e.type());
    }

    @Test
    void eachCallGetsItsOwnFrame() {
        List<String> out = run(
                "func depth(n: int): int {",
                "  var local: int;",
                "  local = n;",
                "  if (n > 0) { depth(n - 1); }",
                "  return local;",
                "}",
                "func main(): void { print(depth(3)); }");
        assertEquals(List.of("3"), out);
    }

    @Test
    void callerFrameIsRestoredAfterError() {
        // the error unwinds every frame; a second run on the same engine starts clean
        QuillScript qs = new QuillScript();
        List<String> out = new ArrayList<>();
        qs.setOutput(out::add);
        assertThrows(QuillError.class, () -> qs.run(
                "func boom(): int { return 1 / 0; } func main(): void { print(boom()); }"));
        qs.run("func main(): void { var x: int; print(x); }");
        assertEquals(List.of("0"), out);
    }

    @Test
    void undefinedVariableInAssignmentIsNameError() {
        QuillError e = assertThrows(QuillError.class, () -> run(
                "func main(): void { y = 2; }"));
        assertEquals(ErrorType.NAME_ERROR, e.type());
    }

    @Test
    void parametersAreLocalToTheCall() {
        List<String> out = run(
                "func twice(n: int): int { n = n * 2; return n; }",
                "func main(): void {",
                "  var n: int;",
                "  n = 4;",
                "  print(twice(n), \" \", n);",
                "}");
        assertEquals(List.of("8 4"), out);
    }
}
