package com.quill.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import com.quill.debug.Debug;
import com.quill.script.parser.AstJson;
import com.quill.script.parser.Environment;
import com.quill.script.parser.Interpreter;
import com.quill.script.parser.Lexer;
import com.quill.script.parser.Parser;
import com.quill.script.parser.Program;
import com.quill.script.parser.Token;
import com.quill.script.parser.Value;

/**
 * Quill engine facade: parses source text, builds the struct and function tables and
 * runs {@code main()}.
 *
 * ERROR HANDLING CONTRACT:
 *  - every failure surfaces as a {@link QuillError} (NAME, TYPE, FAULT or SYNTAX)
 *  - a registered {@link SystemErrorReporter} sees it first
 *  - the error is then always rethrown; a run never resumes after an error
 */
public class QuillScript {
    private static final String TAG = "QuillScript";

    /** Where print() and input prompts write, one line per call. */
    public interface OutputSink {
        void println(String line);
    }

    /** Where inputi()/inputs() read from. Returns null at end of input. */
    public interface InputSource {
        String readLine();
    }

    /** Host hook notified of every error before it is rethrown. */
    public interface SystemErrorReporter {
        void report(QuillError error, String functionName);
    }

    private OutputSink output = System.out::println;
    private InputSource input = null;
    private SystemErrorReporter errorReporter = null;
    private boolean traceOutput = false;

    public QuillScript() {}

    // ===================== CONFIGURATION =====================

    public void setOutput(OutputSink output) {
        this.output = (output == null) ? System.out::println : output;
    }

    public void setInput(InputSource input) {
        this.input = input;
    }

    public void setErrorReporter(SystemErrorReporter errorReporter) {
        this.errorReporter = errorReporter;
    }

    /** Emits a TRACE line through {@link Debug} for every executed statement. */
    public void setTraceOutput(boolean traceOutput) {
        this.traceOutput = traceOutput;
    }

    // ===================== ENGINE PUBLIC API =====================

    public Program parse(String source) {
        try {
            List<Token> tokens = new Lexer(source).tokenize();
            return new Parser(tokens).parse();
        } catch (QuillError e) {
            throw report(e);
        }
    }

    public Value run(String source) {
        return run(parse(source));
    }

    /** Runs a parsed program and returns what main() returned (Void for a void main). */
    public Value run(Program program) {
        Interpreter interpreter = new Interpreter(new Environment(), output, inputSource(), traceOutput);
        try {
            Value result = interpreter.run(program);
            Debug.get().d(TAG, "main() returned " + result);
            return result;
        } catch (QuillError e) {
            throw report(e);
        }
    }

    public String dumpAst(String source) {
        return new AstJson().toPrettyString(parse(source));
    }

    private InputSource inputSource() {
        if (input != null) return input;
        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        return () -> {
            try {
                return stdin.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read standard input", e);
            }
        };
    }

    private QuillError report(QuillError e) {
        Debug.get().e(TAG, e.getMessage() + (e.function() == null ? "" : " (in " + e.function() + ")"));
        if (errorReporter != null) {
            try {
                errorReporter.report(e, e.function());
            } catch (RuntimeException re) {
                Debug.get().e(TAG, "error reporter failed", re);
                e.addSuppressed(re);
            }
        }
        return e;
    }
}
