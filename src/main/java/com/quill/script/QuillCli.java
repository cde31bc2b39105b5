package com.quill.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.quill.debug.Debug;
import com.quill.debug.DebugLevel;

public final class QuillCli {

    public static void main(String[] args) {
        boolean trace = false;
        boolean ast = false;
        String file = null;

        for (String a : args) {
            if ("--trace".equals(a)) trace = true;
            else if ("--ast".equals(a)) ast = true;
            else if (file == null && !a.startsWith("--")) file = a;
            else usage();
        }
        if (file == null) usage();

        final Path scriptPath = Path.of(file);
        final String script;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Failed to read script file: " + scriptPath);
            e.printStackTrace(System.err);
            System.exit(3);
            return;
        }

        if (trace) {
            Debug.useSysOut();
        } else {
            // warnings only; the error itself is printed below
            Debug.get().setSink((level, tag, message, error) -> {
                if (level == DebugLevel.WARN) System.err.println("[" + level + "][" + tag + "] " + message);
            });
        }

        final QuillScript engine = new QuillScript();
        engine.setTraceOutput(trace);

        try {
            if (ast) {
                System.out.println(engine.dumpAst(script));
            } else {
                engine.run(script);
            }
        } catch (QuillError e) {
            System.err.println(e.getMessage());
            System.exit(1);
        }
    }

    private static void usage() {
        System.err.println("Usage: QuillCli [--trace] [--ast] <script-file>");
        System.exit(2);
    }

    private QuillCli() {}
}
