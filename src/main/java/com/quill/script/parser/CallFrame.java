package com.quill.script.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/** Activation record of one in-progress call: a LIFO of block scopes. */
public class CallFrame {
    final String functionName;
    final Deque<Map<String, Value>> blocks = new ArrayDeque<>();

    CallFrame(String functionName) {
        this.functionName = functionName;
        blocks.push(new LinkedHashMap<>()); // parameter block
    }
}
