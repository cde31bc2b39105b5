package com.quill.script.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stack of call frames, each a stack of blocks. Name resolution never leaves the
 * current frame.
 */
public class Environment {

    private final Deque<CallFrame> frames = new ArrayDeque<>();

    // -------------------------
    // Frames
    // -------------------------
    public void pushFrame(String functionName) {
        frames.push(new CallFrame(functionName));
    }

    public void popFrame() {
        if (frames.isEmpty()) {
            throw new IllegalStateException("Cannot pop frame: no active call");
        }
        frames.pop();
    }

    public int depth() {
        return frames.size();
    }

    /** Name of the function owning the current frame, or null outside any call. */
    public String currentFunctionName() {
        CallFrame f = frames.peek();
        return (f == null) ? null : f.functionName;
    }

    // -------------------------
    // Block-scoping (LIFO)
    // -------------------------
    public void pushBlock() {
        frame().blocks.push(new LinkedHashMap<>());
    }

    public void popBlock() {
        CallFrame f = frame();
        if (f.blocks.size() <= 1) {
            throw new IllegalStateException("Cannot pop parameter block of frame " + f.functionName);
        }
        f.blocks.pop();
    }

    private CallFrame frame() {
        CallFrame f = frames.peek();
        if (f == null) throw new IllegalStateException("Environment has no active frame (bug)");
        return f;
    }

    // -------------------------
    // Vars API
    // -------------------------

    /** False when the innermost block already holds {@code name}; outer blocks are not checked. */
    public boolean define(String name, Value value) {
        Map<String, Value> top = frame().blocks.peek();
        if (top.containsKey(name)) return false;
        top.put(name, value);
        return true;
    }

    /** Innermost-to-outermost over the current frame only; null when absent. */
    public Value lookup(String name) {
        for (Map<String, Value> block : frame().blocks) {
            Value v = block.get(name);
            if (v != null) return v;
        }
        return null;
    }

    /** Overwrites the first block holding {@code name}; false when absent from the frame. */
    public boolean assign(String name, Value value) {
        for (Map<String, Value> block : frame().blocks) {
            if (block.containsKey(name)) {
                block.put(name, value);
                return true;
            }
        }
        return false;
    }
}
