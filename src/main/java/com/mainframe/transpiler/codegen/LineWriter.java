package com.mainframe.transpiler.codegen;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects rendered lines with the indentation of the current block.
 */
public class LineWriter {
    private final String unit;
    private final List<String> lines = new ArrayList<>();
    private int depth;

    public LineWriter(String unit) {
        this.unit = unit;
    }

    public LineWriter line(String text) {
        lines.add(unit.repeat(depth) + text);
        return this;
    }

    public LineWriter indent() {
        depth++;
        return this;
    }

    public LineWriter dedent() {
        depth--;
        return this;
    }

    public int size() {
        return lines.size();
    }

    public List<String> lines() {
        return List.copyOf(lines);
    }
}
