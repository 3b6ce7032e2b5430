package com.mainframe.transpiler.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.mainframe.transpiler.diagnostics.TranspilerException;

/**
 * Record stream over a list: input records are given up front, written records are collected.
 */
public class InMemoryRecordStream implements RecordStream {
    private final List<String> input;
    private final List<String> written = new ArrayList<>();
    private int position;
    private String mode;

    public InMemoryRecordStream(List<String> input) {
        this.input = List.copyOf(input);
    }

    public InMemoryRecordStream() {
        this(List.of());
    }

    @Override
    public void open(String mode) {
        if (this.mode != null) {
            throw new TranspilerException("Record stream already open in mode " + this.mode);
        }
        this.mode = mode;
        this.position = 0;
        if ("OUTPUT".equals(mode)) {
            written.clear();
        }
    }

    @Override
    public String read() {
        requireOpen();
        return position < input.size() ? input.get(position++) : null;
    }

    @Override
    public void write(String record) {
        requireOpen();
        written.add(record);
    }

    @Override
    public void close() {
        requireOpen();
        mode = null;
    }

    public List<String> getWritten() {
        return Collections.unmodifiableList(written);
    }

    public boolean isOpen() {
        return mode != null;
    }

    private void requireOpen() {
        if (mode == null) {
            throw new TranspilerException("Record stream is not open");
        }
    }
}
