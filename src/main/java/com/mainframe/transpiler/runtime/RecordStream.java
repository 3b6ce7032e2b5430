package com.mainframe.transpiler.runtime;

/**
 * Abstract record-stream contract files are lowered to. Records are fixed-length strings.
 */
public interface RecordStream {

    void open(String mode);

    /**
     * Next record, or null at end of file.
     */
    String read();

    void write(String record);

    void close();
}
