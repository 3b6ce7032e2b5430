package com.mainframe.transpiler.orchestrator;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mainframe.transpiler.codegen.util.FileWriteUtil;
import com.mainframe.transpiler.mapping.FunctionalityMapping;

import lombok.Value;

/**
 * Outcome of a whole run, one entry per program in source order.
 */
@Value
public class RunReport {
    public static final String FILE_NAME = "run-report.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    List<ProgramReport> programs;

    public long count(ProgramStatus status) {
        return programs.stream().filter(p -> p.getStatus() == status).count();
    }

    public long failedCount() {
        return programs.stream().filter(p -> p.getStatus().isFailed()).count();
    }

    /**
     * True when every program succeeded, with or without edge cases.
     */
    @JsonIgnore
    public boolean isSuccess() {
        return failedCount() == 0;
    }

    @JsonIgnore
    public List<FunctionalityMapping> getMappings() {
        return programs.stream().flatMap(p -> p.getMappings().stream()).toList();
    }

    public String toJson() throws IOException {
        return MAPPER.writeValueAsString(this);
    }

    public Path write(Path directory) throws IOException {
        Path target = directory.resolve(FILE_NAME);
        FileWriteUtil.atomicWriteString(target, toJson());
        return target;
    }
}
