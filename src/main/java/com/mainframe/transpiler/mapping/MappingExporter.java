package com.mainframe.transpiler.mapping;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mainframe.transpiler.codegen.util.FileWriteUtil;

/**
 * Writes and reads the functionality mappings of a run as one JSON array.
 */
public class MappingExporter {
    private static final Logger log = LoggerFactory.getLogger(MappingExporter.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public void write(List<FunctionalityMapping> mappings, Path target) throws IOException {
        FileWriteUtil.atomicWriteString(target, MAPPER.writeValueAsString(mappings));
        log.info("Wrote {} functionality mappings to {}", mappings.size(), target);
    }

    public List<FunctionalityMapping> read(Path source) throws IOException {
        return MAPPER.readValue(source.toFile(), new TypeReference<List<FunctionalityMapping>>() {
        });
    }
}
