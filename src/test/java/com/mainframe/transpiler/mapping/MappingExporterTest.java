package com.mainframe.transpiler.mapping;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the mappings JSON file.
 */
class MappingExporterTest {

    @TempDir
    Path tempDir;

    @Test
    void testWriteAndRead() throws IOException {
        FunctionalityMapping exact = new FunctionalityMapping("PAY.MAIN", "PAY.cbl:MAIN", "Pay.main_", EquivalenceLevel.EXACT);
        FunctionalityMapping partial = new FunctionalityMapping("PAY.FIX", "PAY.cbl:FIX", "Pay.fix", EquivalenceLevel.PARTIAL);
        partial.addFinding("validation run did not reach the paragraph");
        Path target = tempDir.resolve("mappings/mappings.json");

        MappingExporter exporter = new MappingExporter();
        exporter.write(List.of(exact, partial), target);

        String json = Files.readString(target);
        assertThat(json).contains("\"functionalityId\" : \"PAY.MAIN\"");
        assertThat(json).contains("\"equivalenceLevel\" : \"PARTIAL\"");
        assertThat(exporter.read(target)).containsExactly(exact, partial);
    }
}
