package com.spinemlgen.generator;

import com.spinemlgen.generator.config.GeneratorConfig;
import com.spinemlgen.generator.config.GeneratorConfigReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GeneratorConfigReaderTest {

    private final GeneratorConfigReader reader = new GeneratorConfigReader();

    @Test
    void allFieldsRead(@TempDir Path tmp) throws IOException {
        String json = """
            {
              "dt": 0.05,
              "network_name": "cortex",
              "spike_port": "fire",
              "quiet": true,
              "output_dir": "/tmp/out"
            }
            """;
        Path config = tmp.resolve("config.json");
        Files.writeString(config, json);

        GeneratorConfig c = reader.read(config);
        assertEquals(0.05, c.getDt());
        assertEquals("cortex", c.getNetworkName());
        assertEquals("fire", c.getSpikePort());
        assertTrue(c.isQuiet());
        assertEquals("/tmp/out", c.getOutputDir());
    }

    @Test
    void missingFieldsFallBackToDefaults(@TempDir Path tmp) throws IOException {
        Path config = tmp.resolve("config.json");
        Files.writeString(config, "{}");

        GeneratorConfig c = reader.read(config);
        assertEquals(0.1, c.getDt());
        assertNull(c.getNetworkName());
        assertEquals("spike", c.getSpikePort());
        assertFalse(c.isQuiet());
        assertNull(c.getOutputDir());
    }

    @Test
    void fileNotFoundThrowsConfigReadException() {
        Path missing = Path.of("/tmp/does-not-exist-config.json");
        assertThrows(GeneratorConfigReader.ConfigReadException.class, () -> reader.read(missing));
    }

    @Test
    void emptyFileThrowsConfigReadException(@TempDir Path tmp) throws IOException {
        Path empty = tmp.resolve("empty.json");
        Files.writeString(empty, "");
        assertThrows(GeneratorConfigReader.ConfigReadException.class, () -> reader.read(empty));
    }

    @Test
    void malformedJsonThrowsConfigReadException(@TempDir Path tmp) throws IOException {
        Path bad = tmp.resolve("bad.json");
        Files.writeString(bad, "{ \"dt\": ");
        assertThrows(GeneratorConfigReader.ConfigReadException.class, () -> reader.read(bad));
    }

    @Test
    void nonPositiveDtThrowsConfigReadException(@TempDir Path tmp) throws IOException {
        Path config = tmp.resolve("config.json");
        Files.writeString(config, "{\"dt\": 0}");
        assertThrows(GeneratorConfigReader.ConfigReadException.class, () -> reader.read(config));
    }
}
