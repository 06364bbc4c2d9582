package org.fpbjs.amlmapper.config;

import org.fpbjs.amlmapper.MappingException;
import org.fpbjs.amlmapper.config.models.MapperConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MapperConfigHelperTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadBundledDefaults() {
        MapperConfig config = MapperConfigHelper.loadDefault();

        assertEquals("FPBJS_Project", config.projectName);
        assertEquals("http://www.hsu-ifa.de/fpbjs", config.targetNamespace);
        assertEquals("fpb-export.aml", config.fileName);
        assertEquals(32, config.maxDecompositionDepth);
    }

    @Test
    void shouldLoadPartialFileOverDefaults() throws IOException {
        Path file = tempDir.resolve("mapper.json");
        Files.writeString(file, "{\"fileName\": \"plant.aml\", \"maxDecompositionDepth\": 4, \"comment\": \"ignored\"}");

        MapperConfig config = MapperConfigHelper.loadConfigFile(file.toString());

        assertEquals("plant.aml", config.fileName);
        assertEquals(4, config.maxDecompositionDepth);
        assertEquals("fpb-aml-mapper", config.originName);
    }

    @Test
    void shouldRejectInvalidDepth() throws IOException {
        Path file = tempDir.resolve("mapper.json");
        Files.writeString(file, "{\"maxDecompositionDepth\": 0}");

        MappingException e = assertThrows(MappingException.class,
                () -> MapperConfigHelper.loadConfigFile(file.toString()));
        assertTrue(e.getMessage().startsWith("Invalid configuration " + file + ": "), e.getMessage());
    }

    @Test
    void shouldRejectWrongType() throws IOException {
        Path file = tempDir.resolve("mapper.json");
        Files.writeString(file, "{\"projectName\": 5}");

        assertThrows(MappingException.class, () -> MapperConfigHelper.loadConfigFile(file.toString()));
    }

    @Test
    void shouldFailOnMissingFile() {
        String path = tempDir.resolve("missing.json").toString();

        MappingException e = assertThrows(MappingException.class, () -> MapperConfigHelper.loadConfigFile(path));
        assertEquals("Failed to read configuration: " + path, e.getMessage());
    }
}
