package com.termindex.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.termindex.codec.TermMetadata;
import com.termindex.codec.TermType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IndexConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        IndexConfig config = IndexConfig.defaults();

        assertEquals(Path.of("./index.tikv"), config.getStoreFile());
        assertEquals(TermType.STRING, config.getDefaultTermType());
        assertTrue(config.getFieldTermTypes().isEmpty());
        assertEquals(Constants.DEFAULT_TERM_LIMIT, config.getTermLimit());
    }

    @Test
    void testSettersAndTermMetadata() {
        IndexConfig config = IndexConfig.defaults();
        config.setStoreFile(Path.of("/tmp/custom.tikv"));
        config.setFieldTermTypes(Map.of(9, TermType.INT64));
        config.setTermLimit(7);

        TermMetadata metadata = config.toTermMetadata();
        assertEquals(Path.of("/tmp/custom.tikv"), config.getStoreFile());
        assertEquals(7, config.getTermLimit());
        assertEquals(TermType.INT64, metadata.typeOf(9));
        assertEquals(TermType.STRING, metadata.typeOf(1));

        config.setFieldTermTypes(null);
        assertTrue(config.getFieldTermTypes().isEmpty());
    }

    @Test
    void testLoadFromJson() throws IOException {
        Path file = tempDir.resolve("index.json");
        Files.writeString(file, "{\n"
            + "  \"storeFile\": \"data/events.tikv\",\n"
            + "  \"defaultTermType\": \"STRING\",\n"
            + "  \"fieldTermTypes\": {\"9\": \"INT64\"},\n"
            + "  \"termLimit\": 25,\n"
            + "  \"unknownKey\": true\n"
            + "}", StandardCharsets.UTF_8);

        IndexConfig config = IndexConfig.load(file);

        assertEquals(Path.of("data/events.tikv"), config.getStoreFile());
        assertEquals(25, config.getTermLimit());
        assertEquals(TermType.INT64, config.toTermMetadata().typeOf(9));
    }

    @Test
    void testLoadKeepsDefaultsForMissingKeys() throws IOException {
        Path file = tempDir.resolve("partial.json");
        Files.writeString(file, "{\"termLimit\": 3}", StandardCharsets.UTF_8);

        IndexConfig config = IndexConfig.load(file);

        assertEquals(3, config.getTermLimit());
        assertEquals(TermType.STRING, config.getDefaultTermType());
        assertEquals(Path.of("./index.tikv"), config.getStoreFile());
    }

    @Test
    void testLoadRejectsInvalidInput() throws IOException {
        assertThrows(IllegalArgumentException.class, () -> IndexConfig.load(null));
        assertThrows(IOException.class, () -> IndexConfig.load(tempDir.resolve("missing.json")));

        Path file = tempDir.resolve("bad-limit.json");
        Files.writeString(file, "{\"termLimit\": 0}", StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> IndexConfig.load(file));

        Path malformed = tempDir.resolve("malformed.json");
        Files.writeString(malformed, "{\"termLimit\": ", StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> IndexConfig.load(malformed));
    }
}
