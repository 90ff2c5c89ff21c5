package org.ensembl.compara.testdb.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SubsetConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldReturnDefaultsWithoutPath() {
        SubsetConfig config = SubsetConfigLoader.from(null).load();

        assertEquals(List.of(3L, 11L), config.getSelection().getOtherGenomeDbIds());
    }

    @Test
    void load_shouldReturnDefaultsForMissingFile() {
        SubsetConfig config = SubsetConfigLoader.from(tempDir.resolve("absent.toml")).load();

        assertTrue(config.isVerifyClosure());
        assertEquals(1, config.getSelection().getReferenceGenomeDbId());
    }

    @Test
    void load_shouldOverrideOnlyGivenKeys() throws Exception {
        Path file = tempDir.resolve("testdb.toml");
        Files.writeString(file, """
                verify-closure = false

                [selection]
                other-genome-db-ids = [3, 22, 31]
                max-alignment-length = 25000

                [seed-regions]
                output-directory = "/tmp/regions"
                """);

        SubsetConfig config = SubsetConfigLoader.from(file).load();

        assertFalse(config.isVerifyClosure());
        assertEquals(List.of(3L, 22L, 31L), config.getSelection().getOtherGenomeDbIds());
        assertEquals(25000L, config.getSelection().getMaxAlignmentLength());
        assertEquals(1, config.getSelection().getReferenceGenomeDbId());
        assertEquals(1, config.getSelection().getMethodLinkId());
        assertEquals("/tmp/regions", config.getSeedRegions().getOutputDirectory());
        assertEquals(100_000, config.getSeedRegions().getMergeGap());
    }

    @Test
    void load_shouldRejectUnknownKeys() throws Exception {
        Path file = tempDir.resolve("testdb.toml");
        Files.writeString(file, """
                [selection]
                reference-genome = 1
                """);

        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> SubsetConfigLoader.from(file).load());
        assertTrue(ex.getMessage().contains("testdb.toml"));
    }

    @Test
    void load_shouldRejectMalformedToml() throws Exception {
        Path file = tempDir.resolve("broken.toml");
        Files.writeString(file, "[selection\nmethod-link-id = ");

        assertThrows(ConfigurationException.class, () -> SubsetConfigLoader.from(file).load());
    }
}
