package org.ensembl.compara.testdb.db.emit;

import org.ensembl.compara.testdb.core.domain.SeedRegion;
import org.ensembl.compara.testdb.core.event.SubsetEventBus;
import org.ensembl.compara.testdb.core.event.SubsetEvents.SeedRegionFileWrittenEvent;
import org.ensembl.compara.testdb.db.SubsetException;
import org.ensembl.compara.testdb.db.platform.SqlitePlatform;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.util.List;

import static org.ensembl.compara.testdb.db.ComparaFixture.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SeedRegionEmitterTest {

    @TempDir
    Path tempDir;

    private Connection conn;
    private SubsetEventBus events;
    private SeedRegionEmitter emitter;
    private Path outputDir;

    @BeforeEach
    void setUp() throws Exception {
        SqlitePlatform platform = new SqlitePlatform(createSource(tempDir), tempDir.resolve("target.db"));
        conn = prepareDestination(platform);
        events = mock(SubsetEventBus.class);
        outputDir = tempDir.resolve("regions");
        emitter = new SeedRegionEmitter(platform.sqlContext(), events, 100_000, outputDir);

        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("INSERT INTO compara_target.genome_db VALUES (3, 10090, 'Mus musculus', 'NCBIM37', NULL)");
            stmt.executeUpdate("INSERT INTO compara_target.genome_db VALUES (20, 7955, 'Danio rerio', 'ZFISH7', NULL)");
            stmt.executeUpdate("INSERT INTO compara_target.dnafrag VALUES (300, 103492577, '15', 3, 'chromosome')");
            stmt.executeUpdate("INSERT INTO compara_target.dnafrag VALUES (301, 98252459, '16', 3, 'chromosome')");
            stmt.executeUpdate("INSERT INTO compara_target.genomic_align VALUES (1, 1, 5, 300, 100, 200, 1, NULL)");
            stmt.executeUpdate("INSERT INTO compara_target.genomic_align VALUES (2, 2, 5, 300, 310000, 310100, 1, NULL)");
            stmt.executeUpdate("INSERT INTO compara_target.genomic_align VALUES (3, 3, 5, 300, 150, 180, 1, NULL)");
            stmt.executeUpdate("INSERT INTO compara_target.genomic_align VALUES (4, 4, 5, 300, 90000, 90500, 1, NULL)");
            stmt.executeUpdate("INSERT INTO compara_target.genomic_align VALUES (5, 5, 5, 301, 7, 9, 1, NULL)");
        }
    }

    @AfterEach
    void tearDown() throws Exception {
        conn.close();
    }

    @Test
    void fileName_shouldLowerCaseAndJoinWords() {
        assertEquals("mus_musculus.seq_regions.json", SeedRegionEmitter.fileName("Mus musculus"));
        assertEquals("canis_lupus_familiaris.seq_regions.json",
                SeedRegionEmitter.fileName(" Canis  lupus\tfamiliaris"));
    }

    @Test
    void alignedRegions_shouldBeSortedByNameStartEnd() throws Exception {
        List<SeedRegion> regions = emitter.alignedRegions(conn, 3);

        assertEquals(List.of(
                new SeedRegion("15", 100, 200),
                new SeedRegion("15", 150, 180),
                new SeedRegion("15", 90000, 90500),
                new SeedRegion("15", 310000, 310100),
                new SeedRegion("16", 7, 9)), regions);
    }

    @Test
    void emit_shouldWriteMergedRegions() throws Exception {
        Files.createDirectories(outputDir);

        Path file = emitter.emit(conn, 3);

        assertEquals(outputDir.resolve("mus_musculus.seq_regions.json"), file);
        // 90000 - 200 is below the gap, 310000 - 90500 is not
        assertEquals("[\n[\"15\",100,90500],\n[\"15\",310000,310100],\n[\"16\",7,9]\n]\n",
                Files.readString(file, StandardCharsets.UTF_8));

        ArgumentCaptor<SeedRegionFileWrittenEvent> captor = ArgumentCaptor.forClass(SeedRegionFileWrittenEvent.class);
        verify(events).post(captor.capture());
        assertEquals(3, captor.getValue().regions());
        assertEquals(3L, captor.getValue().genomeDbId());
    }

    @Test
    void emitAll_shouldCreateDirectoryAndWriteEmptyList() throws Exception {
        List<Path> files = emitter.emitAll(conn, List.of(20L));

        assertEquals(List.of(outputDir.resolve("danio_rerio.seq_regions.json")), files);
        assertEquals("[\n]\n", Files.readString(files.get(0), StandardCharsets.UTF_8));
    }

    @Test
    void emitAll_shouldKeepGenomesWithSameFileNameApart() throws Exception {
        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("INSERT INTO compara_target.genome_db VALUES (30, 10090, 'Mus  Musculus', 'GRCm38', NULL)");
        }

        List<Path> files = emitter.emitAll(conn, List.of(3L, 20L, 30L));

        assertEquals(List.of(
                outputDir.resolve("mus_musculus_3.seq_regions.json"),
                outputDir.resolve("danio_rerio.seq_regions.json"),
                outputDir.resolve("mus_musculus_30.seq_regions.json")), files);
        assertTrue(Files.readString(files.get(0), StandardCharsets.UTF_8).contains("[\"16\",7,9]"));
        assertEquals("[\n]\n", Files.readString(files.get(2), StandardCharsets.UTF_8));
        assertFalse(Files.exists(outputDir.resolve("mus_musculus.seq_regions.json")));
    }

    @Test
    void emit_shouldFailForGenomeMissingFromDestination() {
        assertThrows(SubsetException.class, () -> emitter.emit(conn, 99));
    }
}
