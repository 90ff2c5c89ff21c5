package org.ensembl.compara.testdb.db;

import org.ensembl.compara.testdb.core.config.SubsetConfig;
import org.ensembl.compara.testdb.core.domain.SeedRegion;
import org.ensembl.compara.testdb.core.event.SubsetEventBus;
import org.ensembl.compara.testdb.db.platform.SqlitePlatform;
import org.ensembl.compara.testdb.db.subset.SubsetParameters;
import org.ensembl.compara.testdb.db.verify.ClosureVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.ensembl.compara.testdb.db.ComparaFixture.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

/**
 * End-to-end runs against a SQLite source built from the test fixture.
 * The destination file is reopened after each run to inspect what was
 * committed.
 */
@ExtendWith(MockitoExtension.class)
class TestDatabaseBuilderTest {

    private static final SeedRegion WINDOW = new SeedRegion("22", 100, 200);

    @TempDir
    Path tempDir;

    @Mock
    private Confirmation confirmation;

    private Path source;
    private Path destination;
    private Path outputDir;
    private SubsetConfig config;

    @BeforeEach
    void setUp() throws Exception {
        source = createSource(tempDir);
        destination = tempDir.resolve("test_compara.db");
        outputDir = tempDir.resolve("regions");
        config = new SubsetConfig();
        config.getSeedRegions().setOutputDirectory(outputDir.toString());
    }

    private BuildResult build(List<SeedRegion> windows) throws Exception {
        TestDatabaseBuilder builder = new TestDatabaseBuilder(new SqlitePlatform(source, destination), config,
                confirmation, new SubsetEventBus());
        return builder.build(windows);
    }

    private void proceed() {
        when(confirmation.confirm(anyString())).thenReturn(true);
    }

    private void updateSource(String sql) throws SQLException {
        try (Connection conn = open(source); Statement stmt = conn.createStatement()) {
            stmt.executeUpdate(sql);
        }
    }

    // -- Successful runs --

    @Test
    void build_shouldCopyWindowSubsetAndItsReferences() throws Exception {
        proceed();
        BuildResult result = build(List.of(WINDOW));

        assertTrue(result.created());
        try (Connection conn = open(destination)) {
            assertEquals(4, count(conn, "SELECT COUNT(*) FROM method_link"));
            assertEquals(2, count(conn, "SELECT COUNT(*) FROM meta"));
            assertEquals(List.of(21L, 22L, 31L, 32L, 61L, 62L, 71L, 72L),
                    longs(conn, "SELECT genomic_align_id FROM genomic_align ORDER BY 1"));
            assertEquals(List.of(2L, 3L, 6L, 7L),
                    longs(conn, "SELECT genomic_align_block_id FROM genomic_align_block ORDER BY 1"));
            assertEquals(2, count(conn, "SELECT COUNT(*) FROM genomic_align_group"));
            assertEquals(List.of(100L, 300L, 301L, 1100L),
                    longs(conn, "SELECT dnafrag_id FROM dnafrag ORDER BY 1"));
            assertEquals(List.of(1L, 2L, 4L), longs(conn, "SELECT homology_id FROM homology ORDER BY 1"));
            assertEquals(6, count(conn, "SELECT COUNT(*) FROM homology_member"));
            assertEquals(List.of(1L), longs(conn, "SELECT family_id FROM family"));
            assertEquals(3, count(conn, "SELECT COUNT(*) FROM family_member"));
            assertEquals(9, count(conn, "SELECT COUNT(*) FROM member"));
            assertEquals(List.of(5001L, 5002L, 5003L, 5006L),
                    longs(conn, "SELECT sequence_id FROM sequence ORDER BY 1"));
            assertEquals(List.of(4932L, 7955L, 9598L, 9606L, 10090L),
                    longs(conn, "SELECT taxon_id FROM taxon ORDER BY 1"));
            assertEquals(List.of(1L), longs(conn, "SELECT synteny_region_id FROM synteny_region"));
            assertEquals(2, count(conn, "SELECT COUNT(*) FROM dnafrag_region"));
            assertEquals(List.of(5L, 6L, 7L, 8L, 9L, 10L), longs(conn,
                    "SELECT DISTINCT method_link_species_set_id FROM method_link_species_set ORDER BY 1"));
        }
    }

    @Test
    void build_shouldProduceReferentiallyClosedDestination() throws Exception {
        proceed();
        build(List.of(WINDOW));

        try (Connection conn = open(destination)) {
            ClosureVerifier verifier = new ClosureVerifier(new SqlContext(SqlDialect.SQLITE, "main", "main"));
            assertTrue(verifier.verify(conn).isEmpty());
        }
    }

    @Test
    void build_shouldClearEveryGenomeLocator() throws Exception {
        proceed();
        build(List.of(WINDOW));

        try (Connection conn = open(destination)) {
            assertEquals(4, count(conn, "SELECT COUNT(*) FROM genome_db"));
            assertEquals(0, count(conn, "SELECT COUNT(*) FROM genome_db WHERE locator IS NOT NULL"));
        }
    }

    @Test
    void build_shouldReplaceExistingDestination() throws Exception {
        Files.writeString(destination, "not a database");
        proceed();

        BuildResult result = build(List.of(WINDOW));

        assertTrue(result.created());
        try (Connection conn = open(destination)) {
            assertEquals(4, count(conn, "SELECT COUNT(*) FROM genome_db"));
        }
    }

    @Test
    void build_shouldPreferConfiguredMaxAlignmentLength() throws Exception {
        config.getSelection().setMaxAlignmentLength(100L);
        proceed();

        build(List.of(WINDOW));

        try (Connection conn = open(destination)) {
            // 50-120 now passes the lower bound 100 - 100 = 0
            assertEquals(1, count(conn, "SELECT COUNT(*) FROM genomic_align WHERE genomic_align_id = 11"));
            assertEquals(1, count(conn, "SELECT COUNT(*) FROM genomic_align WHERE genomic_align_id = 12"));
        }
    }

    @Test
    void build_shouldStillCopyHomologiesWithoutAlignmentMlss() throws Exception {
        config.getSelection().setMethodLinkId(999);
        config.getSelection().setOtherGenomeDbIds(List.of(MOUSE));
        proceed();

        BuildResult result = build(List.of(WINDOW));

        assertTrue(result.created());
        try (Connection conn = open(destination)) {
            assertEquals(0, count(conn, "SELECT COUNT(*) FROM genomic_align"));
            assertEquals(List.of(1L, 4L), longs(conn, "SELECT homology_id FROM homology ORDER BY 1"));
        }
    }

    // -- Seed region files --

    @Test
    void build_shouldWriteMergedFootprintPerCompanionGenome() throws Exception {
        proceed();
        BuildResult result = build(List.of(WINDOW));

        assertEquals(List.of(outputDir.resolve("mus_musculus.seq_regions.json"),
                outputDir.resolve("pan_troglodytes.seq_regions.json")), result.seedRegionFiles());
        assertEquals("[\n[\"15\",5000,5120],\n[\"16\",400000,400030]\n]\n",
                Files.readString(result.seedRegionFiles().get(0), StandardCharsets.UTF_8));
        assertEquals("[\n[\"22\",95,115]\n]\n",
                Files.readString(result.seedRegionFiles().get(1), StandardCharsets.UTF_8));
    }

    @Test
    void build_shouldWriteEmptyListForGenomeWithoutAlignments() throws Exception {
        config.getSelection().setOtherGenomeDbIds(List.of(MOUSE, ZEBRAFISH));
        proceed();

        BuildResult result = build(List.of(WINDOW));

        Path zebrafish = outputDir.resolve("danio_rerio.seq_regions.json");
        assertTrue(result.seedRegionFiles().contains(zebrafish));
        assertEquals("[\n]\n", Files.readString(zebrafish, StandardCharsets.UTF_8));
    }

    // -- Abort and failure paths --

    @Test
    void build_shouldLeaveEverythingUntouchedWhenDeclined() throws Exception {
        Files.writeString(destination, "keep");
        when(confirmation.confirm(anyString())).thenReturn(false);

        BuildResult result = build(List.of(WINDOW));

        assertFalse(result.created());
        assertNull(result.report());
        assertEquals("keep", Files.readString(destination));
        assertFalse(Files.exists(outputDir));
        verify(confirmation).confirm(contains(destination.toAbsolutePath().toString()));
    }

    @Test
    void build_shouldRefuseToReplaceTheSource() throws Exception {
        Path sameFile = tempDir.resolve("regions").resolve("..").resolve(source.getFileName());
        TestDatabaseBuilder builder = new TestDatabaseBuilder(new SqlitePlatform(source, sameFile), config,
                confirmation, new SubsetEventBus());

        SubsetException ex = assertThrows(SubsetException.class, () -> builder.build(List.of(WINDOW)));

        assertTrue(ex.getMessage().contains("is the source database"));
        verifyNoInteractions(confirmation);
        try (Connection conn = open(source)) {
            assertEquals(14, count(conn, "SELECT COUNT(*) FROM genomic_align"));
        }
    }

    @Test
    void populate_shouldKeepOriginalFailureWhenRollbackFails() throws Exception {
        Connection conn = mock(Connection.class);
        SQLException lost = new SQLException("Connection reset");
        SQLException rollbackFailure = new SQLException("Connection closed");
        when(conn.prepareStatement(anyString())).thenThrow(lost);
        doThrow(rollbackFailure).when(conn).rollback();
        TestDatabaseBuilder builder = new TestDatabaseBuilder(new SqlitePlatform(source, destination), config,
                confirmation, new SubsetEventBus());

        SQLException thrown = assertThrows(SQLException.class,
                () -> builder.populate(conn, SubsetParameters.from(config.getSelection(), List.of(WINDOW))));

        assertSame(lost, thrown);
        assertArrayEquals(new Throwable[] {rollbackFailure}, thrown.getSuppressed());
    }

    @Test
    void build_shouldRollBackWhenHomologyPairRepeats() throws Exception {
        proceed();

        assertThrows(SQLException.class, () -> build(List.of(WINDOW, WINDOW)));

        try (Connection conn = open(destination)) {
            assertEquals(0, count(conn, "SELECT COUNT(*) FROM genome_db"));
            assertEquals(0, count(conn, "SELECT COUNT(*) FROM genomic_align"));
            assertEquals(0, count(conn, "SELECT COUNT(*) FROM homology"));
        }
        assertFalse(Files.exists(outputDir));
    }

    @Test
    void build_shouldFailForUnknownGenome() throws Exception {
        config.getSelection().setOtherGenomeDbIds(List.of(99L));
        proceed();

        SubsetException ex = assertThrows(SubsetException.class, () -> build(List.of(WINDOW)));
        assertTrue(ex.getMessage().contains("99"));
    }

    @Test
    void build_shouldFailWithoutAnyMaxAlignmentLength() throws Exception {
        updateSource("DELETE FROM meta WHERE meta_key = 'max_alignment_length'");
        proceed();

        SubsetException ex = assertThrows(SubsetException.class, () -> build(List.of(WINDOW)));
        assertTrue(ex.getMessage().contains("max_alignment_length"));
    }

    @Test
    void build_shouldRollBackWhenSubsetIsNotClosed() throws Exception {
        updateSource("UPDATE homology_member SET peptide_member_id = 9999 WHERE homology_id = 1 AND member_id = 3001");
        proceed();

        SubsetException ex = assertThrows(SubsetException.class, () -> build(List.of(WINDOW)));

        assertTrue(ex.getMessage().contains("homology_member.peptide_member_id"));
        try (Connection conn = open(destination)) {
            assertEquals(0, count(conn, "SELECT COUNT(*) FROM homology"));
        }
    }

    @Test
    void build_shouldKeepUnclosedSubsetWhenVerificationDisabled() throws Exception {
        updateSource("UPDATE homology_member SET peptide_member_id = 9999 WHERE homology_id = 1 AND member_id = 3001");
        config.setVerifyClosure(false);
        proceed();

        BuildResult result = build(List.of(WINDOW));

        assertTrue(result.created());
        try (Connection conn = open(destination)) {
            assertEquals(3, count(conn, "SELECT COUNT(*) FROM homology"));
        }
    }
}
