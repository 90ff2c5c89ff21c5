package org.ensembl.compara.testdb.db.emit;

import org.ensembl.compara.testdb.core.domain.SeedRegion;
import org.ensembl.compara.testdb.core.event.SubsetEventBus;
import org.ensembl.compara.testdb.core.event.SubsetEvents.SeedRegionFileWrittenEvent;
import org.ensembl.compara.testdb.core.seedregion.SeedRegionFile;
import org.ensembl.compara.testdb.core.seedregion.SeedRegionMerger;
import org.ensembl.compara.testdb.db.SqlContext;
import org.ensembl.compara.testdb.db.SubsetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes, for each companion genome, the merged footprint of its copied
 * alignments as a seed-region file. The files drive the matching subset of
 * that genome's own core database.
 *
 * <p>
 * A genome without copied alignments gets a file with an empty list.
 */
public class SeedRegionEmitter {

    private static final Logger LOG = LoggerFactory.getLogger(SeedRegionEmitter.class);

    static final String FILE_SUFFIX = ".seq_regions.json";

    private final SqlContext sql;
    private final SubsetEventBus events;
    private final long mergeGap;
    private final Path outputDirectory;

    public SeedRegionEmitter(SqlContext sql, SubsetEventBus events, long mergeGap, Path outputDirectory) {
        this.sql = sql;
        this.events = events;
        this.mergeGap = mergeGap;
        this.outputDirectory = outputDirectory;
    }

    /**
     * Writes one file per genome, returning the paths in input order. Genomes
     * whose names map to the same file name get their genome_db_id appended,
     * e.g. {@code mus_musculus_3.seq_regions.json}.
     */
    public List<Path> emitAll(Connection conn, List<Long> genomeDbIds)
            throws SQLException, IOException, SubsetException {
        Files.createDirectories(outputDirectory);
        Map<Long, String> names = new LinkedHashMap<>();
        for (long id : genomeDbIds) {
            names.put(id, genomeName(conn, id));
        }
        Map<String, Long> fileNameCounts = names.values().stream()
                .collect(Collectors.groupingBy(SeedRegionEmitter::fileName, Collectors.counting()));

        List<Path> files = new ArrayList<>();
        for (Map.Entry<Long, String> genome : names.entrySet()) {
            String fileName = fileName(genome.getValue());
            if (fileNameCounts.get(fileName) > 1) {
                fileName = fileName(genome.getValue(), genome.getKey());
                LOG.warn("Genome name '{}' is shared by several companion genomes, writing genome {} to {}",
                        genome.getValue(), genome.getKey(), fileName);
            }
            files.add(write(conn, genome.getKey(), genome.getValue(), fileName));
        }
        return files;
    }

    public Path emit(Connection conn, long genomeDbId) throws SQLException, IOException, SubsetException {
        String genomeName = genomeName(conn, genomeDbId);
        return write(conn, genomeDbId, genomeName, fileName(genomeName));
    }

    private Path write(Connection conn, long genomeDbId, String genomeName, String fileName)
            throws SQLException, IOException {
        List<SeedRegion> footprint = SeedRegionMerger.merge(alignedRegions(conn, genomeDbId), mergeGap);

        Path file = outputDirectory.resolve(fileName);
        SeedRegionFile.write(file, footprint);
        LOG.info("Wrote {} seed regions for genome {} ({}) to {}", footprint.size(), genomeDbId, genomeName, file);
        events.post(new SeedRegionFileWrittenEvent(genomeDbId, file, footprint.size()));
        return file;
    }

    /** Copied alignment extents on the genome, sorted by name, start, end. */
    public List<SeedRegion> alignedRegions(Connection conn, long genomeDbId) throws SQLException {
        List<SeedRegion> regions = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql.sql("select-genome-aligned-regions"))) {
            ps.setLong(1, genomeDbId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    regions.add(new SeedRegion(rs.getString(1), rs.getLong(2), rs.getLong(3)));
                }
            }
        }
        return regions;
    }

    private String genomeName(Connection conn, long genomeDbId) throws SQLException, SubsetException {
        try (PreparedStatement ps = conn.prepareStatement(sql.sql("select-genome-db-name"))) {
            ps.setLong(1, genomeDbId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    throw new SubsetException("genome_db_id " + genomeDbId + " is not in the destination");
                return rs.getString(1);
            }
        }
    }

    /** {@code "Mus musculus"} becomes {@code mus_musculus.seq_regions.json}. */
    static String fileName(String genomeName) {
        return baseName(genomeName) + FILE_SUFFIX;
    }

    static String fileName(String genomeName, long genomeDbId) {
        return baseName(genomeName) + "_" + genomeDbId + FILE_SUFFIX;
    }

    private static String baseName(String genomeName) {
        return genomeName.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
    }
}
