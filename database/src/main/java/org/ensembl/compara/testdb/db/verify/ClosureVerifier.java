package org.ensembl.compara.testdb.db.verify;

import org.ensembl.compara.testdb.db.SqlContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks that every reference held by a destination row resolves to a
 * destination row.
 */
public class ClosureVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(ClosureVerifier.class);

    public static final List<ForeignKey> COMPARA_KEYS = List.of(
            ForeignKey.of("genomic_align", "genomic_align_block_id", "genomic_align_block", "genomic_align_block_id"),
            ForeignKey.of("genomic_align", "dnafrag_id", "dnafrag", "dnafrag_id"),
            ForeignKey.of("genomic_align", "method_link_species_set_id",
                    "method_link_species_set", "method_link_species_set_id"),
            ForeignKey.of("genomic_align_block", "method_link_species_set_id",
                    "method_link_species_set", "method_link_species_set_id"),
            ForeignKey.of("genomic_align_group", "genomic_align_id", "genomic_align", "genomic_align_id"),
            ForeignKey.of("dnafrag", "genome_db_id", "genome_db", "genome_db_id"),
            ForeignKey.of("homology", "method_link_species_set_id",
                    "method_link_species_set", "method_link_species_set_id"),
            ForeignKey.of("homology_member", "homology_id", "homology", "homology_id"),
            ForeignKey.of("homology_member", "member_id", "member", "member_id"),
            new ForeignKey("homology_member", "peptide_member_id", "member", "member_id", true),
            ForeignKey.of("family", "method_link_species_set_id",
                    "method_link_species_set", "method_link_species_set_id"),
            ForeignKey.of("family_member", "family_id", "family", "family_id"),
            ForeignKey.of("family_member", "member_id", "member", "member_id"),
            ForeignKey.of("member", "genome_db_id", "genome_db", "genome_db_id"),
            new ForeignKey("member", "sequence_id", "sequence", "sequence_id", true),
            ForeignKey.of("member", "taxon_id", "taxon", "taxon_id"),
            ForeignKey.of("genome_db", "taxon_id", "taxon", "taxon_id"),
            ForeignKey.of("synteny_region", "method_link_species_set_id",
                    "method_link_species_set", "method_link_species_set_id"),
            ForeignKey.of("dnafrag_region", "synteny_region_id", "synteny_region", "synteny_region_id"),
            ForeignKey.of("dnafrag_region", "dnafrag_id", "dnafrag", "dnafrag_id"),
            ForeignKey.of("method_link_species_set", "method_link_id", "method_link", "method_link_id"),
            ForeignKey.of("method_link_species_set", "genome_db_id", "genome_db", "genome_db_id"));

    private final SqlContext sql;
    private final List<ForeignKey> keys;

    public ClosureVerifier(SqlContext sql) {
        this(sql, COMPARA_KEYS);
    }

    public ClosureVerifier(SqlContext sql, List<ForeignKey> keys) {
        this.sql = sql;
        this.keys = List.copyOf(keys);
    }

    /** Returns one violation per edge with dangling rows; empty when closed. */
    public List<ClosureViolation> verify(Connection conn) throws SQLException {
        List<ClosureViolation> violations = new ArrayList<>();
        for (ForeignKey key : keys) {
            long dangling = countDangling(conn, key);
            if (dangling > 0) {
                LOG.warn("Dangling references {}: {} rows", key, dangling);
                violations.add(new ClosureViolation(key, dangling));
            }
        }
        LOG.info("Checked {} reference edges, {} violated.", keys.size(), violations.size());
        return violations;
    }

    long countDangling(Connection conn, ForeignKey key) throws SQLException {
        String template = key.zeroMeansNone() ? "count-dangling-references-nonzero" : "count-dangling-references";
        String statement = sql.sql(template, Map.of(
                "child_table", key.childTable(),
                "child_column", key.childColumn(),
                "parent_table", key.parentTable(),
                "parent_column", key.parentColumn()));
        try (PreparedStatement ps = conn.prepareStatement(statement);
                ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        }
    }
}
