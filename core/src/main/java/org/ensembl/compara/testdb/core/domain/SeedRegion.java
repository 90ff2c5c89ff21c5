package org.ensembl.compara.testdb.core.domain;

/**
 * A closed genomic interval on a named sequence region, e.g. a chromosome.
 * Used both as an input window on the reference genome and as an emitted
 * footprint on a companion genome.
 *
 * @param name  sequence region (dnafrag) name, e.g. {@code "22"} or {@code "chrX"}
 * @param start first base, inclusive
 * @param end   last base, inclusive, never below {@code start}
 */
public record SeedRegion(String name, long start, long end) {

    public SeedRegion {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Seed region name must not be blank");
        if (start < 0)
            throw new IllegalArgumentException("Seed region " + name + " has negative start " + start);
        if (start > end)
            throw new IllegalArgumentException(
                    "Seed region " + name + " has start " + start + " after end " + end);
    }

    @Override
    public String toString() {
        return name + ":" + start + "-" + end;
    }
}
