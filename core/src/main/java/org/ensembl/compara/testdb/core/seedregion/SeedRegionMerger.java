package org.ensembl.compara.testdb.core.seedregion;

import org.ensembl.compara.testdb.core.domain.SeedRegion;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses a sorted stream of intervals into runs.
 *
 * <p>
 * Input must be ordered by name, then start, then end. A record joins the
 * current run when it has the same name and
 * {@code start - runEnd < mergeGap}; overlapping records therefore always
 * join. The run's end only ever grows, so a record nested inside the run
 * does not shorten it.
 */
public final class SeedRegionMerger {

    private SeedRegionMerger() {
    }

    public static List<SeedRegion> merge(List<SeedRegion> sorted, long mergeGap) {
        if (mergeGap < 0)
            throw new IllegalArgumentException("Merge gap must not be negative: " + mergeGap);

        List<SeedRegion> merged = new ArrayList<>();
        String runName = null;
        long runStart = 0;
        long runEnd = 0;

        for (SeedRegion r : sorted) {
            if (runName != null && runName.equals(r.name()) && r.start() - runEnd < mergeGap) {
                runEnd = Math.max(runEnd, r.end());
                continue;
            }
            if (runName != null)
                merged.add(new SeedRegion(runName, runStart, runEnd));
            runName = r.name();
            runStart = r.start();
            runEnd = r.end();
        }
        if (runName != null)
            merged.add(new SeedRegion(runName, runStart, runEnd));
        return merged;
    }
}
