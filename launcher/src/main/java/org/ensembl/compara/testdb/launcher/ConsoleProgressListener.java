package org.ensembl.compara.testdb.launcher;

import com.google.common.eventbus.Subscribe;
import org.ensembl.compara.testdb.core.event.SubsetEvents.PairStartedEvent;
import org.ensembl.compara.testdb.core.event.SubsetEvents.SeedRegionFileWrittenEvent;
import org.ensembl.compara.testdb.core.event.SubsetEvents.StepCompletedEvent;

import java.io.PrintStream;

/**
 * Prints build progress for the operator.
 */
public class ConsoleProgressListener {

    private final PrintStream out;

    public ConsoleProgressListener(PrintStream out) {
        this.out = out;
    }

    @Subscribe
    public void onPairStarted(PairStartedEvent event) {
        String dnafrag = event.dnafragId() == null ? "<none>" : event.dnafragId().toString();
        out.println("Dumping data for dnafrag " + dnafrag + " (seq=" + event.window()
                + "; against genome " + event.genomeDbId() + ")");
    }

    @Subscribe
    public void onStepCompleted(StepCompletedEvent event) {
        out.println(" - " + event.step() + ": " + event.rows() + " rows");
    }

    @Subscribe
    public void onSeedRegionFileWritten(SeedRegionFileWrittenEvent event) {
        out.println("Wrote " + event.regions() + " seed regions for genome " + event.genomeDbId()
                + " to " + event.file());
    }
}
