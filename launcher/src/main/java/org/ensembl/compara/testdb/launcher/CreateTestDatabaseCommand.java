package org.ensembl.compara.testdb.launcher;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import org.ensembl.compara.testdb.core.config.ConfigurationException;
import org.ensembl.compara.testdb.core.config.ConnectionSettings;
import org.ensembl.compara.testdb.core.config.Platform;
import org.ensembl.compara.testdb.core.config.SelectionConfig;
import org.ensembl.compara.testdb.core.config.SubsetConfig;
import org.ensembl.compara.testdb.core.config.SubsetConfigLoader;
import org.ensembl.compara.testdb.core.domain.SeedRegion;
import org.ensembl.compara.testdb.core.event.SubsetEventBus;
import org.ensembl.compara.testdb.core.seedregion.SeedRegionFile;
import org.ensembl.compara.testdb.core.seedregion.SeedRegionFormatException;
import org.ensembl.compara.testdb.db.BuildResult;
import org.ensembl.compara.testdb.db.SubsetException;
import org.ensembl.compara.testdb.db.TestDatabaseBuilder;
import org.ensembl.compara.testdb.db.platform.DatabasePlatform;
import org.ensembl.compara.testdb.db.platform.SchemaCloneException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Entry point. Parses the command line, loads configuration and seed regions,
 * wires the run and maps its outcome to an exit status.
 *
 * <h3>Exit status</h3>
 * <ul>
 * <li>{@code 0}: database created, or the operator declined the prompt</li>
 * <li>{@code 2}: missing or invalid options, including a destination that
 * names the source, nothing was opened</li>
 * <li>structure copy status: the schema clone process failed</li>
 * <li>{@code 1}: any other failure</li>
 * </ul>
 */
@CommandLine.Command(
        name = "create-compara-test-db",
        description = "Creates a Compara test database holding the subset of a source database "
                + "anchored on seed regions of a reference genome.",
        sortOptions = false)
public class CreateTestDatabaseCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CreateTestDatabaseCommand.class);

    static final int EXIT_FAILURE = 1;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-s", "--source"}, required = true,
            description = "Source database name (file path for sqlite)")
    String source;

    @CommandLine.Option(names = {"-d", "--destination"}, required = true,
            description = "Destination database name (file path for sqlite); replaced if it exists")
    String destination;

    @CommandLine.Option(names = {"-h", "--host"}, description = "Database host (mysql)")
    String host;

    @CommandLine.Option(names = {"-u", "--user"}, description = "Database user (mysql)")
    String user;

    @CommandLine.Option(names = {"-p", "--password"}, description = "Database password (mysql)")
    String password;

    @CommandLine.Option(names = {"--port"}, defaultValue = "3306", description = "Database port (default: ${DEFAULT-VALUE})")
    int port;

    @CommandLine.Option(names = {"--seq-region-file", "--seq_region_file"}, required = true,
            description = "JSON file of [name, start, end] windows on the reference genome")
    Path seqRegionFile;

    @CommandLine.Option(names = {"--platform"}, defaultValue = "mysql",
            description = "mysql or sqlite (default: ${DEFAULT-VALUE})")
    String platform;

    @CommandLine.Option(names = {"--config"}, description = "TOML configuration file")
    Path configFile;

    @CommandLine.Option(names = {"--output-dir"}, description = "Directory for the emitted seed-region files")
    String outputDirectory;

    @CommandLine.Option(names = {"--reference-genome-db-id"}, description = "Reference genome_db_id")
    Long referenceGenomeDbId;

    @CommandLine.Option(names = {"--other-genome-db-ids"}, split = ",",
            description = "Companion genome_db_ids, comma separated")
    List<Long> otherGenomeDbIds;

    @CommandLine.Option(names = {"--method-link-id"}, description = "method_link_id of the pairwise alignments")
    Long methodLinkId;

    @CommandLine.Option(names = {"--max-alignment-length"},
            description = "Overrides the source meta value max_alignment_length")
    Long maxAlignmentLength;

    @CommandLine.Option(names = {"--no-verify"}, description = "Skip the referential closure check")
    boolean noVerify;

    @CommandLine.Option(names = {"--help"}, usageHelp = true, description = "Show this help message and exit")
    boolean help;

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    public CreateTestDatabaseCommand() {
        this(System.in, System.out, System.err);
    }

    CreateTestDatabaseCommand(InputStream in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new CreateTestDatabaseCommand()).execute(args));
    }

    @Override
    public Integer call() {
        Platform selected = parsePlatform();
        ConnectionSettings settings = connectionSettings(selected);

        SubsetConfig config;
        List<SeedRegion> windows;
        try {
            config = SubsetConfigLoader.from(configFile).load();
            applyOverrides(config);
            windows = SeedRegionFile.read(seqRegionFile);
        } catch (ConfigurationException | SeedRegionFormatException e) {
            err.println(e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            err.println("Could not read seed region file " + seqRegionFile + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
        LOG.info("Loaded {} seed regions from {}", windows.size(), seqRegionFile);

        Injector injector = Guice.createInjector(createModule(config, selected, settings));
        if (injector.getInstance(DatabasePlatform.class).destinationIsSource())
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Destination " + destination + " is the same database as source " + source);
        injector.getInstance(SubsetEventBus.class).register(new ConsoleProgressListener(out));

        try {
            BuildResult result = injector.getInstance(TestDatabaseBuilder.class).build(windows);
            if (!result.created()) {
                out.println("Test database creation aborted");
                return CommandLine.ExitCode.OK;
            }
            out.println("Test database " + destination + " created");
            return CommandLine.ExitCode.OK;
        } catch (SchemaCloneException e) {
            err.println(e.getMessage());
            return e.exitStatus();
        } catch (SQLException e) {
            LOG.error("Database error", e);
            err.println("Database error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (SubsetException | IOException e) {
            LOG.error("Test database creation failed", e);
            err.println(e.getMessage());
            return EXIT_FAILURE;
        }
    }

    Module createModule(SubsetConfig config, Platform selected, ConnectionSettings settings) {
        return new SubsetModule(config, selected, source, destination, settings, new ConsoleConfirmation(in, out));
    }

    private Platform parsePlatform() {
        try {
            return Platform.of(platform);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }
    }

    /**
     * Server platforms need host, user and password; their absence is a usage
     * error raised before any connection is attempted.
     */
    private ConnectionSettings connectionSettings(Platform selected) {
        if (!selected.requiresServer())
            return null;
        if (isBlank(host) || isBlank(user) || password == null)
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Missing required options for " + selected.name().toLowerCase()
                            + ": --host, --user and --password");
        try {
            return new ConnectionSettings(host, port, user, password);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage());
        }
    }

    void applyOverrides(SubsetConfig config) {
        SelectionConfig selection = config.getSelection();
        if (referenceGenomeDbId != null)
            selection.setReferenceGenomeDbId(referenceGenomeDbId);
        if (otherGenomeDbIds != null && !otherGenomeDbIds.isEmpty())
            selection.setOtherGenomeDbIds(otherGenomeDbIds);
        if (methodLinkId != null)
            selection.setMethodLinkId(methodLinkId);
        if (maxAlignmentLength != null)
            selection.setMaxAlignmentLength(maxAlignmentLength);
        if (outputDirectory != null)
            config.getSeedRegions().setOutputDirectory(outputDirectory);
        if (noVerify)
            config.setVerifyClosure(false);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
