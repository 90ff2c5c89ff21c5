package org.ensembl.compara.testdb.db.platform;

import org.ensembl.compara.testdb.core.config.ConnectionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Copies a MySQL schema's structure by piping {@code mysqldump --no-data}
 * into the {@code mysql} client.
 *
 * <p>
 * The password travels in the {@code MYSQL_PWD} environment variable of both
 * child processes so that it never appears in a process listing. Both
 * processes share the parent's stderr; the pipeline fails if either exits
 * non-zero.
 */
public final class MysqlDumpCloner {

    private static final Logger LOG = LoggerFactory.getLogger(MysqlDumpCloner.class);

    /** Status reported when a command cannot be started at all, as a shell would. */
    static final int NOT_STARTED_STATUS = 127;

    private final List<String> dumpCommand;
    private final List<String> loadCommand;
    private final Map<String, String> environment;

    MysqlDumpCloner(List<String> dumpCommand, List<String> loadCommand, Map<String, String> environment) {
        this.dumpCommand = List.copyOf(dumpCommand);
        this.loadCommand = List.copyOf(loadCommand);
        this.environment = Map.copyOf(environment);
    }

    public static MysqlDumpCloner forSchemas(ConnectionSettings settings, String source, String destination) {
        List<String> common = List.of(
                "-h", settings.host(),
                "-P", String.valueOf(settings.port()),
                "-u", settings.user());

        List<String> dump = new ArrayList<>();
        dump.add("mysqldump");
        dump.add("--no-data");
        dump.addAll(common);
        dump.add(source);

        List<String> load = new ArrayList<>();
        load.add("mysql");
        load.addAll(common);
        load.add(destination);

        String password = settings.password() == null ? "" : settings.password();
        return new MysqlDumpCloner(dump, load, Map.of("MYSQL_PWD", password));
    }

    List<String> dumpCommand() {
        return dumpCommand;
    }

    List<String> loadCommand() {
        return loadCommand;
    }

    /**
     * Runs the pipeline and waits for both processes.
     *
     * @throws SchemaCloneException carrying the first non-zero exit status
     */
    public void run() throws SchemaCloneException {
        ProcessBuilder dump = new ProcessBuilder(dumpCommand)
                .redirectError(ProcessBuilder.Redirect.INHERIT);
        ProcessBuilder load = new ProcessBuilder(loadCommand)
                .redirectOutput(ProcessBuilder.Redirect.INHERIT)
                .redirectError(ProcessBuilder.Redirect.INHERIT);
        dump.environment().putAll(environment);
        load.environment().putAll(environment);

        LOG.info("Cloning schema structure: {} | {}", String.join(" ", dumpCommand), String.join(" ", loadCommand));

        List<Process> processes;
        try {
            processes = ProcessBuilder.startPipeline(List.of(dump, load));
        } catch (IOException e) {
            throw new SchemaCloneException("Could not start schema copy: " + e.getMessage(), NOT_STARTED_STATUS, e);
        }

        try {
            int dumpStatus = processes.get(0).waitFor();
            int loadStatus = processes.get(1).waitFor();
            if (dumpStatus != 0)
                throw new SchemaCloneException(
                        "mysqldump failed with return code: " + dumpStatus, dumpStatus);
            if (loadStatus != 0)
                throw new SchemaCloneException(
                        "mysql schema load failed with return code: " + loadStatus, loadStatus);
        } catch (InterruptedException e) {
            processes.forEach(Process::destroyForcibly);
            Thread.currentThread().interrupt();
            throw new SchemaCloneException("Schema copy interrupted", 130, e);
        }
        LOG.info("Schema structure cloned.");
    }
}
