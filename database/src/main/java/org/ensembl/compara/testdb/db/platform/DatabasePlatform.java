package org.ensembl.compara.testdb.db.platform;

import org.ensembl.compara.testdb.db.SqlContext;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Where the source and destination schemas live and how to manage the
 * destination's lifecycle.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link MySqlPlatform}: both schemas are databases on one MySQL
 * server</li>
 * <li>{@link SqlitePlatform}: both schemas are SQLite files, attached to a
 * single connection</li>
 * </ul>
 *
 * <p>
 * Callers open one connection with {@link #connect()} and pass it to every
 * other method. Until {@link #createDestination} has run, the connection
 * must not be used to address the destination schema.
 */
public interface DatabasePlatform {

    /** Template renderer bound to this platform's schema names. */
    SqlContext sqlContext();

    /** Human readable name of the destination, used in prompts and logs. */
    String destinationName();

    /**
     * Whether source and destination name the same schema, in which case
     * replacing the destination would destroy the source. Decided from the
     * configured names alone, without connecting.
     */
    boolean destinationIsSource();

    /**
     * Opens the single connection used for the whole run. The source schema
     * must be readable through it.
     */
    Connection connect() throws SQLException;

    boolean destinationExists(Connection connection) throws SQLException;

    /** Destroys the destination and all of its data. */
    void dropDestination(Connection connection) throws SQLException;

    /** Creates an empty destination and makes it addressable on the connection. */
    void createDestination(Connection connection) throws SQLException;

    /**
     * Copies the structure of every source table, without rows, into the
     * freshly created destination.
     *
     * @throws SchemaCloneException if the structural copy fails; the
     *                              destination may be left partially built
     */
    void cloneStructure(Connection connection) throws SQLException, SchemaCloneException;
}
