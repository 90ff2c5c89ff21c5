/**
 * Command-line entry point.
 *
 * <pre>
 * CreateTestDatabaseCommand  : options, config overrides, exit status mapping
 * SubsetModule               : Guice wiring, picks the database platform
 * ConsoleConfirmation        : blocking y/n prompt on stdin
 * ConsoleProgressListener    : prints pipeline events to stdout
 * </pre>
 */
package org.ensembl.compara.testdb.launcher;
