/**
 * Builds a Compara test database: a structural copy of a source schema
 * holding only the rows reachable from a set of windows on a reference
 * genome.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [launcher]
 *        │
 *        ▼
 *   TestDatabaseBuilder   ← confirm, recreate, clone, populate, emit
 *        │
 *        ├── DatabasePlatform   ← MySQL server or SQLite files (Guice binding)
 *        │
 *        ├── SubsetPipeline     ← REFERENCE_DATA → WINDOWS → CLOSURE, one transaction
 *        │     ├── ReferenceDataStep
 *        │     ├── WindowSelector
 *        │     └── ClosurePass
 *        │
 *        ├── ClosureVerifier    ← dangling-reference check before commit
 *        │
 *        └── SeedRegionEmitter  ← one seed-region file per companion genome
 * </pre>
 *
 * <h2>One connection, two schemas</h2>
 * Every statement names its tables with a schema qualifier, so rows move with
 * a single {@code INSERT ... SELECT} and never pass through the JVM. On MySQL
 * the qualifiers are the database names. On SQLite they are the aliases of
 * the attached source and destination files.
 *
 * <h2>SQL File Inventory</h2>
 * All statements live in {@code sql/*.sql}, loaded via {@link SqlLoader} and
 * rendered by {@link SqlContext}:
 * <ul>
 * <li>{@code copy-method-link.sql}, {@code copy-genome-db.sql},
 * {@code clear-genome-db-locator.sql}, {@code copy-meta.sql},
 * {@code select-meta-value.sql}: reference tables</li>
 * <li>{@code select-pair-mlss.sql}, {@code select-reference-dnafrag.sql}:
 * per-pair lookups</li>
 * <li>{@code copy-window-genomic-align.sql}, {@code copy-genomic-align-block.sql},
 * {@code copy-block-genomic-align.sql}, {@code copy-genomic-align-group.sql}:
 * alignments overlapping a window</li>
 * <li>{@code copy-window-homology.sql}, {@code copy-window-family.sql}:
 * member-anchored rows</li>
 * <li>{@code copy-dnafrag.sql}, {@code copy-synteny-region.sql},
 * {@code copy-dnafrag-region.sql}, {@code copy-*-member*.sql},
 * {@code copy-sequence.sql}, {@code copy-*-taxon.sql}, {@code copy-*-mlss.sql}:
 * closure</li>
 * <li>{@code count-dangling-references*.sql}:
 * verification</li>
 * <li>{@code select-genome-aligned-regions.sql}, {@code select-genome-db-name.sql}:
 * seed-region emission</li>
 * <li>{@code select-schema-ddl.sql}: SQLite structure copy</li>
 * </ul>
 */
package org.ensembl.compara.testdb.db;
