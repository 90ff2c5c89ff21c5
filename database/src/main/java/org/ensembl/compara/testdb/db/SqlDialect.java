package org.ensembl.compara.testdb.db;

import java.util.regex.Pattern;

/**
 * The few syntax differences between the supported databases.
 * Both accept backtick-quoted identifiers, so quoting is shared.
 */
public enum SqlDialect {

    MYSQL("INSERT IGNORE"),
    SQLITE("INSERT OR IGNORE");

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_$]+");

    private final String insertIgnore;

    SqlDialect(String insertIgnore) {
        this.insertIgnore = insertIgnore;
    }

    /** Insert keyword that skips rows colliding with an existing key. */
    public String insertIgnore() {
        return insertIgnore;
    }

    /**
     * Quotes a schema, table or column name. Only plain identifiers are
     * accepted, so the result can be spliced into SQL text safely.
     *
     * @throws IllegalArgumentException for anything else
     */
    public String quote(String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches())
            throw new IllegalArgumentException("Not a plain SQL identifier: '" + identifier + "'");
        return "`" + identifier + "`";
    }
}
