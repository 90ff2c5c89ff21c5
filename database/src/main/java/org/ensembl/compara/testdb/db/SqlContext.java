package org.ensembl.compara.testdb.db;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {@link SqlLoader} templates for one source/target schema pair.
 *
 * <p>
 * Templates address every table with a schema qualifier, so one connection
 * reads the source and writes the target. Supported placeholders:
 * <ul>
 * <li>{@code ${source}} / {@code ${target}}: quoted schema names</li>
 * <li>{@code ${insert_ignore}}: the dialect's duplicate-skipping insert</li>
 * <li>any extra name passed to {@link #sql(String, Map)}, quoted as an
 * identifier</li>
 * </ul>
 * Values never go through placeholders; they are bound as statement
 * parameters.
 */
public final class SqlContext {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([a-z_]+)}");

    private final SqlDialect dialect;
    private final String source;
    private final String target;

    public SqlContext(SqlDialect dialect, String source, String target) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.source = dialect.quote(source);
        this.target = dialect.quote(target);
    }

    public SqlDialect dialect() {
        return dialect;
    }

    /** Returns the rendered statement for {@code sql/<name>.sql}. */
    public String sql(String name) {
        return sql(name, Map.of());
    }

    /**
     * Renders a template with additional identifier placeholders.
     *
     * @throws IllegalStateException if the template uses an unknown placeholder
     */
    public String sql(String name, Map<String, String> identifiers) {
        Map<String, String> values = new HashMap<>();
        values.put("source", source);
        values.put("target", target);
        values.put("insert_ignore", dialect.insertIgnore());
        identifiers.forEach((k, v) -> values.put(k, dialect.quote(v)));

        Matcher m = PLACEHOLDER.matcher(SqlLoader.load(name));
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = values.get(m.group(1));
            if (value == null)
                throw new IllegalStateException("Unknown placeholder ${" + m.group(1) + "} in sql/" + name + ".sql");
            m.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
