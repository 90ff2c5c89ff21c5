package org.ensembl.compara.testdb.db.verify;

/**
 * One reference edge of the Compara schema.
 *
 * @param zeroMeansNone {@code true} for columns where the schema stores
 *                      {@code 0} instead of NULL for "no reference"
 */
public record ForeignKey(String childTable, String childColumn, String parentTable, String parentColumn,
        boolean zeroMeansNone) {

    public static ForeignKey of(String childTable, String childColumn, String parentTable, String parentColumn) {
        return new ForeignKey(childTable, childColumn, parentTable, parentColumn, false);
    }

    @Override
    public String toString() {
        return childTable + "." + childColumn + " -> " + parentTable + "." + parentColumn;
    }
}
