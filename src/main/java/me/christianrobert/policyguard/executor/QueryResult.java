package me.christianrobert.policyguard.executor;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Rows returned by a statement (select or RETURNING) and the number of rows it affected.
 */
public class QueryResult {

    private final List<Map<String, Object>> rows;
    private final long numAffectedRows;

    public QueryResult(List<Map<String, Object>> rows, long numAffectedRows) {
        this.rows = rows == null ? Collections.emptyList() : Collections.unmodifiableList(rows);
        this.numAffectedRows = numAffectedRows;
    }

    public static QueryResult ofRows(List<Map<String, Object>> rows) {
        return new QueryResult(rows, rows.size());
    }

    public static QueryResult ofAffected(long numAffectedRows) {
        return new QueryResult(Collections.emptyList(), numAffectedRows);
    }

    public static QueryResult empty() {
        return new QueryResult(Collections.emptyList(), 0);
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public long getNumAffectedRows() {
        return numAffectedRows;
    }

    /**
     * @return the first row, or {@code null} when there is none
     */
    public Map<String, Object> firstRow() {
        return rows.isEmpty() ? null : rows.get(0);
    }

    @Override
    public String toString() {
        return "QueryResult{rows=" + rows.size() + ", numAffectedRows=" + numAffectedRows + "}";
    }
}
