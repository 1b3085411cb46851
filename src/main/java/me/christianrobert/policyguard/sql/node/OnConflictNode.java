package me.christianrobert.policyguard.sql.node;

import java.util.List;

/**
 * {@code ON CONFLICT (columns) DO NOTHING} when there are no updates, otherwise
 * {@code ON CONFLICT (columns) DO UPDATE SET ... [WHERE updateWhere]}.
 */
public class OnConflictNode {

    private final List<String> conflictColumns;
    private final List<ColumnUpdateNode> updates;
    private final SqlNode updateWhere;

    public OnConflictNode(List<String> conflictColumns, List<ColumnUpdateNode> updates, SqlNode updateWhere) {
        this.conflictColumns = List.copyOf(conflictColumns);
        this.updates = updates == null ? List.of() : List.copyOf(updates);
        this.updateWhere = updateWhere;
    }

    public List<String> getConflictColumns() {
        return conflictColumns;
    }

    public List<ColumnUpdateNode> getUpdates() {
        return updates;
    }

    public boolean isDoNothing() {
        return updates.isEmpty();
    }

    public SqlNode getUpdateWhere() {
        return updateWhere;
    }

    public OnConflictNode withUpdateWhere(SqlNode where) {
        return new OnConflictNode(conflictColumns, updates, where);
    }

    @Override
    public String toString() {
        return "ON CONFLICT " + conflictColumns + (isDoNothing() ? " DO NOTHING" : " DO UPDATE " + updates);
    }
}
