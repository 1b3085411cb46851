package me.christianrobert.policyguard.sql.node;

import java.util.Objects;

/**
 * {@code node AS alias}, for selections and table sources alike.
 */
public class AliasNode implements SqlNode {

    private final SqlNode node;
    private final String alias;

    public AliasNode(SqlNode node, String alias) {
        this.node = Objects.requireNonNull(node, "node");
        this.alias = Objects.requireNonNull(alias, "alias");
    }

    public static AliasNode of(SqlNode node, String alias) {
        return new AliasNode(node, alias);
    }

    public SqlNode getNode() {
        return node;
    }

    public String getAlias() {
        return alias;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitAlias(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AliasNode)) return false;
        AliasNode that = (AliasNode) o;
        return node.equals(that.node) && alias.equals(that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(node, alias);
    }

    @Override
    public String toString() {
        return node + " AS " + alias;
    }
}
