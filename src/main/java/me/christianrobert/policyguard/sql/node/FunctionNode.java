package me.christianrobert.policyguard.sql.node;

import java.util.List;
import java.util.Objects;

/**
 * Function call such as {@code COUNT(1)} or {@code COALESCE(x, FALSE)}.
 */
public class FunctionNode implements SqlNode {

    private final String name;
    private final List<SqlNode> args;

    public FunctionNode(String name, List<SqlNode> args) {
        this.name = Objects.requireNonNull(name, "name");
        this.args = List.copyOf(args);
    }

    public static FunctionNode of(String name, SqlNode... args) {
        return new FunctionNode(name, List.of(args));
    }

    public String getName() {
        return name;
    }

    public List<SqlNode> getArgs() {
        return args;
    }

    @Override
    public <R> R accept(SqlNodeVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionNode)) return false;
        FunctionNode that = (FunctionNode) o;
        return name.equals(that.name) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args);
    }

    @Override
    public String toString() {
        return name + args;
    }
}
