package me.christianrobert.policyguard.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Function invocation, e.g. {@code auth()}, {@code before()} or {@code contains(title, 'x')}.
 */
public class CallExpression implements Expression {

    private final String function;
    private final List<Expression> args;

    public CallExpression(String function, List<Expression> args) {
        this.function = Objects.requireNonNull(function, "function");
        this.args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    public String getFunction() {
        return function;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitCall(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallExpression)) return false;
        CallExpression that = (CallExpression) o;
        return function.equals(that.function) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, args);
    }

    @Override
    public String toString() {
        return function + args.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
