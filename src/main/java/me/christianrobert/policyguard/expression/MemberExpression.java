package me.christianrobert.policyguard.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Member access chain: {@code receiver.m1.m2...}. The member list is never empty.
 */
public class MemberExpression implements Expression {

    private final Expression receiver;
    private final List<String> members;

    public MemberExpression(Expression receiver, List<String> members) {
        this.receiver = Objects.requireNonNull(receiver, "receiver");
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("Member expression requires at least one member");
        }
        this.members = Collections.unmodifiableList(new ArrayList<>(members));
    }

    public Expression getReceiver() {
        return receiver;
    }

    public List<String> getMembers() {
        return members;
    }

    /**
     * Returns a new member expression with {@code member} appended to the chain.
     */
    public MemberExpression append(String member) {
        List<String> extended = new ArrayList<>(members);
        extended.add(member);
        return new MemberExpression(receiver, extended);
    }

    @Override
    public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
        return visitor.visitMember(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemberExpression)) return false;
        MemberExpression that = (MemberExpression) o;
        return receiver.equals(that.receiver) && members.equals(that.members);
    }

    @Override
    public int hashCode() {
        return Objects.hash(receiver, members);
    }

    @Override
    public String toString() {
        return receiver + "." + String.join(".", members);
    }
}
