package me.christianrobert.policyguard.schema.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Operations a policy rule can apply to.
 * {@code POST_UPDATE} rules are evaluated against the row after an update has been applied.
 */
public enum PolicyOperation {
    CREATE("create"),
    READ("read"),
    UPDATE("update"),
    POST_UPDATE("post-update"),
    DELETE("delete");

    private final String keyword;

    PolicyOperation(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * Parses a comma-separated operation list such as {@code "create,read"} or {@code "all"}.
     * {@code all} expands to create, read, update and delete; it never includes post-update.
     *
     * @throws IllegalArgumentException for unknown keywords or an empty list
     */
    public static Set<PolicyOperation> parseList(String operations) {
        Set<PolicyOperation> result = EnumSet.noneOf(PolicyOperation.class);
        for (String part : operations.split(",")) {
            String keyword = part.trim();
            if (keyword.isEmpty()) {
                continue;
            }
            if ("all".equals(keyword)) {
                result.addAll(EnumSet.of(CREATE, READ, UPDATE, DELETE));
            } else {
                result.add(fromKeyword(keyword));
            }
        }
        if (result.isEmpty()) {
            throw new IllegalArgumentException("Policy operation list is empty: '" + operations + "'");
        }
        return result;
    }

    public static PolicyOperation fromKeyword(String keyword) {
        for (PolicyOperation op : values()) {
            if (op.keyword.equals(keyword)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown policy operation: " + keyword);
    }

    @Override
    public String toString() {
        return keyword;
    }
}
