package me.christianrobert.policyguard.policy.transformer;

/**
 * What a collection-predicate binding name stands for while its predicate is compiled: either rows of a
 * related model (type + alias) or a plain element value taken from principal data.
 */
public class BindingScope {

    private final String type;
    private final String alias;
    private final Object value;
    private final boolean hasValue;

    private BindingScope(String type, String alias, Object value, boolean hasValue) {
        this.type = type;
        this.alias = alias;
        this.value = value;
        this.hasValue = hasValue;
    }

    public static BindingScope ofRows(String type, String alias) {
        return new BindingScope(type, alias, null, false);
    }

    public static BindingScope ofValue(String type, String alias, Object value) {
        return new BindingScope(type, alias, value, true);
    }

    public String getType() {
        return type;
    }

    public String getAlias() {
        return alias;
    }

    public Object getValue() {
        return value;
    }

    public boolean hasValue() {
        return hasValue;
    }

    @Override
    public String toString() {
        return "BindingScope{type='" + type + "', alias='" + alias + "'" + (hasValue ? ", value=" + value : "") + "}";
    }
}
