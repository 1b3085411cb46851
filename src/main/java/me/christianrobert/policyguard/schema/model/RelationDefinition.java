package me.christianrobert.policyguard.schema.model;

import java.util.Collections;
import java.util.List;

/**
 * Relation metadata of a field. The owning side lists its foreign key {@code fields} and the
 * {@code references} they point to; the other side only names its {@code opposite} field.
 */
public class RelationDefinition {

    private final List<String> fields;
    private final List<String> references;
    private final String opposite;
    private final String name;

    public RelationDefinition(List<String> fields, List<String> references, String opposite) {
        this(fields, references, opposite, null);
    }

    public RelationDefinition(List<String> fields, List<String> references, String opposite, String name) {
        this.fields = fields == null ? Collections.emptyList() : List.copyOf(fields);
        this.references = references == null ? Collections.emptyList() : List.copyOf(references);
        this.opposite = opposite;
        this.name = name;
        if (this.fields.size() != this.references.size()) {
            throw new IllegalArgumentException("Relation fields and references must have the same length");
        }
    }

    public List<String> getFields() {
        return fields;
    }

    public List<String> getReferences() {
        return references;
    }

    public String getOpposite() {
        return opposite;
    }

    /**
     * @return the relation name, or {@code null} when none was given
     */
    public String getName() {
        return name;
    }

    /**
     * Whether the declaring model holds the foreign key.
     */
    public boolean isOwner() {
        return !fields.isEmpty();
    }

    @Override
    public String toString() {
        return "RelationDefinition{fields=" + fields + ", references=" + references + ", opposite=" + opposite
                + (name != null ? ", name=" + name : "") + "}";
    }
}
