package me.christianrobert.policyguard.schema.model;

/**
 * An implicit many-to-many relation seen from one of its fields. Both models are linked through a join table
 * holding one foreign key column per side, named {@code A} and {@code B}.
 */
public class ManyToManyRelation {

    private final String parentFk;
    private final String parentPk;
    private final String otherModel;
    private final String otherField;
    private final String otherFk;
    private final String otherPk;
    private final String joinTable;

    public ManyToManyRelation(String parentFk, String parentPk, String otherModel, String otherField,
                              String otherFk, String otherPk, String joinTable) {
        this.parentFk = parentFk;
        this.parentPk = parentPk;
        this.otherModel = otherModel;
        this.otherField = otherField;
        this.otherFk = otherFk;
        this.otherPk = otherPk;
        this.joinTable = joinTable;
    }

    /**
     * Join table column referencing the model that declares the field.
     */
    public String getParentFk() {
        return parentFk;
    }

    public String getParentPk() {
        return parentPk;
    }

    public String getOtherModel() {
        return otherModel;
    }

    public String getOtherField() {
        return otherField;
    }

    /**
     * Join table column referencing the related model.
     */
    public String getOtherFk() {
        return otherFk;
    }

    public String getOtherPk() {
        return otherPk;
    }

    public String getJoinTable() {
        return joinTable;
    }

    @Override
    public String toString() {
        return "ManyToManyRelation{joinTable='" + joinTable + "', " + parentFk + " -> " + parentPk + ", "
                + otherFk + " -> " + otherModel + "." + otherPk + "}";
    }
}
