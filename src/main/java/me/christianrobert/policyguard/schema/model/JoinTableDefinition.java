package me.christianrobert.policyguard.schema.model;

/**
 * Join table of an implicit many-to-many relation. It is not a model and has no policies of its own:
 * column {@link #FIRST_COLUMN} references the first model, {@link #SECOND_COLUMN} the second one.
 * The first model is the one whose name sorts first, or for a self-relation the one whose field name does.
 */
public class JoinTableDefinition {

    public static final String FIRST_COLUMN = "A";
    public static final String SECOND_COLUMN = "B";

    private final String tableName;
    private final String firstModel;
    private final String firstIdField;
    private final String secondModel;
    private final String secondIdField;

    public JoinTableDefinition(String tableName, String firstModel, String firstIdField, String secondModel,
                               String secondIdField) {
        this.tableName = tableName;
        this.firstModel = firstModel;
        this.firstIdField = firstIdField;
        this.secondModel = secondModel;
        this.secondIdField = secondIdField;
    }

    public String getTableName() {
        return tableName;
    }

    public String getFirstModel() {
        return firstModel;
    }

    public String getFirstIdField() {
        return firstIdField;
    }

    public String getSecondModel() {
        return secondModel;
    }

    public String getSecondIdField() {
        return secondIdField;
    }

    @Override
    public String toString() {
        return "JoinTableDefinition{table='" + tableName + "', A=" + firstModel + "." + firstIdField
                + ", B=" + secondModel + "." + secondIdField + "}";
    }
}
