package me.christianrobert.policyguard.schema.model;

/**
 * Scalar field types. Any field type not listed here names a model or a type definition.
 */
public enum BuiltinType {
    STRING("String"),
    INT("Int"),
    BIGINT("BigInt"),
    FLOAT("Float"),
    DECIMAL("Decimal"),
    BOOLEAN("Boolean"),
    DATETIME("DateTime"),
    JSON("Json"),
    BYTES("Bytes");

    private final String typeName;

    BuiltinType(String typeName) {
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }

    /**
     * @return the builtin type with this schema name, or {@code null} if the name refers to a model or type
     */
    public static BuiltinType fromTypeName(String typeName) {
        for (BuiltinType type : values()) {
            if (type.typeName.equals(typeName)) {
                return type;
            }
        }
        return null;
    }
}
