package me.christianrobert.policyguard.expression;

/**
 * Binary operators of the policy language.
 *
 * <p>The three collection predicates take a to-many operand on the left and a predicate evaluated
 * per element on the right: {@code ?} is "some", {@code !} is "every" and {@code ^} is "none".
 */
public enum BinaryOperator {

    AND("&&"),
    OR("||"),
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    IN("in"),
    SOME("?"),
    EVERY("!"),
    NONE("^");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }

    public boolean isCollectionPredicate() {
        return this == SOME || this == EVERY || this == NONE;
    }

    public boolean isEquality() {
        return this == EQ || this == NE;
    }

    public boolean isOrdering() {
        return this == LT || this == LE || this == GT || this == GE;
    }

    /**
     * Resolves the operator for a source symbol.
     *
     * @throws IllegalArgumentException if the symbol is unknown
     */
    public static BinaryOperator fromSymbol(String symbol) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown binary operator: " + symbol);
    }

    /**
     * Resolves the collection predicate operator for a source symbol ({@code ?}, {@code !}, {@code ^}).
     * Needed separately because {@code !} is also the unary negation symbol.
     */
    public static BinaryOperator collectionPredicateFromSymbol(String symbol) {
        return switch (symbol) {
            case "?" -> SOME;
            case "!" -> EVERY;
            case "^" -> NONE;
            default -> throw new IllegalArgumentException("Unknown collection predicate operator: " + symbol);
        };
    }

    @Override
    public String toString() {
        return symbol;
    }
}
