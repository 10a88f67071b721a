package de.bsommerfeld.mtgbuilder.scryfall.query;

/**
 * Why a search query was rejected before reaching the network.
 *
 * @param kind  the failed rule
 * @param field offending field name, only set for {@link Kind#INVALID_FIELD}
 */
public record QueryValidationError(Kind kind, String field) {

    public enum Kind {
        EMPTY_QUERY,
        UNBALANCED_PARENTHESES,
        UNBALANCED_QUOTES,
        INVALID_FIELD,
        CONSECUTIVE_OPERATORS,
        LEADING_OPERATOR,
        TRAILING_OPERATOR
    }

    public static QueryValidationError of(Kind kind) {
        return new QueryValidationError(kind, null);
    }

    public static QueryValidationError invalidField(String field) {
        return new QueryValidationError(Kind.INVALID_FIELD, field);
    }

    /** Human readable reason, suitable for CLI output. */
    public String message() {
        return switch (kind) {
            case EMPTY_QUERY -> "Query cannot be empty";
            case UNBALANCED_PARENTHESES -> "Unbalanced parentheses in query";
            case UNBALANCED_QUOTES -> "Unbalanced quotes in query";
            case INVALID_FIELD -> "Invalid field: '" + field + "'";
            case CONSECUTIVE_OPERATORS -> "Consecutive operators are not allowed";
            case LEADING_OPERATOR -> "Query cannot start with an operator";
            case TRAILING_OPERATOR -> "Query cannot end with an operator";
        };
    }

    @Override
    public String toString() {
        return message();
    }
}
