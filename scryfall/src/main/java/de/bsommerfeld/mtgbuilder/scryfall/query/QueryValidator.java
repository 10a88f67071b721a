package de.bsommerfeld.mtgbuilder.scryfall.query;

import com.google.common.collect.ImmutableSet;
import com.google.inject.Singleton;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Static structural checks for Scryfall search queries, run before any
 * request is issued.
 *
 * <p>
 * This is not a grammar. Rules are applied in order and the first failure
 * wins:
 * <ol>
 * <li>empty after trimming</li>
 * <li>parenthesis balance, ignoring parentheses inside double quotes</li>
 * <li>even number of double quotes</li>
 * <li>field names in front of {@code : = < > !} outside quotes</li>
 * <li>{@code or}/{@code and} position: not first, not last, never
 * twice in a row</li>
 * </ol>
 *
 * <p>
 * An unknown field name is only rejected when it is also not a plain word
 * (letters, digits, underscore). Bare words without a comparison are free
 * text name searches and always pass.
 */
@Singleton
public class QueryValidator {

    /** Search fields Scryfall recognizes. */
    static final Set<String> KNOWN_FIELDS = ImmutableSet.of(
            // name and text
            "name", "oracle", "type", "o", "t", "m", "mana", "devotion",
            // colors and identity
            "c", "color", "id", "identity", "ci",
            // stats
            "cmc", "mv", "manavalue", "power", "pow", "toughness", "tou", "loyalty", "loy",
            // rarity and set
            "r", "rarity", "s", "set", "e", "edition", "cn", "number",
            // legality
            "f", "format", "legal", "banned", "restricted",
            "is", "not", "has",
            // prices
            "usd", "eur", "tix", "price",
            // art and frames
            "art", "artist", "flavor", "ft", "watermark", "wm",
            "year", "date", "lang", "game", "new", "order", "unique", "prefer",
            "include", "border", "frame", "stamp", "keyword");

    /**
     * Validates a single query.
     *
     * @return the first rule violation, or empty if the query may be sent
     */
    public Optional<QueryValidationError> validate(String query) {
        String trimmed = query == null ? "" : query.trim();
        if (trimmed.isEmpty()) {
            return Optional.of(QueryValidationError.of(QueryValidationError.Kind.EMPTY_QUERY));
        }

        QueryValidationError error = checkParentheses(trimmed);
        if (error == null)
            error = checkQuotes(trimmed);
        if (error == null)
            error = checkFields(trimmed);
        if (error == null)
            error = checkOperators(trimmed);
        return Optional.ofNullable(error);
    }

    /**
     * Validates every query independently. The result has one entry per
     * input, in input order; a failing query does not stop the others.
     */
    public List<ValidatedQuery> validateMany(List<String> queries) {
        List<ValidatedQuery> results = new ArrayList<>(queries.size());
        for (int i = 0; i < queries.size(); i++) {
            String query = queries.get(i);
            results.add(new ValidatedQuery(i, query, validate(query)));
        }
        return results;
    }

    /**
     * Percent-encodes a query for the {@code q} parameter. Spaces become
     * {@code %20}, not {@code +}.
     */
    public String encode(String query) {
        return URLEncoder.encode(query, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~");
    }

    // =====================================================================
    // Rules
    // =====================================================================

    private QueryValidationError checkParentheses(String query) {
        int depth = 0;
        boolean inQuotes = false;
        for (int i = 0; i < query.length(); i++) {
            char ch = query.charAt(i);
            if (ch == '"') {
                inQuotes = !inQuotes;
            } else if (!inQuotes && ch == '(') {
                depth++;
            } else if (!inQuotes && ch == ')') {
                if (--depth < 0)
                    return QueryValidationError.of(QueryValidationError.Kind.UNBALANCED_PARENTHESES);
            }
        }
        return depth == 0 ? null : QueryValidationError.of(QueryValidationError.Kind.UNBALANCED_PARENTHESES);
    }

    private QueryValidationError checkQuotes(String query) {
        long quotes = query.chars().filter(c -> c == '"').count();
        return quotes % 2 == 0 ? null : QueryValidationError.of(QueryValidationError.Kind.UNBALANCED_QUOTES);
    }

    private QueryValidationError checkFields(String query) {
        boolean inQuotes = false;
        StringBuilder current = new StringBuilder();

        for (int i = 0; i < query.length(); i++) {
            char ch = query.charAt(i);
            if (ch == '"') {
                inQuotes = !inQuotes;
                current.setLength(0);
            } else if (inQuotes) {
                continue;
            } else if (isComparison(ch)) {
                String field = current.toString().trim().toLowerCase(Locale.ROOT);
                if (!field.isEmpty() && !field.startsWith("-")
                        && !KNOWN_FIELDS.contains(field) && !isPlainWord(field)) {
                    return QueryValidationError.invalidField(field);
                }
                current.setLength(0);
            } else if (ch == ' ' || ch == '(' || ch == ')') {
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        return null;
    }

    private QueryValidationError checkOperators(String query) {
        String[] words = query.toLowerCase(Locale.ROOT).trim().split("\\s+");
        if (words.length == 0 || words[0].isEmpty())
            return null;

        if (isBooleanOperator(words[0]))
            return QueryValidationError.of(QueryValidationError.Kind.LEADING_OPERATOR);
        if (isBooleanOperator(words[words.length - 1]))
            return QueryValidationError.of(QueryValidationError.Kind.TRAILING_OPERATOR);

        boolean previousWasOperator = false;
        for (String word : words) {
            boolean operator = isBooleanOperator(word);
            if (operator && previousWasOperator)
                return QueryValidationError.of(QueryValidationError.Kind.CONSECUTIVE_OPERATORS);
            previousWasOperator = operator;
        }
        return null;
    }

    private static boolean isComparison(char ch) {
        return ch == ':' || ch == '=' || ch == '<' || ch == '>' || ch == '!';
    }

    private static boolean isBooleanOperator(String word) {
        return word.equals("or") || word.equals("and");
    }

    private static boolean isPlainWord(String field) {
        return field.codePoints().allMatch(c -> Character.isLetterOrDigit(c) || c == '_');
    }
}
