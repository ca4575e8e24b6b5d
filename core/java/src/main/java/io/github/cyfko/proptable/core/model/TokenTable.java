package io.github.cyfko.proptable.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Table of the parenthesized groups extracted from a formula.
 * <p>
 * Each group is addressed by an integer key equal to its discovery order. The stored text of a
 * group has its own inner groups already replaced by their keys, so {@code ((a&b)|c)} is stored
 * as two entries:
 * </p>
 * <pre>
 * 0 → (a&amp;b)
 * 1 → (0|c)
 * </pre>
 * <p>
 * A key may only refer to strictly smaller keys. {@link #expand(int)} relies on this to rebuild
 * the original text of any group.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TokenTable {

    /**
     * A token reference inside a stored text: a run of decimal digits.
     */
    public static final Pattern TOKEN_REFERENCE = Pattern.compile("\\d+");

    private static final TokenTable EMPTY = new TokenTable(List.of());

    private final List<String> texts;

    /**
     * @param texts stored group texts, indexed by key
     */
    public TokenTable(List<String> texts) {
        this.texts = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(texts, "texts")));
    }

    public static TokenTable empty() {
        return EMPTY;
    }

    public int size() {
        return texts.size();
    }

    public boolean isEmpty() {
        return texts.isEmpty();
    }

    /**
     * Returns the stored (compressed) text of a group.
     *
     * @param key the token key
     * @return the stored text, inner groups written as keys
     * @throws IndexOutOfBoundsException if the key is unknown
     */
    public String text(int key) {
        return texts.get(key);
    }

    /**
     * @return stored texts in key order
     */
    public List<String> texts() {
        return texts;
    }

    /**
     * Rebuilds the full parenthesized text of a group, leading negation included.
     *
     * @param key the token key
     * @return the text of the group exactly as it appeared in the formula
     * @throws IllegalStateException if the stored text refers to its own or a later key
     */
    public String expand(int key) {
        return expand(text(key), key);
    }

    /**
     * Rebuilds the full text of an expression whose groups were replaced by keys, such as the
     * flat root of a tokenized formula.
     *
     * @param compressed text containing token references
     * @return the text with every reference recursively expanded
     * @throws IllegalStateException if a reference is not a known key
     */
    public String expandAll(String compressed) {
        return expand(Objects.requireNonNull(compressed, "compressed"), texts.size());
    }

    private String expand(String compressed, int bound) {
        Matcher matcher = TOKEN_REFERENCE.matcher(compressed);
        StringBuilder result = new StringBuilder(compressed.length() * 2);
        while (matcher.find()) {
            int ref = Integer.parseInt(matcher.group());
            if (ref >= bound) {
                throw new IllegalStateException(String.format(
                        "Token table is inconsistent: '%s' refers to token %d, only tokens below %d may be referenced",
                        compressed, ref, bound));
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(expand(texts.get(ref), ref)));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("TokenTable{");
        for (int i = 0; i < texts.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(i).append('=').append(texts.get(i));
        }
        return sb.append('}').toString();
    }
}
