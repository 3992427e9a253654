package org.stianloader.picopip.line;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picopip.RequirementParseException;
import org.stianloader.picopip.RequirementParseException.Kind;

/**
 * Helpers for the bracketed extras suffix of requirements, as in {@code requests[security,socks]}.
 *
 * <p>Extras are always handled in their canonical form: lower-cased, deduplicated and sorted.
 */
public final class Extras {

    /**
     * A string split into the part before the bracketed extras and the extras themselves.
     *
     * @param base The string without the extras suffix
     * @param extras The canonical extras, possibly empty
     */
    public static record Split(@NotNull String base, @NotNull List<@NotNull String> extras) {
    }

    private Extras() {
        throw new UnsupportedOperationException();
    }

    @NotNull
    @Contract(pure = true)
    public static List<@NotNull String> canonicalize(@NotNull Collection<@NotNull String> extras) {
        TreeSet<String> canonical = new TreeSet<>();
        for (String extra : extras) {
            String trimmed = extra.trim();
            if (!trimmed.isEmpty()) {
                canonical.add(trimmed.toLowerCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(canonical));
    }

    /**
     * Parses a comma-separated list of extras, with or without the surrounding brackets.
     *
     * @param extras The extras string, for example "[security, socks]"
     * @return The canonical extras
     */
    @NotNull
    @Contract(pure = true)
    public static List<@NotNull String> parse(@NotNull String extras) {
        String trimmed = extras.trim();
        if (trimmed.startsWith("[")) {
            if (!trimmed.endsWith("]")) {
                throw new RequirementParseException(Kind.UNPARSABLE_REQUIREMENT, extras, "Unterminated extras");
            }
            trimmed = trimmed.substring(1, trimmed.length() - 1);
        }
        List<String> parts = new ArrayList<>();
        for (String part : trimmed.split(",")) {
            String extra = part.trim();
            if (extra.isEmpty()) {
                continue;
            }
            for (int i = 0; i < extra.length(); i++) {
                char c = extra.charAt(i);
                if (!Character.isLetterOrDigit(c) && c != '-' && c != '_' && c != '.') {
                    throw new RequirementParseException(Kind.UNPARSABLE_REQUIREMENT, extras, "Invalid character '" + c + "' in extra '" + extra + "'");
                }
            }
            parts.add(extra);
        }
        return Extras.canonicalize(parts);
    }

    /**
     * Splits a trailing bracketed extras suffix from the given string. If the string does not end with
     * such a suffix, the string is returned as-is, along with an empty list of extras.
     *
     * @param string The string, for example "requests[security]"
     * @return The split string
     */
    @NotNull
    @Contract(pure = true)
    public static Split split(@NotNull String string) {
        String trimmed = string.trim();
        if (!trimmed.endsWith("]")) {
            return new Split(trimmed, Collections.emptyList());
        }
        int open = trimmed.lastIndexOf('[');
        if (open <= 0) {
            return new Split(trimmed, Collections.emptyList());
        }
        return new Split(trimmed.substring(0, open).trim(), Extras.parse(trimmed.substring(open)));
    }

    /**
     * Formats extras in their canonical bracketed form, producing the empty string if there are no extras.
     *
     * @param extras The extras
     * @return The formatted extras, for example "[security,socks]"
     */
    @NotNull
    @Contract(pure = true)
    public static String toString(@NotNull Collection<@NotNull String> extras) {
        if (extras.isEmpty()) {
            return "";
        }
        return '[' + String.join(",", Extras.canonicalize(extras)) + ']';
    }
}
