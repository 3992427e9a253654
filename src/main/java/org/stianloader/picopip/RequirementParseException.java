package org.stianloader.picopip;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown whenever textual input (a requirement line, a version, a specifier, a marker,
 * a URI or a manifest record) cannot be understood.
 *
 * <p>Parsers never attempt to recover from malformed input. Callers that want lenient
 * behaviour must catch this exception themselves.
 */
public class RequirementParseException extends IllegalArgumentException {

    public enum Kind {
        INVALID_MANIFEST,
        MALFORMED_MARKER,
        MALFORMED_SPECIFIER,
        MALFORMED_URI,
        MALFORMED_VERSION,
        MISSING_EGG_FRAGMENT,
        UNPARSABLE_REQUIREMENT;
    }

    private static final long serialVersionUID = -3524407702366342717L;

    @NotNull
    private final Kind kind;

    @NotNull
    private final String input;

    public RequirementParseException(@NotNull Kind kind, @NotNull String input, @NotNull String message) {
        this(kind, input, message, null);
    }

    public RequirementParseException(@NotNull Kind kind, @NotNull String input, @NotNull String message, @Nullable Throwable cause) {
        super(kind + ": " + message + " (input: '" + input + "')", cause);
        this.kind = Objects.requireNonNull(kind, "kind may not be null");
        this.input = input;
    }

    /**
     * Obtains the offending input string, as it was passed to the parser
     * that raised this exception.
     *
     * @return The offending input
     */
    @NotNull
    public String getInput() {
        return this.input;
    }

    @NotNull
    public Kind getKind() {
        return this.kind;
    }
}
