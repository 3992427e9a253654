package org.stianloader.picopip.version;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public enum SpecifierOperator {
    // Declaration order is the sort order used when grouping specifiers.
    LT("<"),
    LE("<="),
    EQ("=="),
    NE("!="),
    GE(">="),
    GT(">"),
    COMPATIBLE("~="),
    ARBITRARY("==="),
    IN("in"),
    NOT_IN("not in");

    // Longest symbols first so that "===" is not read as "==" followed by "=".
    private static final SpecifierOperator[] PARSE_ORDER = {ARBITRARY, COMPATIBLE, EQ, NE, LE, GE, LT, GT};

    @NotNull
    private final String symbol;

    SpecifierOperator(@NotNull String symbol) {
        this.symbol = symbol;
    }

    /**
     * Obtains the operator whose symbol the given string starts with. Only the PEP 440 operators
     * are considered, the membership operators {@link #IN} and {@link #NOT_IN} never match.
     *
     * @param string The specifier string
     * @return The matching operator, or null if the string does not start with an operator
     */
    @Nullable
    public static SpecifierOperator matchPrefix(@NotNull String string) {
        for (SpecifierOperator op : SpecifierOperator.PARSE_ORDER) {
            if (string.startsWith(op.symbol)) {
                return op;
            }
        }
        return null;
    }

    @Nullable
    public static SpecifierOperator fromSymbol(@NotNull String symbol) {
        for (SpecifierOperator op : SpecifierOperator.values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        return null;
    }

    @NotNull
    public String getSymbol() {
        return this.symbol;
    }

    public boolean isLowerBound() {
        return this == GT || this == GE;
    }

    public boolean isMembership() {
        return this == IN || this == NOT_IN;
    }

    public boolean isUpperBound() {
        return this == LT || this == LE;
    }

    @Override
    public String toString() {
        return this.symbol;
    }
}
