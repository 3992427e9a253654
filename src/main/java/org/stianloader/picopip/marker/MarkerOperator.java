package org.stianloader.picopip.marker;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picopip.version.SpecifierOperator;

public enum MarkerOperator {
    EQ("==", SpecifierOperator.EQ),
    NE("!=", SpecifierOperator.NE),
    LT("<", SpecifierOperator.LT),
    LE("<=", SpecifierOperator.LE),
    GT(">", SpecifierOperator.GT),
    GE(">=", SpecifierOperator.GE),
    COMPATIBLE("~=", SpecifierOperator.COMPATIBLE),
    ARBITRARY("===", SpecifierOperator.ARBITRARY),
    IN("in", SpecifierOperator.IN),
    NOT_IN("not in", SpecifierOperator.NOT_IN);

    @NotNull
    private final String symbol;

    @NotNull
    private final SpecifierOperator specifierOperator;

    MarkerOperator(@NotNull String symbol, @NotNull SpecifierOperator specifierOperator) {
        this.symbol = symbol;
        this.specifierOperator = specifierOperator;
    }

    @Nullable
    public static MarkerOperator fromSymbol(@NotNull String symbol) {
        for (MarkerOperator op : MarkerOperator.values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        return null;
    }

    @NotNull
    public static MarkerOperator fromSpecifierOperator(@NotNull SpecifierOperator op) {
        for (MarkerOperator markerOp : MarkerOperator.values()) {
            if (markerOp.specifierOperator == op) {
                return markerOp;
            }
        }
        throw new IllegalArgumentException("No marker operator for " + op);
    }

    /**
     * Obtains the operator to use when both sides of a comparison are swapped,
     * so that {@code '3.7' < python_version} can be read as {@code python_version > '3.7'}.
     * Operators without a mirrored counterpart (such as "in") return null.
     *
     * @return The mirrored operator, or null
     */
    @Nullable
    public MarkerOperator mirror() {
        switch (this) {
        case EQ:
        case NE:
        case ARBITRARY:
            return this;
        case LT:
            return GT;
        case LE:
            return GE;
        case GT:
            return LT;
        case GE:
            return LE;
        default:
            return null;
        }
    }

    @NotNull
    public SpecifierOperator getSpecifierOperator() {
        return this.specifierOperator;
    }

    @NotNull
    public String getSymbol() {
        return this.symbol;
    }

    @Override
    public String toString() {
        return this.symbol;
    }
}
