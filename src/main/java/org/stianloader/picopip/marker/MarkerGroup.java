package org.stianloader.picopip.marker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * A flat sequence of operands joined by connectives, mirroring the source text of the marker:
 * {@code a and b or c} is stored as the operands {@code [a, b, c]} and the connectives {@code [and, or]}.
 * When nested inside of another group, the group is written in parentheses.
 *
 * <p>As usual, "and" binds stronger than "or".
 */
public final class MarkerGroup implements MarkerNode {

    @NotNull
    private final List<@NotNull MarkerConnective> connectives;

    @NotNull
    private final List<@NotNull MarkerNode> operands;

    public MarkerGroup(@NotNull List<@NotNull MarkerNode> operands, @NotNull List<@NotNull MarkerConnective> connectives) {
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("A marker group needs at least one operand");
        }
        if (connectives.size() != operands.size() - 1) {
            throw new IllegalArgumentException("Expected " + (operands.size() - 1) + " connectives for " + operands.size() + " operands, got " + connectives.size());
        }
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        this.connectives = Collections.unmodifiableList(new ArrayList<>(connectives));
    }

    /**
     * Joins all operands with the same connective.
     *
     * @param operands The operands
     * @param connective The connective to place between each operand
     * @return The created group
     */
    @NotNull
    @Contract(pure = true)
    public static MarkerGroup join(@NotNull List<@NotNull MarkerNode> operands, @NotNull MarkerConnective connective) {
        return new MarkerGroup(operands, Collections.nCopies(Math.max(0, operands.size() - 1), connective));
    }

    @Override
    public void appendTo(@NotNull StringBuilder builder) {
        builder.append('(');
        this.appendContents(builder);
        builder.append(')');
    }

    public void appendContents(@NotNull StringBuilder builder) {
        this.operands.get(0).appendTo(builder);
        for (int i = 0; i < this.connectives.size(); i++) {
            builder.append(' ').append(this.connectives.get(i).getKeyword()).append(' ');
            this.operands.get(i + 1).appendTo(builder);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof MarkerGroup) {
            MarkerGroup other = (MarkerGroup) obj;
            return other.operands.equals(this.operands) && other.connectives.equals(this.connectives);
        }
        return false;
    }

    @Override
    public boolean evaluate(@NotNull MarkerEnvironment environment) {
        boolean any = false;
        boolean run = this.operands.get(0).evaluate(environment);
        for (int i = 0; i < this.connectives.size(); i++) {
            boolean next = this.operands.get(i + 1).evaluate(environment);
            if (this.connectives.get(i) == MarkerConnective.AND) {
                run = run && next;
            } else {
                any |= run;
                run = next;
            }
        }
        return any || run;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull MarkerConnective> getConnectives() {
        return this.connectives;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull MarkerNode> getOperands() {
        return this.operands;
    }

    @Override
    public int hashCode() {
        return this.operands.hashCode() * 31 + this.connectives.hashCode();
    }

    /**
     * Checks whether all operands are joined by "and", which is trivially the case for a single operand.
     *
     * @return True if no "or" connective is present at this level
     */
    @Contract(pure = true)
    public boolean isConjunction() {
        return !this.connectives.contains(MarkerConnective.OR);
    }

    @Override
    public boolean references(@NotNull MarkerVariable variable) {
        for (MarkerNode node : this.operands) {
            if (node.references(variable)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Splits the group on its "or" connectives, returning the "and"-joined runs of operands.
     *
     * @return The conjunctive runs, in source order
     */
    @NotNull
    public List<@NotNull List<@NotNull MarkerNode>> splitDisjunction() {
        List<List<MarkerNode>> runs = new ArrayList<>();
        List<MarkerNode> run = new ArrayList<>();
        run.add(this.operands.get(0));
        for (int i = 0; i < this.connectives.size(); i++) {
            if (this.connectives.get(i) == MarkerConnective.OR) {
                runs.add(run);
                run = new ArrayList<>();
            }
            run.add(this.operands.get(i + 1));
        }
        runs.add(run);
        return runs;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        this.appendContents(builder);
        return builder.toString();
    }
}
