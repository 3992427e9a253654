package org.stianloader.picopip.marker;

import org.stianloader.picopip.version.SpecifierJoin;

public enum MarkerConnective {
    AND("and", SpecifierJoin.AND),
    OR("or", SpecifierJoin.OR);

    private final String keyword;
    private final SpecifierJoin join;

    MarkerConnective(String keyword, SpecifierJoin join) {
        this.keyword = keyword;
        this.join = join;
    }

    public String getKeyword() {
        return this.keyword;
    }

    public SpecifierJoin toSpecifierJoin() {
        return this.join;
    }

    @Override
    public String toString() {
        return this.keyword;
    }
}
