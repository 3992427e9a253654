package org.stianloader.picopip.version;

/**
 * The boolean connective under which a list of specifiers is interpreted.
 */
public enum SpecifierJoin {
    AND,
    OR;
}
