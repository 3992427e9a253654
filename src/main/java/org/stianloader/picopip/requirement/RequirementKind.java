package org.stianloader.picopip.requirement;

public enum RequirementKind {
    FILE,
    NAMED,
    VCS;
}
