package com.initialone.jmigrate.model;

import java.util.Objects;

/** 一条改名规则：legacyName -> marker + legacyName */
public final class RenameRule {

    private final String legacyName;
    private final String shadowName;

    RenameRule(String marker, String legacyName) {
        this.legacyName = legacyName;
        this.shadowName = marker + legacyName;
    }

    public String legacyName() { return legacyName; }

    public String shadowName() { return shadowName; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RenameRule r)) return false;
        return legacyName.equals(r.legacyName) && shadowName.equals(r.shadowName);
    }

    @Override
    public int hashCode() { return Objects.hash(legacyName, shadowName); }

    @Override
    public String toString() { return legacyName + " -> " + shadowName; }
}
