package com.sentimento.access.model;

/** Privilege tiers derived from the configured email allowlists. */
public enum Role {
    SEEDBRINGER("Seedbringer", 2),
    COUNCIL("Council", 1),
    UNAUTHORIZED("Unauthorized", 0);

    private final String displayName;
    private final int rank;

    Role(String displayName, int rank) {
        this.displayName = displayName;
        this.rank = rank;
    }

    public String displayName() {
        return displayName;
    }

    /** Higher is more privileged. Used only to pick the least privileged role when reporting a denial. */
    public int rank() {
        return rank;
    }
}
