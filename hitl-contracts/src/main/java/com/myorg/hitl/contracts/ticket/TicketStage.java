package com.myorg.hitl.contracts.ticket;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * The four lifecycle stores. A ticket id lives in at most one of them at a time.
 */
public enum TicketStage {
    PENDING("pending"),
    DRAFTED("drafted"),
    ESCALATED("escalated"),
    COMPLETED("completed");

    private final String storeName;

    TicketStage(String storeName) {
        this.storeName = storeName;
    }

    public String storeName() {
        return storeName;
    }

    public boolean isTerminal() {
        return this == COMPLETED;
    }

    public Set<TicketStage> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(DRAFTED, ESCALATED, COMPLETED);
            case DRAFTED -> EnumSet.of(ESCALATED, COMPLETED);
            case ESCALATED -> EnumSet.of(COMPLETED);
            case COMPLETED -> EnumSet.noneOf(TicketStage.class);
        };
    }

    public boolean canMoveTo(TicketStage target) {
        return target != null && allowedTargets().contains(target);
    }

    /** Accepts both the enum name and the store name, case-insensitive. */
    public static TicketStage fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("stage must not be blank");
        }
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (TicketStage s : values()) {
            if (s.storeName.equals(n) || s.name().toLowerCase(Locale.ROOT).equals(n)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + name);
    }
}
