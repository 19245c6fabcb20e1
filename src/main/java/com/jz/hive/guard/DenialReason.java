package com.jz.hive.guard;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DenialReason {
    WARNING("warning"),
    FINAL_WARNING("final_warning"),
    SUSPENSION("suspension"),
    /** 存储不可用且策略为 FAIL_CLOSED */
    UNAVAILABLE("unavailable");

    private final String wire;

    DenialReason(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    static DenialReason of(ModerationAction action) {
        return switch (action) {
            case WARNING -> WARNING;
            case FINAL_WARNING -> FINAL_WARNING;
            case SUSPENSION -> SUSPENSION;
            case SUSPENSION_REMOVED -> throw new IllegalArgumentException("not a denial: " + action);
        };
    }
}
