package com.jz.hive.guard;

import com.fasterxml.jackson.annotation.JsonValue;

/** 审计日志里的动作类型 */
public enum ModerationAction {
    WARNING("warning"),
    FINAL_WARNING("final_warning"),
    SUSPENSION("suspension"),
    SUSPENSION_REMOVED("suspension_removed");

    private final String wire;

    ModerationAction(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
