package com.codelogickeep.coverage.model;

import java.util.Locale;

/**
 * Type of branch reported for a line.
 */
public enum BranchType {
    CONDITIONAL,
    SWITCH,
    LOOP,
    EXCEPTION,
    RETURN;

    /**
     * Maps a Cobertura {@code condition type} attribute ("jump", "switch") to a branch type.
     */
    public static BranchType fromConditionType(String type) {
        if (type == null) {
            return CONDITIONAL;
        }
        switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "switch":
                return SWITCH;
            case "loop":
                return LOOP;
            case "exception":
                return EXCEPTION;
            case "return":
                return RETURN;
            default:
                return CONDITIONAL;
        }
    }
}
