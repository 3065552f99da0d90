package com.example.jsoncompare.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Background treatment of a styled line. The text-rendering side maps each value to a theme color.
 */
public enum LineHighlight {
    NONE,
    ADDED,
    REMOVED,
    MODIFIED,
    PADDING,
    COLLAPSE;

    public static LineHighlight forDiffType(DiffType type) {
        return switch (type) {
            case ADDED -> ADDED;
            case REMOVED -> REMOVED;
            case MODIFIED -> MODIFIED;
            case UNCHANGED -> NONE;
        };
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
