package com.example.jsoncompare.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DiffType {
    ADDED,
    REMOVED,
    MODIFIED,
    UNCHANGED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
