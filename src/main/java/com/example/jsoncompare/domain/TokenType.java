package com.example.jsoncompare.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Syntax category of a span inside one pretty-printed JSON line. */
public enum TokenType {
    KEY,
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,
    STRUCTURE,
    WHITESPACE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
