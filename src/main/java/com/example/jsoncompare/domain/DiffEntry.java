package com.example.jsoncompare.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Flat record of one leaf difference, as copied out by "copy diff". {@code left} is set only for removed
 * and modified entries, {@code right} only for added and modified ones.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiffEntry(String path, DiffType type, JsonValue left, JsonValue right) {}
