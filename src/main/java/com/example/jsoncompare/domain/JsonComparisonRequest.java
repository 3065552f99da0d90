package com.example.jsoncompare.domain;

import java.util.Objects;
import java.util.Set;

/**
 * Raw inputs of one comparison run. An {@code indentWidth} of zero or less selects the configured default.
 */
public record JsonComparisonRequest(
        String leftText,
        String rightText,
        CompareOptions options,
        Set<Integer> expandedSections,
        int indentWidth) {
    public JsonComparisonRequest {
        Objects.requireNonNull(leftText, "leftText");
        Objects.requireNonNull(rightText, "rightText");
        Objects.requireNonNull(options, "options");
        expandedSections = expandedSections == null ? Set.of() : Set.copyOf(expandedSections);
    }
}
