package com.example.jsoncompare.domain;

import java.util.List;

/**
 * Paired pane contents. Both line lists always have the same length.
 */
public record CompareRenderResult(
        List<RenderLine> leftLines,
        List<RenderLine> rightLines,
        List<DiffLocation> diffLocations,
        int totalLines,
        boolean truncated) {

    public CompareRenderResult {
        leftLines = List.copyOf(leftLines);
        rightLines = List.copyOf(rightLines);
        diffLocations = List.copyOf(diffLocations);
        if (leftLines.size() != rightLines.size()) {
            throw new IllegalArgumentException(
                    "Pane sizes differ: " + leftLines.size() + " vs " + rightLines.size());
        }
    }
}
