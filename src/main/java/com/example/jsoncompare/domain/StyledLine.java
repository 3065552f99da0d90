package com.example.jsoncompare.domain;

import java.util.List;

/**
 * A render line decorated for display.
 *
 * @param gutterMarked whether the pane gutter shows a change bar next to this line
 */
public record StyledLine(List<StyledSpan> spans, LineHighlight highlight, boolean gutterMarked) {
    public StyledLine {
        spans = List.copyOf(spans);
    }

    public String text() {
        StringBuilder sb = new StringBuilder();
        for (StyledSpan span : spans) {
            sb.append(span.text());
        }
        return sb.toString();
    }
}
