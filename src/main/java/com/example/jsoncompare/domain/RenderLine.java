package com.example.jsoncompare.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One display line of a side-by-side pane.
 *
 * <p>{@code diffType} is set for content lines only; {@code sectionIndex} and {@code hiddenLineCount} for
 * collapse markers only. Padding lines carry {@link #NO_LINE} as their line index.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RenderLine(
        int lineIndex,
        RenderLineKind kind,
        DiffType diffType,
        Integer sectionIndex,
        Integer hiddenLineCount,
        String text) {
    public static final int NO_LINE = -1;

    public static RenderLine content(int lineIndex, DiffType diffType, String text) {
        return new RenderLine(lineIndex, RenderLineKind.CONTENT, diffType, null, null, text);
    }

    public static RenderLine padding() {
        return new RenderLine(NO_LINE, RenderLineKind.PADDING, null, null, null, "");
    }

    public static RenderLine collapse(int lineIndex, int sectionIndex, int hiddenLineCount) {
        return new RenderLine(
                lineIndex,
                RenderLineKind.COLLAPSE,
                null,
                sectionIndex,
                hiddenLineCount,
                "··· " + hiddenLineCount + " unchanged lines ···");
    }

    @JsonIgnore
    public boolean isChangedContent() {
        return kind == RenderLineKind.CONTENT && diffType != DiffType.UNCHANGED;
    }
}
