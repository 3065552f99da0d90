package com.example.jsoncompare.domain;

import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * Holds everything produced by one comparison run.
 */
@Getter
public class JsonComparison {
    private final CompareDiffResult diffResult;
    private final CompareRenderResult renderResult;
    private final List<StyledLine> leftStyled;
    private final List<StyledLine> rightStyled;
    @Setter private ComparisonTiming timing;

    public JsonComparison(
            CompareDiffResult diffResult,
            CompareRenderResult renderResult,
            List<StyledLine> leftStyled,
            List<StyledLine> rightStyled) {
        this.diffResult = diffResult;
        this.renderResult = renderResult;
        this.leftStyled = List.copyOf(leftStyled);
        this.rightStyled = List.copyOf(rightStyled);
        this.timing = null;
    }
}
