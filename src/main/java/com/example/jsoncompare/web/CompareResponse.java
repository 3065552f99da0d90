package com.example.jsoncompare.web;

import com.example.jsoncompare.domain.CompareDiffResult;
import com.example.jsoncompare.domain.CompareRenderResult;
import com.example.jsoncompare.domain.ComparisonTiming;
import com.example.jsoncompare.domain.DiffEntry;
import com.example.jsoncompare.domain.DiffLocation;
import com.example.jsoncompare.domain.JsonComparison;
import com.example.jsoncompare.domain.RenderLine;
import com.example.jsoncompare.domain.StyledLine;

import java.util.List;

public record CompareResponse(
        boolean identical,
        int addedCount,
        int removedCount,
        int modifiedCount,
        int totalDiffCount,
        List<DiffEntry> diffs,
        List<RenderLine> leftLines,
        List<RenderLine> rightLines,
        List<DiffLocation> diffLocations,
        int totalLines,
        boolean truncated,
        List<StyledLine> leftStyled,
        List<StyledLine> rightStyled,
        ComparisonTiming timing) {

    static CompareResponse from(JsonComparison comparison) {
        CompareDiffResult diff = comparison.getDiffResult();
        CompareRenderResult render = comparison.getRenderResult();
        return new CompareResponse(
                diff.isIdentical(),
                diff.addedCount(),
                diff.removedCount(),
                diff.modifiedCount(),
                diff.totalDiffCount(),
                diff.serializeDiff(),
                render.leftLines(),
                render.rightLines(),
                render.diffLocations(),
                render.totalLines(),
                render.truncated(),
                comparison.getLeftStyled(),
                comparison.getRightStyled(),
                comparison.getTiming());
    }
}
