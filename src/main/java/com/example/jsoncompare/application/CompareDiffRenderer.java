package com.example.jsoncompare.application;

import com.example.jsoncompare.domain.CompareDiffResult;
import com.example.jsoncompare.domain.CompareRenderResult;

import java.util.Set;

public interface CompareDiffRenderer {
    CompareRenderResult render(
            String leftText,
            String rightText,
            CompareDiffResult diffResult,
            Set<Integer> expandedSections,
            int indentWidth);
}
