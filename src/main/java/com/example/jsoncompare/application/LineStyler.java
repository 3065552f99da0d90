package com.example.jsoncompare.application;

import com.example.jsoncompare.domain.RenderLine;
import com.example.jsoncompare.domain.StyledLine;

import java.util.List;

/**
 * Turns already rendered lines into styled lines. Works on stored lines, so a theme change does not need
 * a new comparison.
 */
public interface LineStyler {
    List<StyledLine> style(List<RenderLine> lines);
}
