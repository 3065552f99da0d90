package com.example.jsoncompare.domain;

/** Position of a changed line in the final render output, used for next/previous navigation. */
public record DiffLocation(int renderLineIndex, DiffType diffType) {}
