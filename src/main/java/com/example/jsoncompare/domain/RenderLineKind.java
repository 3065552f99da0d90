package com.example.jsoncompare.domain;

public enum RenderLineKind {
    CONTENT,
    PADDING,
    COLLAPSE
}
