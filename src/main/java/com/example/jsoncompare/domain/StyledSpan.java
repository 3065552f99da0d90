package com.example.jsoncompare.domain;

public record StyledSpan(String text, TokenType tokenType) {}
