package com.example.jsoncompare.application;

public interface JsonFormatter {
    /**
     * Pretty-prints {@code text} with sorted object keys and the given indent width. Text that does not
     * parse is returned unchanged.
     */
    String format(String text, int indentWidth);
}
