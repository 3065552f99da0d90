package com.example.jsoncompare.application;

import com.example.jsoncompare.domain.InvalidJsonException;
import com.example.jsoncompare.domain.JsonValue;

public interface JsonValueParser {
    /**
     * Parses a complete JSON document.
     *
     * @throws InvalidJsonException if the text is empty, malformed or has trailing content
     */
    JsonValue parse(String text);
}
