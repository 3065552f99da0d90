package com.example.jsoncompare.application;

import com.example.jsoncompare.domain.CompareDiffResult;
import com.example.jsoncompare.domain.CompareOptions;
import com.example.jsoncompare.domain.JsonValue;

public interface JsonDiffEngine {
    CompareDiffResult compare(JsonValue left, JsonValue right, CompareOptions options);
}
