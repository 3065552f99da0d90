package com.example.jsoncompare.web;

import com.example.jsoncompare.config.JsonCompareProperties;
import com.example.jsoncompare.domain.CompareOptions;
import com.example.jsoncompare.domain.JsonComparisonRequest;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

@Component
public class CompareRequestAdapter {
    private final int maxIndentWidth;

    public CompareRequestAdapter(JsonCompareProperties properties) {
        this.maxIndentWidth = properties.getRender().getMaxIndentWidth();
    }

    public JsonComparisonRequest adapt(CompareRequest body, CompareOptions defaults) {
        if (body == null) {
            throw new IllegalArgumentException("Request body must be provided");
        }
        if (body.getLeft() == null || body.getRight() == null) {
            throw new IllegalArgumentException("Both left and right documents must be provided");
        }
        int indentWidth = body.getIndentWidth() == null ? 0 : body.getIndentWidth();
        if (indentWidth > maxIndentWidth) {
            throw new IllegalArgumentException(
                    "indentWidth must not exceed " + maxIndentWidth + ", got " + indentWidth);
        }
        return new JsonComparisonRequest(
                body.getLeft(),
                body.getRight(),
                resolveOptions(body, defaults),
                expandedSections(body.getExpandedSections()),
                indentWidth);
    }

    // JSON nulls in the list carry no section index
    private static Set<Integer> expandedSections(Set<Integer> requested) {
        if (requested == null) {
            return Set.of();
        }
        Set<Integer> sections = new HashSet<>(requested);
        sections.remove(null);
        return sections;
    }

    public CompareOptions resolveOptions(CompareRequest body, CompareOptions defaults) {
        CompareOptions options = defaults;
        if (body.getIgnoreKeyOrder() != null) {
            options = options.withIgnoreKeyOrder(body.getIgnoreKeyOrder());
        }
        if (body.getIgnoreArrayOrder() != null) {
            options = options.withIgnoreArrayOrder(body.getIgnoreArrayOrder());
        }
        if (body.getStrictType() != null) {
            options = options.withStrictType(body.getStrictType());
        }
        return options;
    }
}
