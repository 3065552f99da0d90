package com.example.jsoncompare.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One node of the comparison tree. {@code leftValue} is null only for {@link DiffType#ADDED} items and
 * {@code rightValue} only for {@link DiffType#REMOVED} items.
 */
public record DiffItem(
        List<String> path,
        DiffType type,
        String key,
        JsonValue leftValue,
        JsonValue rightValue,
        List<DiffItem> children,
        int depth) {

    public DiffItem {
        path = List.copyOf(path);
        Objects.requireNonNull(type, "type");
        children = List.copyOf(children);
        if (type != DiffType.ADDED) {
            Objects.requireNonNull(leftValue, "leftValue");
        }
        if (type != DiffType.REMOVED) {
            Objects.requireNonNull(rightValue, "rightValue");
        }
    }

    public static DiffItem leaf(
            List<String> path, DiffType type, JsonValue leftValue, JsonValue rightValue) {
        return new DiffItem(
                path, type, lastSegment(path), leftValue, rightValue, List.of(), path.size());
    }

    public static DiffItem container(
            List<String> path, JsonValue leftValue, JsonValue rightValue, List<DiffItem> children) {
        boolean anyDiff = children.stream().anyMatch(DiffItem::hasDiff);
        return new DiffItem(
                path,
                anyDiff ? DiffType.MODIFIED : DiffType.UNCHANGED,
                lastSegment(path),
                leftValue,
                rightValue,
                children,
                path.size());
    }

    /** Returns a new path with {@code segment} appended; the receiver is never modified. */
    public static List<String> childPath(List<String> path, String segment) {
        List<String> child = new ArrayList<>(path.size() + 1);
        child.addAll(path);
        child.add(segment);
        return List.copyOf(child);
    }

    public boolean hasDiff() {
        if (type != DiffType.UNCHANGED) {
            return true;
        }
        return children.stream().anyMatch(DiffItem::hasDiff);
    }

    /** True when this item differs and none of its children carry a difference of their own. */
    public boolean isLeafDiff() {
        return type != DiffType.UNCHANGED && children.stream().noneMatch(DiffItem::hasDiff);
    }

    /** RFC 6901 pointer; {@code ~} and {@code /} inside a segment are escaped. */
    public String jsonPointer() {
        StringBuilder sb = new StringBuilder();
        for (String segment : path) {
            sb.append('/').append(segment.replace("~", "~0").replace("/", "~1"));
        }
        return sb.length() == 0 ? "/" : sb.toString();
    }

    private static String lastSegment(List<String> path) {
        return path.isEmpty() ? null : path.get(path.size() - 1);
    }
}
