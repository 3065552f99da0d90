package com.example.jsoncompare.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of one structural comparison. Every derived value is recomputed from the item tree.
 */
public final class CompareDiffResult {
    private final List<DiffItem> items;

    public CompareDiffResult(List<DiffItem> items) {
        this.items = List.copyOf(items);
    }

    public List<DiffItem> items() {
        return items;
    }

    public int addedCount() {
        return countLeafDiffs(items, DiffType.ADDED);
    }

    public int removedCount() {
        return countLeafDiffs(items, DiffType.REMOVED);
    }

    public int modifiedCount() {
        return countLeafDiffs(items, DiffType.MODIFIED);
    }

    public int totalDiffCount() {
        return addedCount() + removedCount() + modifiedCount();
    }

    public boolean isIdentical() {
        return totalDiffCount() == 0;
    }

    public List<DiffItem> flattenedDiffItems() {
        List<DiffItem> result = new ArrayList<>();
        flatten(items, result);
        return List.copyOf(result);
    }

    public List<DiffEntry> serializeDiff() {
        List<DiffEntry> entries = new ArrayList<>();
        for (DiffItem item : flattenedDiffItems()) {
            JsonValue left =
                    item.type() == DiffType.REMOVED || item.type() == DiffType.MODIFIED
                            ? item.leftValue()
                            : null;
            JsonValue right =
                    item.type() == DiffType.ADDED || item.type() == DiffType.MODIFIED
                            ? item.rightValue()
                            : null;
            entries.add(new DiffEntry(item.jsonPointer(), item.type(), left, right));
        }
        return entries;
    }

    private static void flatten(List<DiffItem> level, List<DiffItem> into) {
        for (DiffItem item : level) {
            if (item.isLeafDiff()) {
                into.add(item);
            } else {
                flatten(item.children(), into);
            }
        }
    }

    private static int countLeafDiffs(List<DiffItem> level, DiffType type) {
        int count = 0;
        for (DiffItem item : level) {
            if (item.type() == type && item.isLeafDiff()) {
                count++;
            } else {
                count += countLeafDiffs(item.children(), type);
            }
        }
        return count;
    }
}
