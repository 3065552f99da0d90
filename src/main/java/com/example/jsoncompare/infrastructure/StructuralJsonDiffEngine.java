package com.example.jsoncompare.infrastructure;

import com.example.jsoncompare.application.JsonDiffEngine;
import com.example.jsoncompare.domain.CompareDiffResult;
import com.example.jsoncompare.domain.CompareOptions;
import com.example.jsoncompare.domain.DiffItem;
import com.example.jsoncompare.domain.DiffType;
import com.example.jsoncompare.domain.JsonValue;
import com.example.jsoncompare.domain.JsonValue.ArrayValue;
import com.example.jsoncompare.domain.JsonValue.ObjectValue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Predicate;

/**
 * Recursive structural comparison of two JSON value trees.
 */
@Component
public class StructuralJsonDiffEngine implements JsonDiffEngine {
    private static final Logger log = LogManager.getLogger(StructuralJsonDiffEngine.class);

    static final List<String> PREFERRED_MATCHING_KEYS = List.of("id", "_id", "uuid", "key", "name");

    @Override
    public CompareDiffResult compare(JsonValue left, JsonValue right, CompareOptions options) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(options, "options");
        DiffItem root = compareValues(left, right, List.of(), options);
        return new CompareDiffResult(List.of(root));
    }

    private DiffItem compareValues(
            JsonValue left, JsonValue right, List<String> path, CompareOptions options) {
        if (left.getClass() != right.getClass()) {
            if (!options.strictType()
                    && !left.isContainer()
                    && !right.isContainer()
                    && left.asText().equals(right.asText())) {
                return DiffItem.leaf(path, DiffType.UNCHANGED, left, right);
            }
            return DiffItem.leaf(path, DiffType.MODIFIED, left, right);
        }
        if (left instanceof ObjectValue l && right instanceof ObjectValue r) {
            return compareObjects(l, r, path, options);
        }
        if (left instanceof ArrayValue l && right instanceof ArrayValue r) {
            return compareArrays(l, r, path, options);
        }
        DiffType type = valuesEqual(left, right, options) ? DiffType.UNCHANGED : DiffType.MODIFIED;
        return DiffItem.leaf(path, type, left, right);
    }

    private DiffItem compareObjects(
            ObjectValue left, ObjectValue right, List<String> path, CompareOptions options) {
        Map<String, JsonValue> leftMembers = left.members();
        Map<String, JsonValue> rightMembers = right.members();

        List<String> orderedKeys = new ArrayList<>();
        if (options.ignoreKeyOrder()) {
            Set<String> allKeys = new TreeSet<>(leftMembers.keySet());
            allKeys.addAll(rightMembers.keySet());
            orderedKeys.addAll(allKeys);
        } else {
            orderedKeys.addAll(leftMembers.keySet());
            for (String key : rightMembers.keySet()) {
                if (!leftMembers.containsKey(key)) {
                    orderedKeys.add(key);
                }
            }
        }

        List<DiffItem> children = new ArrayList<>(orderedKeys.size());
        for (String key : orderedKeys) {
            List<String> childPath = DiffItem.childPath(path, key);
            boolean inLeft = leftMembers.containsKey(key);
            boolean inRight = rightMembers.containsKey(key);
            if (inLeft && !inRight) {
                children.add(DiffItem.leaf(childPath, DiffType.REMOVED, leftMembers.get(key), null));
            } else if (!inLeft && inRight) {
                children.add(DiffItem.leaf(childPath, DiffType.ADDED, null, rightMembers.get(key)));
            } else {
                children.add(
                        compareValues(leftMembers.get(key), rightMembers.get(key), childPath, options));
            }
        }
        return DiffItem.container(path, left, right, children);
    }

    private DiffItem compareArrays(
            ArrayValue left, ArrayValue right, List<String> path, CompareOptions options) {
        List<DiffItem> children =
                options.ignoreArrayOrder()
                        ? compareArraysUnordered(left.elements(), right.elements(), path, options)
                        : compareArraysOrdered(left.elements(), right.elements(), path, options);
        return DiffItem.container(path, left, right, children);
    }

    private List<DiffItem> compareArraysOrdered(
            List<JsonValue> left, List<JsonValue> right, List<String> path, CompareOptions options) {
        int maxCount = Math.max(left.size(), right.size());
        List<DiffItem> children = new ArrayList<>(maxCount);
        for (int i = 0; i < maxCount; i++) {
            List<String> childPath = DiffItem.childPath(path, String.valueOf(i));
            if (i < left.size() && i < right.size()) {
                children.add(compareValues(left.get(i), right.get(i), childPath, options));
            } else if (i < left.size()) {
                children.add(DiffItem.leaf(childPath, DiffType.REMOVED, left.get(i), null));
            } else {
                children.add(DiffItem.leaf(childPath, DiffType.ADDED, null, right.get(i)));
            }
        }
        return children;
    }

    private List<DiffItem> compareArraysUnordered(
            List<JsonValue> left, List<JsonValue> right, List<String> path, CompareOptions options) {
        if (allMatch(left, right, value -> !value.isContainer())) {
            return comparePrimitiveArraysUnordered(left, right, path, options);
        }
        if (allMatch(left, right, value -> value instanceof ObjectValue)) {
            Optional<String> matchingKey = inferMatchingKey(left, right);
            if (matchingKey.isPresent()) {
                log.debug("Matching array elements at {} by key '{}'", path, matchingKey.get());
                return compareObjectArraysByKey(left, right, matchingKey.get(), path, options);
            }
            return compareArraysByHash(left, right, path, options);
        }
        return compareArraysOrdered(left, right, path, options);
    }

    private List<DiffItem> comparePrimitiveArraysUnordered(
            List<JsonValue> left, List<JsonValue> right, List<String> path, CompareOptions options) {
        boolean[] matchedRight = new boolean[right.size()];
        List<DiffItem> children = new ArrayList<>();
        for (int li = 0; li < left.size(); li++) {
            JsonValue leftValue = left.get(li);
            List<String> childPath = DiffItem.childPath(path, String.valueOf(li));
            int match = -1;
            for (int ri = 0; ri < right.size(); ri++) {
                if (!matchedRight[ri] && valuesEqual(leftValue, right.get(ri), options)) {
                    match = ri;
                    break;
                }
            }
            if (match >= 0) {
                matchedRight[match] = true;
                children.add(
                        DiffItem.leaf(childPath, DiffType.UNCHANGED, leftValue, right.get(match)));
            } else {
                children.add(DiffItem.leaf(childPath, DiffType.REMOVED, leftValue, null));
            }
        }
        appendUnmatchedRight(right, matchedRight, path, children);
        return children;
    }

    Optional<String> inferMatchingKey(List<JsonValue> left, List<JsonValue> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }
        Set<String> leftCommon = commonKeys(left);
        Set<String> rightCommon = commonKeys(right);
        if (leftCommon == null || rightCommon == null) {
            return Optional.empty();
        }
        Set<String> common = new TreeSet<>(leftCommon);
        common.retainAll(rightCommon);

        List<String> candidates = new ArrayList<>();
        for (String preferred : PREFERRED_MATCHING_KEYS) {
            if (common.contains(preferred)) {
                candidates.add(preferred);
            }
        }
        for (String key : common) {
            if (!PREFERRED_MATCHING_KEYS.contains(key)) {
                candidates.add(key);
            }
        }

        for (String candidate : candidates) {
            if (isValidMatchingKey(candidate, left) && isValidMatchingKey(candidate, right)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /** Keys present in every element, or null when an element is not an object. */
    private Set<String> commonKeys(List<JsonValue> elements) {
        Set<String> common = null;
        for (JsonValue element : elements) {
            if (!(element instanceof ObjectValue object)) {
                return null;
            }
            if (common == null) {
                common = new HashSet<>(object.members().keySet());
            } else {
                common.retainAll(object.members().keySet());
            }
        }
        return common;
    }

    private boolean isValidMatchingKey(String key, List<JsonValue> elements) {
        Set<String> seen = new HashSet<>();
        for (JsonValue element : elements) {
            if (!(element instanceof ObjectValue object)) {
                return false;
            }
            JsonValue value = object.members().get(key);
            if (value == null || value.isContainer()) {
                return false;
            }
            if (!seen.add(value.asText())) {
                return false;
            }
        }
        return true;
    }

    private List<DiffItem> compareObjectArraysByKey(
            List<JsonValue> left,
            List<JsonValue> right,
            String matchingKey,
            List<String> path,
            CompareOptions options) {
        Map<String, JsonValue> rightByKey = new HashMap<>();
        for (JsonValue element : right) {
            rightByKey.put(keyText(element, matchingKey), element);
        }

        List<DiffItem> children = new ArrayList<>();
        Set<String> consumed = new HashSet<>();
        for (int li = 0; li < left.size(); li++) {
            JsonValue leftElement = left.get(li);
            String keyText = keyText(leftElement, matchingKey);
            List<String> childPath = DiffItem.childPath(path, String.valueOf(li));
            JsonValue rightElement = rightByKey.get(keyText);
            if (rightElement != null) {
                consumed.add(keyText);
                children.add(compareValues(leftElement, rightElement, childPath, options));
            } else {
                children.add(DiffItem.leaf(childPath, DiffType.REMOVED, leftElement, null));
            }
        }
        for (int ri = 0; ri < right.size(); ri++) {
            JsonValue rightElement = right.get(ri);
            if (!consumed.contains(keyText(rightElement, matchingKey))) {
                children.add(
                        DiffItem.leaf(
                                DiffItem.childPath(path, String.valueOf(ri)),
                                DiffType.ADDED,
                                null,
                                rightElement));
            }
        }
        return children;
    }

    private List<DiffItem> compareArraysByHash(
            List<JsonValue> left, List<JsonValue> right, List<String> path, CompareOptions options) {
        List<String> rightHashes = new ArrayList<>(right.size());
        for (JsonValue element : right) {
            rightHashes.add(element.toCanonicalJson());
        }
        boolean[] matchedRight = new boolean[right.size()];
        List<DiffItem> children = new ArrayList<>();
        for (int li = 0; li < left.size(); li++) {
            String leftHash = left.get(li).toCanonicalJson();
            List<String> childPath = DiffItem.childPath(path, String.valueOf(li));
            int match = -1;
            for (int ri = 0; ri < right.size(); ri++) {
                if (!matchedRight[ri] && rightHashes.get(ri).equals(leftHash)) {
                    match = ri;
                    break;
                }
            }
            if (match >= 0) {
                matchedRight[match] = true;
                children.add(compareValues(left.get(li), right.get(match), childPath, options));
            } else {
                children.add(DiffItem.leaf(childPath, DiffType.REMOVED, left.get(li), null));
            }
        }
        appendUnmatchedRight(right, matchedRight, path, children);
        return children;
    }

    private void appendUnmatchedRight(
            List<JsonValue> right, boolean[] matchedRight, List<String> path, List<DiffItem> children) {
        for (int ri = 0; ri < right.size(); ri++) {
            if (!matchedRight[ri]) {
                children.add(
                        DiffItem.leaf(
                                DiffItem.childPath(path, String.valueOf(ri)),
                                DiffType.ADDED,
                                null,
                                right.get(ri)));
            }
        }
    }

    private boolean valuesEqual(JsonValue left, JsonValue right, CompareOptions options) {
        if (options.strictType()) {
            return left.equals(right);
        }
        return left.asText().equals(right.asText());
    }

    private static String keyText(JsonValue element, String matchingKey) {
        return ((ObjectValue) element).members().get(matchingKey).asText();
    }

    private static boolean allMatch(
            List<JsonValue> left, List<JsonValue> right, Predicate<JsonValue> test) {
        return left.stream().allMatch(test) && right.stream().allMatch(test);
    }
}
