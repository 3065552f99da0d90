package com.example.jsoncompare.infrastructure;

import com.example.jsoncompare.domain.CompareDiffResult;
import com.example.jsoncompare.domain.CompareOptions;
import com.example.jsoncompare.domain.DiffItem;
import com.example.jsoncompare.domain.DiffType;
import com.example.jsoncompare.domain.JsonValue;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StructuralJsonDiffEngineTest {

    private static final CompareOptions DEFAULTS = CompareOptions.defaults();
    private static final CompareOptions UNORDERED = DEFAULTS.withIgnoreArrayOrder(true);

    private final JacksonJsonValueParser parser = new JacksonJsonValueParser(new ObjectMapper());
    private final StructuralJsonDiffEngine engine = new StructuralJsonDiffEngine();

    private CompareDiffResult diff(String left, String right, CompareOptions options) {
        return engine.compare(parser.parse(left), parser.parse(right), options);
    }

    private List<JsonValue> elements(String array) {
        return ((JsonValue.ArrayValue) parser.parse(array)).elements();
    }

    @Test
    void comparingValueWithItselfIsIdenticalUnderEveryOptionCombination() {
        String doc =
                """
                {"users": [{"id": 1, "tags": ["a", "b"]}, {"id": 2, "tags": []}],
                 "count": 2, "active": true, "note": null, "ratio": 0.5, "nested": {"x": {}}}
                """;
        for (boolean keyOrder : new boolean[] {true, false}) {
            for (boolean arrayOrder : new boolean[] {true, false}) {
                for (boolean strict : new boolean[] {true, false}) {
                    CompareOptions options = new CompareOptions(keyOrder, arrayOrder, strict);
                    assertTrue(diff(doc, doc, options).isIdentical(), "Not identical with " + options);
                }
            }
        }
    }

    @Test
    void swappingSidesSwapsAddedAndRemovedCounts() {
        String left = "{\"a\": 1, \"b\": [1, 2], \"c\": \"x\"}";
        String right = "{\"a\": 2, \"b\": [1, 2, 3], \"d\": true}";

        CompareDiffResult forward = diff(left, right, DEFAULTS);
        CompareDiffResult backward = diff(right, left, DEFAULTS);

        assertThat(forward.addedCount()).isEqualTo(2);
        assertThat(forward.removedCount()).isEqualTo(1);
        assertThat(forward.modifiedCount()).isEqualTo(1);
        assertThat(backward.addedCount()).isEqualTo(forward.removedCount());
        assertThat(backward.removedCount()).isEqualTo(forward.addedCount());
        assertThat(backward.modifiedCount()).isEqualTo(forward.modifiedCount());
    }

    @Test
    void flattenedItemsMatchTotalCount() {
        CompareDiffResult result =
                diff(
                        "{\"a\": {\"b\": 1, \"c\": [1, 2, 3]}, \"gone\": 1}",
                        "{\"a\": {\"b\": 2, \"c\": [1, 5]}, \"new\": {\"k\": 1}}",
                        DEFAULTS);

        assertEquals(result.totalDiffCount(), result.flattenedDiffItems().size());
        assertEquals(
                result.totalDiffCount(),
                result.addedCount() + result.removedCount() + result.modifiedCount());
        assertThat(result.flattenedDiffItems())
                .extracting(DiffItem::jsonPointer)
                .containsExactly("/a/b", "/a/c/1", "/a/c/2", "/gone", "/new");
    }

    @Test
    void orderedArrayWithExtraElementYieldsSingleAddedLeaf() {
        CompareDiffResult result = diff("[1,2,3]", "[1,2,3,4]", DEFAULTS);

        List<DiffItem> flattened = result.flattenedDiffItems();
        assertThat(flattened).hasSize(1);
        DiffItem added = flattened.get(0);
        assertEquals(DiffType.ADDED, added.type());
        assertEquals(List.of("3"), added.path());
        assertEquals("/3", added.jsonPointer());
        assertEquals(JsonValue.number(4), added.rightValue());
        assertNull(added.leftValue());
    }

    @Test
    void reorderedPrimitiveArrayIsIdenticalOnlyWhenArrayOrderIgnored() {
        assertTrue(diff("[1,2,3]", "[3,2,1]", UNORDERED).isIdentical());

        CompareDiffResult ordered = diff("[1,2,3]", "[3,2,1]", DEFAULTS);
        assertThat(ordered.modifiedCount()).isEqualTo(2);
        assertThat(ordered.flattenedDiffItems())
                .extracting(DiffItem::jsonPointer)
                .containsExactly("/0", "/2");
    }

    @Test
    void unorderedPrimitiveArrayReportsUnmatchedElementsAtTheirOwnIndices() {
        CompareDiffResult result = diff("[1,2,2]", "[2,3]", UNORDERED);

        List<DiffItem> children = result.items().get(0).children();
        assertThat(children)
                .extracting(DiffItem::jsonPointer, DiffItem::type)
                .containsExactly(
                        tuple("/0", DiffType.REMOVED),
                        tuple("/1", DiffType.UNCHANGED),
                        tuple("/2", DiffType.REMOVED),
                        tuple("/1", DiffType.ADDED));
        assertThat(result.addedCount()).isEqualTo(1);
        assertThat(result.removedCount()).isEqualTo(2);
    }

    @Test
    void objectsMatchedByInferredKeyReportFieldLevelChange() {
        CompareDiffResult result =
                diff("[{\"id\":1,\"v\":\"a\"}]", "[{\"id\":1,\"v\":\"b\"}]", UNORDERED);

        List<DiffItem> flattened = result.flattenedDiffItems();
        assertThat(flattened).hasSize(1);
        assertEquals(DiffType.MODIFIED, flattened.get(0).type());
        assertEquals("/0/v", flattened.get(0).jsonPointer());
        assertEquals(0, result.addedCount());
        assertEquals(0, result.removedCount());
    }

    @Test
    void reorderedObjectsWithIdAreIdentical() {
        assertTrue(
                diff(
                                "[{\"id\":1,\"v\":\"a\"},{\"id\":2,\"v\":\"b\"}]",
                                "[{\"id\":2,\"v\":\"b\"},{\"id\":1,\"v\":\"a\"}]",
                                UNORDERED)
                        .isIdentical());
    }

    @Test
    void keyMatchingEmitsUnmatchedRightElementsAfterLeftOnes() {
        CompareDiffResult result =
                diff(
                        "[{\"id\":\"a\"},{\"id\":\"b\"}]",
                        "[{\"id\":\"c\"},{\"id\":\"a\"}]",
                        UNORDERED);

        assertThat(result.items().get(0).children())
                .extracting(DiffItem::jsonPointer, DiffItem::type)
                .containsExactly(
                        tuple("/0", DiffType.UNCHANGED),
                        tuple("/1", DiffType.REMOVED),
                        tuple("/0", DiffType.ADDED));
    }

    @Test
    void preferredKeysWinOverAlphabeticalCandidates() {
        List<JsonValue> left = elements("[{\"code\":\"x\",\"name\":\"n1\"}]");
        List<JsonValue> right = elements("[{\"code\":\"y\",\"name\":\"n1\"}]");

        assertEquals(Optional.of("name"), engine.inferMatchingKey(left, right));
    }

    @Test
    void noMatchingKeyWhenEitherArrayIsEmpty() {
        assertEquals(Optional.empty(), engine.inferMatchingKey(elements("[{\"id\":1}]"), List.of()));
    }

    @Test
    void keyWithDuplicateValuesOnOneSideIsSkipped() {
        CompareDiffResult result =
                diff(
                        "[{\"id\":1,\"v\":1},{\"id\":1,\"v\":2}]",
                        "[{\"id\":1,\"v\":1},{\"id\":2,\"v\":2}]",
                        UNORDERED);

        assertThat(result.flattenedDiffItems())
                .extracting(DiffItem::jsonPointer, DiffItem::type)
                .containsExactly(tuple("/1/id", DiffType.MODIFIED));
    }

    @Test
    void objectsWithoutUsableKeyFallBackToContentHash() {
        assertTrue(
                diff("[{\"tags\":[1]},{\"tags\":[2]}]", "[{\"tags\":[2]},{\"tags\":[1]}]", UNORDERED)
                        .isIdentical());

        CompareDiffResult changed =
                diff("[{\"tags\":[1]},{\"tags\":[2]}]", "[{\"tags\":[2]},{\"tags\":[3]}]", UNORDERED);
        assertThat(changed.flattenedDiffItems())
                .extracting(DiffItem::jsonPointer, DiffItem::type)
                .containsExactly(
                        tuple("/0", DiffType.REMOVED),
                        tuple("/1", DiffType.ADDED));
    }

    @Test
    void mixedArrayFallsBackToPositionalComparison() {
        CompareDiffResult result = diff("[1, {\"a\": 1}]", "[{\"a\": 1}, 1]", UNORDERED);

        assertThat(result.modifiedCount()).isEqualTo(2);
        assertThat(result.flattenedDiffItems()).allSatisfy(item -> assertThat(item.children()).isEmpty());
    }

    @Test
    void looseTypingTreatsMatchingRenderingsAsEqual() {
        CompareOptions loose = DEFAULTS.withStrictType(false);

        assertTrue(diff("\"1\"", "1", loose).isIdentical());
        assertEquals(DiffType.UNCHANGED, diff("\"1\"", "1", loose).items().get(0).type());
        assertEquals(DiffType.MODIFIED, diff("\"1\"", "1", DEFAULTS).items().get(0).type());
        assertTrue(diff("[\"1\", 2]", "[1, \"2\"]", loose.withIgnoreArrayOrder(true)).isIdentical());
        assertTrue(diff("{\"flag\": \"true\"}", "{\"flag\": true}", loose).isIdentical());
    }

    @Test
    void typeMismatchIsNotDecomposed() {
        CompareDiffResult result = diff("{\"a\": [1]}", "{\"a\": {\"x\": 1}}", DEFAULTS);

        DiffItem item = result.flattenedDiffItems().get(0);
        assertEquals("/a", item.jsonPointer());
        assertEquals(DiffType.MODIFIED, item.type());
        assertThat(item.children()).isEmpty();
    }

    @Test
    void keyOrderFollowsLeftDocumentWhenNotIgnored() {
        String left = "{\"b\": 1, \"a\": 2}";
        String right = "{\"c\": 3, \"a\": 2, \"b\": 1}";

        assertThat(diff(left, right, DEFAULTS.withIgnoreKeyOrder(false)).items().get(0).children())
                .extracting(DiffItem::key)
                .containsExactly("b", "a", "c");
        assertThat(diff(left, right, DEFAULTS).items().get(0).children())
                .extracting(DiffItem::key)
                .containsExactly("a", "b", "c");
    }

    @Test
    void containerCarriesBothValuesAndDepthFollowsPath() {
        CompareDiffResult result = diff("{\"a\": {\"b\": 1}}", "{\"a\": {\"b\": 2}}", DEFAULTS);

        DiffItem root = result.items().get(0);
        assertEquals(0, root.depth());
        assertNull(root.key());
        assertEquals(DiffType.MODIFIED, root.type());
        assertEquals(parser.parse("{\"a\": {\"b\": 1}}"), root.leftValue());
        assertEquals(parser.parse("{\"a\": {\"b\": 2}}"), root.rightValue());

        DiffItem leaf = root.children().get(0).children().get(0);
        assertEquals(2, leaf.depth());
        assertEquals("b", leaf.key());
        assertEquals(1, result.modifiedCount());
    }

    @Test
    void emptyContainersAreHandled() {
        assertTrue(diff("{}", "{}", DEFAULTS).isIdentical());
        assertTrue(diff("[]", "[]", UNORDERED).isIdentical());
        assertEquals(1, diff("[]", "[1]", UNORDERED).addedCount());
        assertEquals(2, diff("[{\"id\":1},{\"id\":2}]", "[]", UNORDERED).removedCount());
        assertTrue(diff("[null, null]", "[null, null]", UNORDERED).isIdentical());
    }

    @Test
    void negativeZeroEqualsZero() {
        assertTrue(diff("-0.0", "0", DEFAULTS).isIdentical());
        assertTrue(diff("{\"v\": -0}", "{\"v\": 0.0}", DEFAULTS).isIdentical());
        assertTrue(diff("[-0.0, 1]", "[1, 0]", UNORDERED).isIdentical());
        assertEquals("0", parser.parse("-0.0").asText());
    }
}
