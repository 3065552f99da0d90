package com.example.jsoncompare.infrastructure;

import com.example.jsoncompare.application.CompareDiffRenderer;
import com.example.jsoncompare.application.JsonFormatter;
import com.example.jsoncompare.config.JsonCompareProperties;
import com.example.jsoncompare.domain.CompareDiffResult;
import com.example.jsoncompare.domain.CompareRenderResult;
import com.example.jsoncompare.domain.DiffItem;
import com.example.jsoncompare.domain.DiffLocation;
import com.example.jsoncompare.domain.DiffSide;
import com.example.jsoncompare.domain.DiffType;
import com.example.jsoncompare.domain.JsonValue;
import com.example.jsoncompare.domain.JsonValue.StringValue;
import com.example.jsoncompare.domain.RenderLine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Lays a structural diff over the pretty-printed text of both documents.
 *
 * <p>Lines are annotated by substring search: each leaf diff claims the first still-unchanged line that
 * contains its rendered primitive value. Container values are not located.
 */
@Component
public class SideBySideDiffRenderer implements CompareDiffRenderer {
    private static final Logger log = LogManager.getLogger(SideBySideDiffRenderer.class);

    private final JsonFormatter formatter;
    private final int contextLines;
    private final int maxDisplayLines;
    private final int maxIndentWidth;

    @Autowired
    public SideBySideDiffRenderer(JsonFormatter formatter, JsonCompareProperties properties) {
        this(
                formatter,
                properties.getRender().getContextLines(),
                properties.getRender().getMaxDisplayLines(),
                properties.getRender().getMaxIndentWidth());
    }

    public SideBySideDiffRenderer(
            JsonFormatter formatter, int contextLines, int maxDisplayLines, int maxIndentWidth) {
        this.formatter = formatter;
        this.contextLines = Math.max(0, contextLines);
        this.maxDisplayLines = Math.max(1, maxDisplayLines);
        this.maxIndentWidth = Math.max(0, maxIndentWidth);
    }

    @Override
    public CompareRenderResult render(
            String leftText,
            String rightText,
            CompareDiffResult diffResult,
            Set<Integer> expandedSections,
            int indentWidth) {
        Objects.requireNonNull(diffResult, "diffResult");
        Set<Integer> expanded = expandedSections == null ? Set.of() : expandedSections;
        int indent = Math.min(Math.max(0, indentWidth), maxIndentWidth);
        if (indent != indentWidth) {
            log.debug("Indent width {} clamped to {}", indentWidth, indent);
        }

        List<String> leftLines = splitLines(formatter.format(nullToEmpty(leftText), indent));
        List<String> rightLines = splitLines(formatter.format(nullToEmpty(rightText), indent));

        List<DiffItem> flattened = diffResult.flattenedDiffItems();
        DiffType[] leftTypes = assignLineDiffs(leftLines, flattened, DiffSide.LEFT);
        DiffType[] rightTypes = assignLineDiffs(rightLines, flattened, DiffSide.RIGHT);

        List<RenderLine> pairedLeft = new ArrayList<>();
        List<RenderLine> pairedRight = new ArrayList<>();
        pairLines(leftLines, leftTypes, rightLines, rightTypes, pairedLeft, pairedRight);

        List<RenderLine> collapsedLeft = new ArrayList<>();
        List<RenderLine> collapsedRight = new ArrayList<>();
        applyCollapse(pairedLeft, pairedRight, expanded, collapsedLeft, collapsedRight);

        boolean truncated = collapsedLeft.size() > maxDisplayLines;
        List<RenderLine> finalLeft = truncate(collapsedLeft);
        List<RenderLine> finalRight = truncate(collapsedRight);
        if (truncated) {
            log.warn(
                    "Render output truncated from {} to {} lines",
                    collapsedLeft.size(),
                    maxDisplayLines);
        }

        return new CompareRenderResult(
                finalLeft,
                finalRight,
                buildDiffLocations(finalLeft, finalRight),
                finalLeft.size(),
                truncated);
    }

    private DiffType[] assignLineDiffs(List<String> lines, List<DiffItem> flattened, DiffSide side) {
        DiffType[] types = new DiffType[lines.size()];
        Arrays.fill(types, DiffType.UNCHANGED);
        for (DiffItem item : flattened) {
            switch (item.type()) {
                case ADDED -> {
                    if (side == DiffSide.RIGHT) {
                        markFirstLine(item.rightValue(), lines, types, DiffType.ADDED);
                    }
                }
                case REMOVED -> {
                    if (side == DiffSide.LEFT) {
                        markFirstLine(item.leftValue(), lines, types, DiffType.REMOVED);
                    }
                }
                case MODIFIED -> markFirstLine(
                        side == DiffSide.LEFT ? item.leftValue() : item.rightValue(),
                        lines,
                        types,
                        DiffType.MODIFIED);
                case UNCHANGED -> {
                    // flattened items always differ
                }
            }
        }
        return types;
    }

    private void markFirstLine(JsonValue value, List<String> lines, DiffType[] types, DiffType type) {
        if (value == null || value.isContainer()) {
            return;
        }
        String needle =
                (value instanceof StringValue s ? JsonValue.quote(s.value()) : value.asText()).trim();
        for (int i = 0; i < lines.size(); i++) {
            if (types[i] == DiffType.UNCHANGED && lines.get(i).trim().contains(needle)) {
                types[i] = type;
                return;
            }
        }
    }

    private void pairLines(
            List<String> leftLines,
            DiffType[] leftTypes,
            List<String> rightLines,
            DiffType[] rightTypes,
            List<RenderLine> pairedLeft,
            List<RenderLine> pairedRight) {
        int maxCount = Math.max(leftLines.size(), rightLines.size());
        for (int i = 0; i < maxCount; i++) {
            pairedLeft.add(
                    i < leftLines.size()
                            ? RenderLine.content(i, leftTypes[i], leftLines.get(i))
                            : RenderLine.padding());
            pairedRight.add(
                    i < rightLines.size()
                            ? RenderLine.content(i, rightTypes[i], rightLines.get(i))
                            : RenderLine.padding());
        }
    }

    private void applyCollapse(
            List<RenderLine> left,
            List<RenderLine> right,
            Set<Integer> expandedSections,
            List<RenderLine> resultLeft,
            List<RenderLine> resultRight) {
        int count = left.size();
        boolean[] visible = new boolean[count];
        for (int i = 0; i < count; i++) {
            if (left.get(i).isChangedContent() || right.get(i).isChangedContent()) {
                int start = Math.max(0, i - contextLines);
                int end = Math.min(count - 1, i + contextLines);
                for (int j = start; j <= end; j++) {
                    visible[j] = true;
                }
            }
        }

        int sectionIndex = 0;
        int i = 0;
        while (i < count) {
            if (visible[i]) {
                resultLeft.add(left.get(i));
                resultRight.add(right.get(i));
                i++;
                continue;
            }
            int sectionStart = i;
            while (i < count && !visible[i]) {
                i++;
            }
            int hidden = i - sectionStart;
            if (expandedSections.contains(sectionIndex)) {
                resultLeft.addAll(left.subList(sectionStart, i));
                resultRight.addAll(right.subList(sectionStart, i));
            } else {
                RenderLine marker = RenderLine.collapse(sectionStart, sectionIndex, hidden);
                resultLeft.add(marker);
                resultRight.add(marker);
            }
            sectionIndex++;
        }
    }

    private List<RenderLine> truncate(List<RenderLine> lines) {
        if (lines.size() <= maxDisplayLines) {
            return lines;
        }
        return lines.subList(0, maxDisplayLines);
    }

    /** One entry per changed position; when both panes change at a position the left type is reported. */
    private List<DiffLocation> buildDiffLocations(List<RenderLine> left, List<RenderLine> right) {
        Map<Integer, DiffType> byPosition = new TreeMap<>();
        for (int i = 0; i < left.size(); i++) {
            if (left.get(i).isChangedContent()) {
                byPosition.put(i, left.get(i).diffType());
            }
        }
        for (int i = 0; i < right.size(); i++) {
            if (right.get(i).isChangedContent()) {
                byPosition.putIfAbsent(i, right.get(i).diffType());
            }
        }
        List<DiffLocation> locations = new ArrayList<>(byPosition.size());
        byPosition.forEach((position, type) -> locations.add(new DiffLocation(position, type)));
        return locations;
    }

    private static List<String> splitLines(String text) {
        String normalized = text.replace("\r\n", "\n").replace("\r", "\n");
        return Arrays.asList(normalized.split("\n", -1));
    }

    private static String nullToEmpty(String text) {
        return text == null ? "" : text;
    }
}
