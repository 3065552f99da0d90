package com.example.jsoncompare.application;

import com.example.jsoncompare.config.JsonCompareProperties;
import com.example.jsoncompare.domain.CompareDiffResult;
import com.example.jsoncompare.domain.CompareOptions;
import com.example.jsoncompare.domain.CompareRenderResult;
import com.example.jsoncompare.domain.ComparisonTiming;
import com.example.jsoncompare.domain.DiffEntry;
import com.example.jsoncompare.domain.DiffSide;
import com.example.jsoncompare.domain.InvalidJsonException;
import com.example.jsoncompare.domain.JsonComparison;
import com.example.jsoncompare.domain.JsonComparisonRequest;
import com.example.jsoncompare.domain.JsonValue;
import com.example.jsoncompare.domain.StyledLine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ComparisonUseCase {
    private static final Logger log = LogManager.getLogger(ComparisonUseCase.class);

    private final JsonValueParser parser;
    private final JsonDiffEngine diffEngine;
    private final CompareDiffRenderer diffRenderer;
    private final LineStyler lineStyler;
    private final JsonCompareProperties properties;

    public ComparisonUseCase(
            JsonValueParser parser,
            JsonDiffEngine diffEngine,
            CompareDiffRenderer diffRenderer,
            LineStyler lineStyler,
            JsonCompareProperties properties) {
        this.parser = parser;
        this.diffEngine = diffEngine;
        this.diffRenderer = diffRenderer;
        this.lineStyler = lineStyler;
        this.properties = properties;
    }

    /**
     * Parses both texts, diffs them and renders the result.
     *
     * @throws InvalidJsonException if either text is not valid JSON; the exception names the side
     */
    public JsonComparison compare(JsonComparisonRequest request) {
        ComparisonTiming timing = new ComparisonTiming();

        long leftParseStart = System.nanoTime();
        JsonValue left = parse(request.leftText(), DiffSide.LEFT);
        timing.record("Parse (left)", leftParseStart);

        long rightParseStart = System.nanoTime();
        JsonValue right = parse(request.rightText(), DiffSide.RIGHT);
        timing.record("Parse (right)", rightParseStart);

        long diffStart = System.nanoTime();
        CompareDiffResult diffResult = diffEngine.compare(left, right, request.options());
        double diffSeconds = timing.record("Structural diff", diffStart);
        log.info(
                "Compared documents in {}s: {} added, {} removed, {} modified",
                diffSeconds,
                diffResult.addedCount(),
                diffResult.removedCount(),
                diffResult.modifiedCount());

        long renderStart = System.nanoTime();
        CompareRenderResult renderResult =
                diffRenderer.render(
                        request.leftText(),
                        request.rightText(),
                        diffResult,
                        request.expandedSections(),
                        resolveIndentWidth(request.indentWidth()));
        double renderSeconds = timing.record("Render panes", renderStart);
        log.info("Rendered {} lines in {}s", renderResult.totalLines(), renderSeconds);

        long styleStart = System.nanoTime();
        List<StyledLine> leftStyled = lineStyler.style(renderResult.leftLines());
        List<StyledLine> rightStyled = lineStyler.style(renderResult.rightLines());
        timing.record("Style panes", styleStart);

        JsonComparison comparison =
                new JsonComparison(diffResult, renderResult, leftStyled, rightStyled);
        comparison.setTiming(timing.finish());
        timing.slowestStep().ifPresent(step -> log.debug("Slowest step: {}", step));
        return comparison;
    }

    /** Leaf differences only, for copying out as text. */
    public List<DiffEntry> serializeDiff(String leftText, String rightText, CompareOptions options) {
        JsonValue left = parse(leftText, DiffSide.LEFT);
        JsonValue right = parse(rightText, DiffSide.RIGHT);
        return diffEngine.compare(left, right, options).serializeDiff();
    }

    public CompareOptions defaultOptions() {
        return properties.defaultOptions();
    }

    private int resolveIndentWidth(int requested) {
        return requested > 0 ? requested : properties.getRender().getDefaultIndentWidth();
    }

    private JsonValue parse(String text, DiffSide side) {
        try {
            return parser.parse(text);
        } catch (InvalidJsonException ex) {
            log.debug("Rejected {} document: {}", side, ex.getMessage());
            throw ex.onSide(side);
        }
    }
}
