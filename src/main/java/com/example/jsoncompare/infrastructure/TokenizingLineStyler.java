package com.example.jsoncompare.infrastructure;

import com.example.jsoncompare.application.LineStyler;
import com.example.jsoncompare.domain.LineHighlight;
import com.example.jsoncompare.domain.RenderLine;
import com.example.jsoncompare.domain.StyledLine;
import com.example.jsoncompare.domain.StyledSpan;
import com.example.jsoncompare.domain.TokenType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class TokenizingLineStyler implements LineStyler {
    private final JsonLineTokenizer tokenizer;

    public TokenizingLineStyler(JsonLineTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    @Override
    public List<StyledLine> style(List<RenderLine> lines) {
        List<StyledLine> styled = new ArrayList<>(lines.size());
        for (RenderLine line : lines) {
            styled.add(styleLine(line));
        }
        return styled;
    }

    private StyledLine styleLine(RenderLine line) {
        return switch (line.kind()) {
            case CONTENT -> new StyledLine(
                    tokenizer.tokenize(line.text()),
                    LineHighlight.forDiffType(line.diffType()),
                    line.isChangedContent());
            // a single blank cell keeps both panes the same height
            case PADDING -> new StyledLine(
                    List.of(new StyledSpan(" ", TokenType.WHITESPACE)), LineHighlight.PADDING, false);
            case COLLAPSE -> new StyledLine(
                    List.of(new StyledSpan(line.text(), TokenType.STRUCTURE)),
                    LineHighlight.COLLAPSE,
                    false);
        };
    }
}
