package com.example.jsoncompare.infrastructure;

import com.example.jsoncompare.domain.DiffType;
import com.example.jsoncompare.domain.LineHighlight;
import com.example.jsoncompare.domain.RenderLine;
import com.example.jsoncompare.domain.StyledLine;
import com.example.jsoncompare.domain.StyledSpan;
import com.example.jsoncompare.domain.TokenType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenizingLineStylerTest {

    private final TokenizingLineStyler styler = new TokenizingLineStyler(new JsonLineTokenizer());

    @Test
    void stylesEachLineKind() {
        List<StyledLine> styled =
                styler.style(
                        List.of(
                                RenderLine.content(0, DiffType.MODIFIED, "  \"a\": 2,"),
                                RenderLine.content(1, DiffType.UNCHANGED, "}"),
                                RenderLine.padding(),
                                RenderLine.collapse(4, 0, 12)));

        StyledLine modified = styled.get(0);
        assertEquals(LineHighlight.MODIFIED, modified.highlight());
        assertTrue(modified.gutterMarked());
        assertEquals("  \"a\": 2,", modified.text());

        assertEquals(LineHighlight.NONE, styled.get(1).highlight());
        assertFalse(styled.get(1).gutterMarked());

        StyledLine padding = styled.get(2);
        assertEquals(LineHighlight.PADDING, padding.highlight());
        assertEquals(" ", padding.text());

        StyledLine collapse = styled.get(3);
        assertEquals(LineHighlight.COLLAPSE, collapse.highlight());
        assertEquals("··· 12 unchanged lines ···", collapse.text());
        assertThat(collapse.spans())
                .singleElement()
                .extracting(StyledSpan::tokenType)
                .isEqualTo(TokenType.STRUCTURE);
    }

    @Test
    void restylingKeepsLineCount() {
        List<RenderLine> lines =
                List.of(RenderLine.content(0, DiffType.ADDED, "1"), RenderLine.padding());

        assertEquals(styler.style(lines), styler.style(lines));
        assertEquals(2, styler.style(lines).size());
    }
}
