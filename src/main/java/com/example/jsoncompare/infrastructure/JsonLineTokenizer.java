package com.example.jsoncompare.infrastructure;

import com.example.jsoncompare.domain.StyledSpan;
import com.example.jsoncompare.domain.TokenType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one pretty-printed JSON line into syntax spans. Works line by line, so unbalanced input is fine;
 * characters it does not recognise become structure spans.
 */
@Component
public class JsonLineTokenizer {
    private static final String STRUCTURE_CHARS = "{}[]:,";

    public List<StyledSpan> tokenize(String line) {
        List<StyledSpan> spans = new ArrayList<>();
        int i = 0;
        int length = line.length();
        while (i < length) {
            char c = line.charAt(i);
            if (c == ' ' || c == '\t') {
                int end = i;
                while (end < length && (line.charAt(end) == ' ' || line.charAt(end) == '\t')) {
                    end++;
                }
                spans.add(new StyledSpan(line.substring(i, end), TokenType.WHITESPACE));
                i = end;
            } else if (STRUCTURE_CHARS.indexOf(c) >= 0) {
                spans.add(new StyledSpan(String.valueOf(c), TokenType.STRUCTURE));
                i++;
            } else if (c == '"' && findStringEnd(line, i) > 0) {
                int end = findStringEnd(line, i) + 1;
                int next = end;
                while (next < length && line.charAt(next) == ' ') {
                    next++;
                }
                boolean isKey = next < length && line.charAt(next) == ':';
                spans.add(new StyledSpan(line.substring(i, end), isKey ? TokenType.KEY : TokenType.STRING));
                i = end;
            } else if (c == '-' || Character.isDigit(c)) {
                int end = i;
                while (end < length && isNumberChar(line.charAt(end))) {
                    end++;
                }
                spans.add(new StyledSpan(line.substring(i, end), TokenType.NUMBER));
                i = end;
            } else if (line.startsWith("true", i)) {
                spans.add(new StyledSpan("true", TokenType.BOOLEAN));
                i += 4;
            } else if (line.startsWith("false", i)) {
                spans.add(new StyledSpan("false", TokenType.BOOLEAN));
                i += 5;
            } else if (line.startsWith("null", i)) {
                spans.add(new StyledSpan("null", TokenType.NULL));
                i += 4;
            } else {
                spans.add(new StyledSpan(String.valueOf(c), TokenType.STRUCTURE));
                i++;
            }
        }
        return spans;
    }

    /** Index of the closing quote of the string starting at {@code start}, or -1 when unterminated. */
    private static int findStringEnd(String line, int start) {
        boolean escaped = false;
        for (int i = start + 1; i < line.length(); i++) {
            char c = line.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '"') {
                return i;
            }
        }
        return -1;
    }

    private static boolean isNumberChar(char c) {
        return Character.isDigit(c) || c == '.' || c == '-' || c == '+' || c == 'e' || c == 'E';
    }
}
