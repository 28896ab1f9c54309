package com.williamcallahan.chatblocks.service.parsing;

import com.williamcallahan.chatblocks.domain.blocks.ContentBlock;
import com.williamcallahan.chatblocks.domain.blocks.FormulaBlock;
import com.williamcallahan.chatblocks.domain.blocks.TextBlock;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a prose line into text and inline formula fragments.
 *
 * <p>Recognizes {@code $...$} and {@code \(...\)} spans. A delimiter directly preceded by a
 * backslash is escaped and never opens or closes a span; only the single preceding
 * character is inspected, so {@code \\$} is still treated as escaped. Spans are matched
 * shortest-first and the earliest opener with a valid closer wins. Openers without a
 * closer stay literal text.</p>
 */
final class InlineMathScanner {

    private static final char BACKSLASH = '\\';
    private static final char DOLLAR = '$';
    private static final char OPEN_PAREN = '(';
    private static final String PAREN_CLOSE = "\\)";
    private static final int PAREN_DELIMITER_WIDTH = 2;

    private InlineMathScanner() {}

    /**
     * Kind of delimiter pair that produced a span.
     */
    enum Delimiter {
        DOLLAR,
        PARENTHESES
    }

    /**
     * Location of one inline formula within a line.
     *
     * @param start index of the opening delimiter
     * @param end index just past the closing delimiter
     * @param content un-escaped text between the delimiters
     * @param delimiter delimiter pair that matched
     */
    record MathSpan(int start, int end, String content, Delimiter delimiter) {}

    /**
     * Splits a line into ordered text and formula fragments.
     *
     * @param line prose line outside any open block
     * @return fragments whose concatenation reproduces the line, modulo formula un-escaping
     */
    static List<ContentBlock> scan(String line) {
        List<MathSpan> spans = findSpans(line);
        if (spans.isEmpty()) {
            return List.of(new TextBlock(line));
        }

        List<ContentBlock> fragments = new ArrayList<>();
        int lastIndexProcessed = 0;
        for (MathSpan span : spans) {
            if (span.start() > lastIndexProcessed) {
                fragments.add(new TextBlock(line.substring(lastIndexProcessed, span.start())));
            }
            fragments.add(new FormulaBlock(span.content()));
            lastIndexProcessed = span.end();
        }
        if (lastIndexProcessed < line.length()) {
            fragments.add(new TextBlock(line.substring(lastIndexProcessed)));
        }
        return fragments;
    }

    /**
     * Finds every inline formula span, left to right, without overlap.
     *
     * @param line text to scan
     * @return spans in line order; empty when the line holds no complete span
     */
    static List<MathSpan> findSpans(String line) {
        List<MathSpan> spans = new ArrayList<>();
        int cursor = 0;
        while (cursor < line.length()) {
            MathSpan span = matchAt(line, cursor);
            if (span != null) {
                spans.add(span);
                cursor = span.end();
            } else {
                cursor++;
            }
        }
        return spans;
    }

    private static MathSpan matchAt(String line, int index) {
        char current = line.charAt(index);
        if (current == DOLLAR && !isEscaped(line, index)) {
            int closeIndex = findDollarClose(line, index + 1);
            if (closeIndex >= 0) {
                String content = unescape(line.substring(index + 1, closeIndex));
                return new MathSpan(index, closeIndex + 1, content, Delimiter.DOLLAR);
            }
            return null;
        }
        if (isParenOpener(line, index)) {
            int contentStart = index + PAREN_DELIMITER_WIDTH;
            int closeIndex = findParenClose(line, contentStart);
            if (closeIndex >= 0) {
                String content = unescape(line.substring(contentStart, closeIndex));
                return new MathSpan(index, closeIndex + PAREN_DELIMITER_WIDTH, content, Delimiter.PARENTHESES);
            }
        }
        return null;
    }

    private static boolean isParenOpener(String line, int index) {
        return line.charAt(index) == BACKSLASH
            && index + 1 < line.length()
            && line.charAt(index + 1) == OPEN_PAREN
            && !isEscaped(line, index);
    }

    private static int findDollarClose(String line, int fromIndex) {
        for (int scanIndex = fromIndex; scanIndex < line.length(); scanIndex++) {
            if (line.charAt(scanIndex) == DOLLAR && !isEscaped(line, scanIndex)) {
                return scanIndex;
            }
        }
        return -1;
    }

    private static int findParenClose(String line, int fromIndex) {
        int scanIndex = line.indexOf(PAREN_CLOSE, fromIndex);
        while (scanIndex >= 0) {
            if (!isEscaped(line, scanIndex)) {
                return scanIndex;
            }
            scanIndex = line.indexOf(PAREN_CLOSE, scanIndex + 1);
        }
        return -1;
    }

    /**
     * One-character lookback: a delimiter is escaped when the character before it is a backslash.
     */
    private static boolean isEscaped(String line, int index) {
        return index > 0 && line.charAt(index - 1) == BACKSLASH;
    }

    static String unescape(String content) {
        return content.replace("\\$", "$")
            .replace("\\(", "(")
            .replace("\\)", ")");
    }
}
