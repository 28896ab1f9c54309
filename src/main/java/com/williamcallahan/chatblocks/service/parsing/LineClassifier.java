package com.williamcallahan.chatblocks.service.parsing;

/**
 * Classifies a single line by its leading marker.
 *
 * <p>Matching is done on the stripped line and ignores the assembler's current mode;
 * the caller keeps the original line for buffering. Checks run in a fixed priority
 * order, so a line that starts with {@code <think>} is thinking even if it also
 * contains a fence.</p>
 */
final class LineClassifier {

    static final String THINK_OPEN = "<think>";
    static final String THINK_CLOSE = "</think>";
    static final String FENCE = "```";
    static final String MATH_BLOCK_OPEN = "\\[";
    static final String MATH_BLOCK_CLOSE = "\\]";
    static final String IMAGE_OPEN = "<image-uuid>";
    static final String IMAGE_CLOSE = "</image-uuid>";

    private static final char TABLE_PIPE = '|';

    private LineClassifier() {}

    /**
     * Classifies a line without a trailing newline.
     *
     * @param line raw line
     * @return category of the line
     */
    static LineCategory classify(String line) {
        String trimmedLine = line.strip();

        if (trimmedLine.startsWith(THINK_OPEN)) {
            return LineCategory.THINKING;
        }
        if (trimmedLine.startsWith(FENCE)) {
            return LineCategory.CODE_FENCE;
        }
        if (!trimmedLine.isEmpty() && trimmedLine.charAt(0) == TABLE_PIPE) {
            return LineCategory.TABLE_ROW;
        }
        if (trimmedLine.startsWith(MATH_BLOCK_OPEN)) {
            return trimmedLine.replace(" ", "").equals(MATH_BLOCK_OPEN)
                ? LineCategory.MATH_BLOCK_OPEN
                : LineCategory.MATH_LINE;
        }
        if (trimmedLine.startsWith(MATH_BLOCK_CLOSE)) {
            return LineCategory.MATH_LINE;
        }
        if (trimmedLine.startsWith(IMAGE_OPEN)) {
            return LineCategory.IMAGE_REFERENCE;
        }
        return LineCategory.TEXT;
    }

    /**
     * Returns whether the stripped line starts with the display-math closer.
     */
    static boolean startsWithMathClose(String line) {
        return line.strip().startsWith(MATH_BLOCK_CLOSE);
    }

    /**
     * Counts the leading whitespace characters of a line.
     *
     * @param line raw line
     * @return number of whitespace characters before the first non-whitespace one
     */
    static int leadingWhitespaceWidth(String line) {
        int width = 0;
        while (width < line.length() && Character.isWhitespace(line.charAt(width))) {
            width++;
        }
        return width;
    }
}
