package com.williamcallahan.chatblocks.service.parsing;

import com.williamcallahan.chatblocks.domain.blocks.CodeBlock;
import com.williamcallahan.chatblocks.domain.blocks.ContentBlock;
import com.williamcallahan.chatblocks.domain.blocks.FormulaBlock;
import com.williamcallahan.chatblocks.domain.blocks.ImageBlock;
import com.williamcallahan.chatblocks.domain.blocks.TextBlock;
import com.williamcallahan.chatblocks.domain.blocks.ThinkingBlock;
import com.williamcallahan.chatblocks.domain.images.ImageResource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Line-by-line state machine that groups message lines into content blocks.
 *
 * <p>This is a mutable, single-use object: feed every line to {@link #accept(String)} in
 * order, then call {@link #finish()} once. Each buffer has exactly one flush method and
 * every flush is a no-op when its buffer is empty, so transitions can flush freely.</p>
 *
 * <p>Prose lines outside any block are not batched. Each one is split by
 * {@link InlineMathScanner} and appended immediately. The text buffer only collects image
 * reference lines whose image could not be resolved.</p>
 */
final class BlockAssembler {

    private static final String LINE_SEPARATOR = "\n";

    private final LineRouting lineRouting;
    private final Function<UUID, Optional<ImageResource>> imageLookup;

    private final List<ContentBlock> blocks = new ArrayList<>();
    private final List<String> textLines = new ArrayList<>();
    private final List<String> codeLines = new ArrayList<>();
    private final List<String> mathLines = new ArrayList<>();
    private final List<String> thinkingLines = new ArrayList<>();
    private final TableAccumulator table = new TableAccumulator();

    private boolean codeOpen;
    private String codeLanguage;
    private int codeIndent;
    private boolean mathOpen;
    private boolean thinkingOpen;
    private String pendingRemainder;

    BlockAssembler(LineRouting lineRouting, Function<UUID, Optional<ImageResource>> imageLookup) {
        this.lineRouting = lineRouting;
        this.imageLookup = imageLookup;
    }

    /**
     * Consumes one line without its trailing newline.
     *
     * @param line raw message line
     */
    void accept(String line) {
        String next = line;
        while (next != null) {
            pendingRemainder = null;
            route(next);
            next = pendingRemainder;
        }
    }

    private void route(String line) {
        LineCategory category = LineClassifier.classify(line);
        if (lineRouting == LineRouting.OPEN_BLOCK_FIRST && captureInOpenBlock(line, category)) {
            return;
        }

        switch (category) {
            case CODE_FENCE -> handleFence(line);
            case TABLE_ROW -> handleTableRow(line);
            case MATH_BLOCK_OPEN -> handleMathBlockOpen();
            case MATH_LINE -> handleMathLine(line);
            case THINKING -> handleThinking(line);
            case IMAGE_REFERENCE -> handleImageReference(line);
            case TEXT -> handleText(line);
        }
    }

    /**
     * Flushes every pending buffer, including unterminated blocks, and returns the result.
     *
     * @return blocks in message order
     */
    List<ContentBlock> finish() {
        flushText();
        flushCode();
        flushMath();
        flushTable();
        flushThinking();
        return List.copyOf(blocks);
    }

    private boolean captureInOpenBlock(String line, LineCategory category) {
        if (thinkingOpen) {
            appendThinkingLine(line);
            return true;
        }
        if (codeOpen) {
            if (category == LineCategory.CODE_FENCE) {
                return false;
            }
            appendCodeLine(line);
            return true;
        }
        if (mathOpen) {
            if (category == LineCategory.MATH_LINE && LineClassifier.startsWithMathClose(line)) {
                return false;
            }
            appendMathLine(line);
            return true;
        }
        return false;
    }

    private void handleFence(String line) {
        if (codeOpen) {
            flushCode();
            codeOpen = false;
            codeLanguage = null;
            codeIndent = 0;
            return;
        }
        flushText();
        flushTable();
        codeOpen = true;
        codeLanguage = fenceLanguage(line);
        codeIndent = LineClassifier.leadingWhitespaceWidth(line);
    }

    private void handleTableRow(String line) {
        flushText();
        table.acceptRow(line);
    }

    private void handleMathBlockOpen() {
        flushText();
        flushTable();
        if (!mathLines.isEmpty()) {
            flushMath();
        }
        mathOpen = true;
    }

    private void handleMathLine(String line) {
        flushText();
        flushTable();
        if (LineClassifier.startsWithMathClose(line)) {
            flushMath();
            return;
        }
        appendMathLine(line);
        if (!mathOpen) {
            // opener and closer share this line
            flushMath();
        }
    }

    private void handleThinking(String line) {
        int closeIndex = line.indexOf(LineClassifier.THINK_CLOSE);
        if (closeIndex >= 0) {
            String between = line.substring(0, closeIndex);
            blocks.add(ThinkingBlock.collapsed(stripThinkTags(between).strip()));
            acceptRemainder(line.substring(closeIndex + LineClassifier.THINK_CLOSE.length()));
            return;
        }
        flushText();
        flushTable();
        thinkingOpen = true;
        String firstLine = line.replace(LineClassifier.THINK_OPEN, "");
        if (!firstLine.isEmpty()) {
            thinkingLines.add(firstLine);
        }
    }

    private void handleImageReference(String line) {
        Optional<ImageResource> image = ImageReferenceExtractor.extractImageId(line).flatMap(imageLookup);
        if (image.isPresent()) {
            flushText();
            blocks.add(new ImageBlock(image.get()));
        } else {
            textLines.add(line);
        }
    }

    private void handleText(String line) {
        if (thinkingOpen) {
            appendThinkingLine(line);
        } else if (codeOpen) {
            appendCodeLine(line);
        } else if (mathOpen) {
            appendMathLine(line);
        } else {
            flushTable();
            flushText();
            blocks.addAll(InlineMathScanner.scan(line));
        }
    }

    private void appendThinkingLine(String line) {
        int closeIndex = line.indexOf(LineClassifier.THINK_CLOSE);
        if (closeIndex < 0) {
            thinkingLines.add(line);
            return;
        }
        String lastLine = line.substring(0, closeIndex);
        if (!lastLine.isEmpty()) {
            thinkingLines.add(lastLine);
        }
        thinkingOpen = false;
        flushThinking();
        acceptRemainder(line.substring(closeIndex + LineClassifier.THINK_CLOSE.length()));
    }

    private void appendCodeLine(String line) {
        if (codeIndent == 0) {
            codeLines.add(line);
        } else {
            codeLines.add(line.length() <= codeIndent ? "" : line.substring(codeIndent));
        }
    }

    private void appendMathLine(String line) {
        mathLines.add(line.replace(LineClassifier.MATH_BLOCK_OPEN, "")
            .replace(LineClassifier.MATH_BLOCK_CLOSE, ""));
    }

    /**
     * Text following a closing think tag is parsed as a line of its own once the
     * current line is done.
     */
    private void acceptRemainder(String remainder) {
        if (!remainder.isBlank()) {
            pendingRemainder = remainder;
        }
    }

    private void flushText() {
        if (textLines.isEmpty()) {
            return;
        }
        blocks.add(new TextBlock(String.join(LINE_SEPARATOR, textLines)));
        textLines.clear();
    }

    private void flushCode() {
        if (codeLines.isEmpty()) {
            return;
        }
        blocks.add(new CodeBlock(String.join(LINE_SEPARATOR, codeLines), codeLanguage, codeIndent));
        codeLines.clear();
    }

    /**
     * An explicitly opened block emits a formula even when it holds no lines.
     */
    private void flushMath() {
        if (!mathOpen && mathLines.isEmpty()) {
            return;
        }
        blocks.add(new FormulaBlock(String.join(LINE_SEPARATOR, mathLines)));
        mathLines.clear();
        mathOpen = false;
    }

    private void flushTable() {
        table.drain().ifPresent(blocks::add);
    }

    private void flushThinking() {
        if (thinkingLines.isEmpty()) {
            return;
        }
        String combined = stripThinkTags(String.join(LINE_SEPARATOR, thinkingLines)).strip();
        blocks.add(ThinkingBlock.collapsed(combined));
        thinkingLines.clear();
    }

    private static String stripThinkTags(String text) {
        return text.replace(LineClassifier.THINK_OPEN, "").replace(LineClassifier.THINK_CLOSE, "");
    }

    private static String fenceLanguage(String line) {
        String afterFence = line.strip();
        int tagStart = 0;
        while (tagStart < afterFence.length() && afterFence.charAt(tagStart) == '`') {
            tagStart++;
        }
        String language = afterFence.substring(tagStart).strip();
        return language.isEmpty() ? null : language;
    }
}
