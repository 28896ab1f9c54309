package com.williamcallahan.chatblocks.service.parsing;

import com.williamcallahan.chatblocks.domain.blocks.CodeBlock;
import com.williamcallahan.chatblocks.domain.blocks.ContentBlock;
import com.williamcallahan.chatblocks.domain.blocks.FormulaBlock;
import com.williamcallahan.chatblocks.domain.blocks.ImageBlock;
import com.williamcallahan.chatblocks.domain.blocks.TableBlock;
import com.williamcallahan.chatblocks.domain.blocks.TextBlock;
import com.williamcallahan.chatblocks.domain.blocks.ThinkingBlock;
import com.williamcallahan.chatblocks.domain.images.ImageResource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * End-to-end parsing of whole messages with the default classifier-first routing.
 */
class MessageParserTest {

    private static final UUID IMAGE_ID = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");
    private static final String IMAGE_LINE = "<image-uuid>" + IMAGE_ID + "</image-uuid>";

    private final MessageParser parser = new MessageParser();

    private static TextBlock text(String body) {
        return new TextBlock(body);
    }

    private static FormulaBlock formula(String content) {
        return new FormulaBlock(content);
    }

    @Test
    void parse_emptyInput_returnsSingleEmptyText() {
        assertEquals(List.of(text("")), parser.parse(""));
        assertEquals(List.of(text("")), parser.parse(null));
    }

    @Test
    void parse_proseLines_emitOneTextPerLine() {
        assertEquals(List.of(text("First line"), text(""), text("Third line")),
            parser.parse("First line\n\nThird line"));
    }

    @Test
    void parse_inlineMath_splitsTextAndFormula() {
        assertEquals(List.of(text("Hello "), formula("x^2"), text(" world")), parser.parse("Hello $x^2$ world"));
        assertEquals(List.of(text("Text "), formula(""), text(" end")), parser.parse("Text $$ end"));
    }

    @Test
    void parse_tableBetweenProse_emitsTableInPlace() {
        String message = String.join("\n",
            "Before the table",
            "| Name | Age |",
            "| --- | ---: |",
            "| Ann | 31 |",
            "| Bob | 42 |",
            "After the table");

        List<ContentBlock> blocks = parser.parse(message);

        assertEquals(List.of(
            text("Before the table"),
            new TableBlock(List.of("Name", "Age"), List.of(List.of("Ann", "31"), List.of("Bob", "42"))),
            text("After the table")), blocks);
    }

    @Test
    void parse_tableAtEndOfInput_isFlushed() {
        assertEquals(List.of(new TableBlock(List.of("A", "B"), List.of(List.of("1", "2")))),
            parser.parse("| A | B |\n|---|---|\n| 1 | 2 |"));
    }

    @Test
    @DisplayName("A header row with no data rows never leaks into a later table")
    void parse_headerOnlyTable_isDiscarded() {
        assertEquals(List.of(text("plain")), parser.parse("| Only | Header |\nplain"));
        assertEquals(List.of(text("note"), text("end")), parser.parse("| A | B |\nnote\n| 1 | 2 |\nend"));
    }

    @Test
    void parse_tableFollowedByFence_emitsTableThenCode() {
        assertEquals(List.of(
                new TableBlock(List.of("A", "B"), List.of(List.of("1", "2"))),
                new CodeBlock("code", null, 0)),
            parser.parse("| A | B |\n| 1 | 2 |\n```\ncode\n```"));
    }

    @Test
    void parse_fenceWithLanguage_capturesLanguage() {
        assertEquals(List.of(text("Code:"), new CodeBlock("let a = 1", "swift", 0), text("End.")),
            parser.parse("Code:\n```swift\nlet a = 1\n```\nEnd."));
    }

    @Test
    void parse_indentedFence_stripsIndentFromBody() {
        String message = String.join("\n",
            "Steps:",
            "   ```python",
            "   def f():",
            "       return 1",
            "   ```");

        assertEquals(List.of(text("Steps:"), new CodeBlock("def f():\n    return 1", "python", 3)),
            parser.parse(message));
    }

    @Test
    @DisplayName("An unclosed fence captures everything after it as code")
    void parse_unclosedFence_emitsSingleCodeBlock() {
        String message = String.join("\n",
            "Here's a FizzBuzz implementation:",
            "",
            "```",
            "The Infamous FizzBuzz Program.",
            "By ChatGPT.",
            "",
            "Act 1: The Setup",
            "[Enter Romeo and Juliet]");

        List<ContentBlock> blocks = parser.parse(message);

        assertEquals(3, blocks.size());
        assertEquals(text("Here's a FizzBuzz implementation:"), blocks.get(0));
        assertEquals(text(""), blocks.get(1));
        assertEquals(new CodeBlock(
            "The Infamous FizzBuzz Program.\nBy ChatGPT.\n\nAct 1: The Setup\n[Enter Romeo and Juliet]", null, 0),
            blocks.get(2));
    }

    @Test
    void parse_emptyFencedBlock_emitsNothing() {
        assertEquals(List.of(), parser.parse("```\n```"));
    }

    @Test
    void parse_displayMathBlock_emitsFormulaAndInlineMathAfter() {
        String message = String.join("\n",
            "Sure, here's the Polyakov action for the bosonic string:",
            "",
            "\\[",
            "S = -\\frac{1}{4\\pi\\alpha'} \\int d^2\\sigma \\sqrt{-h} h^{ab} \\partial_a X^\\mu \\partial_b X_\\mu",
            "\\]",
            "",
            "Where:",
            "- \\( S \\) is the action.");

        List<ContentBlock> blocks = parser.parse(message);

        assertEquals(List.of(
            text("Sure, here's the Polyakov action for the bosonic string:"),
            text(""),
            formula("S = -\\frac{1}{4\\pi\\alpha'} \\int d^2\\sigma \\sqrt{-h} h^{ab} \\partial_a X^\\mu \\partial_b X_\\mu"),
            text(""),
            text("Where:"),
            text("- "),
            formula(" S "),
            text(" is the action.")), blocks);
    }

    @Test
    void parse_oneLineDisplayMath_emitsFormula() {
        assertEquals(List.of(text("Formula:"), formula("\\sum i = 0"), text("Next line.")),
            parser.parse("Formula:\n\\[\\sum i = 0\\]\nNext line."));
    }

    @Test
    void parse_consecutiveMathBlocks_doNotShareLines() {
        assertEquals(List.of(formula("a"), formula("b")), parser.parse("\\[\na\n\\]\n\\[\nb\n\\]"));
    }

    @Test
    void parse_unterminatedMathBlock_isFlushedAtEnd() {
        assertEquals(List.of(formula("x = 1")), parser.parse("\\[\nx = 1"));
    }

    @Test
    void parse_openedEmptyMathBlock_emitsEmptyFormula() {
        assertEquals(List.of(formula("")), parser.parse("\\[\n\\]"));
    }

    @Test
    void parse_strayMathCloser_emitsNothing() {
        assertEquals(List.of(text("before")), parser.parse("before\n\\]"));
    }

    @Test
    void parse_multiLineThinking_emitsCollapsedBlock() {
        String message = String.join("\n",
            "<think>",
            "Let me add the numbers.",
            "2 + 2 = 4",
            "</think>",
            "The answer is 4.");

        assertEquals(List.of(ThinkingBlock.collapsed("Let me add the numbers.\n2 + 2 = 4"), text("The answer is 4.")),
            parser.parse(message));
    }

    @Test
    void parse_singleLineThinking_trimsContent() {
        assertEquals(List.of(new ThinkingBlock("quick check", false)), parser.parse("<think> quick check </think>"));
    }

    @Test
    void parse_textAfterClosingThinkTag_isParsedAsLine() {
        assertEquals(List.of(ThinkingBlock.collapsed("plan"), text("Answer: 42")),
            parser.parse("<think>plan</think>Answer: 42"));
        assertEquals(List.of(ThinkingBlock.collapsed("First thought\nSecond thought"), text("Done")),
            parser.parse("<think>First thought\nSecond thought</think>\nDone"));
    }

    @Test
    void parse_manySameLineThinkingSections_emitsOneBlockEach() {
        List<ContentBlock> blocks = parser.parse("<think>a</think>".repeat(6_000));

        assertEquals(6_000, blocks.size());
        assertTrue(blocks.stream().allMatch(ThinkingBlock.collapsed("a")::equals));
    }

    @Test
    @DisplayName("A same-line thinking section is emitted before a table that is still pending")
    void parse_sameLineThinkingAfterTable_precedesTable() {
        assertEquals(List.of(
                ThinkingBlock.collapsed("x"),
                new TableBlock(List.of("A"), List.of(List.of("1"))),
                text("after")),
            parser.parse("| A |\n| 1 |\n<think>x</think>\nafter"));
    }

    @Test
    void parse_unterminatedThinking_isFlushedAtEnd() {
        assertEquals(List.of(ThinkingBlock.collapsed("still going\nmore")), parser.parse("<think>still going\nmore"));
    }

    @Test
    void parse_resolvedImage_emitsImageBlock() {
        ImageResource resource = new ImageResource(IMAGE_ID, "image/png", 128);
        MessageParser imageParser = new MessageParser(id -> id.equals(IMAGE_ID) ? Optional.of(resource) : Optional.empty());

        assertEquals(List.of(text("Look:"), new ImageBlock(resource), text("Nice")),
            imageParser.parse("Look:\n" + IMAGE_LINE + "\nNice"));
    }

    @Test
    void parse_unresolvedImages_areGroupedAsText() {
        String other = "<image-uuid>00000000-0000-0000-0000-000000000001</image-uuid>";

        assertEquals(List.of(text(IMAGE_LINE + "\n" + other), text("after")),
            parser.parse(IMAGE_LINE + "\n" + other + "\nafter"));
    }

    @Test
    void parse_malformedImageId_neverCallsResolver() {
        ImageResolver resolver = mock(ImageResolver.class);
        MessageParser imageParser = new MessageParser(resolver);

        List<ContentBlock> blocks = imageParser.parse("<image-uuid>not-a-uuid</image-uuid>");

        assertEquals(List.of(text("<image-uuid>not-a-uuid</image-uuid>")), blocks);
        verify(resolver, never()).resolve(any());
    }

    @Test
    void parse_failingResolver_keepsReferenceAsText() {
        ImageResolver resolver = mock(ImageResolver.class);
        given(resolver.resolve(IMAGE_ID)).willThrow(new IllegalStateException("disk unavailable"));
        MessageParser imageParser = new MessageParser(resolver);

        assertEquals(List.of(text(IMAGE_LINE)), imageParser.parse(IMAGE_LINE));
        verify(resolver).resolve(IMAGE_ID);
    }

    @Test
    void parse_escapedDollar_staysLiteral() {
        assertEquals(List.of(text("This is a real \\$5 price, not "), formula("x=1"), text(".")),
            parser.parse("This is a real \\$5 price, not $x=1$."));
    }

    @Test
    void parse_sameInputTwice_returnsEqualResults() {
        String message = "Hi $a$\n| h |\n| d |\n```js\nx()\n```\n<think>t</think>";
        assertEquals(parser.parse(message), parser.parse(message));
        assertTrue(parser.getLineRouting() == LineRouting.CLASSIFIER_FIRST);
    }
}
