package com.scroll.ocr.core.ocr;

import org.junit.jupiter.api.Test;

import java.awt.Rectangle;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredTextBuilderTest {

    @Test
    void groupsWordsIntoLinesParagraphsAndBlocks() {
        List<TextBlock> words = Arrays.asList(
            new TextBlock("Hello", 10, 10, 40, 12, 95),
            new TextBlock("world", 60, 10, 40, 12, 93),
            new TextBlock("Second", 10, 30, 50, 12, 90),
            new TextBlock("Footer", 10, 200, 50, 12, 88));
        List<Rectangle> lines = Arrays.asList(
            new Rectangle(5, 5, 120, 20),
            new Rectangle(5, 25, 120, 20),
            new Rectangle(5, 195, 120, 20));
        List<Rectangle> paragraphs = Arrays.asList(
            new Rectangle(0, 0, 130, 50),
            new Rectangle(0, 190, 130, 30));
        List<Rectangle> blocks = Arrays.asList(
            new Rectangle(0, 0, 130, 50),
            new Rectangle(0, 190, 130, 30));

        StructuredText text = StructuredTextBuilder.build(blocks, paragraphs, lines, words, " Hello world\n");

        assertThat(text.getBlocks()).hasSize(2);
        assertThat(text.getBlocks().get(0).getBlockNum()).isEqualTo(1);
        StructuredText.Paragraph first = text.getBlocks().get(0).getParagraphs().get(0);
        assertThat(first.getParNum()).isEqualTo(1);
        assertThat(first.getLines()).extracting(StructuredText.Line::getText)
            .containsExactly("Hello world", "Second");
        assertThat(first.getLines()).extracting(StructuredText.Line::getLineNum).containsExactly(1, 2);
        assertThat(text.getBlocks().get(1).getParagraphs().get(0).getLines().get(0).getText()).isEqualTo("Footer");
        assertThat(text.getWordCount()).isEqualTo(4);
        assertThat(text.getFullText()).isEqualTo("Hello world");
    }

    @Test
    void missingLayoutLevelsFallBackToSingleContainer() {
        List<TextBlock> words = Arrays.asList(
            new TextBlock("a", 0, 0, 10, 10, 80),
            new TextBlock("b", 20, 0, 10, 10, 80));

        StructuredText text = StructuredTextBuilder.build(null, Collections.emptyList(),
            Collections.emptyList(), words, "a b");

        assertThat(text.getBlocks()).hasSize(1);
        assertThat(text.getBlocks().get(0).getParagraphs()).hasSize(1);
        assertThat(text.getWordCount()).isEqualTo(2);
    }

    @Test
    void emptyPageHasNoBlocks() {
        StructuredText text = StructuredTextBuilder.build(Collections.emptyList(), Collections.emptyList(),
            Collections.emptyList(), Collections.emptyList(), null);

        assertThat(text.getBlocks()).isEmpty();
        assertThat(text.getFullText()).isEmpty();
    }

    @Test
    void childOutsideAllParentsGoesToNearestOneVertically() {
        List<Rectangle> parents = Arrays.asList(new Rectangle(0, 0, 100, 20), new Rectangle(0, 100, 100, 20));
        List<Rectangle> children = Collections.singletonList(new Rectangle(0, 85, 10, 6));

        int[] owner = StructuredTextBuilder.assign(children, parents);

        assertThat(owner).containsExactly(1);
    }
}
