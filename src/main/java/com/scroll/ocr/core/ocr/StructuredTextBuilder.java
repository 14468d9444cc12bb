package com.scroll.ocr.core.ocr;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.List;

/**
 * 根据各层级的外接矩形把词归入行、行归入段落、段落归入块
 * <p>
 * 归属规则：子元素中心点落在哪个父矩形内就归哪个；都不包含时归入垂直距离最近的父元素。
 * 父层级为空时生成一个覆盖全部子元素的默认父元素。
 */
public final class StructuredTextBuilder {

    private StructuredTextBuilder() {
    }

    /**
     * @param blocks     块级矩形（扫描顺序）
     * @param paragraphs 段落级矩形
     * @param lines      行级矩形
     * @param words      词级结果
     * @param fullText   整页文本
     */
    public static StructuredText build(List<Rectangle> blocks, List<Rectangle> paragraphs,
                                       List<Rectangle> lines, List<TextBlock> words, String fullText) {
        if (words.isEmpty() && (lines == null || lines.isEmpty())) {
            StructuredText empty = new StructuredText();
            empty.setFullText(fullText == null ? "" : fullText.trim());
            return empty;
        }

        List<Rectangle> wordBoxes = new ArrayList<>(words.size());
        for (TextBlock word : words) {
            wordBoxes.add(new Rectangle(word.getX(), word.getY(), word.getWidth(), word.getHeight()));
        }

        List<Rectangle> lineBoxes = orDefault(lines, wordBoxes);
        List<Rectangle> paragraphBoxes = orDefault(paragraphs, lineBoxes);
        List<Rectangle> blockBoxes = orDefault(blocks, paragraphBoxes);

        int[] wordToLine = assign(wordBoxes, lineBoxes);
        int[] lineToParagraph = assign(lineBoxes, paragraphBoxes);
        int[] paragraphToBlock = assign(paragraphBoxes, blockBoxes);

        List<StructuredText.Line> lineNodes = new ArrayList<>(lineBoxes.size());
        for (int i = 0; i < lineBoxes.size(); i++) {
            lineNodes.add(new StructuredText.Line(0));
        }
        for (int i = 0; i < words.size(); i++) {
            lineNodes.get(wordToLine[i]).getWords().add(words.get(i));
        }

        List<StructuredText.Paragraph> paragraphNodes = new ArrayList<>(paragraphBoxes.size());
        for (int i = 0; i < paragraphBoxes.size(); i++) {
            paragraphNodes.add(new StructuredText.Paragraph(0));
        }
        for (int i = 0; i < lineNodes.size(); i++) {
            StructuredText.Paragraph paragraph = paragraphNodes.get(lineToParagraph[i]);
            StructuredText.Line line = lineNodes.get(i);
            line.setLineNum(paragraph.getLines().size() + 1);
            paragraph.getLines().add(line);
        }

        StructuredText result = new StructuredText();
        for (int i = 0; i < blockBoxes.size(); i++) {
            result.getBlocks().add(new StructuredText.Block(i + 1));
        }
        for (int i = 0; i < paragraphNodes.size(); i++) {
            StructuredText.Block block = result.getBlocks().get(paragraphToBlock[i]);
            StructuredText.Paragraph paragraph = paragraphNodes.get(i);
            paragraph.setParNum(block.getParagraphs().size() + 1);
            block.getParagraphs().add(paragraph);
        }

        result.setFullText(fullText == null ? "" : fullText.trim());
        return result;
    }

    /**
     * 父层级为空时用一个包含所有子元素的矩形代替
     */
    private static List<Rectangle> orDefault(List<Rectangle> parents, List<Rectangle> children) {
        if (parents != null && !parents.isEmpty()) {
            return parents;
        }
        Rectangle union = null;
        for (Rectangle child : children) {
            union = union == null ? new Rectangle(child) : union.union(child);
        }
        List<Rectangle> single = new ArrayList<>(1);
        single.add(union == null ? new Rectangle() : union);
        return single;
    }

    static int[] assign(List<Rectangle> children, List<Rectangle> parents) {
        int[] owner = new int[children.size()];
        for (int i = 0; i < children.size(); i++) {
            Rectangle child = children.get(i);
            int cx = child.x + child.width / 2;
            int cy = child.y + child.height / 2;

            int found = -1;
            int nearest = 0;
            int nearestDistance = Integer.MAX_VALUE;
            for (int p = 0; p < parents.size(); p++) {
                Rectangle parent = parents.get(p);
                if (cx >= parent.x && cx <= parent.x + parent.width
                    && cy >= parent.y && cy <= parent.y + parent.height) {
                    found = p;
                    break;
                }
                int distance = verticalDistance(cy, parent);
                if (distance < nearestDistance) {
                    nearestDistance = distance;
                    nearest = p;
                }
            }
            owner[i] = found >= 0 ? found : nearest;
        }
        return owner;
    }

    private static int verticalDistance(int y, Rectangle rect) {
        if (y < rect.y) {
            return rect.y - y;
        }
        if (y > rect.y + rect.height) {
            return y - (rect.y + rect.height);
        }
        return 0;
    }
}
