package com.scroll.ocr.core.ocr;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 带层级结构的识别结果：块 → 段落 → 行 → 词
 */
@Data
@NoArgsConstructor
public class StructuredText {
    private List<Block> blocks = new ArrayList<>();
    private String fullText = "";

    public int getWordCount() {
        int count = 0;
        for (Block block : blocks) {
            for (Paragraph paragraph : block.getParagraphs()) {
                for (Line line : paragraph.getLines()) {
                    count += line.getWords().size();
                }
            }
        }
        return count;
    }

    @Data
    @NoArgsConstructor
    public static class Block {
        private int blockNum;
        private List<Paragraph> paragraphs = new ArrayList<>();

        public Block(int blockNum) {
            this.blockNum = blockNum;
        }
    }

    @Data
    @NoArgsConstructor
    public static class Paragraph {
        private int parNum;
        private List<Line> lines = new ArrayList<>();

        public Paragraph(int parNum) {
            this.parNum = parNum;
        }
    }

    @Data
    @NoArgsConstructor
    public static class Line {
        private int lineNum;
        private List<TextBlock> words = new ArrayList<>();

        public Line(int lineNum) {
            this.lineNum = lineNum;
        }

        public String getText() {
            StringBuilder sb = new StringBuilder();
            for (TextBlock word : words) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(word.getText());
            }
            return sb.toString();
        }
    }
}
