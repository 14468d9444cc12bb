package com.scroll.ocr.core.ocr;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 识别出的单个词及其位置
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TextBlock {
    private String text;
    private int x;
    private int y;
    private int width;
    private int height;
    /** 引擎置信度 (0-100) */
    private double confidence;

    public int getCenterX() {
        return x + width / 2;
    }

    public int getCenterY() {
        return y + height / 2;
    }
}
