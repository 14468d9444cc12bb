package com.scroll.ocr.exception;

/**
 * OCR 没有识别出任何文字
 */
public class NoTextExtractedException extends ScrollOcrException {

    public NoTextExtractedException() {
        super("No text was extracted from the image");
    }
}
