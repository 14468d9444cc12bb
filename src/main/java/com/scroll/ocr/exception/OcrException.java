package com.scroll.ocr.exception;

/**
 * OCR 引擎调用失败（tessdata 缺失、语言包不存在等）
 */
public class OcrException extends ScrollOcrException {

    public OcrException(String message, Throwable cause) {
        super(message, cause);
    }
}
