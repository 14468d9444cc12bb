package com.scroll.ocr.exception;

/**
 * 所有业务异常的基类
 */
public class ScrollOcrException extends RuntimeException {

    public ScrollOcrException(String message) {
        super(message);
    }

    public ScrollOcrException(String message, Throwable cause) {
        super(message, cause);
    }
}
