package com.scroll.ocr.exception;

public class EmptyInputException extends ScrollOcrException {

    public EmptyInputException() {
        super("No images provided");
    }
}
