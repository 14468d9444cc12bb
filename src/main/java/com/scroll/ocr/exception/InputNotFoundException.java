package com.scroll.ocr.exception;

import java.nio.file.Path;

/**
 * 输入图片不存在，整个运行直接终止
 */
public class InputNotFoundException extends ScrollOcrException {
    private final Path path;

    public InputNotFoundException(Path path) {
        super("Image file not found: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
