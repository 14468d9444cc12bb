package com.scroll.ocr.exception;

import java.nio.file.Path;

/**
 * 输入路径存在但不是普通文件（例如目录）
 */
public class InputNotAFileException extends ScrollOcrException {
    private final Path path;

    public InputNotAFileException(Path path) {
        super("Not a file: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
