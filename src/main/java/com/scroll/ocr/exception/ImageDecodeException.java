package com.scroll.ocr.exception;

import java.nio.file.Path;

/**
 * 图片无法解码
 * <p>
 * 流水线中除第一张外可跳过，第一张解码失败则无法继续
 */
public class ImageDecodeException extends ScrollOcrException {
    private final Path path;

    public ImageDecodeException(Path path) {
        super("Could not read image: " + path);
        this.path = path;
    }

    public ImageDecodeException(Path path, Throwable cause) {
        super("Could not read image: " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
