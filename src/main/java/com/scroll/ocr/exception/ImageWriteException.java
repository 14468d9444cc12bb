package com.scroll.ocr.exception;

import java.nio.file.Path;

public class ImageWriteException extends ScrollOcrException {
    private final Path path;

    public ImageWriteException(Path path) {
        super("Could not write image: " + path);
        this.path = path;
    }

    public ImageWriteException(Path path, Throwable cause) {
        super("Could not write image: " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
