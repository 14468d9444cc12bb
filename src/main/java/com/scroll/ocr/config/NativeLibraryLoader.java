package com.scroll.ocr.config;

import org.opencv.core.Core;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Native Library Loader
 * 负责加载 OpenCV JNI 库，整个进程只加载一次
 */
public class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static boolean loaded = false;

    private NativeLibraryLoader() {
    }

    /**
     * 预加载 OpenCV native 库
     * 必须在任何 Mat 操作之前调用
     */
    public static synchronized void loadNativeLibraries() {
        if (loaded) {
            return;
        }

        // 优先使用 openpnp 打包的 native 库（解压到临时目录）
        try {
            nu.pattern.OpenCV.loadLocally();
            logger.info("OpenCV {} loaded via openpnp", Core.VERSION);
            loaded = true;
            return;
        } catch (Throwable e) {
            logger.warn("Failed to load OpenCV via openpnp: {}", e.getMessage());
        }

        // 回退到系统库路径
        try {
            System.loadLibrary(Core.NATIVE_LIBRARY_NAME);
            logger.info("OpenCV loaded from system library path");
            loaded = true;
        } catch (UnsatisfiedLinkError e) {
            logger.error("Failed to load OpenCV library. Please ensure {} is in java.library.path",
                Core.NATIVE_LIBRARY_NAME);
            throw new IllegalStateException("OpenCV native library not found: " + Core.NATIVE_LIBRARY_NAME, e);
        }
    }

    public static synchronized boolean isLoaded() {
        return loaded;
    }
}
