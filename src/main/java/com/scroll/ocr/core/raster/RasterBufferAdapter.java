package com.scroll.ocr.core.raster;

import com.scroll.ocr.exception.ImageDecodeException;
import com.scroll.ocr.exception.ImageWriteException;
import org.opencv.core.Core;
import org.opencv.core.CvException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.Size;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * 图像读写适配层
 * <p>
 * 负责图片编解码以及通道数、宽度的归一化，不包含任何拼接逻辑。
 * 读写均通过字节数组 + imdecode/imencode 完成，避免 imread 对非 ASCII 路径的兼容问题。
 */
@Component
public class RasterBufferAdapter {
    private static final Logger logger = LoggerFactory.getLogger(RasterBufferAdapter.class);

    private static final String DEFAULT_EXTENSION = ".png";

    /**
     * 读取图片
     *
     * @param path 图片路径
     * @return 1 通道或 3 通道 8 位图像
     * @throws ImageDecodeException 文件无法读取或无法解码
     */
    public RasterBuffer load(Path path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new ImageDecodeException(path, e);
        }

        if (bytes.length == 0) {
            throw new ImageDecodeException(path);
        }

        MatOfByte encoded = new MatOfByte(bytes);
        Mat decoded;
        try {
            decoded = Imgcodecs.imdecode(encoded, Imgcodecs.IMREAD_UNCHANGED);
        } catch (CvException e) {
            throw new ImageDecodeException(path, e);
        } finally {
            encoded.release();
        }

        if (decoded == null || decoded.empty()) {
            throw new ImageDecodeException(path);
        }

        Mat normalized = normalizeChannels(decoded);
        if (normalized != decoded) {
            decoded.release();
        }
        logger.debug("Loaded {} ({}x{}, {} channels)", path, normalized.cols(), normalized.rows(), normalized.channels());
        return RasterBuffer.wrap(normalized);
    }

    /**
     * 保存图片，格式由扩展名决定（无扩展名时按 PNG 编码）
     *
     * @throws ImageWriteException 编码或写入失败
     */
    public void save(RasterBuffer buffer, Path path) {
        String extension = extensionOf(path);
        MatOfByte encoded = new MatOfByte();
        try {
            if (!Imgcodecs.imencode(extension, buffer.getMat(), encoded)) {
                throw new ImageWriteException(path);
            }
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(path, encoded.toArray());
            logger.info("Saved image to: {} ({}x{})", path, buffer.getWidth(), buffer.getHeight());
        } catch (IOException e) {
            throw new ImageWriteException(path, e);
        } catch (CvException e) {
            // 不支持的扩展名
            throw new ImageWriteException(path, e);
        } finally {
            encoded.release();
        }
    }

    /**
     * 转为 AWT 图像，供 OCR 引擎使用
     */
    public BufferedImage toBufferedImage(RasterBuffer buffer) throws IOException {
        MatOfByte encoded = new MatOfByte();
        try {
            if (!Imgcodecs.imencode(DEFAULT_EXTENSION, buffer.getMat(), encoded)) {
                throw new IOException("Failed to encode raster " + buffer);
            }
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(encoded.toArray()));
            if (image == null) {
                throw new IOException("Failed to convert raster " + buffer);
            }
            return image;
        } finally {
            encoded.release();
        }
    }

    // =========================================================
    // 归一化工具
    // =========================================================

    /**
     * 转单通道灰度，返回新 Mat
     */
    public static Mat toGray(Mat src) {
        Mat gray = new Mat();
        if (src.channels() == 3) {
            Imgproc.cvtColor(src, gray, Imgproc.COLOR_BGR2GRAY);
        } else if (src.channels() == 4) {
            Imgproc.cvtColor(src, gray, Imgproc.COLOR_BGRA2GRAY);
        } else {
            src.copyTo(gray);
        }
        return gray;
    }

    /**
     * 转 3 通道 BGR，返回新 Mat
     */
    public static Mat toBgr(Mat src) {
        Mat bgr = new Mat();
        if (src.channels() == 1) {
            Imgproc.cvtColor(src, bgr, Imgproc.COLOR_GRAY2BGR);
        } else if (src.channels() == 4) {
            Imgproc.cvtColor(src, bgr, Imgproc.COLOR_BGRA2BGR);
        } else {
            src.copyTo(bgr);
        }
        return bgr;
    }

    /**
     * 仅拉伸宽度到 targetWidth，高度不变（双线性插值），返回新 Mat
     */
    public static Mat resizeToWidth(Mat src, int targetWidth) {
        Mat dst = new Mat();
        if (src.cols() == targetWidth) {
            src.copyTo(dst);
        } else {
            Imgproc.resize(src, dst, new Size(targetWidth, src.rows()), 0, 0, Imgproc.INTER_LINEAR);
        }
        return dst;
    }

    /**
     * 把 RasterBuffer 拉伸到指定宽度，宽度一致时返回副本
     */
    public static RasterBuffer resizeToWidth(RasterBuffer buffer, int targetWidth) {
        return RasterBuffer.wrap(resizeToWidth(buffer.getMat(), targetWidth));
    }

    /**
     * 统一为 8 位 1 或 3 通道；已满足条件时返回原对象
     */
    static Mat normalizeChannels(Mat src) {
        Mat working = src;
        if (src.depth() != CvType.CV_8U) {
            // 16 位 PNG 等按比例压到 8 位
            Mat scaled = new Mat();
            double alpha = src.depth() == CvType.CV_16U ? 1.0 / 257.0 : 1.0;
            src.convertTo(scaled, CvType.makeType(CvType.CV_8U, src.channels()), alpha);
            working = scaled;
        }

        switch (working.channels()) {
            case 1:
            case 3:
                return working;
            case 4: {
                Mat bgr = new Mat();
                Imgproc.cvtColor(working, bgr, Imgproc.COLOR_BGRA2BGR);
                if (working != src) {
                    working.release();
                }
                return bgr;
            }
            default: {
                // 灰度 + alpha 等少见格式，取第一个通道
                Mat first = new Mat();
                Core.extractChannel(working, first, 0);
                if (working != src) {
                    working.release();
                }
                return first;
            }
        }
    }

    private static String extensionOf(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return DEFAULT_EXTENSION;
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
