package com.scroll.ocr.core.raster;

import org.opencv.core.Mat;

/**
 * 不可变的光栅图像
 * <p>
 * 内部持有一个 OpenCV Mat（1 通道灰度或 3 通道 BGR）。创建后像素不再被修改，
 * 拼接等操作总是产生新的 RasterBuffer。
 * <p>
 * Mat 占用 native 内存，不再使用时应调用 {@link #release()}。
 */
public final class RasterBuffer {
    private final Mat mat;

    private RasterBuffer(Mat mat) {
        this.mat = mat;
    }

    /**
     * 接管 Mat 的所有权
     *
     * @param mat 宽高均大于 0，通道数为 1 或 3
     * @throws IllegalArgumentException 尺寸或通道数不合法
     */
    public static RasterBuffer wrap(Mat mat) {
        if (mat == null || mat.empty() || mat.cols() <= 0 || mat.rows() <= 0) {
            throw new IllegalArgumentException("Raster must have positive width and height");
        }
        if (mat.channels() != 1 && mat.channels() != 3) {
            throw new IllegalArgumentException("Unsupported channel count: " + mat.channels());
        }
        return new RasterBuffer(mat);
    }

    /**
     * 复制 Mat 后再包装，调用方仍持有原 Mat
     */
    public static RasterBuffer copyOf(Mat mat) {
        if (mat == null || mat.empty()) {
            throw new IllegalArgumentException("Raster must have positive width and height");
        }
        return wrap(mat.clone());
    }

    public int getWidth() {
        return mat.cols();
    }

    public int getHeight() {
        return mat.rows();
    }

    public int getChannels() {
        return mat.channels();
    }

    /**
     * 只读视图，调用方不得写入
     */
    public Mat getMat() {
        return mat;
    }

    /**
     * 返回像素数据的独立副本，调用方负责释放
     */
    public Mat copyMat() {
        return mat.clone();
    }

    public void release() {
        mat.release();
    }

    @Override
    public String toString() {
        return "RasterBuffer{" + getWidth() + "x" + getHeight() + ", channels=" + getChannels() + "}";
    }
}
