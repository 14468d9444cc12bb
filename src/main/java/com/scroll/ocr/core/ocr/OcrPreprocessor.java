package com.scroll.ocr.core.ocr;

import com.scroll.ocr.core.raster.RasterBuffer;
import com.scroll.ocr.core.raster.RasterBufferAdapter;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

/**
 * OCR 前的图像预处理
 * <p>
 * 灰度 → 3x3 高斯模糊去噪 → 自适应阈值二值化（应对截图中明暗不均的背景）
 */
@Component
public class OcrPreprocessor {

    private static final Size BLUR_KERNEL = new Size(3, 3);
    private static final int THRESHOLD_BLOCK_SIZE = 11;
    private static final double THRESHOLD_C = 2;

    /**
     * @return 单通道二值图（新对象，输入不变）
     */
    public RasterBuffer preprocess(RasterBuffer image) {
        Mat gray = RasterBufferAdapter.toGray(image.getMat());
        Mat blurred = new Mat();
        Mat binary = new Mat();
        try {
            Imgproc.GaussianBlur(gray, blurred, BLUR_KERNEL, 0);
            Imgproc.adaptiveThreshold(blurred, binary, 255,
                Imgproc.ADAPTIVE_THRESH_GAUSSIAN_C, Imgproc.THRESH_BINARY,
                THRESHOLD_BLOCK_SIZE, THRESHOLD_C);
        } catch (RuntimeException e) {
            binary.release();
            throw e;
        } finally {
            gray.release();
            blurred.release();
        }
        return RasterBuffer.wrap(binary);
    }
}
