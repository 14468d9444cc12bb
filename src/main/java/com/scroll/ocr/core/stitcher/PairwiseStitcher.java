package com.scroll.ocr.core.stitcher;

import com.scroll.ocr.core.raster.RasterBuffer;
import com.scroll.ocr.core.raster.RasterBufferAdapter;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 两张图的垂直拼接
 * <p>
 * 找到重叠时保留上图 [0, offset) 行 + 下图全部行（重复区域以下图为准）；
 * 未找到时上下直接拼接。宽度不一致时把较窄的一张拉伸到较宽的宽度（拉伸而非裁剪）。
 * <p>
 * 输出宽度 = max(w1, w2)，高度 = offset + h2 或 h1 + h2。输入不会被修改。
 */
public class PairwiseStitcher {
    private static final Logger logger = LoggerFactory.getLogger(PairwiseStitcher.class);

    private final OverlapLocator overlapLocator;

    public PairwiseStitcher(OverlapLocator overlapLocator) {
        this.overlapLocator = overlapLocator;
    }

    public RasterBuffer stitch(RasterBuffer upper, RasterBuffer lower) {
        return stitchWithOverlap(upper, lower).getBuffer();
    }

    /**
     * 拼接并返回本次使用的重叠检测结果
     */
    public PairwiseStitch stitchWithOverlap(RasterBuffer upper, RasterBuffer lower) {
        OverlapResult overlap = overlapLocator.locate(upper, lower);
        return new PairwiseStitch(merge(upper, lower, overlap), overlap);
    }

    /**
     * 按给定重叠结果合并
     */
    public RasterBuffer merge(RasterBuffer upper, RasterBuffer lower, OverlapResult overlap) {
        int width = Math.max(upper.getWidth(), lower.getWidth());
        boolean color = upper.getChannels() == 3 || lower.getChannels() == 3;

        int keepRows = overlap.isFound()
            ? Math.min(overlap.getOffset(), upper.getHeight())
            : upper.getHeight();

        Mat lowerPart = prepare(lower.getMat(), width, color);
        if (keepRows == 0) {
            // 下图完全覆盖上图
            logger.debug("Upper image fully covered by lower image");
            return RasterBuffer.wrap(lowerPart);
        }

        Mat upperView = upper.getMat().rowRange(0, keepRows);
        Mat upperPart = prepare(upperView, width, color);
        upperView.release();

        Mat result = new Mat();
        try {
            List<Mat> parts = new ArrayList<>(2);
            parts.add(upperPart);
            parts.add(lowerPart);
            Core.vconcat(parts, result);
        } finally {
            upperPart.release();
            lowerPart.release();
        }

        logger.debug("Merged {}x{} + {}x{} -> {}x{} (overlap: {})",
            upper.getWidth(), upper.getHeight(), lower.getWidth(), lower.getHeight(),
            result.cols(), result.rows(), overlap);
        return RasterBuffer.wrap(result);
    }

    /**
     * 拉伸到目标宽度并统一通道数，总是返回新 Mat
     */
    private static Mat prepare(Mat src, int width, boolean color) {
        Mat resized = RasterBufferAdapter.resizeToWidth(src, width);
        if (color && resized.channels() != 3) {
            Mat bgr = RasterBufferAdapter.toBgr(resized);
            resized.release();
            return bgr;
        }
        return resized;
    }

    public OverlapLocator getOverlapLocator() {
        return overlapLocator;
    }

    /**
     * 单次拼接结果
     */
    public static class PairwiseStitch {
        private final RasterBuffer buffer;
        private final OverlapResult overlap;

        public PairwiseStitch(RasterBuffer buffer, OverlapResult overlap) {
            this.buffer = buffer;
            this.overlap = overlap;
        }

        public RasterBuffer getBuffer() {
            return buffer;
        }

        public OverlapResult getOverlap() {
            return overlap;
        }
    }
}
