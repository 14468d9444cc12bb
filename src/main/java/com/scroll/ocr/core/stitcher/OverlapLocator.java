package com.scroll.ocr.core.stitcher;

import com.scroll.ocr.core.raster.RasterBuffer;
import com.scroll.ocr.core.raster.RasterBufferAdapter;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 垂直重叠定位器
 * <p>
 * 上图底部与下图顶部内容重复时，找出重复内容在上图中的起始行。
 * 做法是对一系列候选重叠高度做归一化互相关（TM_CCOEFF_NORMED）模板匹配：
 * <ol>
 *   <li>候选高度 s 从 maxOverlap 递减到 minOverlap，步长 sweepStep</li>
 *   <li>模板 = 上图底部 s 行；搜索窗口 = 下图顶部 min(s + searchMargin, h2) 行</li>
 *   <li>宽度不一致时把较窄的一方拉伸到较宽的宽度</li>
 *   <li>记录达到阈值且严格大于当前最优的得分（同分保留先找到的）</li>
 * </ol>
 * 图像过小（minOverlap >= maxOverlap）时直接返回未找到，不抛异常。
 */
public class OverlapLocator {
    private static final Logger logger = LoggerFactory.getLogger(OverlapLocator.class);

    private final StitchConfiguration configuration;

    public OverlapLocator(StitchConfiguration configuration) {
        this.configuration = configuration;
    }

    /**
     * 使用构造时配置的搜索比例和阈值定位重叠
     */
    public OverlapResult locate(RasterBuffer upper, RasterBuffer lower) {
        return locate(upper, lower, configuration.getSearchRegionFraction(), configuration.getOverlapThreshold());
    }

    /**
     * @param searchRegionFraction 上图底部参与搜索的比例，仅在 enforceSearchRegion 开启时限制最大候选高度
     * @param overlapThreshold     最低置信度
     */
    public OverlapResult locate(RasterBuffer upper, RasterBuffer lower,
                                double searchRegionFraction, double overlapThreshold) {
        int h1 = upper.getHeight();
        int h2 = lower.getHeight();
        int minHeight = Math.min(h1, h2);

        int minOverlap = (int) Math.floor(minHeight * configuration.getMinOverlapRatio());
        int maxOverlap = (int) Math.floor(minHeight * configuration.getMaxOverlapRatio());
        if (configuration.isEnforceSearchRegion()) {
            maxOverlap = Math.min(maxOverlap, (int) Math.floor(h1 * searchRegionFraction));
        }

        if (minOverlap >= maxOverlap) {
            logger.debug("Images too small for overlap search ({} / {} rows)", h1, h2);
            return OverlapResult.notFound();
        }

        List<Integer> candidates = new ArrayList<>();
        for (int s = maxOverlap; s >= minOverlap; s -= configuration.getSweepStep()) {
            if (s > 0) {
                candidates.add(s);
            }
        }

        // 灰度只转一次，每个候选只截取行区间
        Mat upperGray = RasterBufferAdapter.toGray(upper.getMat());
        Mat lowerGray = RasterBufferAdapter.toGray(lower.getMat());
        try {
            List<CandidateScore> scores;
            if (configuration.isParallelSweep()) {
                // parallelStream + collect 保持候选顺序，归约仍按扫描顺序进行
                scores = candidates.parallelStream()
                    .map(s -> evaluate(upperGray, lowerGray, s))
                    .collect(Collectors.toList());
            } else {
                scores = new ArrayList<>(candidates.size());
                for (Integer s : candidates) {
                    scores.add(evaluate(upperGray, lowerGray, s));
                }
            }

            CandidateScore best = null;
            for (CandidateScore score : scores) {
                if (score == null || score.correlation < overlapThreshold) {
                    continue;
                }
                if (best == null || score.correlation > best.correlation) {
                    best = score;
                }
            }

            if (best == null) {
                logger.info("No overlap detected, images will be concatenated");
                return OverlapResult.notFound();
            }

            int offset = h1 - best.overlapSize;
            if (configuration.isRefineWithMatchLocation()) {
                offset -= best.matchY;
            }
            offset = Math.max(0, Math.min(h1, offset));
            double confidence = Math.max(0.0, Math.min(1.0, best.correlation));

            logger.info("Found overlap with confidence: {}% (offset {}, template {} rows, match y {})",
                String.format("%.2f", confidence * 100), offset, best.overlapSize, best.matchY);
            return OverlapResult.found(offset, confidence);
        } finally {
            upperGray.release();
            lowerGray.release();
        }
    }

    /**
     * 计算单个候选重叠高度的最佳匹配；几何不合法时返回 null
     */
    private CandidateScore evaluate(Mat upperGray, Mat lowerGray, int overlapSize) {
        int h1 = upperGray.rows();
        int h2 = lowerGray.rows();
        int windowRows = Math.min(overlapSize + configuration.getSearchMargin(), h2);
        if (overlapSize > h1 || windowRows <= 0) {
            return null;
        }

        Mat templateView = upperGray.rowRange(h1 - overlapSize, h1);
        Mat windowView = lowerGray.rowRange(0, windowRows);
        Mat template = templateView;
        Mat window = windowView;
        Mat result = new Mat();
        try {
            if (upperGray.cols() < lowerGray.cols()) {
                template = RasterBufferAdapter.resizeToWidth(templateView, lowerGray.cols());
            } else if (upperGray.cols() > lowerGray.cols()) {
                window = RasterBufferAdapter.resizeToWidth(windowView, upperGray.cols());
            }

            if (template.rows() > window.rows()) {
                return null;
            }

            Imgproc.matchTemplate(window, template, result, Imgproc.TM_CCOEFF_NORMED);
            Core.MinMaxLocResult minMax = Core.minMaxLoc(result);
            if (Double.isNaN(minMax.maxVal)) {
                return null;
            }
            logger.debug("Overlap candidate {} rows: score {}, y {}", overlapSize,
                String.format("%.4f", minMax.maxVal), (int) minMax.maxLoc.y);
            return new CandidateScore(overlapSize, minMax.maxVal, (int) minMax.maxLoc.y);
        } finally {
            if (template != templateView) {
                template.release();
            }
            if (window != windowView) {
                window.release();
            }
            templateView.release();
            windowView.release();
            result.release();
        }
    }

    public StitchConfiguration getConfiguration() {
        return configuration;
    }

    // 单个候选的得分
    private static class CandidateScore {
        final int overlapSize;
        final double correlation;
        final int matchY;

        CandidateScore(int overlapSize, double correlation, int matchY) {
            this.overlapSize = overlapSize;
            this.correlation = correlation;
            this.matchY = matchY;
        }
    }
}
