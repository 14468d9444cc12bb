package com.scroll.ocr.config;

import com.scroll.ocr.core.stitcher.StitchConfiguration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "scroll-ocr")
public class ScrollOcrConfig {
    private StitchingConfig stitching = new StitchingConfig();
    private OcrConfig ocr = new OcrConfig();
    private OutputConfig output = new OutputConfig();

    @Data
    public static class StitchingConfig {
        private double overlapThreshold = StitchConfiguration.DEFAULT_OVERLAP_THRESHOLD;
        private double searchRegionFraction = StitchConfiguration.DEFAULT_SEARCH_REGION_FRACTION;
        // 开启后用 searchRegionFraction 限制最大候选重叠高度
        private boolean enforceSearchRegion = false;
        private int sweepStep = StitchConfiguration.DEFAULT_SWEEP_STEP;
        private int searchMargin = StitchConfiguration.DEFAULT_SEARCH_MARGIN;
        private double minOverlapRatio = StitchConfiguration.DEFAULT_MIN_OVERLAP_RATIO;
        private double maxOverlapRatio = StitchConfiguration.DEFAULT_MAX_OVERLAP_RATIO;
        private boolean parallelSweep = false;
        private boolean refineWithMatchLocation = true;
    }

    @Data
    public static class OcrConfig {
        private String language = "eng";
        private String datapath;          // tessdata 目录，空则读 TESSDATA_PREFIX
        private int pageSegMode = 6;      // 单一文本块
        private int engineMode = 3;       // 默认引擎
        private boolean preprocess = true;
    }

    @Data
    public static class OutputConfig {
        private String image = "stitched_output.png";
        private String text = "extracted_text.txt";
        private int previewLength = 500;
    }

    /**
     * 转为不可变的拼接配置
     */
    public StitchConfiguration toStitchConfiguration() {
        return StitchConfiguration.builder()
            .overlapThreshold(stitching.getOverlapThreshold())
            .searchRegionFraction(stitching.getSearchRegionFraction())
            .enforceSearchRegion(stitching.isEnforceSearchRegion())
            .sweepStep(stitching.getSweepStep())
            .searchMargin(stitching.getSearchMargin())
            .minOverlapRatio(stitching.getMinOverlapRatio())
            .maxOverlapRatio(stitching.getMaxOverlapRatio())
            .parallelSweep(stitching.isParallelSweep())
            .refineWithMatchLocation(stitching.isRefineWithMatchLocation())
            .build();
    }
}
