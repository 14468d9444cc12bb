package com.scroll.ocr.core.stitcher;

import lombok.Getter;
import lombok.ToString;

/**
 * 拼接引擎参数（构造后不可变）
 * <p>
 * 在引擎创建时一次性传入，每次拼接都使用同一份值，不依赖任何全局默认状态。
 */
@Getter
@ToString
public final class StitchConfiguration {
    public static final double DEFAULT_OVERLAP_THRESHOLD = 0.80;
    public static final double DEFAULT_SEARCH_REGION_FRACTION = 0.5;
    public static final int DEFAULT_SWEEP_STEP = 10;
    public static final int DEFAULT_SEARCH_MARGIN = 100;
    public static final double DEFAULT_MIN_OVERLAP_RATIO = 0.1;
    public static final double DEFAULT_MAX_OVERLAP_RATIO = 0.9;

    /** 判定存在重叠所需的最低匹配置信度 [0,1] */
    private final double overlapThreshold;
    /** 上图底部参与搜索的比例 (0,1]，仅在 enforceSearchRegion 时生效 */
    private final double searchRegionFraction;
    private final boolean enforceSearchRegion;
    /** 重叠高度扫描步长（行） */
    private final int sweepStep;
    /** 下图搜索窗口在候选重叠高度之外额外多取的行数 */
    private final int searchMargin;
    private final double minOverlapRatio;
    private final double maxOverlapRatio;
    private final boolean parallelSweep;
    /** 用匹配位置修正步长带来的偏差 */
    private final boolean refineWithMatchLocation;

    private StitchConfiguration(Builder builder) {
        if (builder.overlapThreshold < 0.0 || builder.overlapThreshold > 1.0) {
            throw new IllegalArgumentException("overlapThreshold must be within [0, 1]: " + builder.overlapThreshold);
        }
        if (builder.searchRegionFraction <= 0.0 || builder.searchRegionFraction > 1.0) {
            throw new IllegalArgumentException("searchRegionFraction must be within (0, 1]: " + builder.searchRegionFraction);
        }
        if (builder.sweepStep < 1) {
            throw new IllegalArgumentException("sweepStep must be >= 1: " + builder.sweepStep);
        }
        if (builder.searchMargin < 0) {
            throw new IllegalArgumentException("searchMargin must be >= 0: " + builder.searchMargin);
        }
        if (builder.minOverlapRatio < 0.0 || builder.maxOverlapRatio > 1.0
            || builder.minOverlapRatio > builder.maxOverlapRatio) {
            throw new IllegalArgumentException("Invalid overlap ratio range: ["
                + builder.minOverlapRatio + ", " + builder.maxOverlapRatio + "]");
        }
        this.overlapThreshold = builder.overlapThreshold;
        this.searchRegionFraction = builder.searchRegionFraction;
        this.enforceSearchRegion = builder.enforceSearchRegion;
        this.sweepStep = builder.sweepStep;
        this.searchMargin = builder.searchMargin;
        this.minOverlapRatio = builder.minOverlapRatio;
        this.maxOverlapRatio = builder.maxOverlapRatio;
        this.parallelSweep = builder.parallelSweep;
        this.refineWithMatchLocation = builder.refineWithMatchLocation;
    }

    public static StitchConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 以当前配置为基础复制一份 Builder（用于命令行覆盖个别参数）
     */
    public Builder toBuilder() {
        return new Builder()
            .overlapThreshold(overlapThreshold)
            .searchRegionFraction(searchRegionFraction)
            .enforceSearchRegion(enforceSearchRegion)
            .sweepStep(sweepStep)
            .searchMargin(searchMargin)
            .minOverlapRatio(minOverlapRatio)
            .maxOverlapRatio(maxOverlapRatio)
            .parallelSweep(parallelSweep)
            .refineWithMatchLocation(refineWithMatchLocation);
    }

    public static final class Builder {
        private double overlapThreshold = DEFAULT_OVERLAP_THRESHOLD;
        private double searchRegionFraction = DEFAULT_SEARCH_REGION_FRACTION;
        private boolean enforceSearchRegion = false;
        private int sweepStep = DEFAULT_SWEEP_STEP;
        private int searchMargin = DEFAULT_SEARCH_MARGIN;
        private double minOverlapRatio = DEFAULT_MIN_OVERLAP_RATIO;
        private double maxOverlapRatio = DEFAULT_MAX_OVERLAP_RATIO;
        private boolean parallelSweep = false;
        private boolean refineWithMatchLocation = true;

        private Builder() {
        }

        public Builder overlapThreshold(double overlapThreshold) {
            this.overlapThreshold = overlapThreshold;
            return this;
        }

        public Builder searchRegionFraction(double searchRegionFraction) {
            this.searchRegionFraction = searchRegionFraction;
            return this;
        }

        public Builder enforceSearchRegion(boolean enforceSearchRegion) {
            this.enforceSearchRegion = enforceSearchRegion;
            return this;
        }

        public Builder sweepStep(int sweepStep) {
            this.sweepStep = sweepStep;
            return this;
        }

        public Builder searchMargin(int searchMargin) {
            this.searchMargin = searchMargin;
            return this;
        }

        public Builder minOverlapRatio(double minOverlapRatio) {
            this.minOverlapRatio = minOverlapRatio;
            return this;
        }

        public Builder maxOverlapRatio(double maxOverlapRatio) {
            this.maxOverlapRatio = maxOverlapRatio;
            return this;
        }

        public Builder parallelSweep(boolean parallelSweep) {
            this.parallelSweep = parallelSweep;
            return this;
        }

        public Builder refineWithMatchLocation(boolean refineWithMatchLocation) {
            this.refineWithMatchLocation = refineWithMatchLocation;
            return this;
        }

        public StitchConfiguration build() {
            return new StitchConfiguration(this);
        }
    }
}
