package com.scroll.ocr.core.stitcher;

import com.scroll.ocr.core.raster.RasterBuffer;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * 多图拼接结果
 */
public class StitchResult {
    private final RasterBuffer composite;
    private final List<OverlapRegion> overlapRegions;
    private final int mergedCount;
    private final List<Path> skippedPaths;

    public StitchResult(RasterBuffer composite, List<OverlapRegion> overlapRegions,
                        int mergedCount, List<Path> skippedPaths) {
        this.composite = composite;
        this.overlapRegions = Collections.unmodifiableList(overlapRegions);
        this.mergedCount = mergedCount;
        this.skippedPaths = Collections.unmodifiableList(skippedPaths);
    }

    public RasterBuffer getComposite() {
        return composite;
    }

    public List<OverlapRegion> getOverlapRegions() {
        return overlapRegions;
    }

    /**
     * 实际参与拼接的输入数量（不含跳过的）
     */
    public int getMergedCount() {
        return mergedCount;
    }

    public List<Path> getSkippedPaths() {
        return skippedPaths;
    }

    public int getWidth() {
        return composite.getWidth();
    }

    public int getHeight() {
        return composite.getHeight();
    }
}
