package com.scroll.ocr.core.stitcher;

import com.scroll.ocr.core.raster.RasterBuffer;
import com.scroll.ocr.support.TestImages;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;

import static org.assertj.core.api.Assertions.assertThat;

class PairwiseStitcherTest {

    private final PairwiseStitcher stitcher = new PairwiseStitcher(new OverlapLocator(StitchConfiguration.defaults()));

    @BeforeAll
    static void loadOpenCv() {
        TestImages.loadOpenCv();
    }

    @Test
    void overlappingFramesReconstructSource() {
        Mat source = TestImages.texture(11L, 200, 700);
        RasterBuffer upper = TestImages.strip(source, 0, 400);
        RasterBuffer lower = TestImages.strip(source, 300, 700);

        PairwiseStitcher.PairwiseStitch step = stitcher.stitchWithOverlap(upper, lower);
        RasterBuffer merged = step.getBuffer();

        assertThat(step.getOverlap().isFound()).isTrue();
        assertThat(merged.getWidth()).isEqualTo(200);
        assertThat(merged.getHeight()).isEqualTo(700);
        assertThat(TestImages.maxDifference(merged.getMat(), source)).isZero();

        merged.release();
        upper.release();
        lower.release();
        source.release();
    }

    @Test
    void unrelatedFramesAreConcatenated() {
        Mat a = TestImages.texture(1L, 200, 100);
        Mat b = TestImages.texture(2L, 200, 120);
        RasterBuffer upper = RasterBuffer.wrap(a);
        RasterBuffer lower = RasterBuffer.wrap(b);

        RasterBuffer merged = stitcher.stitch(upper, lower);

        assertThat(merged.getHeight()).isEqualTo(220);
        assertThat(merged.getWidth()).isEqualTo(200);
        // 输入保持不变
        assertThat(upper.getHeight()).isEqualTo(100);
        assertThat(lower.getHeight()).isEqualTo(120);

        merged.release();
        upper.release();
        lower.release();
    }

    @Test
    void narrowerFrameIsStretchedToWiderWidth() {
        RasterBuffer upper = RasterBuffer.wrap(TestImages.texture(3L, 150, 100));
        RasterBuffer lower = RasterBuffer.wrap(TestImages.texture(4L, 200, 100));

        RasterBuffer merged = stitcher.stitch(upper, lower);

        assertThat(merged.getWidth()).isEqualTo(200);
        assertThat(merged.getHeight()).isEqualTo(200);

        merged.release();
        upper.release();
        lower.release();
    }

    @Test
    void grayAndColorFramesProduceColorOutput() {
        RasterBuffer upper = RasterBuffer.wrap(TestImages.texture(5L, 120, 80));
        RasterBuffer lower = RasterBuffer.wrap(TestImages.colorTexture(6L, 120, 80));

        RasterBuffer merged = stitcher.stitch(upper, lower);

        assertThat(merged.getChannels()).isEqualTo(3);
        assertThat(merged.getHeight()).isEqualTo(160);

        merged.release();
        upper.release();
        lower.release();
    }

    @Test
    void zeroOffsetKeepsOnlyLowerFrame() {
        RasterBuffer upper = RasterBuffer.wrap(TestImages.texture(8L, 100, 60));
        RasterBuffer lower = RasterBuffer.wrap(TestImages.texture(9L, 100, 90));

        RasterBuffer merged = stitcher.merge(upper, lower, OverlapResult.found(0, 0.95));

        assertThat(merged.getHeight()).isEqualTo(90);
        assertThat(TestImages.maxDifference(merged.getMat(), lower.getMat())).isZero();

        merged.release();
        upper.release();
        lower.release();
    }

    @Test
    void mergeKeepsUpperRowsAboveOffset() {
        RasterBuffer upper = RasterBuffer.wrap(TestImages.texture(10L, 100, 60));
        RasterBuffer lower = RasterBuffer.wrap(TestImages.texture(12L, 100, 50));

        RasterBuffer merged = stitcher.merge(upper, lower, OverlapResult.found(25, 0.9));

        assertThat(merged.getHeight()).isEqualTo(75);

        merged.release();
        upper.release();
        lower.release();
    }
}
