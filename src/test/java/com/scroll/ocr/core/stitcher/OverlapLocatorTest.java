package com.scroll.ocr.core.stitcher;

import com.scroll.ocr.core.raster.RasterBuffer;
import com.scroll.ocr.support.TestImages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OverlapLocatorTest {

    private Mat source;
    private RasterBuffer upper;
    private RasterBuffer lower;

    @BeforeAll
    static void loadOpenCv() {
        TestImages.loadOpenCv();
    }

    @BeforeEach
    void setUp() {
        // 700 行的长图切成两帧：[0, 400) 和 [300, 700)，重叠 100 行
        source = TestImages.texture(42L, 200, 700);
        upper = TestImages.strip(source, 0, 400);
        lower = TestImages.strip(source, 300, 700);
    }

    @AfterEach
    void tearDown() {
        source.release();
        upper.release();
        lower.release();
    }

    @Test
    void locatesExactOffsetOfSharedContent() {
        OverlapLocator locator = new OverlapLocator(StitchConfiguration.defaults());

        OverlapResult result = locator.locate(upper, lower);

        assertThat(result.isFound()).isTrue();
        assertThat(result.getOffset()).isEqualTo(300);
        assertThat(result.getConfidence()).isGreaterThan(0.99).isLessThanOrEqualTo(1.0);
    }

    @Test
    void offsetWithoutRefinementFollowsSweptOverlapSize() {
        StitchConfiguration configuration = StitchConfiguration.builder()
            .refineWithMatchLocation(false)
            .build();

        OverlapResult result = new OverlapLocator(configuration).locate(upper, lower);

        // 只有不超过真实重叠高度的候选能完全匹配，offset = h1 - s
        assertThat(result.isFound()).isTrue();
        assertThat(result.getOffset()).isBetween(300, 360);
        assertThat((400 - result.getOffset()) % 10).isZero();
    }

    @Test
    void unrelatedImagesAreNotMatched() {
        Mat other = TestImages.texture(7L, 200, 400);
        RasterBuffer unrelated = TestImages.strip(other, 0, 400);
        try {
            OverlapResult result = new OverlapLocator(StitchConfiguration.defaults()).locate(upper, unrelated);

            assertThat(result.isFound()).isFalse();
            assertThatThrownBy(result::getOffset).isInstanceOf(IllegalStateException.class);
        } finally {
            other.release();
            unrelated.release();
        }
    }

    @Test
    void thresholdAboveBestScoreRejectsMatch() {
        Mat other = TestImages.texture(7L, 200, 400);
        RasterBuffer unrelated = TestImages.strip(other, 0, 400);
        try {
            OverlapLocator locator = new OverlapLocator(StitchConfiguration.defaults());

            assertThat(locator.locate(upper, unrelated, 0.5, -1.0).isFound()).isTrue();
            assertThat(locator.locate(upper, lower, 0.5, 1.01).isFound()).isFalse();
        } finally {
            other.release();
            unrelated.release();
        }
    }

    @Test
    void tooShortImagesReturnNotFound() {
        RasterBuffer a = RasterBuffer.wrap(new Mat(1, 50, CvType.CV_8UC1));
        RasterBuffer b = RasterBuffer.wrap(new Mat(1, 50, CvType.CV_8UC1));
        try {
            OverlapResult result = new OverlapLocator(StitchConfiguration.defaults()).locate(a, b);

            assertThat(result.isFound()).isFalse();
        } finally {
            a.release();
            b.release();
        }
    }

    @Test
    void narrowerLowerImageIsStretchedBeforeMatching() {
        RasterBuffer narrow = TestImages.resized(lower, 160);
        try {
            OverlapResult result = new OverlapLocator(StitchConfiguration.defaults()).locate(upper, narrow);

            assertThat(result.isFound()).isTrue();
            assertThat(result.getOffset()).isCloseTo(300, within(3));
        } finally {
            narrow.release();
        }
    }

    @Test
    void colorInputsAreMatchedOnLuminance() {
        Mat color = TestImages.colorTexture(42L, 200, 700);
        RasterBuffer colorUpper = TestImages.strip(color, 0, 400);
        RasterBuffer colorLower = TestImages.strip(color, 300, 700);
        try {
            OverlapResult result = new OverlapLocator(StitchConfiguration.defaults()).locate(colorUpper, colorLower);

            assertThat(result.isFound()).isTrue();
            assertThat(result.getOffset()).isEqualTo(300);
        } finally {
            color.release();
            colorUpper.release();
            colorLower.release();
        }
    }

    @Test
    void parallelSweepAgreesWithSequentialSweep() {
        OverlapResult sequential = new OverlapLocator(StitchConfiguration.defaults()).locate(upper, lower);
        OverlapResult parallel = new OverlapLocator(StitchConfiguration.builder().parallelSweep(true).build())
            .locate(upper, lower);

        assertThat(parallel.isFound()).isEqualTo(sequential.isFound());
        assertThat(parallel.getOffset()).isEqualTo(sequential.getOffset());
        assertThat(parallel.getConfidence()).isEqualTo(sequential.getConfidence());
    }

    @Test
    void enforcedSearchRegionCapsCandidateOverlap() {
        StitchConfiguration configuration = StitchConfiguration.builder()
            .enforceSearchRegion(true)
            .searchRegionFraction(0.05)
            .build();

        // 0.05 * 400 = 20 行，小于最小重叠 40 行
        assertThat(new OverlapLocator(configuration).locate(upper, lower).isFound()).isFalse();
        assertThat(new OverlapLocator(StitchConfiguration.defaults()).locate(upper, lower).isFound()).isTrue();
    }

    @Test
    void finerSweepStepStillFindsSameOffset() {
        StitchConfiguration configuration = StitchConfiguration.builder().sweepStep(1).build();

        OverlapResult result = new OverlapLocator(configuration).locate(upper, lower);

        assertThat(result.getOffset()).isEqualTo(300);
    }
}
