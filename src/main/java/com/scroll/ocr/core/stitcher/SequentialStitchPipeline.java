package com.scroll.ocr.core.stitcher;

import com.scroll.ocr.core.raster.RasterBuffer;
import com.scroll.ocr.core.raster.RasterBufferAdapter;
import com.scroll.ocr.exception.EmptyInputException;
import com.scroll.ocr.exception.ImageDecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 顺序拼接流水线
 * <p>
 * 以第一张图为初始合成图，依次把后续图片拼接上去。每一步依赖上一步的结果，严格串行。
 * 第一张图读取失败直接抛出；之后的图片读取失败只记录警告并跳过。
 */
public class SequentialStitchPipeline implements StitchStrategy {
    private static final Logger logger = LoggerFactory.getLogger(SequentialStitchPipeline.class);

    private final RasterBufferAdapter adapter;
    private final PairwiseStitcher stitcher;

    public SequentialStitchPipeline(RasterBufferAdapter adapter, PairwiseStitcher stitcher) {
        this.adapter = adapter;
        this.stitcher = stitcher;
    }

    /**
     * 按路径顺序读取并拼接
     *
     * @param paths 自上而下的截图路径
     * @throws EmptyInputException   paths 为空
     * @throws ImageDecodeException 第一张图无法读取
     */
    public StitchResult stitchAll(List<Path> paths) {
        if (paths == null || paths.isEmpty()) {
            throw new EmptyInputException();
        }

        if (paths.size() == 1) {
            RasterBuffer single = adapter.load(paths.get(0));
            return new StitchResult(single, new ArrayList<>(), 1, new ArrayList<>());
        }

        logger.info("Stitching {} images...", paths.size());

        RasterBuffer composite = adapter.load(paths.get(0));
        logger.info("Loaded image 1: {}", paths.get(0));

        List<OverlapRegion> regions = new ArrayList<>();
        List<Path> skipped = new ArrayList<>();
        int merged = 1;

        for (int i = 1; i < paths.size(); i++) {
            Path path = paths.get(i);
            RasterBuffer next;
            try {
                next = adapter.load(path);
            } catch (ImageDecodeException e) {
                logger.warn("Could not read image: {}, skipping", path);
                skipped.add(path);
                continue;
            }

            logger.info("Stitching image {}: {}", i + 1, path);
            RasterBuffer previous = composite;
            try {
                composite = stitchStep(previous, next, i, regions);
            } finally {
                previous.release();
                next.release();
            }
            merged++;
        }

        logger.info("Final stitched image size: {}x{}", composite.getWidth(), composite.getHeight());
        return new StitchResult(composite, regions, merged, skipped);
    }

    /**
     * 拼接已解码的图像；输入的所有权仍归调用方
     */
    @Override
    public StitchResult stitch(List<RasterBuffer> frames) {
        if (frames == null || frames.isEmpty()) {
            throw new EmptyInputException();
        }
        if (frames.size() == 1) {
            return new StitchResult(RasterBuffer.copyOf(frames.get(0).getMat()), new ArrayList<>(), 1, new ArrayList<>());
        }

        List<OverlapRegion> regions = new ArrayList<>();
        RasterBuffer composite = frames.get(0);
        for (int i = 1; i < frames.size(); i++) {
            RasterBuffer previous = composite;
            composite = stitchStep(previous, frames.get(i), i, regions);
            // 中间结果由本方法创建，可以释放；frames[0] 属于调用方
            if (previous != frames.get(0)) {
                previous.release();
            }
        }
        return new StitchResult(composite, regions, frames.size(), new ArrayList<>());
    }

    private RasterBuffer stitchStep(RasterBuffer composite, RasterBuffer next, int index, List<OverlapRegion> regions) {
        PairwiseStitcher.PairwiseStitch step = stitcher.stitchWithOverlap(composite, next);
        OverlapResult overlap = step.getOverlap();
        if (overlap.isFound()) {
            regions.add(new OverlapRegion(index, overlap.getOffset(),
                composite.getHeight() - overlap.getOffset(), overlap.getConfidence()));
        }
        return step.getBuffer();
    }

    public PairwiseStitcher getStitcher() {
        return stitcher;
    }
}
