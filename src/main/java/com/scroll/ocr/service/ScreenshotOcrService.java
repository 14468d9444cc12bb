package com.scroll.ocr.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scroll.ocr.core.chat.ChatDetector;
import com.scroll.ocr.core.chat.ChatProcessingResult;
import com.scroll.ocr.core.ocr.OcrEngine;
import com.scroll.ocr.core.ocr.OcrPreprocessor;
import com.scroll.ocr.core.raster.RasterBuffer;
import com.scroll.ocr.core.raster.RasterBufferAdapter;
import com.scroll.ocr.core.stitcher.OverlapLocator;
import com.scroll.ocr.core.stitcher.PairwiseStitcher;
import com.scroll.ocr.core.stitcher.SequentialStitchPipeline;
import com.scroll.ocr.core.stitcher.StitchConfiguration;
import com.scroll.ocr.core.stitcher.StitchResult;
import com.scroll.ocr.dto.RunReport;
import com.scroll.ocr.exception.InputNotAFileException;
import com.scroll.ocr.exception.InputNotFoundException;
import com.scroll.ocr.exception.NoTextExtractedException;
import com.scroll.ocr.exception.ScrollOcrException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 截图拼接 + OCR 的各个步骤
 * <p>
 * 步骤之间的编排和控制台输出由命令行层负责，这里只做实际工作。
 */
@Service
public class ScreenshotOcrService {
    private static final Logger logger = LoggerFactory.getLogger(ScreenshotOcrService.class);

    @Autowired
    private RasterBufferAdapter adapter;

    @Autowired
    private StitchConfiguration defaultConfiguration;

    @Autowired
    private OcrEngine ocrEngine;

    @Autowired
    private OcrPreprocessor preprocessor;

    @Autowired
    private ChatDetector chatDetector;

    @Autowired
    private ObjectMapper objectMapper;

    /**
     * 检查所有输入都存在且是普通文件
     *
     * @throws InputNotFoundException 文件不存在
     * @throws InputNotAFileException 路径不是文件
     */
    public List<Path> validateImages(List<Path> images) {
        List<Path> validated = new ArrayList<>(images.size());
        for (Path path : images) {
            if (!Files.exists(path)) {
                throw new InputNotFoundException(path);
            }
            if (!Files.isRegularFile(path)) {
                throw new InputNotAFileException(path);
            }
            validated.add(path);
        }
        return validated;
    }

    /**
     * 在默认配置上叠加本次运行的覆盖项
     *
     * @param overlapThreshold 为空时沿用默认值
     * @param sweepStep        为空时沿用默认值
     */
    public StitchConfiguration resolveConfiguration(Double overlapThreshold, Integer sweepStep) {
        StitchConfiguration.Builder builder = defaultConfiguration.toBuilder();
        if (overlapThreshold != null) {
            builder.overlapThreshold(overlapThreshold);
        }
        if (sweepStep != null) {
            builder.sweepStep(sweepStep);
        }
        return builder.build();
    }

    public StitchResult stitch(List<Path> images, StitchConfiguration configuration) {
        SequentialStitchPipeline pipeline = new SequentialStitchPipeline(adapter,
            new PairwiseStitcher(new OverlapLocator(configuration)));
        return pipeline.stitchAll(images);
    }

    public void saveImage(RasterBuffer image, Path output) {
        adapter.save(image, output);
        logger.info("Stitched image saved to: {}", output);
    }

    /**
     * 识别文字
     *
     * @throws NoTextExtractedException 识别结果为空白
     */
    public String extractText(RasterBuffer image, String language, boolean preprocess) {
        String text;
        if (preprocess) {
            RasterBuffer prepared = preprocessor.preprocess(image);
            try {
                text = ocrEngine.extractText(prepared, language);
            } finally {
                prepared.release();
            }
        } else {
            text = ocrEngine.extractText(image, language);
        }

        if (text == null || text.isBlank()) {
            throw new NoTextExtractedException();
        }
        logger.info("Extracted {} characters (lang: {}, preprocess: {})", text.length(), language, preprocess);
        return text;
    }

    public ChatProcessingResult processChat(String text) {
        return chatDetector.processText(text);
    }

    public void saveText(String text, Path output) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, text, StandardCharsets.UTF_8);
            logger.info("Text saved to: {}", output);
        } catch (IOException e) {
            throw new ScrollOcrException("Could not write text: " + output, e);
        }
    }

    public void writeReport(RunReport report, Path output) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(output.toFile(), report);
            logger.info("Run report saved to: {}", output);
        } catch (IOException e) {
            throw new ScrollOcrException("Could not write report: " + output, e);
        }
    }
}
