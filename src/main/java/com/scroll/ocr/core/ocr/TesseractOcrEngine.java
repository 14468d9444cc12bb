package com.scroll.ocr.core.ocr;

import com.scroll.ocr.core.raster.RasterBuffer;
import com.scroll.ocr.core.raster.RasterBufferAdapter;
import com.scroll.ocr.exception.OcrException;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import net.sourceforge.tess4j.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于 Tesseract（Tess4J）的 OCR 实现
 * <p>
 * Tesseract 实例不是线程安全的，每次调用新建一个。
 */
public class TesseractOcrEngine implements OcrEngine {
    private static final Logger logger = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final RasterBufferAdapter adapter;
    private final String datapath;
    private final int pageSegMode;
    private final int engineMode;

    /**
     * @param datapath    tessdata 目录，为空时依次尝试 TESSDATA_PREFIX 环境变量和 Tess4J 默认值
     * @param pageSegMode 页面分割模式，默认 6（单一文本块）
     * @param engineMode  引擎模式，默认 3（自动）
     */
    public TesseractOcrEngine(RasterBufferAdapter adapter, String datapath, int pageSegMode, int engineMode) {
        this.adapter = adapter;
        this.datapath = resolveDatapath(datapath);
        this.pageSegMode = pageSegMode;
        this.engineMode = engineMode;
        logger.info("Tesseract engine configured - datapath: {}, psm: {}, oem: {}",
            this.datapath == null ? "(default)" : this.datapath, pageSegMode, engineMode);
    }

    @Override
    public String extractText(RasterBuffer image, String language) {
        ITesseract tesseract = newTesseract(language);
        try {
            String text = tesseract.doOCR(toImage(image));
            return text == null ? "" : text.trim();
        } catch (TesseractException e) {
            throw new OcrException("Tesseract failed to extract text: " + e.getMessage(), e);
        }
    }

    @Override
    public List<TextBlock> extractTextBlocks(RasterBuffer image, String language) {
        ITesseract tesseract = newTesseract(language);
        List<Word> words = tesseract.getWords(toImage(image), ITessAPI.TessPageIteratorLevel.RIL_WORD);
        return toTextBlocks(words);
    }

    @Override
    public StructuredText extractStructuredText(RasterBuffer image, String language) {
        ITesseract tesseract = newTesseract(language);
        BufferedImage bufferedImage = toImage(image);
        try {
            List<Rectangle> blocks = tesseract.getSegmentedRegions(bufferedImage, ITessAPI.TessPageIteratorLevel.RIL_BLOCK);
            List<Rectangle> paragraphs = tesseract.getSegmentedRegions(bufferedImage, ITessAPI.TessPageIteratorLevel.RIL_PARA);
            List<Rectangle> lines = tesseract.getSegmentedRegions(bufferedImage, ITessAPI.TessPageIteratorLevel.RIL_TEXTLINE);
            List<TextBlock> words = toTextBlocks(
                tesseract.getWords(bufferedImage, ITessAPI.TessPageIteratorLevel.RIL_WORD));
            String fullText = tesseract.doOCR(bufferedImage);
            return StructuredTextBuilder.build(blocks, paragraphs, lines, words, fullText);
        } catch (TesseractException e) {
            throw new OcrException("Tesseract failed to analyse layout: " + e.getMessage(), e);
        }
    }

    static List<TextBlock> toTextBlocks(List<Word> words) {
        List<TextBlock> blocks = new ArrayList<>();
        if (words == null) {
            return blocks;
        }
        for (Word word : words) {
            String text = word.getText() == null ? "" : word.getText().trim();
            if (text.isEmpty() || word.getConfidence() <= 0) {
                continue;
            }
            Rectangle box = word.getBoundingBox();
            blocks.add(new TextBlock(text, box.x, box.y, box.width, box.height, word.getConfidence()));
        }
        return blocks;
    }

    private ITesseract newTesseract(String language) {
        Tesseract tesseract = new Tesseract();
        if (datapath != null) {
            tesseract.setDatapath(datapath);
        }
        tesseract.setLanguage(language);
        tesseract.setPageSegMode(pageSegMode);
        tesseract.setOcrEngineMode(engineMode);
        return tesseract;
    }

    private BufferedImage toImage(RasterBuffer image) {
        try {
            return adapter.toBufferedImage(image);
        } catch (IOException e) {
            throw new OcrException("Failed to prepare image for OCR", e);
        }
    }

    private static String resolveDatapath(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String env = System.getenv("TESSDATA_PREFIX");
        if (env != null && !env.isBlank()) {
            return env;
        }
        return null;
    }
}
