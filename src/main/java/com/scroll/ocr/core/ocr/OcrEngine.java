package com.scroll.ocr.core.ocr;

import com.scroll.ocr.core.raster.RasterBuffer;

import java.util.List;

/**
 * OCR 引擎接口
 * <p>
 * 输入一张（通常已预处理的）图像和语言代码，输出文字。
 */
public interface OcrEngine {

    /**
     * 识别整张图的纯文本
     *
     * @param image    要识别的图像
     * @param language 语言代码，例如 "eng"、"chi_sim"、"eng+fra"
     * @return 去掉首尾空白的文本，可能为空串但不为 null
     */
    String extractText(RasterBuffer image, String language);

    /**
     * 识别词级文字框，按扫描顺序（自上而下、行内自左向右）返回。
     * 空文本和置信度不大于 0 的结果被丢弃。
     */
    List<TextBlock> extractTextBlocks(RasterBuffer image, String language);

    /**
     * 识别带块/段落/行层级的结构化结果
     */
    StructuredText extractStructuredText(RasterBuffer image, String language);
}
