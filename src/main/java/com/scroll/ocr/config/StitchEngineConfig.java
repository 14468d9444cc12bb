package com.scroll.ocr.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.scroll.ocr.core.ocr.OcrEngine;
import com.scroll.ocr.core.ocr.TesseractOcrEngine;
import com.scroll.ocr.core.raster.RasterBufferAdapter;
import com.scroll.ocr.core.stitcher.StitchConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 引擎装配
 * <p>
 * 拼接引擎本身不依赖 Spring，这里只负责把 yml 配置转成不可变的 {@link StitchConfiguration}。
 */
@Configuration
public class StitchEngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(StitchEngineConfig.class);

    static {
        NativeLibraryLoader.loadNativeLibraries();
    }

    @Bean
    public StitchConfiguration stitchConfiguration(ScrollOcrConfig config) {
        StitchConfiguration configuration = config.toStitchConfiguration();
        logger.info("Stitch configuration: {}", configuration);
        return configuration;
    }

    @Bean
    public OcrEngine ocrEngine(ScrollOcrConfig config, RasterBufferAdapter adapter) {
        ScrollOcrConfig.OcrConfig ocr = config.getOcr();
        return new TesseractOcrEngine(adapter, ocr.getDatapath(), ocr.getPageSegMode(), ocr.getEngineMode());
    }

    @Bean
    public ObjectMapper reportObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        return objectMapper;
    }
}
