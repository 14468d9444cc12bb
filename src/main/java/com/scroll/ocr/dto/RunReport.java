package com.scroll.ocr.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scroll.ocr.core.stitcher.OverlapRegion;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 一次运行的 JSON 报告
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunReport {
    private Instant startedAt;
    private Instant finishedAt;
    private List<String> inputImages = new ArrayList<>();
    private List<String> skippedImages = new ArrayList<>();
    private int mergedCount;
    private int width;
    private int height;
    private double overlapThreshold;
    private List<OverlapRegion> overlapRegions = new ArrayList<>();
    private String outputImage;       // text-only 模式下为空
    private String outputText;
    private String language;
    private boolean preprocessed;
    private int characterCount;
    private Boolean chatDetected;     // 未开启 --chat 时为空
    private Integer messageCount;
    private List<String> participants;
}
