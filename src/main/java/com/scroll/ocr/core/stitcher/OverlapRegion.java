package com.scroll.ocr.core.stitcher;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 某张输入图与已拼接结果之间检测到的重叠区域，用于运行报告
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OverlapRegion {
    /** 输入序号（从 0 开始） */
    @JsonProperty("image_index")
    private int imageIndex;
    /** 重叠在上方合成图中的起始行 */
    @JsonProperty("y_offset")
    private int offset;
    /** 被去除的重复行数 */
    @JsonProperty("overlap_height")
    private int overlapHeight;
    private double confidence;
}
