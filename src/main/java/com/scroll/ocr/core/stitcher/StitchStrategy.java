package com.scroll.ocr.core.stitcher;

import com.scroll.ocr.core.raster.RasterBuffer;

import java.util.List;

public interface StitchStrategy {
    /**
     * 按顺序拼接多张已解码的截图
     * @param frames 自上而下排列的图像，调用方保留所有权
     * @return 拼接结果
     */
    StitchResult stitch(List<RasterBuffer> frames);
}
