package com.scroll.ocr.core.stitcher;

/**
 * 重叠检测结果：未找到，或找到（偏移量 + 置信度）
 * <p>
 * offset 从上图顶部起算，表示下图中重复内容在上图中开始的那一行，满足 0 <= offset <= height(upper)。
 */
public final class OverlapResult {
    private static final OverlapResult NOT_FOUND = new OverlapResult(false, -1, 0.0);

    private final boolean found;
    private final int offset;
    private final double confidence;

    private OverlapResult(boolean found, int offset, double confidence) {
        this.found = found;
        this.offset = offset;
        this.confidence = confidence;
    }

    public static OverlapResult notFound() {
        return NOT_FOUND;
    }

    public static OverlapResult found(int offset, double confidence) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0: " + offset);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        return new OverlapResult(true, offset, confidence);
    }

    public boolean isFound() {
        return found;
    }

    /**
     * @throws IllegalStateException 未找到重叠时调用
     */
    public int getOffset() {
        if (!found) {
            throw new IllegalStateException("No overlap found");
        }
        return offset;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        if (!found) {
            return "OverlapResult{NotFound}";
        }
        return String.format("OverlapResult{offset=%d, confidence=%.4f}", offset, confidence);
    }
}
