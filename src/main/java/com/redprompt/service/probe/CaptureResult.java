package com.redprompt.service.probe;

/**
 * 一次响应抓取的结果。
 */
public final class CaptureResult {

    public enum Outcome {
        /** 文本在稳定窗口内未变化 */
        STABLE,
        /** 等待预算耗尽，返回最后一次看到的（可能未完成的）文本 */
        PARTIAL,
        /** 从未捕获到消息元素，从文档可见文本中兜底提取 */
        SALVAGED,
        /** 什么都没拿到 */
        NONE
    }

    private final Outcome outcome;
    private final String text;
    private final long elapsedMs;

    private CaptureResult(Outcome outcome, String text, long elapsedMs) {
        this.outcome = outcome;
        this.text = text;
        this.elapsedMs = elapsedMs;
    }

    public static CaptureResult of(Outcome outcome, String text, long elapsedMs) {
        if (outcome != Outcome.NONE && (text == null || text.isEmpty())) {
            throw new IllegalArgumentException(outcome + " capture requires text");
        }
        return new CaptureResult(outcome, outcome == Outcome.NONE ? null : text, elapsedMs);
    }

    public static CaptureResult none(long elapsedMs) {
        return new CaptureResult(Outcome.NONE, null, elapsedMs);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getText() {
        return text;
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    @Override
    public String toString() {
        return "CaptureResult{" + outcome + ", elapsedMs=" + elapsedMs + "}";
    }
}
