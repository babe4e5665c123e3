package com.redprompt.service.probe;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 提交前消息区的位置基线：每个消息 selector 的元素数量与最后一条的文本。
 *
 * <p>新回复按位置判定：同一 selector 下元素数量增长，或最后一条文本发生变化。
 * 文本与上一条回复完全相同（例如固定话术的拒答）时依然算作新回复。</p>
 */
public final class MessageSnapshot {
    private static final MessageSnapshot EMPTY = new MessageSnapshot(
            Collections.<String, Integer>emptyMap(), Collections.<String, String>emptyMap());

    private final Map<String, Integer> counts;
    private final Map<String, String> lastTexts;

    private MessageSnapshot(Map<String, Integer> counts, Map<String, String> lastTexts) {
        this.counts = counts;
        this.lastTexts = lastTexts;
    }

    public static MessageSnapshot empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int countOf(String selector) {
        Integer n = counts.get(selector);
        return n == null ? 0 : n;
    }

    public String lastTextOf(String selector) {
        return lastTexts.get(selector);
    }

    /**
     * @param count 当前该 selector 匹配的元素数量
     * @param text  当前最后一条的文本（已 trim）
     */
    public boolean isFresh(String selector, int count, String text) {
        if (count > countOf(selector)) return true;
        return !text.equals(lastTexts.get(selector));
    }

    public Set<String> texts() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(lastTexts.values()));
    }

    @Override
    public String toString() {
        return "MessageSnapshot{counts=" + counts + "}";
    }

    public static final class Builder {
        private final Map<String, Integer> counts = new LinkedHashMap<>();
        private final Map<String, String> lastTexts = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder record(String selector, int count, String lastText) {
            counts.put(selector, count);
            if (lastText != null && !lastText.isEmpty()) {
                lastTexts.put(selector, lastText);
            }
            return this;
        }

        public MessageSnapshot build() {
            return new MessageSnapshot(Collections.unmodifiableMap(new LinkedHashMap<>(counts)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(lastTexts)));
        }
    }
}
