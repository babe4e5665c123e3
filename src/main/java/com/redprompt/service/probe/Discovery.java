package com.redprompt.service.probe;

import java.util.NoSuchElementException;

/**
 * 发现步骤的结果：找到（携带值与命中的策略描述）或未找到（携带原因）。
 *
 * <p>"没找到" 是预期内的情况，用返回值表达而不是抛异常。</p>
 */
public final class Discovery<T> {
    private final T value;
    private final String strategy;
    private final String reason;

    private Discovery(T value, String strategy, String reason) {
        this.value = value;
        this.strategy = strategy;
        this.reason = reason;
    }

    public static <T> Discovery<T> found(T value, String strategy) {
        if (value == null) throw new IllegalArgumentException("found value is null");
        return new Discovery<>(value, strategy, null);
    }

    public static <T> Discovery<T> notFound(String reason) {
        return new Discovery<>(null, null, reason == null ? "not found" : reason);
    }

    public boolean isFound() {
        return value != null;
    }

    public T get() {
        if (value == null) throw new NoSuchElementException(reason);
        return value;
    }

    public String getStrategy() {
        return strategy;
    }

    public String getReason() {
        return reason;
    }

    /**
     * 保留原因，转换值类型。
     */
    public <R> Discovery<R> mapNotFound() {
        if (isFound()) throw new IllegalStateException("discovery is found");
        return notFound(reason);
    }

    @Override
    public String toString() {
        return isFound() ? "found[" + strategy + "]" : "notFound[" + reason + "]";
    }
}
