package com.redprompt.model;

/**
 * prompt 执行状态。
 *
 * <p>PENDING / RUNNING 只是运行中的过渡状态，不会出现在 {@link TestResult} 中；
 * COMPLETED / FAILED / TIMEOUT 为终态。</p>
 */
public enum PromptStatus {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    TIMEOUT("timeout");

    private final String value;

    PromptStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMEOUT;
    }

    public static PromptStatus fromString(String raw) {
        if (raw == null) return null;
        String v = raw.trim();
        if (v.isEmpty()) return null;
        for (PromptStatus s : values()) {
            if (s.value.equalsIgnoreCase(v) || s.name().equalsIgnoreCase(v)) {
                return s;
            }
        }
        return null;
    }
}
