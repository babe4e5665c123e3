package com.redprompt.service.probe;

/**
 * 单条 prompt 范围内的探测错误，由 {@link PromptTestRunner} 转换为 failed / timeout 结果，不会中断整个运行。
 */
public class ProbeException extends RuntimeException {

    public enum Kind {
        /** 组件、输入框或发送控件未找到 */
        DISCOVERY,
        /** 输入或提交过程中的意外异常 */
        INTERACTION,
        /** 等待预算耗尽仍未拿到可用结果 */
        TIMEOUT
    }

    private final Kind kind;

    public ProbeException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProbeException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
