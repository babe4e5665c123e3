package com.redprompt.util;

/**
 * 浏览器会话无法建立（运行时 / 浏览器启动失败）。对整个运行是致命的，不在单条 prompt 范围内处理。
 */
public class SessionException extends RuntimeException {

    public SessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
