package com.redprompt.service.prompt;

/**
 * prompt 文件无法解析：格式不支持、内容损坏或缺少 prompt 列。
 */
public class PromptFileException extends RuntimeException {

    public PromptFileException(String message) {
        super(message);
    }

    public PromptFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
