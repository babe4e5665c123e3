package com.redprompt.model;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 单条 prompt 的执行结果，每条 prompt 恰好产生一个，创建后不可变。
 *
 * <p>约定（由工厂方法保证）：</p>
 * <ul>
 *     <li>COMPLETED：response 非空</li>
 *     <li>FAILED / TIMEOUT：response 为空，errorMessage 非空</li>
 * </ul>
 */
public final class TestResult {
    private final String id;
    private final String prompt;
    private final String response;
    private final PromptStatus status;
    private final String timestamp;
    private final double executionTime;
    private final Set<String> tags;
    private final String errorMessage;
    private final String screenshotPath;

    private TestResult(String id, String prompt, String response, PromptStatus status, String timestamp,
                       double executionTime, Collection<String> tags, String errorMessage, String screenshotPath) {
        this.id = id;
        this.prompt = prompt;
        this.response = response;
        this.status = status;
        this.timestamp = timestamp;
        this.executionTime = executionTime;
        this.tags = tags == null ? new LinkedHashSet<>() : new LinkedHashSet<>(tags);
        this.errorMessage = errorMessage;
        this.screenshotPath = screenshotPath;
    }

    public static TestResult completed(Prompt prompt, String response, Collection<String> tags,
                                       String timestamp, double executionTime) {
        if (response == null || response.trim().isEmpty()) {
            throw new IllegalArgumentException("completed result requires a response");
        }
        return new TestResult(prompt.getId(), prompt.getText(), response, PromptStatus.COMPLETED,
                timestamp, executionTime, tags, null, null);
    }

    public static TestResult failed(Prompt prompt, String errorMessage, String timestamp,
                                    double executionTime, String screenshotPath) {
        return unsuccessful(prompt, PromptStatus.FAILED, errorMessage, timestamp, executionTime, screenshotPath);
    }

    public static TestResult timedOut(Prompt prompt, String errorMessage, String timestamp,
                                      double executionTime, String screenshotPath) {
        return unsuccessful(prompt, PromptStatus.TIMEOUT, errorMessage, timestamp, executionTime, screenshotPath);
    }

    private static TestResult unsuccessful(Prompt prompt, PromptStatus status, String errorMessage, String timestamp,
                                           double executionTime, String screenshotPath) {
        String msg = errorMessage == null || errorMessage.trim().isEmpty() ? "Unknown error" : errorMessage;
        return new TestResult(prompt.getId(), prompt.getText(), null, status, timestamp, executionTime,
                prompt.getTags(), msg, screenshotPath);
    }

    public String getId() {
        return id;
    }

    public String getPrompt() {
        return prompt;
    }

    public String getResponse() {
        return response;
    }

    public PromptStatus getStatus() {
        return status;
    }

    public boolean isCompleted() {
        return status == PromptStatus.COMPLETED;
    }

    public String getTimestamp() {
        return timestamp;
    }

    /**
     * 执行耗时，单位秒。
     */
    public double getExecutionTime() {
        return executionTime;
    }

    public Set<String> getTags() {
        return Collections.unmodifiableSet(tags);
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getScreenshotPath() {
        return screenshotPath;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("id", id);
        obj.put("prompt", prompt);
        obj.put("response", response);
        obj.put("status", status.value());
        obj.put("timestamp", timestamp);
        obj.put("execution_time", executionTime);
        obj.put("tags", new JSONArray(tags));
        obj.put("error_message", errorMessage);
        obj.put("screenshot_path", screenshotPath);
        return obj;
    }

    @Override
    public String toString() {
        return "TestResult{" + id + ", " + status.value()
                + (errorMessage == null ? "" : ", error='" + errorMessage + "'") + "}";
    }
}
