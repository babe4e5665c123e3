package com.redprompt.model;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次完整运行的记录：结果列表 + 汇总计数。
 *
 * <p>会话启动失败时 status 为 "error"，results 为空，error 记录原因。</p>
 */
public final class TestRunResult {
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_ERROR = "error";

    private final String testRunId;
    private final String targetUrl;
    private final String timestamp;
    private final String status;
    private final int totalPrompts;
    private final int successfulTests;
    private final int failedTests;
    private final List<TestResult> results;
    private final String error;

    private TestRunResult(String testRunId, String targetUrl, String timestamp, String status, int totalPrompts,
                          int successfulTests, int failedTests, List<TestResult> results, String error) {
        this.testRunId = testRunId;
        this.targetUrl = targetUrl;
        this.timestamp = timestamp;
        this.status = status;
        this.totalPrompts = totalPrompts;
        this.successfulTests = successfulTests;
        this.failedTests = failedTests;
        this.results = results;
        this.error = error;
    }

    public static TestRunResult completed(String testRunId, String targetUrl, String timestamp, List<TestResult> results) {
        List<TestResult> copy = results == null ? new ArrayList<>() : new ArrayList<>(results);
        int ok = 0;
        for (TestResult r : copy) {
            if (r.isCompleted()) ok++;
        }
        return new TestRunResult(testRunId, targetUrl, timestamp, STATUS_COMPLETED, copy.size(), ok,
                copy.size() - ok, copy, null);
    }

    public static TestRunResult error(String testRunId, String targetUrl, String timestamp, int totalPrompts, String error) {
        return new TestRunResult(testRunId, targetUrl, timestamp, STATUS_ERROR, totalPrompts, 0, 0,
                new ArrayList<>(), error == null ? "Unknown error" : error);
    }

    public String getTestRunId() {
        return testRunId;
    }

    public String getTargetUrl() {
        return targetUrl;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public String getStatus() {
        return status;
    }

    public int getTotalPrompts() {
        return totalPrompts;
    }

    public int getSuccessfulTests() {
        return successfulTests;
    }

    public int getFailedTests() {
        return failedTests;
    }

    public List<TestResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    public String getError() {
        return error;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("test_run_id", testRunId);
        obj.put("target_url", targetUrl);
        obj.put("timestamp", timestamp);
        obj.put("status", status);
        obj.put("total_prompts", totalPrompts);
        obj.put("successful_tests", successfulTests);
        obj.put("failed_tests", failedTests);
        JSONArray arr = new JSONArray();
        for (TestResult r : results) {
            arr.add(r.toJson());
        }
        obj.put("results", arr);
        if (error != null) {
            obj.put("error", error);
        }
        return obj;
    }
}
