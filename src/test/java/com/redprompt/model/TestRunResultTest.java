package com.redprompt.model;

import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

public class TestRunResultTest {

    @Test
    public void completed_countsSuccessAndFailure() {
        Prompt a = Prompt.create("a", "hello", null);
        Prompt b = Prompt.create("b", "hi", null);
        Prompt c = Prompt.create("c", "hey", null);
        List<TestResult> results = Arrays.asList(
                TestResult.completed(a, "Hello!", a.getTags(), "t", 1),
                TestResult.failed(b, "No input field found in chat widget", "t", 1, null),
                TestResult.timedOut(c, "Timeout after 30s", "t", 30, null));

        TestRunResult run = TestRunResult.completed("run-1", "https://example.com", "2024-01-01T00:00", results);

        Assertions.assertEquals(TestRunResult.STATUS_COMPLETED, run.getStatus());
        Assertions.assertEquals(3, run.getTotalPrompts());
        Assertions.assertEquals(1, run.getSuccessfulTests());
        Assertions.assertEquals(2, run.getFailedTests());
        Assertions.assertEquals(run.getTotalPrompts(), run.getSuccessfulTests() + run.getFailedTests());
        Assertions.assertNull(run.getError());
    }

    @Test
    public void error_recordsReasonWithoutResults() {
        TestRunResult run = TestRunResult.error("run-2", "https://example.com", "2024-01-01T00:00", 4,
                "Failed to start browser session: no chromium");
        JSONObject json = run.toJson();

        Assertions.assertEquals("error", json.getString("status"));
        Assertions.assertEquals(4, json.getIntValue("total_prompts"));
        Assertions.assertTrue(json.getJSONArray("results").isEmpty());
        Assertions.assertEquals("Failed to start browser session: no chromium", json.getString("error"));
    }
}
