package com.redprompt.service.run;

import com.alibaba.fastjson2.JSONObject;
import com.redprompt.model.Prompt;
import com.redprompt.model.RunConfig;
import com.redprompt.model.TestResult;
import com.redprompt.model.TestRunResult;
import com.redprompt.service.probe.PromptTestRunner;
import com.redprompt.service.result.ResultStore;
import com.redprompt.util.SessionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;

public class TestRunServiceTest {

    @TempDir
    Path tempDir;

    private PromptTestRunner runner;
    private ResultStore store;
    private TestRunService service;
    private RunConfig config;

    @BeforeEach
    public void setUp() {
        runner = Mockito.mock(PromptTestRunner.class);
        store = new ResultStore(tempDir.toFile());
        service = new TestRunService(runner, store);
        config = new RunConfig(30, false, 0, 15, true);
    }

    @AfterEach
    public void tearDown() {
        service.close();
    }

    @Test
    public void submit_runsInBackgroundAndPersists() throws Exception {
        Prompt p = Prompt.create("p1", "hello", null);
        TestResult ok = TestResult.completed(p, "Hi, how can I help?", p.getTags(), "2024-01-01T00:00", 3.0);
        Mockito.when(runner.runPromptTests(eq("https://example.com"), anyList(), any(RunConfig.class)))
                .thenReturn(Collections.singletonList(ok));

        RunTicket ticket = service.submit(" https://example.com ", Collections.singletonList(p), config);
        TestRunResult run = ticket.getFuture().get(5, TimeUnit.SECONDS);

        Assertions.assertEquals(1, ticket.getPromptCount());
        Assertions.assertEquals(ticket.getRunId(), run.getTestRunId());
        Assertions.assertEquals(TestRunResult.STATUS_COMPLETED, run.getStatus());
        Assertions.assertEquals(1, run.getSuccessfulTests());
        JSONObject stored = store.get(ticket.getRunId());
        Assertions.assertNotNull(stored);
        Assertions.assertEquals("completed", stored.getString("status"));
    }

    @Test
    public void submit_recordsSessionFailureAsErrorRun() throws Exception {
        Mockito.when(runner.runPromptTests(any(), anyList(), any()))
                .thenThrow(new SessionException("Failed to start browser session: no chromium", null));
        List<Prompt> prompts = new ArrayList<>();
        prompts.add(Prompt.create("a", "one", null));
        prompts.add(Prompt.create("b", "two", null));

        RunTicket ticket = service.submit("https://example.com", prompts, config);
        TestRunResult run = ticket.getFuture().get(5, TimeUnit.SECONDS);

        Assertions.assertEquals(TestRunResult.STATUS_ERROR, run.getStatus());
        Assertions.assertEquals(2, run.getTotalPrompts());
        Assertions.assertTrue(run.getResults().isEmpty());
        Assertions.assertEquals("error", store.get(ticket.getRunId()).getString("status"));
    }

    @Test
    public void submit_rejectsEmptyPromptList() {
        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> service.submit("https://example.com", Collections.emptyList(), config));
        Assertions.assertEquals("No prompts uploaded. Please upload prompts first.", e.getMessage());
        Mockito.verifyNoInteractions(runner);
    }

    @Test
    public void submit_copiesPromptListBeforeRunning() throws Exception {
        Mockito.when(runner.runPromptTests(any(), anyList(), any())).thenReturn(Collections.emptyList());
        List<Prompt> prompts = new ArrayList<>();
        prompts.add(Prompt.create("a", "one", null));

        RunTicket ticket = service.submit("https://example.com", prompts, config);
        prompts.clear();
        ticket.getFuture().get(5, TimeUnit.SECONDS);

        Mockito.verify(runner).runPromptTests(eq("https://example.com"),
                Mockito.argThat(list -> list.size() == 1), eq(config));
    }
}
