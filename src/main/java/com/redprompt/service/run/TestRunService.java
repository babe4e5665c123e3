package com.redprompt.service.run;

import com.redprompt.config.AppConfig;
import com.redprompt.model.Prompt;
import com.redprompt.model.RunConfig;
import com.redprompt.model.TestResult;
import com.redprompt.model.TestRunResult;
import com.redprompt.service.probe.PromptTestRunner;
import com.redprompt.service.result.ResultStore;
import com.redprompt.util.AppLog;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 后台运行服务：提交后立即返回运行 id，运行在单个守护工作线程上串行执行并落盘。
 *
 * <p>单线程保证同一时刻最多只有一个浏览器会话存活。会话启动失败时保存一条 status=error 的运行记录。</p>
 */
public class TestRunService implements AutoCloseable {
    private final PromptTestRunner runner;
    private final ResultStore store;
    private final ExecutorService worker;

    public TestRunService(PromptTestRunner runner, ResultStore store) {
        this.runner = runner;
        this.store = store;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "RedPrompt-Run-Worker");
            t.setDaemon(true);
            return t;
        });
    }

    public static TestRunService fromConfig(AppConfig cfg) {
        return new TestRunService(PromptTestRunner.fromConfig(cfg), ResultStore.fromConfig(cfg));
    }

    public RunTicket submit(String targetUrl, List<Prompt> prompts, RunConfig config) {
        if (targetUrl == null || targetUrl.trim().isEmpty()) {
            throw new IllegalArgumentException("targetUrl is empty");
        }
        if (prompts == null || prompts.isEmpty()) {
            throw new IllegalArgumentException("No prompts uploaded. Please upload prompts first.");
        }
        String runId = UUID.randomUUID().toString();
        List<Prompt> snapshot = new ArrayList<>(prompts);
        RunConfig cfg = config == null ? RunConfig.defaults() : config;
        Future<TestRunResult> future = worker.submit(() -> execute(runId, targetUrl.trim(), snapshot, cfg));
        AppLog.info("[run] submitted run " + runId + " for " + snapshot.size() + " prompts");
        return new RunTicket(runId, snapshot.size(), future);
    }

    TestRunResult execute(String runId, String targetUrl, List<Prompt> prompts, RunConfig config) {
        TestRunResult run;
        try {
            List<TestResult> results = runner.runPromptTests(targetUrl, prompts, config);
            run = PromptTestRunner.summarize(runId, targetUrl, results);
        } catch (RuntimeException e) {
            AppLog.error("[run] run " + runId + " aborted: " + e.getMessage(), e);
            run = TestRunResult.error(runId, targetUrl, LocalDateTime.now().toString(), prompts.size(), e.getMessage());
        }
        try {
            store.save(run);
        } catch (RuntimeException e) {
            AppLog.error("[run] failed to persist run " + runId, e);
        }
        return run;
    }

    public ResultStore getStore() {
        return store;
    }

    @Override
    public void close() {
        worker.shutdownNow();
    }
}
