package com.redprompt.service.run;

import com.redprompt.model.TestRunResult;

import java.util.concurrent.Future;

/**
 * 已提交运行的句柄。
 */
public final class RunTicket {
    private final String runId;
    private final int promptCount;
    private final Future<TestRunResult> future;

    RunTicket(String runId, int promptCount, Future<TestRunResult> future) {
        this.runId = runId;
        this.promptCount = promptCount;
        this.future = future;
    }

    public String getRunId() {
        return runId;
    }

    public int getPromptCount() {
        return promptCount;
    }

    public Future<TestRunResult> getFuture() {
        return future;
    }

    public boolean isDone() {
        return future.isDone();
    }
}
