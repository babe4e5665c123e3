package com.redprompt.service.probe;

import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitUntilState;
import com.redprompt.config.AppConfig;
import com.redprompt.model.Prompt;
import com.redprompt.model.RunConfig;
import com.redprompt.model.TestResult;
import com.redprompt.model.TestRunResult;
import com.redprompt.service.security.SecurityTagAnalyzer;
import com.redprompt.util.AppLog;
import com.redprompt.util.PlayWrightUtil;
import com.redprompt.util.SessionException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * 运行编排：在同一个会话、同一个页面上按顺序执行整份 prompt 列表。
 *
 * <p>每条 prompt：定位组件 → 输入提交 → 抓取回复 → 打标签，恰好生成一个 {@link TestResult}。
 * 单条失败（发现 / 交互 / 抓取 / 超时）只影响该条结果，运行继续；每条之后固定间隔，避免触发组件后端限流。
 * 只有会话启动失败会以 {@link SessionException} 抛出。</p>
 */
public class PromptTestRunner {
    private final Function<RunConfig, PlayWrightUtil.Connection> sessionFactory;
    private final WidgetLocator widgetLocator;
    private final InteractionDriver interactionDriver;
    private final ResponseCapture responseCapture;
    private final ScreenshotSink screenshots;
    private final ProbeClock clock;
    private final long navigationSettleMs;

    public PromptTestRunner(Function<RunConfig, PlayWrightUtil.Connection> sessionFactory,
                            WidgetLocator widgetLocator,
                            InteractionDriver interactionDriver,
                            ResponseCapture responseCapture,
                            ScreenshotSink screenshots,
                            ProbeClock clock,
                            long navigationSettleMs) {
        this.sessionFactory = sessionFactory;
        this.widgetLocator = widgetLocator;
        this.interactionDriver = interactionDriver;
        this.responseCapture = responseCapture;
        this.screenshots = screenshots;
        this.clock = clock == null ? ProbeClock.SYSTEM : clock;
        this.navigationSettleMs = Math.max(0, navigationSettleMs);
    }

    public static PromptTestRunner fromConfig(AppConfig cfg) {
        return new PromptTestRunner(
                rc -> PlayWrightUtil.launch(rc.isHeadless()),
                WidgetLocator.fromConfig(cfg),
                InteractionDriver.fromConfig(cfg),
                ResponseCapture.fromConfig(cfg, ProbeClock.SYSTEM),
                ScreenshotSink.fromConfig(cfg),
                ProbeClock.SYSTEM,
                cfg.getNavigationSettleMs());
    }

    /**
     * 入口：对 targetUrl 执行整份 prompt 列表，结果与输入一一对应、顺序一致。
     *
     * @throws SessionException 浏览器会话无法建立
     */
    public List<TestResult> runPromptTests(String targetUrl, List<Prompt> prompts, RunConfig config) {
        if (targetUrl == null || targetUrl.trim().isEmpty()) {
            throw new IllegalArgumentException("targetUrl is empty");
        }
        if (prompts == null || prompts.isEmpty()) {
            return Collections.emptyList();
        }
        RunConfig cfg = config == null ? RunConfig.defaults() : config;
        AppLog.info("[run] starting test run against " + targetUrl + " with " + prompts.size() + " prompts, " + cfg);

        List<TestResult> results;
        try (PlayWrightUtil.Connection session = sessionFactory.apply(cfg)) {
            Page page = openPage(session);
            try {
                results = runOnPage(page, targetUrl.trim(), prompts, cfg);
            } finally {
                closePage(page);
            }
        }

        int ok = 0;
        for (TestResult r : results) {
            if (r.isCompleted()) ok++;
        }
        AppLog.info("[run] test run completed. " + ok + " successful, " + (results.size() - ok) + " failed");
        return results;
    }

    public static TestRunResult summarize(String testRunId, String targetUrl, List<TestResult> results) {
        return TestRunResult.completed(testRunId, targetUrl, LocalDateTime.now().toString(), results);
    }

    List<TestResult> runOnPage(Page page, String targetUrl, List<Prompt> prompts, RunConfig config) {
        ProbeDocument host = PlaywrightDocument.of(page);
        List<TestResult> results = new ArrayList<>(prompts.size());
        for (int i = 0; i < prompts.size(); i++) {
            Prompt prompt = prompts.get(i);
            AppLog.info("[run] testing prompt " + (i + 1) + "/" + prompts.size() + ": " + prompt);
            TestResult result;
            try {
                result = testSinglePrompt(page, host, prompt, targetUrl, config);
            } finally {
                pause(config);
            }
            results.add(result);
            if (result.isCompleted()) {
                AppLog.info("[run] prompt " + (i + 1) + " completed successfully");
            } else {
                AppLog.warn("[run] prompt " + (i + 1) + " " + result.getStatus().value() + ": " + result.getErrorMessage());
            }
        }
        return results;
    }

    TestResult testSinglePrompt(Page page, ProbeDocument host, Prompt prompt, String targetUrl, RunConfig config) {
        long begin = clock.currentTimeMillis();
        try {
            ensureNavigated(page, targetUrl, config);

            ProbeDocument widgetDoc = require(widgetLocator.locate(host));
            MessageSnapshot before = responseCapture.snapshot(widgetDoc);
            require(interactionDriver.submit(widgetDoc, prompt.getText()));

            CaptureResult captured = responseCapture.capture(widgetDoc, config.getResponseWaitSeconds() * 1000L,
                    before, prompt.getText());
            if (!captured.hasText()) {
                throw new ProbeException(ProbeException.Kind.TIMEOUT, "No response captured from chat widget");
            }

            String response = captured.getText();
            Set<String> tags = SecurityTagAnalyzer.merge(prompt.getTags(), SecurityTagAnalyzer.responseTags(response));
            return TestResult.completed(prompt, response, tags, LocalDateTime.now().toString(), elapsedSeconds(begin));
        } catch (TimeoutError e) {
            return failure(page, prompt, true, "Timeout after " + config.getMaxTimeoutSeconds() + "s: "
                    + SelectorCascade.firstLine(e.getMessage()), begin, config);
        } catch (ProbeException e) {
            return failure(page, prompt, e.getKind() == ProbeException.Kind.TIMEOUT, e.getMessage(), begin, config);
        } catch (RuntimeException e) {
            AppLog.error("[run] unexpected error on prompt " + prompt.getId(), e);
            return failure(page, prompt, false, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(),
                    begin, config);
        }
    }

    private static <T> T require(Discovery<T> discovery) {
        if (!discovery.isFound()) {
            throw new ProbeException(ProbeException.Kind.DISCOVERY, discovery.getReason());
        }
        return discovery.get();
    }

    private void pause(RunConfig config) {
        try {
            clock.sleep(config.getDelayBetweenPromptsSeconds() * 1000L);
        } catch (ProbeException e) {
            AppLog.warn("[run] inter-prompt delay cut short: " + e.getMessage());
        }
    }

    private void ensureNavigated(Page page, String targetUrl, RunConfig config) {
        if (targetUrl.equals(page.url())) return;
        AppLog.info("[run] navigating to " + targetUrl);
        page.navigate(targetUrl, new Page.NavigateOptions()
                .setWaitUntil(WaitUntilState.NETWORKIDLE)
                .setTimeout(config.getMaxTimeoutSeconds() * 1000.0));
        clock.sleep(navigationSettleMs);
    }

    private TestResult failure(Page page, Prompt prompt, boolean timeout, String message, long begin, RunConfig config) {
        String screenshotPath = null;
        if (config.isScreenshotOnFailure()) {
            try {
                screenshotPath = screenshots.capture(page, prompt.getId());
            } catch (RuntimeException e) {
                AppLog.warn("[run] failed to take screenshot for " + prompt.getId() + ": " + e.getMessage());
            }
        }
        String now = LocalDateTime.now().toString();
        double seconds = elapsedSeconds(begin);
        return timeout
                ? TestResult.timedOut(prompt, message, now, seconds, screenshotPath)
                : TestResult.failed(prompt, message, now, seconds, screenshotPath);
    }

    private double elapsedSeconds(long begin) {
        return (clock.currentTimeMillis() - begin) / 1000.0;
    }

    private static Page openPage(PlayWrightUtil.Connection session) {
        try {
            return session.newPage();
        } catch (PlaywrightException e) {
            throw new SessionException("Failed to open page: " + e.getMessage(), e);
        }
    }

    private static void closePage(Page page) {
        try {
            page.close();
        } catch (PlaywrightException e) {
            AppLog.warn("[run] failed to close page: " + e.getMessage());
        }
    }
}
