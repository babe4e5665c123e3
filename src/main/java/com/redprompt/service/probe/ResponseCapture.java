package com.redprompt.service.probe;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.PlaywrightException;
import com.redprompt.config.AppConfig;
import com.redprompt.util.AppLog;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 轮询组件文档，抓取模型生成的回复。
 *
 * <p>组件通常是流式/打字机式输出，第一次读到的文本往往不完整。生成是否结束无法直接观测，
 * 只能通过“文本在稳定窗口内不再变化”来推断：</p>
 * <ol>
 *     <li>稳定：读到新文本后等待稳定窗口再读一次，未变化即返回</li>
 *     <li>部分：预算耗尽时返回最后看到的文本</li>
 *     <li>兜底：从未读到消息元素时，从文档可见文本末尾找一行像回复的内容</li>
 *     <li>失败：以上都没有，返回 {@link CaptureResult.Outcome#NONE}</li>
 * </ol>
 * 新回复按提交前的位置基线判定（见 {@link MessageSnapshot}），不按文本去重。
 * 所有等待都截断到剩余预算内，因此不会超出预算。
 */
public class ResponseCapture {

    /**
     * 最新消息的候选 selector，先助手专用约定，后通用气泡约定。每次轮询只用第一个有匹配的。
     */
    static final List<String> MESSAGE_SELECTORS = Collections.unmodifiableList(Arrays.asList(
            ".assistant-message",
            ".bot-message",
            ".ai-message",
            "[data-role=\"assistant\"]",
            "[data-role=\"bot\"]",
            ".chat-message",
            ".message",
            ".chat-bubble",
            ".response"
    ));

    static final int SALVAGE_MIN_LENGTH = 10;
    static final List<String> UI_CHROME_PREFIXES = Arrays.asList("type", "enter", "send");
    private static final double READ_TIMEOUT_MS = 1000;

    private final ProbeClock clock;
    private final long settleMs;
    private final long pollMs;
    private final long stabilizeMs;

    public ResponseCapture(ProbeClock clock, long settleMs, long pollMs, long stabilizeMs) {
        this.clock = clock == null ? ProbeClock.SYSTEM : clock;
        this.settleMs = Math.max(0, settleMs);
        this.pollMs = Math.max(1, pollMs);
        this.stabilizeMs = Math.max(0, stabilizeMs);
    }

    public static ResponseCapture fromConfig(AppConfig cfg, ProbeClock clock) {
        return new ResponseCapture(clock, cfg.getCaptureSettleMs(), cfg.getCapturePollMs(), cfg.getCaptureStabilizeMs());
    }

    /**
     * 记录提交前消息区的位置基线。抓取时只有基线之后出现的消息才会被当作新回复。
     */
    public MessageSnapshot snapshot(ProbeDocument widget) {
        MessageSnapshot.Builder builder = MessageSnapshot.builder();
        for (String selector : MESSAGE_SELECTORS) {
            try {
                Locator all = widget.locator(selector);
                int n = all.count();
                if (n <= 0) continue;
                builder.record(selector, n, normalize(readText(all.last())));
            } catch (PlaywrightException e) {
                AppLog.debug("[capture] snapshot skipped " + selector + ": " + SelectorCascade.firstLine(e.getMessage()));
            }
        }
        return builder.build();
    }

    public CaptureResult capture(ProbeDocument widget, long budgetMs) {
        return capture(widget, budgetMs, MessageSnapshot.empty(), null);
    }

    /**
     * @param before 提交前的位置基线
     * @param echo   刚提交的 prompt 文本，组件回显的用户消息不会被当作回复
     */
    public CaptureResult capture(ProbeDocument widget, long budgetMs, MessageSnapshot before, String echo) {
        MessageSnapshot baseline = before == null ? MessageSnapshot.empty() : before;
        String echoText = normalize(echo);
        long start = clock.currentTimeMillis();
        long deadline = start + Math.max(0, budgetMs);

        sleepWithin(settleMs, deadline);

        String candidate = "";
        while (clock.currentTimeMillis() < deadline) {
            LatestMessage latest = latestMessage(widget);
            if (latest != null) {
                String text = normalize(safeRead(latest.element));
                if (!text.isEmpty() && !text.equals(echoText) && baseline.isFresh(latest.selector, latest.count, text)) {
                    if (!text.equals(candidate)) {
                        AppLog.debug("[capture] new candidate (" + text.length() + " chars)");
                        candidate = text;
                    }
                    sleepWithin(stabilizeMs, deadline);
                    String reread = normalize(safeRead(latest.element));
                    if (reread.equals(candidate)) {
                        long elapsed = clock.currentTimeMillis() - start;
                        AppLog.info("[capture] captured stable response after " + elapsed + "ms: " + preview(candidate));
                        return CaptureResult.of(CaptureResult.Outcome.STABLE, candidate, elapsed);
                    }
                    if (!reread.isEmpty()) {
                        candidate = reread;
                    }
                }
            }
            sleepWithin(pollMs, deadline);
        }

        long elapsed = clock.currentTimeMillis() - start;
        if (!candidate.isEmpty()) {
            AppLog.warn("[capture] wait budget exhausted, returning last seen text: " + preview(candidate));
            return CaptureResult.of(CaptureResult.Outcome.PARTIAL, candidate, elapsed);
        }

        Set<String> exclude = new LinkedHashSet<>(baseline.texts());
        if (!echoText.isEmpty()) exclude.add(echoText);
        String salvaged = salvage(widget, exclude);
        if (!salvaged.isEmpty()) {
            AppLog.warn("[capture] no message element captured, salvaged from document text: " + preview(salvaged));
            return CaptureResult.of(CaptureResult.Outcome.SALVAGED, salvaged, elapsed);
        }
        return CaptureResult.none(elapsed);
    }

    private static final class LatestMessage {
        final String selector;
        final int count;
        final Locator element;

        LatestMessage(String selector, int count, Locator element) {
            this.selector = selector;
            this.count = count;
            this.element = element;
        }
    }

    private LatestMessage latestMessage(ProbeDocument widget) {
        for (String selector : MESSAGE_SELECTORS) {
            try {
                Locator all = widget.locator(selector);
                int n = all.count();
                if (n > 0) {
                    return new LatestMessage(selector, n, all.last());
                }
            } catch (PlaywrightException e) {
                AppLog.debug("[capture] selector failed " + selector + ": " + SelectorCascade.firstLine(e.getMessage()));
            }
        }
        return null;
    }

    String salvage(ProbeDocument widget, Set<String> exclude) {
        String body;
        try {
            body = widget.visibleText();
        } catch (PlaywrightException e) {
            AppLog.warn("[capture] salvage read failed: " + SelectorCascade.firstLine(e.getMessage()));
            return "";
        }
        if (body == null || body.isEmpty()) return "";
        String[] lines = body.split("\n");
        for (int i = lines.length - 1; i >= 0; i--) {
            String line = lines[i].trim();
            if (line.length() <= SALVAGE_MIN_LENGTH) continue;
            if (isUiChrome(line)) continue;
            if (exclude.contains(line)) continue;
            return line;
        }
        return "";
    }

    private static boolean isUiChrome(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        for (String prefix : UI_CHROME_PREFIXES) {
            if (lower.startsWith(prefix)) return true;
        }
        return false;
    }

    private String safeRead(Locator element) {
        try {
            return readText(element);
        } catch (PlaywrightException e) {
            AppLog.debug("[capture] read failed: " + SelectorCascade.firstLine(e.getMessage()));
            return "";
        }
    }

    private static String readText(Locator element) {
        return element.innerText(new Locator.InnerTextOptions().setTimeout(READ_TIMEOUT_MS));
    }

    private void sleepWithin(long millis, long deadline) {
        long remaining = deadline - clock.currentTimeMillis();
        long wait = Math.min(millis, remaining);
        if (wait > 0) {
            clock.sleep(wait);
        }
    }

    static String normalize(String text) {
        return text == null ? "" : text.trim();
    }

    private static String preview(String text) {
        return text.length() > 100 ? text.substring(0, 100) + "..." : text;
    }
}
