package com.redprompt.service.probe;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitForSelectorState;
import com.redprompt.util.AppLog;

import java.util.List;
import java.util.function.Predicate;

/**
 * 选择器级联：按顺序尝试一组定位策略，返回第一个可用的匹配。
 *
 * <p>每个候选单独限时等待，单个候选超时或异常只会让级联前进到下一个，只有全部失败才以
 * {@link Discovery#notFound(String)} 上报。命中之后的候选不再求值。</p>
 */
public class SelectorCascade {
    private final long candidateTimeoutMs;

    public SelectorCascade(long candidateTimeoutMs) {
        this.candidateTimeoutMs = Math.max(0, candidateTimeoutMs);
    }

    public long getCandidateTimeoutMs() {
        return candidateTimeoutMs;
    }

    public Discovery<Locator> find(ProbeDocument document, List<LocatorCandidate> candidates) {
        if (document == null || candidates == null || candidates.isEmpty()) {
            return Discovery.notFound("no candidates");
        }
        for (LocatorCandidate candidate : candidates) {
            String selector = candidate.describe();
            try {
                Locator loc = document.locator(selector).first();
                waitAttached(loc);
                if (loc.count() <= 0) continue;
                if (!candidate.isUsable(loc)) {
                    AppLog.debug("[cascade] matched but unusable: " + selector);
                    continue;
                }
                AppLog.debug("[cascade] matched: " + selector);
                return Discovery.found(loc, selector);
            } catch (PlaywrightException e) {
                AppLog.debug("[cascade] candidate failed: " + selector + " (" + firstLine(e.getMessage()) + ")");
            }
        }
        return Discovery.notFound("exhausted " + candidates.size() + " candidates");
    }

    /**
     * 全局兜底：枚举 selector 命中的所有元素，返回第一个满足 matcher 的。
     */
    public Discovery<Locator> scan(ProbeDocument document, String selector, Predicate<Locator> matcher) {
        if (document == null || selector == null || matcher == null) {
            return Discovery.notFound("no scan target");
        }
        int n;
        Locator all;
        try {
            all = document.locator(selector);
            n = all.count();
        } catch (PlaywrightException e) {
            AppLog.debug("[cascade] scan failed: " + selector + " (" + firstLine(e.getMessage()) + ")");
            return Discovery.notFound("scan failed: " + selector);
        }
        for (int i = 0; i < n; i++) {
            try {
                Locator c = all.nth(i);
                if (matcher.test(c)) {
                    AppLog.debug("[cascade] scan matched: " + selector + " #" + i);
                    return Discovery.found(c, selector + " #" + i);
                }
            } catch (PlaywrightException e) {
                AppLog.debug("[cascade] scan element failed: " + selector + " #" + i);
            }
        }
        return Discovery.notFound("scanned " + n + " elements of " + selector);
    }

    private void waitAttached(Locator loc) {
        if (candidateTimeoutMs <= 0) return;
        loc.waitFor(new Locator.WaitForOptions()
                .setState(WaitForSelectorState.ATTACHED)
                .setTimeout(candidateTimeoutMs));
    }

    static String firstLine(String msg) {
        if (msg == null) return "";
        int nl = msg.indexOf('\n');
        return nl < 0 ? msg : msg.substring(0, nl);
    }
}
