package com.redprompt.service.probe;

import com.microsoft.playwright.Locator;
import com.redprompt.config.AppConfig;
import com.redprompt.util.AppLog;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 在宿主页面中定位聊天组件所在的 iframe，并返回其内容文档。
 *
 * <p>先按优先级跑 iframe 属性级联（厂商 src 片段 → 通用 chat/widget/messenger/support → title），
 * 都不命中时再枚举页面上所有 iframe，按同样的子串规则检查 src / title。</p>
 */
public class WidgetLocator {
    static final String FRAME_SELECTOR = "iframe";
    static final List<String> SRC_HINTS = Arrays.asList("chat", "widget", "messenger", "support");
    static final List<String> TITLE_HINTS = Arrays.asList("chat", "assistant");

    private final SelectorCascade cascade;
    private final List<LocatorCandidate> candidates;

    public WidgetLocator(SelectorCascade cascade, List<String> vendorHints) {
        this.cascade = cascade;
        this.candidates = buildCandidates(vendorHints);
    }

    public static WidgetLocator fromConfig(AppConfig cfg) {
        return new WidgetLocator(new SelectorCascade(cfg.getWidgetCandidateTimeoutMs()), cfg.getWidgetVendorHints());
    }

    static List<LocatorCandidate> buildCandidates(List<String> vendorHints) {
        List<LocatorStrategy> strategies = new ArrayList<>();
        if (vendorHints != null) {
            for (String hint : vendorHints) {
                if (hint != null && !hint.trim().isEmpty()) {
                    strategies.add(LocatorStrategy.attributeContains(FRAME_SELECTOR, "src", hint.trim()));
                }
            }
        }
        strategies.add(LocatorStrategy.attributeContains(FRAME_SELECTOR, "src", "chat"));
        strategies.add(LocatorStrategy.attributeContains(FRAME_SELECTOR, "title", "chat"));
        strategies.add(LocatorStrategy.attributeContains(FRAME_SELECTOR, "title", "assistant"));
        strategies.add(LocatorStrategy.attributeContains(FRAME_SELECTOR, "id", "chat"));
        strategies.add(LocatorStrategy.attributeContains(FRAME_SELECTOR, "class", "chat"));
        strategies.add(LocatorStrategy.attributeContains(FRAME_SELECTOR, "src", "widget"));
        strategies.add(LocatorStrategy.attributeContains(FRAME_SELECTOR, "src", "messenger"));
        strategies.add(LocatorStrategy.attributeContains(FRAME_SELECTOR, "src", "support"));
        return LocatorCandidate.all(ElementUsability.VISIBLE, strategies.toArray(new LocatorStrategy[0]));
    }

    public List<LocatorCandidate> getCandidates() {
        return Collections.unmodifiableList(candidates);
    }

    public Discovery<ProbeDocument> locate(ProbeDocument host) {
        Discovery<Locator> frame = cascade.find(host, candidates);
        if (!frame.isFound()) {
            AppLog.info("[widget] no prioritized iframe matched, scanning all frames");
            frame = cascade.scan(host, FRAME_SELECTOR, ElementUsability.safe(WidgetLocator::looksLikeChatFrame));
        }
        if (!frame.isFound()) {
            return Discovery.notFound("Chat widget iframe not found");
        }
        AppLog.info("[widget] found chat iframe with selector: " + frame.getStrategy());

        Optional<ProbeDocument> content = host.contentDocument(frame.get());
        if (!content.isPresent()) {
            return Discovery.notFound("Could not access iframe content");
        }
        AppLog.debug("[widget] attached to " + content.get().name());
        return Discovery.found(content.get(), frame.getStrategy());
    }

    static boolean looksLikeChatFrame(Locator frame) {
        String src = lower(frame.getAttribute("src"));
        for (String hint : SRC_HINTS) {
            if (src.contains(hint)) return true;
        }
        String title = lower(frame.getAttribute("title"));
        for (String hint : TITLE_HINTS) {
            if (title.contains(hint)) return true;
        }
        return false;
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
