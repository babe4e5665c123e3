package com.redprompt.service.probe;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.redprompt.config.AppConfig;
import com.redprompt.util.AppLog;

import java.util.List;

/**
 * 在组件文档里找到输入框、模拟输入 prompt 并提交。
 *
 * <ol>
 *     <li>输入框级联，找不到返回 notFound</li>
 *     <li>清空后逐字输入（带字符间隔，部分组件会拒绝瞬间灌入的文本）</li>
 *     <li>发送按钮级联，命中则点击；否则无条件在输入框上按 Enter</li>
 * </ol>
 * 输入或提交过程中的意外异常以 {@link ProbeException.Kind#INTERACTION} 抛出，Playwright 超时以
 * {@link ProbeException.Kind#TIMEOUT} 抛出。
 */
public class InteractionDriver {
    public static final String SUBMIT_BY_ENTER = "enter";

    static final List<LocatorCandidate> INPUT_CANDIDATES = LocatorCandidate.all(ElementUsability.VISIBLE_AND_ENABLED,
            LocatorStrategy.css("input[type=\"text\"]"),
            LocatorStrategy.css("textarea"),
            LocatorStrategy.attributeContains("input", "placeholder", "message"),
            LocatorStrategy.attributeContains("input", "placeholder", "type"),
            LocatorStrategy.attributeContains("textarea", "placeholder", "message"),
            LocatorStrategy.css("[contenteditable=\"true\"]"),
            LocatorStrategy.role("textbox"),
            LocatorStrategy.css(".chat-input"),
            LocatorStrategy.css(".message-input"),
            LocatorStrategy.css("#chat-input"),
            LocatorStrategy.css("#message-input")
    );

    static final List<LocatorCandidate> SEND_CANDIDATES = LocatorCandidate.all(ElementUsability.VISIBLE_AND_ENABLED,
            LocatorStrategy.css("button[type=\"submit\"]"),
            LocatorStrategy.text("button", "Send"),
            LocatorStrategy.ariaLabel("", "send"),
            LocatorStrategy.css(".send-button"),
            LocatorStrategy.css(".chat-send"),
            LocatorStrategy.css("#send-button")
    );

    private final SelectorCascade inputCascade;
    private final SelectorCascade sendCascade;
    private final double typingDelayMs;

    public InteractionDriver(SelectorCascade inputCascade, SelectorCascade sendCascade, double typingDelayMs) {
        this.inputCascade = inputCascade;
        this.sendCascade = sendCascade;
        this.typingDelayMs = Math.max(0, typingDelayMs);
    }

    public static InteractionDriver fromConfig(AppConfig cfg) {
        return new InteractionDriver(
                new SelectorCascade(cfg.getInputCandidateTimeoutMs()),
                new SelectorCascade(cfg.getSendCandidateTimeoutMs()),
                cfg.getTypingDelayMs());
    }

    public Discovery<Locator> findInput(ProbeDocument widget) {
        Discovery<Locator> input = inputCascade.find(widget, INPUT_CANDIDATES);
        if (!input.isFound()) {
            return Discovery.notFound("No input field found in chat widget");
        }
        AppLog.info("[interact] found input field with selector: " + input.getStrategy());
        return input;
    }

    /**
     * 输入并提交 prompt。返回值描述提交方式：命中的发送按钮 selector，或 {@link #SUBMIT_BY_ENTER}。
     */
    public Discovery<String> submit(ProbeDocument widget, String text) {
        Discovery<Locator> input = findInput(widget);
        if (!input.isFound()) {
            return input.mapNotFound();
        }
        Locator field = input.get();
        try {
            field.click();
            field.fill("");
            field.pressSequentially(text, new Locator.PressSequentiallyOptions().setDelay(typingDelayMs));
        } catch (PlaywrightException e) {
            throw new ProbeException(kindOf(e),
                    "Failed to type prompt into input field: " + SelectorCascade.firstLine(e.getMessage()), e);
        }

        Discovery<Locator> send = sendCascade.find(widget, SEND_CANDIDATES);
        try {
            if (send.isFound()) {
                send.get().click();
                AppLog.info("[interact] clicked send button: " + send.getStrategy());
                return Discovery.found(send.getStrategy(), send.getStrategy());
            }
            field.press("Enter");
            AppLog.info("[interact] pressed Enter to send message");
            return Discovery.found(SUBMIT_BY_ENTER, SUBMIT_BY_ENTER);
        } catch (PlaywrightException e) {
            throw new ProbeException(kindOf(e),
                    "Failed to submit prompt: " + SelectorCascade.firstLine(e.getMessage()), e);
        }
    }

    private static ProbeException.Kind kindOf(PlaywrightException e) {
        return e instanceof TimeoutError ? ProbeException.Kind.TIMEOUT : ProbeException.Kind.INTERACTION;
    }
}
