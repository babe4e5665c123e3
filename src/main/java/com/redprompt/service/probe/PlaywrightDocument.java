package com.redprompt.service.probe;

import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Frame;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;

import java.util.Optional;

/**
 * {@link ProbeDocument} 的 Playwright 实现，包装 Page 或 Frame。
 */
public final class PlaywrightDocument implements ProbeDocument {
    private final Object pageOrFrame;

    private PlaywrightDocument(Object pageOrFrame) {
        this.pageOrFrame = pageOrFrame;
    }

    public static PlaywrightDocument of(Page page) {
        if (page == null) throw new IllegalArgumentException("page is null");
        return new PlaywrightDocument(page);
    }

    public static PlaywrightDocument of(Frame frame) {
        if (frame == null) throw new IllegalArgumentException("frame is null");
        return new PlaywrightDocument(frame);
    }

    @Override
    public String name() {
        if (pageOrFrame instanceof Page) {
            return "page(" + ((Page) pageOrFrame).url() + ")";
        }
        Frame f = (Frame) pageOrFrame;
        return "frame(" + f.url() + ")";
    }

    @Override
    public Locator locator(String selector) {
        if (pageOrFrame instanceof Page) {
            return ((Page) pageOrFrame).locator(selector);
        }
        return ((Frame) pageOrFrame).locator(selector);
    }

    @Override
    public String visibleText() {
        if (pageOrFrame instanceof Page) {
            return ((Page) pageOrFrame).innerText("body");
        }
        return ((Frame) pageOrFrame).innerText("body");
    }

    @Override
    public Optional<ProbeDocument> contentDocument(Locator frameElement) {
        if (frameElement == null) return Optional.empty();
        ElementHandle handle = frameElement.elementHandle();
        if (handle == null) return Optional.empty();
        Frame frame = handle.contentFrame();
        if (frame == null) return Optional.empty();
        return Optional.of(new PlaywrightDocument(frame));
    }
}
