package com.redprompt.service.probe;

import com.microsoft.playwright.Locator;
import com.redprompt.util.AppLog;

import java.util.function.Predicate;

/**
 * 候选元素的可用性判定。判定过程抛异常一律视为不可用。
 */
public final class ElementUsability {

    public static final Predicate<Locator> EXISTS = safe(l -> l.count() > 0);

    public static final Predicate<Locator> VISIBLE = safe(l -> l.count() > 0 && l.isVisible());

    public static final Predicate<Locator> VISIBLE_AND_ENABLED = safe(l -> l.count() > 0 && l.isVisible() && l.isEnabled());

    private ElementUsability() {
    }

    public static Predicate<Locator> safe(Predicate<Locator> predicate) {
        return locator -> {
            if (locator == null) return false;
            try {
                return predicate.test(locator);
            } catch (RuntimeException e) {
                AppLog.debug("[cascade] usability check failed: " + SelectorCascade.firstLine(e.getMessage()));
                return false;
            }
        };
    }
}
