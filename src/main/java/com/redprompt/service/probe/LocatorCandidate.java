package com.redprompt.service.probe;

import com.microsoft.playwright.Locator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * 级联中的一个候选：定位策略 + 可用性判定。
 */
public final class LocatorCandidate {
    private final LocatorStrategy strategy;
    private final Predicate<Locator> usability;

    public LocatorCandidate(LocatorStrategy strategy, Predicate<Locator> usability) {
        if (strategy == null) throw new IllegalArgumentException("strategy is null");
        this.strategy = strategy;
        this.usability = usability == null ? ElementUsability.EXISTS : usability;
    }

    public static List<LocatorCandidate> all(Predicate<Locator> usability, LocatorStrategy... strategies) {
        List<LocatorCandidate> list = new ArrayList<>();
        for (LocatorStrategy s : strategies) {
            list.add(new LocatorCandidate(s, usability));
        }
        return Collections.unmodifiableList(list);
    }

    public LocatorStrategy getStrategy() {
        return strategy;
    }

    public boolean isUsable(Locator locator) {
        return usability.test(locator);
    }

    public String describe() {
        return strategy.toSelector();
    }

    @Override
    public String toString() {
        return "LocatorCandidate{" + strategy + "}";
    }
}
