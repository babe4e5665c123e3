package com.redprompt.service.probe;

/**
 * 定位策略：有限的几种标签化变体，最终渲染成 Playwright selector。
 */
public final class LocatorStrategy {

    public enum Kind {
        /** 原样使用的 css selector */
        CSS,
        /** 属性值包含子串，忽略大小写 */
        ATTRIBUTE_CONTAINS,
        /** 显式 role 属性 */
        ROLE,
        /** 元素文本包含子串 */
        TEXT,
        /** aria-label 包含子串，忽略大小写 */
        ARIA_LABEL
    }

    private final Kind kind;
    private final String element;
    private final String attribute;
    private final String value;

    private LocatorStrategy(Kind kind, String element, String attribute, String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("locator value is empty");
        }
        this.kind = kind;
        this.element = element == null ? "" : element.trim();
        this.attribute = attribute;
        this.value = value;
    }

    public static LocatorStrategy css(String selector) {
        return new LocatorStrategy(Kind.CSS, "", null, selector);
    }

    public static LocatorStrategy attributeContains(String element, String attribute, String value) {
        if (attribute == null || attribute.trim().isEmpty()) {
            throw new IllegalArgumentException("attribute is empty");
        }
        return new LocatorStrategy(Kind.ATTRIBUTE_CONTAINS, element, attribute.trim(), value);
    }

    public static LocatorStrategy role(String role) {
        return new LocatorStrategy(Kind.ROLE, "", "role", role);
    }

    public static LocatorStrategy text(String element, String text) {
        return new LocatorStrategy(Kind.TEXT, element, null, text);
    }

    public static LocatorStrategy ariaLabel(String element, String label) {
        return new LocatorStrategy(Kind.ARIA_LABEL, element, "aria-label", label);
    }

    public Kind getKind() {
        return kind;
    }

    public String getValue() {
        return value;
    }

    public String toSelector() {
        switch (kind) {
            case CSS:
                return value;
            case ATTRIBUTE_CONTAINS:
            case ARIA_LABEL:
                return element + "[" + attribute + "*=\"" + escape(value) + "\" i]";
            case ROLE:
                return element + "[role=\"" + escape(value) + "\"]";
            case TEXT:
                return (element.isEmpty() ? "*" : element) + ":has-text(\"" + escape(value) + "\")";
            default:
                throw new IllegalStateException("unknown locator kind: " + kind);
        }
    }

    static String escape(String raw) {
        return raw.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    @Override
    public String toString() {
        return kind + ":" + toSelector();
    }
}
