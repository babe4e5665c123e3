package com.redprompt.service.probe;

import com.microsoft.playwright.Locator;

import java.util.Optional;

/**
 * 被探测的文档根：宿主页面或聊天组件所在的 iframe。
 *
 * <p>发现 / 交互 / 抓取各步骤只依赖此接口，测试中可直接 mock。</p>
 */
public interface ProbeDocument {

    /**
     * 用于日志的可读名称，例如 frame 的 url。
     */
    String name();

    Locator locator(String selector);

    /**
     * 文档 body 的可见文本。
     */
    String visibleText();

    /**
     * 将 iframe 元素解析为其内容文档；跨域不可访问或尚未加载时返回 empty。
     */
    Optional<ProbeDocument> contentDocument(Locator frameElement);
}
