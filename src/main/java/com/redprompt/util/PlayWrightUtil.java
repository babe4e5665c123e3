package com.redprompt.util;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

public class PlayWrightUtil {

    static final List<String> LAUNCH_ARGS = Arrays.asList("--no-sandbox", "--disable-dev-shm-usage");

    /**
     * 一次运行独占的浏览器会话：一个 Playwright 运行时、一个浏览器实例、一个隔离的 BrowserContext。
     *
     * <p>配合 try-with-resources 使用，任何退出路径都会按 context → browser → playwright 的顺序释放。</p>
     */
    public static class Connection implements AutoCloseable {
        public final Playwright playwright;
        public final Browser browser;
        public final BrowserContext context;
        private boolean closed;

        public Connection(Playwright playwright, Browser browser, BrowserContext context) {
            this.playwright = playwright;
            this.browser = browser;
            this.context = context;
        }

        public Page newPage() {
            return context.newPage();
        }

        public boolean isClosed() {
            return closed;
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            closeQuietly("context", context);
            closeQuietly("browser", browser);
            closeQuietly("playwright", playwright);
            AppLog.info("[session] closed");
        }
    }

    /**
     * 启动无头 / 有头 Chromium 并打开一个新的上下文。
     */
    public static Connection launch(boolean headless) {
        return launch(Playwright::create, headless);
    }

    public static Connection launch(Supplier<Playwright> factory, boolean headless) {
        Playwright playwright = null;
        Browser browser = null;
        try {
            playwright = factory.get();
            browser = playwright.chromium().launch(new BrowserType.LaunchOptions()
                    .setHeadless(headless)
                    .setArgs(LAUNCH_ARGS));
            BrowserContext context = browser.newContext();
            AppLog.info("[session] browser launched (headless=" + headless + ")");
            return new Connection(playwright, browser, context);
        } catch (RuntimeException e) {
            closeQuietly("browser", browser);
            closeQuietly("playwright", playwright);
            throw new SessionException("Failed to start browser session: " + e.getMessage(), e);
        }
    }

    /**
     * 整页截图，失败只记录日志。
     *
     * @return 是否写入成功
     */
    public static boolean screenshot(Page page, Path path) {
        if (page == null || path == null) return false;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            page.screenshot(new Page.ScreenshotOptions().setPath(path).setFullPage(true));
            AppLog.info("[session] screenshot saved: " + path);
            return true;
        } catch (Exception e) {
            AppLog.warn("[session] failed to take screenshot " + path + ": " + e.getMessage());
            return false;
        }
    }

    private static void closeQuietly(String what, AutoCloseable resource) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            AppLog.warn("[session] failed to close " + what + ": " + e.getMessage());
        }
    }
}
